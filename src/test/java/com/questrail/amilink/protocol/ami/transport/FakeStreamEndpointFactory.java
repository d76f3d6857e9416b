package com.questrail.amilink.protocol.ami.transport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Hands out a fresh {@link FakeStreamEndpoint} per connection attempt and
 * remembers them so tests can drive each connection.
 */
public final class FakeStreamEndpointFactory implements AmiStreamEndpointFactory {

    private final List<FakeStreamEndpoint> created = new ArrayList<>();
    private volatile Consumer<FakeStreamEndpoint> customizer = e -> {};

    /**
     * Applied to every endpoint created from now on.
     */
    public FakeStreamEndpointFactory customize(Consumer<FakeStreamEndpoint> customizer) {
        this.customizer = customizer;
        return this;
    }

    @Override
    public synchronized AmiStreamEndpoint create(String host, int port, Duration connectTimeout, int maxLineLength) {
        FakeStreamEndpoint endpoint = new FakeStreamEndpoint();
        customizer.accept(endpoint);
        created.add(endpoint);
        return endpoint;
    }

    public synchronized List<FakeStreamEndpoint> created() {
        return new ArrayList<>(created);
    }

    public synchronized FakeStreamEndpoint last() {
        if (created.isEmpty()) {
            throw new IllegalStateException("no endpoint created yet");
        }
        return created.get(created.size() - 1);
    }
}
