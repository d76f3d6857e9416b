package com.questrail.amilink.protocol.ami.config;

import com.questrail.amilink.protocol.ami.internal.exec.AmiTimingPolicy;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for one manager connection.
 *
 * <p>The client never reads files or the environment; whoever builds the
 * runtime supplies this object.</p>
 *
 * @param host                  switch address
 * @param port                  manager port, usually 5038
 * @param username              manager user
 * @param secret                manager secret; never logged
 * @param connectTimeout        bound on opening the TCP connection
 * @param readTimeout           bound on waiting for the banner after connecting
 * @param timingPolicy          action timeout, reconnect backoff, keep-alive
 * @param autoReconnect         reconnect on connection loss without being asked
 * @param initialStatusActions  actions sent once after every successful login
 * @param loginEvents           {@code Events} value for the login action, or {@code null} to omit it
 * @param maxLineLength         longest inbound line accepted, in bytes
 */
public record AmiClientConfig(
    String host,
    int port,
    String username,
    String secret,
    Duration connectTimeout,
    Duration readTimeout,
    AmiTimingPolicy timingPolicy,
    boolean autoReconnect,
    List<String> initialStatusActions,
    String loginEvents,
    int maxLineLength
) {
    public static final int DEFAULT_PORT = 5038;

    public static final List<String> DEFAULT_INITIAL_STATUS_ACTIONS =
        List.of("CoreShowChannels", "ExtensionStateList", "QueueStatus");

    public AmiClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(secret, "secret");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        initialStatusActions = List.copyOf(initialStatusActions);

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
        if (maxLineLength < 64) {
            throw new IllegalArgumentException("maxLineLength must be at least 64");
        }
    }

    /**
     * The {@code Events} login header, when one is configured.
     */
    public Optional<String> eventMask() {
        return Optional.ofNullable(loginEvents);
    }

    @Override
    public String toString() {
        return "AmiClientConfig{" + username + "@" + host + ":" + port
            + ", connectTimeout=" + connectTimeout
            + ", readTimeout=" + readTimeout
            + ", " + timingPolicy
            + ", autoReconnect=" + autoReconnect + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "127.0.0.1";
        private int port = DEFAULT_PORT;
        private String username;
        private String secret;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private AmiTimingPolicy timingPolicy = AmiTimingPolicy.defaults();
        private boolean autoReconnect = true;
        private List<String> initialStatusActions = DEFAULT_INITIAL_STATUS_ACTIONS;
        private String eventMask;
        private int maxLineLength = 8192;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withCredentials(String username, String secret) {
            this.username = username;
            this.secret = secret;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withTimingPolicy(AmiTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withAutoReconnect(boolean autoReconnect) {
            this.autoReconnect = autoReconnect;
            return this;
        }

        public Builder withInitialStatusActions(List<String> actions) {
            this.initialStatusActions = actions;
            return this;
        }

        public Builder withEventMask(String eventMask) {
            this.eventMask = eventMask;
            return this;
        }

        public Builder withMaxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public AmiClientConfig build() {
            return new AmiClientConfig(host, port, username, secret, connectTimeout, readTimeout,
                timingPolicy, autoReconnect, initialStatusActions, eventMask, maxLineLength);
        }
    }
}
