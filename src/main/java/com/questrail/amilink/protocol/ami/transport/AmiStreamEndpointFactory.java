package com.questrail.amilink.protocol.ami.transport;

import java.time.Duration;

/**
 * Creates one {@link AmiStreamEndpoint} per connection attempt.
 */
@FunctionalInterface
public interface AmiStreamEndpointFactory
{
    /**
     * @param host           manager host
     * @param port           manager port
     * @param connectTimeout bound on {@link AmiStreamEndpoint#start()}
     * @param maxLineLength  longest inbound line accepted
     */
    AmiStreamEndpoint create(String host, int port, Duration connectTimeout, int maxLineLength);
}
