package com.questrail.amilink.protocol.ami.transport;

import java.util.concurrent.CompletableFuture;

/**
 * AmiStreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for one stream connection to a manager port (TCP-style).
 *
 * <p>This endpoint is intentionally small. Higher layers are responsible for:</p>
 * <ul>
 *   <li>grouping inbound lines into blocks and classifying them</li>
 *   <li>correlating responses with the actions that caused them</li>
 *   <li>deciding when to reconnect</li>
 * </ul>
 *
 * <p>An endpoint instance represents a single connection attempt. It is started
 * at most once; a reconnect creates a new endpoint.</p>
 *
 * <p>Implementations may be backed by Netty, plain sockets, or a test harness.</p>
 */
public interface AmiStreamEndpoint
{
    /**
     * Open the connection, blocking for at most the endpoint's connect timeout.
     *
     * <p>On success the endpoint notifies its listener via
     * {@link AmiStreamEndpointListener#onTransportUp()} before returning. On
     * failure it throws and never reports the connection as up or down.</p>
     *
     * @throws com.questrail.amilink.api.AmiTransportException if the connection cannot be opened
     */
    void start();

    /**
     * Close the connection and release its resources.
     *
     * <p>If the connection was up, the listener receives
     * {@link AmiStreamEndpointListener#onTransportDown(Throwable)} exactly once
     * per connection, whether the close was requested here or caused by the peer.</p>
     */
    void stop();

    /**
     * Write text to the stream as-is. The caller supplies complete messages,
     * line terminators included.
     *
     * @return a future that completes when the text has been handed to the
     *         socket, or exceptionally if the write failed
     */
    CompletableFuture<Void> send(String text);

    boolean isOpen();

    /**
     * Register the listener that receives inbound lines and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(AmiStreamEndpointListener listener);
}
