package com.questrail.amilink.protocol.ami.transport;

/**
 * AmiStreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link AmiStreamEndpoint}.
 *
 * <p>All callbacks for one connection are delivered serially, from a single
 * inbound thread, in stream order.</p>
 */
public interface AmiStreamEndpointListener
{
    /**
     * Called when the connection is open and readable.
     */
    void onTransportUp();

    /**
     * Called once when the connection closes, whatever the reason.
     *
     * @param cause the read/write failure that closed the connection, or
     *              {@code null} for an orderly close by either side
     */
    void onTransportDown(Throwable cause);

    /**
     * Called for every inbound line, with the line terminator removed.
     * Empty strings are delivered; they delimit blocks.
     */
    void onLine(String line);

    /**
     * Called instead of {@link #onLine(String)} for an inbound line the
     * endpoint refused, for example one exceeding the maximum line length.
     * The stream continues with the next line.
     */
    void onLineRejected(Throwable cause);
}
