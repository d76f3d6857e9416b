package com.questrail.amilink.api;

/**
 * The manager transport could not be opened, read or written, or the client is
 * not in a state that allows sending. Recovery belongs to the connection
 * supervisor.
 */
public class AmiTransportException extends AmiException
{
    public AmiTransportException(String message) {
        super(message);
    }

    public AmiTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
