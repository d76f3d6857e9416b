package com.questrail.amilink.api;

/**
 * The connection that carried an outstanding action was closed or lost before
 * the action's response arrived.
 */
public final class ConnectionClosedException extends AmiException
{
    public ConnectionClosedException(String message) {
        super(message);
    }

    public ConnectionClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
