package com.questrail.amilink.api;

/**
 * Root of the unchecked exceptions raised by an {@link AmiClient}.
 */
public class AmiException extends RuntimeException
{
    public AmiException(String message) {
        super(message);
    }

    public AmiException(String message, Throwable cause) {
        super(message, cause);
    }
}
