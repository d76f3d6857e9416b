package com.questrail.amilink.protocol.ami.internal.decode;

/**
 * A block could not be turned into a manager message.
 *
 * This typically reflects:
 * <ul>
 *   <li>An empty block</li>
 *   <li>A line without a {@code :} separator outside command output</li>
 *   <li>A line with an empty key</li>
 * </ul>
 *
 * The offending block is dropped; stream processing continues.
 */
public final class AmiDecodeException extends RuntimeException
{
    public AmiDecodeException(String message) {
        super(message);
    }

    public AmiDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
