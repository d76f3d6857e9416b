package com.questrail.amilink.protocol.ami.observability;

import java.time.Instant;

/**
 * An error the client absorbed instead of propagating, such as a dropped
 * block or a failing event handler.
 */
public record AmiErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
