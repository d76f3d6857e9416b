package com.questrail.amilink.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Last known state of a device or extension. Entries are never removed while a
 * connection lives; a stale entry is the last thing the switch told us.
 */
public record DeviceState(String device, String state, Instant updatedAt) {
    public DeviceState {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }
}
