package com.questrail.amilink.protocol.ami.model;

import java.util.Objects;

/**
 * One {@code Key: Value} line of a manager message. The key keeps the case it
 * had on the wire; lookups elsewhere compare keys case-insensitively.
 */
public record AmiHeader(String key, String value) {
    public AmiHeader {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public boolean hasKey(String name) {
        return key.equalsIgnoreCase(name);
    }

    @Override
    public String toString() {
        return key + ": " + value;
    }
}
