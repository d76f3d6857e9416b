package com.questrail.amilink.protocol.ami.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of one action: the correlated response message and, for actions that
 * answer with an event list, the events collected up to and including the
 * list's completion event.
 */
public record AmiResponse(AmiMessage message, List<AmiMessage> events) {

    public static final String SUCCESS = "Success";

    public AmiResponse {
        Objects.requireNonNull(message, "message");
        events = List.copyOf(events);
    }

    public static AmiResponse of(AmiMessage message) {
        return new AmiResponse(message, List.of());
    }

    /**
     * Value of the {@code Response} header ({@code Success}, {@code Error},
     * {@code Follows}, {@code Goodbye}, ...).
     */
    public String status() {
        return message.getOrDefault(AmiMessage.RESPONSE, "");
    }

    public boolean isSuccess() {
        return SUCCESS.equalsIgnoreCase(status());
    }
}
