package com.questrail.amilink.protocol.ami.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * AmiMessage
 * -----------------------------------------------------------------------------
 * Immutable, classified manager message: an ordered list of headers plus a
 * {@link Kind} tag.
 *
 * <h2>Header semantics</h2>
 * <ul>
 *   <li>Keys are matched case-insensitively.</li>
 *   <li>Duplicate keys are preserved in wire order ({@link #getAll(String)}).</li>
 *   <li>Single-value lookups return the first occurrence.</li>
 * </ul>
 *
 * <p>Responses to {@code Command} actions ({@code Response: Follows}) may also
 * carry raw {@link #output()} lines that are not {@code Key: Value} pairs.</p>
 *
 * <p>New event names never need new types: the event name is just
 * {@link #name()}, and the payload is the uniform header list.</p>
 */
public final class AmiMessage
{
    /**
     * What the message is, as decided by the classifier.
     */
    public enum Kind {
        /** Unsolicited server message ({@code Event:} header present). */
        EVENT,
        /** Reply to an action ({@code Response:} header present). */
        RESPONSE,
        /** Neither; callers log and drop these. */
        UNKNOWN
    }

    public static final String EVENT = "Event";
    public static final String RESPONSE = "Response";
    public static final String ACTION_ID = "ActionID";
    public static final String EVENT_LIST = "EventList";

    private final Kind kind;
    private final List<AmiHeader> headers;
    private final List<String> output;

    public AmiMessage(Kind kind, List<AmiHeader> headers, List<String> output) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.headers = List.copyOf(headers);
        this.output = List.copyOf(output);
    }

    public AmiMessage(Kind kind, List<AmiHeader> headers) {
        this(kind, headers, List.of());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isEvent() {
        return kind == Kind.EVENT;
    }

    public boolean isResponse() {
        return kind == Kind.RESPONSE;
    }

    /**
     * Event name for events, response status for responses, empty otherwise.
     */
    public String name() {
        switch (kind) {
            case EVENT:
                return getOrDefault(EVENT, "");
            case RESPONSE:
                return getOrDefault(RESPONSE, "");
            default:
                return "";
        }
    }

    public List<AmiHeader> headers() {
        return headers;
    }

    public List<String> output() {
        return output;
    }

    public Optional<String> get(String key) {
        for (AmiHeader h : headers) {
            if (h.hasKey(key)) {
                return Optional.of(h.value());
            }
        }
        return Optional.empty();
    }

    public String getOrDefault(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    public List<String> getAll(String key) {
        List<String> values = new ArrayList<>();
        for (AmiHeader h : headers) {
            if (h.hasKey(key)) {
                values.add(h.value());
            }
        }
        return values;
    }

    public boolean has(String key) {
        return get(key).isPresent();
    }

    public Optional<String> actionId() {
        return get(ACTION_ID);
    }

    /**
     * True for a response announcing that the result follows as a list of events.
     * Newer switches send {@code EventList: start}; older ones only say so in
     * {@code Message}.
     */
    public boolean isEventListStart() {
        if (!isResponse()) {
            return false;
        }
        if (getOrDefault(EVENT_LIST, "").equalsIgnoreCase("start")) {
            return true;
        }
        return getOrDefault("Message", "").toLowerCase(Locale.ROOT).endsWith("will follow");
    }

    /**
     * True for the event that terminates an event list.
     */
    public boolean isEventListComplete() {
        if (!isEvent()) {
            return false;
        }
        if (getOrDefault(EVENT_LIST, "").equalsIgnoreCase("Complete")) {
            return true;
        }
        return name().endsWith("Complete");
    }

    @Override
    public String toString() {
        return "AmiMessage{" + kind + " " + headers + (output.isEmpty() ? "" : " +" + output.size() + " output lines") + "}";
    }
}
