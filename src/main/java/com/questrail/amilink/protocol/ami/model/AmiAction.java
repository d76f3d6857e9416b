package com.questrail.amilink.protocol.ami.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An outbound manager action: the action name plus ordered parameters.
 *
 * <p>Parameters may repeat (for example several {@code Variable} lines on an
 * {@code Originate}). The correlation token is not part of the action; it is
 * assigned when the action is sent.</p>
 */
public final class AmiAction
{
    private final String name;
    private final List<AmiHeader> parameters;

    private AmiAction(String name, List<AmiHeader> parameters) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("action name must not be blank");
        }
        this.parameters = List.copyOf(parameters);
    }

    public static AmiAction of(String name) {
        return new AmiAction(name, List.of());
    }

    public static AmiAction of(String name, Map<String, String> parameters) {
        Builder b = builder(name);
        if (parameters != null) {
            parameters.forEach(b::header);
        }
        return b.build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<AmiHeader> parameters() {
        return parameters;
    }

    @Override
    public String toString() {
        // Secrets stay out of logs.
        return "AmiAction{" + name + "}";
    }

    public static final class Builder {
        private final String name;
        private final List<AmiHeader> parameters = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder header(String key, String value) {
            parameters.add(new AmiHeader(key, value));
            return this;
        }

        public Builder variable(String name, String value) {
            return header("Variable", name + "=" + value);
        }

        public AmiAction build() {
            return new AmiAction(name, parameters);
        }
    }
}
