package com.minibroker.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A routing node. Exchanges store no messages; the {@link Type} decides which binding
 * patterns a routing key matches.
 */
public class Exchange {
    private final String name;
    private final Type type;
    private final boolean durable;
    private final boolean autoDelete;
    private final boolean internal;
    private final Map<String, Object> arguments;

    public Exchange(String name, Type type, boolean durable, boolean autoDelete, boolean internal) {
        this(name, type, durable, autoDelete, internal, null);
    }

    public Exchange(String name, Type type, boolean durable, boolean autoDelete,
                   boolean internal, Map<String, Object> arguments) {
        this.name = name;
        this.type = type;
        this.durable = durable;
        this.autoDelete = autoDelete;
        this.internal = internal;
        this.arguments = arguments != null ? new HashMap<>(arguments) : new HashMap<>();
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isAutoDelete() {
        return autoDelete;
    }

    public boolean isInternal() {
        return internal;
    }

    public Map<String, Object> getArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    public boolean isDefault() {
        return name.isEmpty();
    }

    public enum Type {
        DIRECT,
        FANOUT,
        TOPIC,
        HEADERS;

        /**
         * Parse the lower-case names clients use ({@code "topic"}, {@code "fanout"}, ...).
         */
        public static Type fromString(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Exchange type cannot be null");
            }
            try {
                return Type.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown exchange type: " + value, e);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("Exchange{name='%s', type=%s, durable=%s, autoDelete=%s, internal=%s}",
                name, type, durable, autoDelete, internal);
    }
}
