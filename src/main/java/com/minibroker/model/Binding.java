package com.minibroker.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A routing relationship from a source exchange to a queue or to another exchange
 * (exchange-to-exchange binding, a RabbitMQ extension to AMQP 0.9.1).
 */
public class Binding {
    private final String source;
    private final String destination;
    private final DestinationType destinationType;
    private final String pattern;
    private final Map<String, Object> arguments;

    public Binding(String source, String destination, DestinationType destinationType,
                   String pattern, Map<String, Object> arguments) {
        this.source = source;
        this.destination = destination;
        this.destinationType = destinationType;
        this.pattern = pattern != null ? pattern : "";
        this.arguments = arguments != null ? new HashMap<>(arguments) : new HashMap<>();
    }

    public static Binding toQueue(String exchange, String queue, String pattern, Map<String, Object> arguments) {
        return new Binding(exchange, queue, DestinationType.QUEUE, pattern, arguments);
    }

    public static Binding toExchange(String source, String destination, String pattern, Map<String, Object> arguments) {
        return new Binding(source, destination, DestinationType.EXCHANGE, pattern, arguments);
    }

    public String getSource() {
        return source;
    }

    public String getDestination() {
        return destination;
    }

    public DestinationType getDestinationType() {
        return destinationType;
    }

    public boolean isQueueBinding() {
        return destinationType == DestinationType.QUEUE;
    }

    public String getPattern() {
        return pattern;
    }

    public Map<String, Object> getArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    public enum DestinationType {
        QUEUE,
        EXCHANGE
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Binding that = (Binding) o;
        return source.equals(that.source) &&
               destination.equals(that.destination) &&
               destinationType == that.destinationType &&
               pattern.equals(that.pattern) &&
               arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, destination, destinationType, pattern, arguments);
    }

    @Override
    public String toString() {
        return String.format("Binding{%s -> %s %s, pattern='%s'}",
                source, destinationType, destination, pattern);
    }
}
