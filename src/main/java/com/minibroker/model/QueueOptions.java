package com.minibroker.model;

import com.minibroker.amqp.AmqpConstants;

import java.util.HashMap;
import java.util.Map;

/**
 * Options for declaring a queue. Defaults follow common client libraries: durable, not
 * exclusive, not auto-delete.
 */
public class QueueOptions {
    private boolean durable = true;
    private boolean exclusive = false;
    private boolean autoDelete = false;
    private final Map<String, Object> arguments = new HashMap<>();

    public static QueueOptions defaults() {
        return new QueueOptions();
    }

    public QueueOptions durable(boolean durable) {
        this.durable = durable;
        return this;
    }

    public QueueOptions exclusive(boolean exclusive) {
        this.exclusive = exclusive;
        return this;
    }

    public QueueOptions autoDelete(boolean autoDelete) {
        this.autoDelete = autoDelete;
        return this;
    }

    public QueueOptions argument(String name, Object value) {
        arguments.put(name, value);
        return this;
    }

    public QueueOptions maxLength(int maxLength) {
        return argument(AmqpConstants.ARG_MAX_LENGTH, maxLength);
    }

    public QueueOptions messageTtl(long ttlMillis) {
        return argument(AmqpConstants.ARG_MESSAGE_TTL, ttlMillis);
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public boolean isAutoDelete() {
        return autoDelete;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }
}
