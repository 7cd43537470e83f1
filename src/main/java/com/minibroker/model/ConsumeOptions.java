package com.minibroker.model;

import com.minibroker.amqp.AmqpConstants;

import java.util.HashMap;
import java.util.Map;

public class ConsumeOptions {
    private String consumerTag;
    private boolean noAck = false;
    private boolean exclusive = false;
    private Integer priority;
    private final Map<String, Object> arguments = new HashMap<>();

    public static ConsumeOptions defaults() {
        return new ConsumeOptions();
    }

    public ConsumeOptions consumerTag(String consumerTag) {
        this.consumerTag = consumerTag;
        return this;
    }

    public ConsumeOptions noAck(boolean noAck) {
        this.noAck = noAck;
        return this;
    }

    public ConsumeOptions exclusive(boolean exclusive) {
        this.exclusive = exclusive;
        return this;
    }

    public ConsumeOptions priority(int priority) {
        this.priority = priority;
        return this;
    }

    public ConsumeOptions argument(String name, Object value) {
        arguments.put(name, value);
        return this;
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    public boolean isNoAck() {
        return noAck;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    /**
     * The explicit priority, else the {@code x-priority} argument, else 0.
     */
    public int getPriority() {
        if (priority != null) {
            return priority;
        }
        Object arg = arguments.get(AmqpConstants.ARG_PRIORITY);
        return arg instanceof Number ? ((Number) arg).intValue() : 0;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }
}
