package com.minibroker.model;

import java.util.HashMap;
import java.util.Map;

public class ExchangeOptions {
    private boolean durable = true;
    private boolean autoDelete = false;
    private boolean internal = false;
    private final Map<String, Object> arguments = new HashMap<>();

    public static ExchangeOptions defaults() {
        return new ExchangeOptions();
    }

    public ExchangeOptions durable(boolean durable) {
        this.durable = durable;
        return this;
    }

    public ExchangeOptions autoDelete(boolean autoDelete) {
        this.autoDelete = autoDelete;
        return this;
    }

    public ExchangeOptions internal(boolean internal) {
        this.internal = internal;
        return this;
    }

    public ExchangeOptions argument(String name, Object value) {
        arguments.put(name, value);
        return this;
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
        return arguments;
    }
}
