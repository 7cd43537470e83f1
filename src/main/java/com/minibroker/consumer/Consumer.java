package com.minibroker.consumer;

import com.minibroker.connection.Channel;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A subscription of one channel to one queue.
 */
public class Consumer {
    private static final AtomicLong registrationCounter = new AtomicLong(0);

    private final String consumerTag;
    private final String queueName;
    private final Channel channel;
    private final boolean noAck;
    private final boolean exclusive;
    private final int priority;
    private final Map<String, Object> arguments;
    private final DeliverCallback deliverCallback;
    private final CancelCallback cancelCallback;
    private final long registrationOrder = registrationCounter.incrementAndGet();
    private final AtomicInteger outstanding = new AtomicInteger(0);
    private volatile boolean active = true;
    private volatile long lastServed = 0;

    public Consumer(String consumerTag, String queueName, Channel channel, boolean noAck,
                    boolean exclusive, int priority, Map<String, Object> arguments,
                    DeliverCallback deliverCallback, CancelCallback cancelCallback) {
        this.consumerTag = consumerTag;
        this.queueName = queueName;
        this.channel = channel;
        this.noAck = noAck;
        this.exclusive = exclusive;
        this.priority = priority;
        this.arguments = arguments != null ? new HashMap<>(arguments) : new HashMap<>();
        this.deliverCallback = deliverCallback;
        this.cancelCallback = cancelCallback;
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    public String getQueueName() {
        return queueName;
    }

    public Channel getChannel() {
        return channel;
    }

    public boolean isNoAck() {
        return noAck;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public int getPriority() {
        return priority;
    }

    public Map<String, Object> getArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    public DeliverCallback getDeliverCallback() {
        return deliverCallback;
    }

    public CancelCallback getCancelCallback() {
        return cancelCallback;
    }

    public boolean isActive() {
        return active;
    }

    void deactivate() {
        this.active = false;
    }

    long getRegistrationOrder() {
        return registrationOrder;
    }

    long getLastServed() {
        return lastServed;
    }

    void markServed(long serveSequence) {
        this.lastServed = serveSequence;
    }

    /**
     * Number of messages delivered to this consumer and not yet acked or nacked.
     */
    public int getOutstanding() {
        return outstanding.get();
    }

    /**
     * Reserve one unit of capacity unless {@code limit} (0 = unlimited) is reached.
     */
    boolean tryReserve(int limit) {
        while (true) {
            int current = outstanding.get();
            if (limit > 0 && current >= limit) {
                return false;
            }
            if (outstanding.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    void release() {
        outstanding.updateAndGet(count -> count > 0 ? count - 1 : 0);
    }

    @Override
    public String toString() {
        return String.format("Consumer{tag='%s', queue='%s', noAck=%s, exclusive=%s, priority=%d}",
                consumerTag, queueName, noAck, exclusive, priority);
    }
}
