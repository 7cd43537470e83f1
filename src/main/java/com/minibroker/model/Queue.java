package com.minibroker.model;

import com.minibroker.amqp.AmqpConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A named message buffer. New messages go to the tail, requeued messages go back to the
 * head. The buffer is guarded by the queue's monitor; callers that need several buffer
 * operations to be atomic synchronize on the queue themselves.
 */
public class Queue {
    private static final Logger logger = LoggerFactory.getLogger(Queue.class);

    private final String name;
    private final boolean durable;
    private final boolean exclusive;
    private final boolean autoDelete;
    private final String exclusiveOwner;
    private final Map<String, Object> arguments;
    private final int maxLength;
    private final long messageTtl;

    private final Deque<Message> messages = new ArrayDeque<>();
    private final AtomicInteger consumerCount = new AtomicInteger(0);
    private long serveSequence = 0;

    public Queue(String name, boolean durable, boolean exclusive, boolean autoDelete) {
        this(name, durable, exclusive, autoDelete, null, null, 0);
    }

    public Queue(String name, boolean durable, boolean exclusive, boolean autoDelete,
                 Map<String, Object> arguments, String exclusiveOwner, int defaultMaxLength) {
        this.name = name;
        this.durable = durable;
        this.exclusive = exclusive;
        this.autoDelete = autoDelete;
        this.exclusiveOwner = exclusive ? exclusiveOwner : null;
        this.arguments = arguments != null ? new HashMap<>(arguments) : new HashMap<>();

        int configuredMaxLength = defaultMaxLength;
        Object maxLenArg = this.arguments.get(AmqpConstants.ARG_MAX_LENGTH);
        if (maxLenArg instanceof Number) {
            configuredMaxLength = ((Number) maxLenArg).intValue();
        }
        this.maxLength = configuredMaxLength;

        long configuredTtl = -1;
        Object ttlArg = this.arguments.get(AmqpConstants.ARG_MESSAGE_TTL);
        if (ttlArg instanceof Number) {
            configuredTtl = ((Number) ttlArg).longValue();
        }
        this.messageTtl = configuredTtl;
    }

    public String getName() {
        return name;
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

    /**
     * Name of the connection that declared this exclusive queue, or {@code null}.
     */
    public String getExclusiveOwner() {
        return exclusiveOwner;
    }

    public Map<String, Object> getArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    public int getMaxLength() {
        return maxLength;
    }

    public long getMessageTtl() {
        return messageTtl;
    }

    public synchronized void enqueue(Message message) {
        if (maxLength > 0 && messages.size() >= maxLength) {
            // Head-drop, like RabbitMQ's default overflow behaviour
            Message dropped = messages.pollFirst();
            logger.debug("Queue {} full ({}), dropped oldest message {}", name, maxLength, dropped);
        }
        messages.offerLast(message);
    }

    /**
     * Put messages back at the head of the buffer. The first message of the list ends up
     * as the new head.
     */
    public synchronized void requeue(List<Message> requeued) {
        ListIterator<Message> it = requeued.listIterator(requeued.size());
        while (it.hasPrevious()) {
            messages.offerFirst(it.previous());
        }
    }

    public Message poll() {
        return poll(System.currentTimeMillis());
    }

    /**
     * Remove and return the head message, discarding any expired messages in front of it.
     */
    public synchronized Message poll(long now) {
        Message message = messages.pollFirst();
        while (message != null && isExpired(message, now)) {
            logger.debug("Message expired in queue {}, discarding: {}", name, message);
            message = messages.pollFirst();
        }
        return message;
    }

    public boolean isExpired(Message message, long now) {
        long ttl = message.getExpirationMillis();
        if (messageTtl >= 0 && (ttl < 0 || messageTtl < ttl)) {
            ttl = messageTtl;
        }
        return ttl >= 0 && now - message.getPublishedAt() >= ttl;
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized boolean isEmpty() {
        return messages.isEmpty();
    }

    /**
     * Remove every buffered message.
     * @return the number of messages removed
     */
    public synchronized int purge() {
        int count = messages.size();
        messages.clear();
        return count;
    }

    public int getConsumerCount() {
        return consumerCount.get();
    }

    public int incrementConsumerCount() {
        return consumerCount.incrementAndGet();
    }

    public int decrementConsumerCount() {
        return consumerCount.updateAndGet(count -> count > 0 ? count - 1 : 0);
    }

    /**
     * Next value of the queue-local counter used to rotate deliveries among consumers.
     */
    public synchronized long nextServeSequence() {
        return ++serveSequence;
    }

    @Override
    public String toString() {
        return String.format("Queue{name='%s', durable=%s, exclusive=%s, autoDelete=%s, size=%d}",
                name, durable, exclusive, autoDelete, size());
    }
}
