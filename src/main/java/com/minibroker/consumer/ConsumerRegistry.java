package com.minibroker.consumer;

import com.minibroker.exception.ResourceLockedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Consumers of every queue of a broker, in registration order.
 */
public class ConsumerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConsumerRegistry.class);

    private final ConcurrentMap<String, List<Consumer>> queueConsumers = new ConcurrentHashMap<>();

    /**
     * @throws ResourceLockedException if the queue has an exclusive consumer, or an
     *         exclusive consumer is requested on a queue that already has consumers
     */
    public synchronized void add(Consumer consumer) {
        List<Consumer> existing = queueConsumers.get(consumer.getQueueName());
        if (existing != null && !existing.isEmpty()) {
            for (Consumer other : existing) {
                if (other.isExclusive()) {
                    throw new ResourceLockedException(
                            "Queue '" + consumer.getQueueName() + "' has an exclusive consumer");
                }
            }
            if (consumer.isExclusive()) {
                throw new ResourceLockedException(
                        "Cannot add exclusive consumer, queue '" + consumer.getQueueName() + "' already has consumers");
            }
        }

        queueConsumers.computeIfAbsent(consumer.getQueueName(), k -> new CopyOnWriteArrayList<>()).add(consumer);
        logger.info("Added consumer: {}", consumer);
    }

    public synchronized boolean remove(Consumer consumer) {
        List<Consumer> consumers = queueConsumers.get(consumer.getQueueName());
        if (consumers == null || !consumers.remove(consumer)) {
            return false;
        }
        if (consumers.isEmpty()) {
            queueConsumers.remove(consumer.getQueueName());
        }
        logger.info("Removed consumer: {}", consumer);
        return true;
    }

    public synchronized List<Consumer> removeAll(String queueName) {
        List<Consumer> removed = queueConsumers.remove(queueName);
        if (removed == null) {
            return Collections.emptyList();
        }
        logger.info("Removed {} consumers of queue {}", removed.size(), queueName);
        return new ArrayList<>(removed);
    }

    public List<Consumer> consumersFor(String queueName) {
        List<Consumer> consumers = queueConsumers.get(queueName);
        return consumers == null ? Collections.emptyList() : Collections.unmodifiableList(consumers);
    }

    /**
     * Names of the queues that currently have at least one consumer.
     */
    public List<String> queueNames() {
        return new ArrayList<>(queueConsumers.keySet());
    }

    public int consumerCount(String queueName) {
        return consumersFor(queueName).size();
    }
}
