package com.minibroker.consumer;

import com.minibroker.connection.Channel;
import com.minibroker.connection.Connection;
import com.minibroker.model.Delivery;
import com.minibroker.model.Message;
import com.minibroker.model.Queue;
import com.minibroker.topology.TopologyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Moves messages from queues to consumers and settles them on ack, nack and recover.
 * <p>
 * Dispatch for a queue runs on the dispatcher pool, never on the publishing thread, and is
 * serialized by the queue's monitor. Requests arriving while a dispatch is already
 * scheduled for the same queue are coalesced. The dispatcher only hands deliveries to the
 * consumer's channel; callbacks run later on that channel's delivery thread.
 */
public class DeliveryEngine {
    private static final Logger logger = LoggerFactory.getLogger(DeliveryEngine.class);

    private static final Comparator<Consumer> DISPATCH_ORDER = Comparator
            .comparingInt(Consumer::getPriority).reversed()
            .thenComparingLong(Consumer::getLastServed)
            .thenComparingLong(Consumer::getRegistrationOrder);

    private final TopologyStore topology;
    private final ConsumerRegistry registry;
    private final ExecutorService dispatcher;
    private final ConcurrentMap<String, AtomicBoolean> scheduled = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public DeliveryEngine(TopologyStore topology, ConsumerRegistry registry, int threads) {
        this.topology = topology;
        this.registry = registry;
        this.dispatcher = Executors.newFixedThreadPool(Math.max(1, threads), new ThreadFactory() {
            private final AtomicLong counter = new AtomicLong(0);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "MessageDispatch-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }

    /**
     * Start dispatching. Queues that gained consumers and messages before the start get a
     * dispatch pass right away.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            logger.info("Delivery engine started");
            for (String queueName : registry.queueNames()) {
                requestDispatch(queueName);
            }
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            logger.info("Stopping delivery engine...");
            dispatcher.shutdown();
            try {
                if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                    dispatcher.shutdownNow();
                }
            } catch (InterruptedException e) {
                dispatcher.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduled.clear();
            logger.info("Delivery engine stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public ConsumerRegistry getRegistry() {
        return registry;
    }

    /**
     * Append a message to a queue and schedule dispatch for it.
     */
    public void enqueue(Queue queue, Message message) {
        queue.enqueue(message);
        requestDispatch(queue.getName());
    }

    /**
     * Schedule a dispatch pass for a queue unless one is already pending.
     */
    public void requestDispatch(String queueName) {
        if (!running.get()) {
            return;
        }
        AtomicBoolean pending = scheduled.computeIfAbsent(queueName, k -> new AtomicBoolean(false));
        if (!pending.compareAndSet(false, true)) {
            return;
        }
        try {
            dispatcher.execute(() -> {
                // Cleared first so a request made during this pass schedules another one
                pending.set(false);
                try {
                    dispatch(queueName);
                } catch (Exception e) {
                    logger.error("Error dispatching messages from queue: {}", queueName, e);
                }
            });
        } catch (RejectedExecutionException e) {
            pending.set(false);
            logger.debug("Dispatcher stopped, dropping dispatch request for queue {}", queueName);
        }
    }

    void dispatch(String queueName) {
        Queue queue = topology.getQueue(queueName);
        if (queue == null) {
            scheduled.remove(queueName);
            return;
        }
        List<Consumer> consumers = registry.consumersFor(queueName);
        if (consumers.isEmpty()) {
            return;
        }

        int delivered = 0;
        synchronized (queue) {
            while (!queue.isEmpty()) {
                Reservation reservation = reserveConsumer(consumers);
                if (reservation == null) {
                    break;
                }
                Message message = queue.poll(System.currentTimeMillis());
                if (message == null) {
                    reservation.cancel();
                    break;
                }
                deliver(queue, reservation, message);
                delivered++;
            }
        }
        if (delivered > 0) {
            logger.debug("Dispatched {} messages from queue {}", delivered, queueName);
        }
    }

    private Reservation reserveConsumer(List<Consumer> consumers) {
        List<Consumer> ordered = new ArrayList<>(consumers);
        ordered.sort(DISPATCH_ORDER);
        for (Consumer consumer : ordered) {
            Reservation reservation = tryReserve(consumer);
            if (reservation != null) {
                return reservation;
            }
        }
        return null;
    }

    private Reservation tryReserve(Consumer consumer) {
        Channel channel = consumer.getChannel();
        if (!consumer.isActive() || !channel.isOpen()) {
            return null;
        }
        if (consumer.isNoAck()) {
            return new Reservation(consumer, false);
        }
        if (!consumer.tryReserve(channel.getPrefetchCount())) {
            return null;
        }
        Connection connection = channel.getConnection();
        if (connection.getGlobalPrefetch() > 0) {
            if (!connection.tryAcquireGlobalCredit()) {
                consumer.release();
                return null;
            }
            return new Reservation(consumer, true);
        }
        return new Reservation(consumer, false);
    }

    private void deliver(Queue queue, Reservation reservation, Message message) {
        Consumer consumer = reservation.consumer;
        Channel channel = consumer.getChannel();
        consumer.markServed(queue.nextServeSequence());

        UnackedMessages unacked = channel.getUnackedMessages();
        // Tag order, tracking order and hand-off order agree per channel
        synchronized (unacked) {
            long tag = unacked.nextDeliveryTag();
            if (!consumer.isNoAck()) {
                unacked.track(new UnackedMessages.UnackedMessage(
                        tag, message, queue.getName(), consumer, reservation.globalCredit));
            }
            channel.deliver(consumer, Delivery.of(message, tag, consumer.getConsumerTag(), -1));
        }
    }

    /**
     * Pull the head message of a queue outside any subscription.
     *
     * @return the delivery, or {@code null} when the queue is empty
     */
    public Delivery get(Channel channel, Queue queue, boolean noAck) {
        synchronized (queue) {
            Message message = queue.poll(System.currentTimeMillis());
            if (message == null) {
                return null;
            }
            UnackedMessages unacked = channel.getUnackedMessages();
            synchronized (unacked) {
                long tag = unacked.nextDeliveryTag();
                if (!noAck) {
                    unacked.track(new UnackedMessages.UnackedMessage(tag, message, queue.getName(), null, false));
                }
                return Delivery.of(message, tag, null, queue.size());
            }
        }
    }

    // ------------------------------------------------------------- consumers

    public void registerConsumer(Consumer consumer) {
        Queue queue = topology.checkQueue(consumer.getQueueName());
        registry.add(consumer);
        queue.incrementConsumerCount();
        requestDispatch(consumer.getQueueName());
    }

    /**
     * @return false if the consumer was not registered
     */
    public boolean cancelConsumer(Consumer consumer) {
        consumer.deactivate();
        if (!registry.remove(consumer)) {
            return false;
        }
        Queue queue = topology.getQueue(consumer.getQueueName());
        if (queue != null) {
            queue.decrementConsumerCount();
        }
        return true;
    }

    /**
     * Deregister every consumer of a queue, as when the queue is deleted.
     */
    public List<Consumer> cancelConsumersForQueue(String queueName) {
        List<Consumer> removed = registry.removeAll(queueName);
        for (Consumer consumer : removed) {
            consumer.deactivate();
        }
        scheduled.remove(queueName);
        return removed;
    }

    /**
     * Re-run dispatch for every queue the channel consumes from, e.g. after a prefetch change.
     */
    public void requestDispatch(Channel channel) {
        for (Consumer consumer : channel.getConsumers()) {
            requestDispatch(consumer.getQueueName());
        }
    }

    // ---------------------------------------------------------- settlement

    /**
     * @return number of messages acknowledged
     */
    public int ack(Channel channel, long deliveryTag, boolean multiple) {
        return acknowledge(channel, channel.getUnackedMessages().remove(deliveryTag, multiple), deliveryTag, multiple);
    }

    /**
     * @return number of messages acknowledged
     */
    public int ackAll(Channel channel) {
        return acknowledge(channel, channel.getUnackedMessages().removeAll(), 0, true);
    }

    private int acknowledge(Channel channel, List<UnackedMessages.UnackedMessage> settled, long deliveryTag, boolean multiple) {
        if (settled.isEmpty()) {
            logger.debug("Ignoring ack for unknown delivery tag {} (multiple={})", deliveryTag, multiple);
            return 0;
        }
        release(channel, settled);
        logger.debug("Acknowledged {} messages up to deliveryTag={}", settled.size(), deliveryTag);
        return settled.size();
    }

    /**
     * @return number of messages rejected
     */
    public int nack(Channel channel, long deliveryTag, boolean multiple, boolean requeue) {
        return reject(channel, channel.getUnackedMessages().remove(deliveryTag, multiple), deliveryTag, multiple, requeue);
    }

    /**
     * @return number of messages rejected
     */
    public int nackAll(Channel channel, boolean requeue) {
        return reject(channel, channel.getUnackedMessages().removeAll(), 0, true, requeue);
    }

    private int reject(Channel channel, List<UnackedMessages.UnackedMessage> settled, long deliveryTag,
                       boolean multiple, boolean requeue) {
        if (settled.isEmpty()) {
            logger.debug("Ignoring nack for unknown delivery tag {} (multiple={})", deliveryTag, multiple);
            return 0;
        }
        release(channel, settled);
        if (requeue) {
            requeue(settled);
        } else {
            logger.debug("Discarded {} nacked messages up to deliveryTag={}", settled.size(), deliveryTag);
        }
        return settled.size();
    }

    /**
     * Requeue every unacked message of the channel.
     *
     * @return number of messages requeued
     */
    public int recover(Channel channel) {
        List<UnackedMessages.UnackedMessage> settled = channel.getUnackedMessages().removeAll();
        if (settled.isEmpty()) {
            return 0;
        }
        release(channel, settled);
        requeue(settled);
        logger.debug("Recovered {} messages", settled.size());
        return settled.size();
    }

    private void requeue(List<UnackedMessages.UnackedMessage> settled) {
        Map<String, List<Message>> byQueue = new LinkedHashMap<>();
        for (UnackedMessages.UnackedMessage unacked : settled) {
            byQueue.computeIfAbsent(unacked.getQueueName(), k -> new ArrayList<>())
                   .add(unacked.getMessage().redeliver());
        }
        for (Map.Entry<String, List<Message>> entry : byQueue.entrySet()) {
            Queue queue = topology.getQueue(entry.getKey());
            if (queue == null) {
                logger.debug("Queue {} no longer exists, dropping {} requeued messages",
                        entry.getKey(), entry.getValue().size());
                continue;
            }
            queue.requeue(entry.getValue());
            logger.debug("Requeued {} messages to queue {}", entry.getValue().size(), entry.getKey());
            requestDispatch(entry.getKey());
        }
    }

    private void release(Channel channel, List<UnackedMessages.UnackedMessage> settled) {
        Set<String> freed = new LinkedHashSet<>();
        boolean globalReleased = false;
        for (UnackedMessages.UnackedMessage unacked : settled) {
            Consumer consumer = unacked.getConsumer();
            if (consumer != null) {
                consumer.release();
                freed.add(consumer.getQueueName());
            }
            if (unacked.holdsGlobalCredit()) {
                channel.getConnection().releaseGlobalCredit();
                globalReleased = true;
            }
        }
        if (globalReleased) {
            for (Channel sibling : channel.getConnection().getChannels()) {
                for (Consumer consumer : sibling.getConsumers()) {
                    freed.add(consumer.getQueueName());
                }
            }
        }
        for (String queueName : freed) {
            requestDispatch(queueName);
        }
    }

    private static final class Reservation {
        final Consumer consumer;
        final boolean globalCredit;

        Reservation(Consumer consumer, boolean globalCredit) {
            this.consumer = consumer;
            this.globalCredit = globalCredit;
        }

        void cancel() {
            if (!consumer.isNoAck()) {
                consumer.release();
                if (globalCredit) {
                    consumer.getChannel().getConnection().releaseGlobalCredit();
                }
            }
        }
    }
}
