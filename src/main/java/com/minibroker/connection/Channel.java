package com.minibroker.connection;

import com.minibroker.amqp.AmqpConstants;
import com.minibroker.consumer.CancelCallback;
import com.minibroker.consumer.Consumer;
import com.minibroker.consumer.DeliverCallback;
import com.minibroker.consumer.DeliveryEngine;
import com.minibroker.consumer.UnackedMessages;
import com.minibroker.exception.ChannelNotOpenException;
import com.minibroker.exception.PreconditionFailedException;
import com.minibroker.model.ConsumeOptions;
import com.minibroker.model.Delivery;
import com.minibroker.model.Exchange;
import com.minibroker.model.ExchangeOptions;
import com.minibroker.model.Message;
import com.minibroker.model.MessageProperties;
import com.minibroker.model.PublishOptions;
import com.minibroker.model.Queue;
import com.minibroker.model.QueueInfo;
import com.minibroker.model.QueueOptions;
import com.minibroker.server.Broker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A client channel: topology management, publishing, consuming and acknowledgement.
 * <p>
 * Each channel owns its delivery tags, unacked messages, consumers and prefetch limit.
 * Consumer callbacks, cancel callbacks and returned messages run on the channel's single
 * delivery thread, in the order the broker produced them.
 */
public class Channel {
    private static final Logger logger = LoggerFactory.getLogger(Channel.class);

    public enum State {
        UNOPENED,
        OPEN,
        CLOSING,
        CLOSED
    }

    private final int channelNumber;
    protected final Connection connection;
    protected final Broker broker;
    private final DeliveryEngine deliveryEngine;
    private final AtomicReference<State> state = new AtomicReference<>(State.UNOPENED);
    private final UnackedMessages unackedMessages = new UnackedMessages();
    private final ConcurrentMap<String, Consumer> consumers = new ConcurrentHashMap<>();
    private final List<ReturnListener> returnListeners = new CopyOnWriteArrayList<>();
    private final List<ChannelListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService deliveryExecutor;
    private volatile int prefetchCount = 0;

    public Channel(Connection connection, int channelNumber) {
        this.connection = connection;
        this.channelNumber = channelNumber;
        this.broker = connection.getBroker();
        this.deliveryEngine = broker.getDeliveryEngine();
        String threadName = connection.getName() + "-channel-" + channelNumber;
        this.deliveryExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Open the channel. Calling it again on an open channel does nothing.
     *
     * @throws ChannelNotOpenException if the channel is closing or closed
     */
    public void open() {
        if (state.compareAndSet(State.UNOPENED, State.OPEN)) {
            logger.debug("Channel {} opened on {}", channelNumber, connection.getName());
            for (ChannelListener listener : listeners) {
                listener.onOpen(this);
            }
            return;
        }
        if (state.get() != State.OPEN) {
            throw new ChannelNotOpenException("Channel " + channelNumber + " is " + state.get());
        }
    }

    protected void ensureOpen() {
        State current = state.get();
        if (current != State.OPEN) {
            throw new ChannelNotOpenException("Channel " + channelNumber + " is " + current);
        }
    }

    // ------------------------------------------------------------ queues

    public QueueInfo assertQueue(String queue) {
        return assertQueue(queue, QueueOptions.defaults());
    }

    public QueueInfo assertQueue(String queue, QueueOptions options) {
        ensureOpen();
        return broker.declareQueue(owner(), queue, options);
    }

    public QueueInfo checkQueue(String queue) {
        ensureOpen();
        return broker.checkQueue(owner(), queue);
    }

    public int deleteQueue(String queue) {
        return deleteQueue(queue, false, false);
    }

    /**
     * @return number of messages the queue held
     */
    public int deleteQueue(String queue, boolean ifUnused, boolean ifEmpty) {
        ensureOpen();
        return broker.deleteQueue(owner(), queue, ifUnused, ifEmpty);
    }

    public int purgeQueue(String queue) {
        ensureOpen();
        return broker.purgeQueue(owner(), queue);
    }

    public void bindQueue(String queue, String exchange, String pattern) {
        bindQueue(queue, exchange, pattern, null);
    }

    public void bindQueue(String queue, String exchange, String pattern, Map<String, Object> arguments) {
        ensureOpen();
        broker.bindQueue(owner(), queue, exchange, pattern, arguments);
    }

    public void unbindQueue(String queue, String exchange, String pattern) {
        unbindQueue(queue, exchange, pattern, null);
    }

    public void unbindQueue(String queue, String exchange, String pattern, Map<String, Object> arguments) {
        ensureOpen();
        broker.unbindQueue(owner(), queue, exchange, pattern, arguments);
    }

    // --------------------------------------------------------- exchanges

    public Exchange assertExchange(String exchange, String type) {
        return assertExchange(exchange, type, ExchangeOptions.defaults());
    }

    public Exchange assertExchange(String exchange, String type, ExchangeOptions options) {
        ensureOpen();
        Exchange.Type exchangeType;
        try {
            exchangeType = Exchange.Type.fromString(type);
        } catch (IllegalArgumentException e) {
            throw new PreconditionFailedException(e.getMessage());
        }
        return broker.declareExchange(exchange, exchangeType, options);
    }

    public Exchange checkExchange(String exchange) {
        ensureOpen();
        return broker.checkExchange(exchange);
    }

    public boolean deleteExchange(String exchange) {
        return deleteExchange(exchange, false);
    }

    public boolean deleteExchange(String exchange, boolean ifUnused) {
        ensureOpen();
        return broker.deleteExchange(exchange, ifUnused);
    }

    public void bindExchange(String destination, String source, String pattern) {
        bindExchange(destination, source, pattern, null);
    }

    public void bindExchange(String destination, String source, String pattern, Map<String, Object> arguments) {
        ensureOpen();
        broker.bindExchange(destination, source, pattern, arguments);
    }

    public void unbindExchange(String destination, String source, String pattern) {
        unbindExchange(destination, source, pattern, null);
    }

    public void unbindExchange(String destination, String source, String pattern, Map<String, Object> arguments) {
        ensureOpen();
        broker.unbindExchange(destination, source, pattern, arguments);
    }

    // -------------------------------------------------------- publishing

    public boolean publish(String exchange, String routingKey, byte[] content) {
        return publish(exchange, routingKey, content, PublishOptions.defaults());
    }

    /**
     * Route a message and enqueue it on every matching queue. Messages that match no queue
     * are dropped, or handed to the return listeners when {@code mandatory} is set.
     *
     * @return always true; the outbound buffer never refuses a write
     */
    public boolean publish(String exchange, String routingKey, byte[] content, PublishOptions options) {
        ensureOpen();
        route(createMessage(exchange, routingKey, content, options), options);
        return true;
    }

    public boolean sendToQueue(String queue, byte[] content) {
        return sendToQueue(queue, content, PublishOptions.defaults());
    }

    public boolean sendToQueue(String queue, byte[] content, PublishOptions options) {
        return publish(AmqpConstants.DEFAULT_EXCHANGE, queue, content, options);
    }

    protected Message createMessage(String exchange, String routingKey, byte[] content, PublishOptions options) {
        PublishOptions opts = options != null ? options : PublishOptions.defaults();
        return new Message(content, exchange != null ? exchange : AmqpConstants.DEFAULT_EXCHANGE,
                routingKey != null ? routingKey : "", opts.toProperties());
    }

    /**
     * @return names of the queues the message was enqueued on
     */
    protected Set<String> route(Message message, PublishOptions options) {
        PublishOptions opts = options != null ? options : PublishOptions.defaults();
        List<String> routingKeys = new ArrayList<>();
        routingKeys.add(message.getRoutingKey());
        routingKeys.addAll(opts.getExtraRoutingKeys());

        Set<String> routed = broker.publish(message.getExchange(), routingKeys, message);
        if (routed.isEmpty() && opts.isMandatory()) {
            returnMessage(message);
        }
        return routed;
    }

    private void returnMessage(Message message) {
        if (returnListeners.isEmpty()) {
            logger.debug("Unroutable mandatory message on channel {} and no return listener: {}",
                    channelNumber, message);
            return;
        }
        MessageProperties properties = message.getProperties();
        byte[] body = message.getBody();
        for (ReturnListener listener : returnListeners) {
            submit(() -> listener.handleReturn(AmqpConstants.REPLY_NO_ROUTE, "NO_ROUTE",
                    message.getExchange(), message.getRoutingKey(), properties, body.clone()));
        }
    }

    // --------------------------------------------------------- consuming

    public String consume(String queue, DeliverCallback callback) {
        return consume(queue, callback, null, ConsumeOptions.defaults());
    }

    public String consume(String queue, DeliverCallback callback, ConsumeOptions options) {
        return consume(queue, callback, null, options);
    }

    /**
     * Subscribe to a queue.
     *
     * @return the consumer tag, generated when the options carry none
     * @throws PreconditionFailedException if the tag is already used on this channel
     * @throws com.minibroker.exception.ResourceLockedException on exclusive queue or consumer conflicts
     */
    public String consume(String queue, DeliverCallback callback, CancelCallback cancelCallback,
                          ConsumeOptions options) {
        ensureOpen();
        ConsumeOptions opts = options != null ? options : ConsumeOptions.defaults();
        broker.accessQueue(owner(), queue);

        String tag = opts.getConsumerTag();
        if (tag == null || tag.isEmpty()) {
            tag = AmqpConstants.GENERATED_CONSUMER_TAG_PREFIX + UUID.randomUUID();
        }
        Consumer consumer = new Consumer(tag, queue, this, opts.isNoAck(), opts.isExclusive(),
                opts.getPriority(), opts.getArguments(), callback, cancelCallback);
        if (consumers.putIfAbsent(tag, consumer) != null) {
            throw new PreconditionFailedException("Consumer tag '" + tag + "' already in use on channel " + channelNumber);
        }
        try {
            deliveryEngine.registerConsumer(consumer);
        } catch (RuntimeException e) {
            consumers.remove(tag, consumer);
            throw e;
        }
        return tag;
    }

    /**
     * Cancel a consumer of this channel. Unknown tags are ignored.
     *
     * @return false if no consumer had the tag
     */
    public boolean cancel(String consumerTag) {
        ensureOpen();
        Consumer consumer = consumers.remove(consumerTag);
        if (consumer == null) {
            logger.debug("Ignoring cancel of unknown consumer {} on channel {}", consumerTag, channelNumber);
            return false;
        }
        cancelConsumer(consumer);
        return true;
    }

    private void cancelConsumer(Consumer consumer) {
        deliveryEngine.cancelConsumer(consumer);
        notifyCancelled(consumer);
        broker.autoDeleteIfUnused(consumer.getQueueName());
    }

    /**
     * The broker removed one of this channel's consumers, e.g. because its queue was deleted.
     */
    public void consumerCancelledByBroker(Consumer consumer) {
        if (consumers.remove(consumer.getConsumerTag(), consumer)) {
            notifyCancelled(consumer);
        }
    }

    private void notifyCancelled(Consumer consumer) {
        CancelCallback callback = consumer.getCancelCallback();
        if (callback != null) {
            submit(() -> callback.handle(consumer.getConsumerTag()));
        }
    }

    /**
     * Pull one message without subscribing.
     *
     * @return the message, or {@code null} when the queue is empty
     */
    public Delivery get(String queue) {
        return get(queue, false);
    }

    public Delivery get(String queue, boolean noAck) {
        ensureOpen();
        Queue target = broker.accessQueue(owner(), queue);
        return deliveryEngine.get(this, target, noAck);
    }

    // ----------------------------------------------------- acknowledgement

    public void ack(long deliveryTag) {
        ack(deliveryTag, false);
    }

    public void ack(long deliveryTag, boolean multiple) {
        ensureOpen();
        deliveryEngine.ack(this, deliveryTag, multiple);
    }

    public void ackAll() {
        ensureOpen();
        deliveryEngine.ackAll(this);
    }

    public void nack(long deliveryTag) {
        nack(deliveryTag, false, true);
    }

    public void nack(long deliveryTag, boolean multiple, boolean requeue) {
        ensureOpen();
        deliveryEngine.nack(this, deliveryTag, multiple, requeue);
    }

    public void nackAll(boolean requeue) {
        ensureOpen();
        deliveryEngine.nackAll(this, requeue);
    }

    public void reject(long deliveryTag, boolean requeue) {
        nack(deliveryTag, false, requeue);
    }

    /**
     * Limit unacked deliveries. Non-global limits apply to each consumer of this channel,
     * global limits are shared by every channel of the connection. 0 means unlimited.
     */
    public void prefetch(int count) {
        prefetch(count, false);
    }

    public void prefetch(int count, boolean global) {
        ensureOpen();
        if (count < 0) {
            throw new PreconditionFailedException("Prefetch count must not be negative: " + count);
        }
        if (global) {
            connection.setGlobalPrefetch(count);
            for (Channel channel : connection.getChannels()) {
                deliveryEngine.requestDispatch(channel);
            }
        } else {
            this.prefetchCount = count;
            deliveryEngine.requestDispatch(this);
        }
        logger.debug("Set prefetch count to {} (global={}) on channel {}", count, global, channelNumber);
    }

    /**
     * Requeue every unacked message of this channel.
     */
    public void recover() {
        ensureOpen();
        deliveryEngine.recover(this);
    }

    // ------------------------------------------------------------- close

    /**
     * Cancel every consumer and close the channel. Unacked messages stay unacked unless the
     * broker is configured to requeue them. Closing again does nothing.
     */
    public void close() {
        if (state.compareAndSet(State.UNOPENED, State.CLOSED)) {
            finishClose();
            return;
        }
        if (!state.compareAndSet(State.OPEN, State.CLOSING)) {
            return;
        }

        for (Consumer consumer : new ArrayList<>(consumers.values())) {
            if (consumers.remove(consumer.getConsumerTag(), consumer)) {
                cancelConsumer(consumer);
            }
        }

        if (broker.getConfig().isRequeueUnackedOnClose()) {
            int requeued = deliveryEngine.recover(this);
            if (requeued > 0) {
                logger.info("Requeued {} unacknowledged messages on close of channel {}", requeued, channelNumber);
            }
        } else {
            releaseGlobalCredit();
        }

        state.set(State.CLOSED);
        finishClose();
    }

    private void releaseGlobalCredit() {
        for (UnackedMessages.UnackedMessage unacked : unackedMessages.snapshot()) {
            if (unacked.holdsGlobalCredit()) {
                connection.releaseGlobalCredit();
            }
        }
    }

    private void finishClose() {
        deliveryExecutor.shutdown();
        connection.channelClosed(this);
        logger.debug("Channel {} closed on {}", channelNumber, connection.getName());
        for (ChannelListener listener : listeners) {
            listener.onClose(this);
        }
    }

    // ------------------------------------------------ delivery engine hooks

    /**
     * Hand a delivery to a consumer callback on the delivery thread.
     */
    public void deliver(Consumer consumer, Delivery delivery) {
        submit(() -> {
            if (!consumer.isActive()) {
                logger.debug("Consumer {} cancelled before delivery {} ran",
                        consumer.getConsumerTag(), delivery.getDeliveryTag());
                return;
            }
            try {
                consumer.getDeliverCallback().handle(delivery);
            } catch (Exception e) {
                logger.error("Consumer {} failed to handle delivery {}",
                        consumer.getConsumerTag(), delivery.getDeliveryTag(), e);
            }
        });
    }

    private void submit(Runnable task) {
        try {
            deliveryExecutor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.error("Callback failed on channel {}", channelNumber, e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Channel {} closed, dropping callback", channelNumber);
        }
    }

    // ------------------------------------------------------------ getters

    private String owner() {
        return connection.getName();
    }

    public int getChannelNumber() {
        return channelNumber;
    }

    public Connection getConnection() {
        return connection;
    }

    public State getState() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == State.OPEN;
    }

    public int getPrefetchCount() {
        return prefetchCount;
    }

    public UnackedMessages getUnackedMessages() {
        return unackedMessages;
    }

    public int getUnackedMessageCount() {
        return unackedMessages.size();
    }

    public Collection<Consumer> getConsumers() {
        return Collections.unmodifiableCollection(consumers.values());
    }

    public boolean hasConsumer(String consumerTag) {
        return consumers.containsKey(consumerTag);
    }

    public void addReturnListener(ReturnListener listener) {
        returnListeners.add(listener);
    }

    public void removeReturnListener(ReturnListener listener) {
        returnListeners.remove(listener);
    }

    public void addChannelListener(ChannelListener listener) {
        listeners.add(listener);
    }

    @Override
    public String toString() {
        return String.format("Channel{number=%d, connection='%s', state=%s}",
                channelNumber, connection.getName(), state.get());
    }
}
