package com.minibroker.server;

import com.minibroker.config.BrokerConfig;
import com.minibroker.confirms.AlwaysAckConfirmResolver;
import com.minibroker.confirms.ConfirmResolver;
import com.minibroker.connection.Connection;
import com.minibroker.consumer.Consumer;
import com.minibroker.consumer.ConsumerRegistry;
import com.minibroker.consumer.DeliveryEngine;
import com.minibroker.exception.PreconditionFailedException;
import com.minibroker.model.Exchange;
import com.minibroker.model.ExchangeOptions;
import com.minibroker.model.Message;
import com.minibroker.model.Queue;
import com.minibroker.model.QueueInfo;
import com.minibroker.model.QueueOptions;
import com.minibroker.routing.Router;
import com.minibroker.topology.TopologyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One simulated broker: its topology, routing, delivery and connections. Brokers share no
 * state, so any number of them can run in one JVM.
 */
public class Broker {
    private static final Logger logger = LoggerFactory.getLogger(Broker.class);

    private final BrokerConfig config;
    private final TopologyStore topology;
    private final Router router;
    private final DeliveryEngine deliveryEngine;
    private final ConfirmResolver confirmResolver;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workerExecutor;
    private final AtomicLong connectionIds = new AtomicLong(0);
    private final Set<Connection> connections = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public Broker() {
        this(BrokerConfig.fromClasspath(BrokerConfig.DEFAULT_RESOURCE));
    }

    public Broker(BrokerConfig config) {
        this(config, new AlwaysAckConfirmResolver());
    }

    public Broker(BrokerConfig config, ConfirmResolver confirmResolver) {
        this.config = config;
        this.confirmResolver = confirmResolver;
        this.topology = new TopologyStore(config);
        this.router = new Router(topology);
        this.deliveryEngine = new DeliveryEngine(topology, new ConsumerRegistry(), config.getDeliveryThreads());
        this.scheduler = Executors.newScheduledThreadPool(1, daemonThreads("BrokerScheduler-"));
        this.workerExecutor = Executors.newCachedThreadPool(daemonThreads("BrokerWorker-"));
        logger.info("Broker initialized with config: {}", config);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        return new ThreadFactory() {
            private final AtomicLong counter = new AtomicLong(0);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        };
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            deliveryEngine.start();
            logger.info("Broker started");
        }
    }

    /**
     * Close every connection, then stop delivery and the broker's threads.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Stopping broker...");
        for (Connection connection : new ArrayList<>(connections)) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                logger.error("Error closing connection {}", connection.getName(), e);
            }
        }
        deliveryEngine.stop();
        shutdown(scheduler);
        shutdown(workerExecutor);
        logger.info("Broker stopped");
    }

    private void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    // ----------------------------------------------------------- connections

    public Connection newConnection() {
        return newConnection("connection-" + connectionIds.incrementAndGet());
    }

    /**
     * Create a connection in the disconnected state. The name identifies the owner of
     * exclusive queues and must be unique within the broker.
     */
    public Connection newConnection(String name) {
        Connection connection = new Connection(this, name);
        connections.add(connection);
        return connection;
    }

    /**
     * Called by a connection once it has closed its channels.
     */
    public void connectionClosed(Connection connection) {
        connections.remove(connection);
        for (String queueName : topology.queuesOwnedBy(connection.getName())) {
            int purged = deleteQueueInternal(queueName, false, false);
            logger.info("Deleted exclusive queue {} ({} messages) owned by {}", queueName, purged, connection.getName());
        }
    }

    public Set<Connection> getConnections() {
        return Collections.unmodifiableSet(connections);
    }

    // ---------------------------------------------------------------- queues

    public QueueInfo declareQueue(String owner, String name, QueueOptions options) {
        Queue queue = topology.declareQueue(name, options != null ? options : QueueOptions.defaults(), owner);
        return QueueInfo.of(queue);
    }

    public QueueInfo checkQueue(String owner, String name) {
        return QueueInfo.of(accessQueue(owner, name));
    }

    /**
     * Look up a queue on behalf of a connection.
     *
     * @throws com.minibroker.exception.NotFoundException if it does not exist
     * @throws com.minibroker.exception.ResourceLockedException if it is exclusive to another connection
     */
    public Queue accessQueue(String owner, String name) {
        Queue queue = topology.checkQueue(name);
        topology.checkExclusiveAccess(queue, owner);
        return queue;
    }

    /**
     * Delete a queue, cancelling its consumers.
     *
     * @return number of messages the queue held
     */
    public int deleteQueue(String owner, String name, boolean ifUnused, boolean ifEmpty) {
        Queue queue = topology.getQueue(name);
        if (queue == null) {
            return 0;
        }
        topology.checkExclusiveAccess(queue, owner);
        return deleteQueueInternal(name, ifUnused, ifEmpty);
    }

    private int deleteQueueInternal(String name, boolean ifUnused, boolean ifEmpty) {
        int purged = topology.deleteQueue(name, ifUnused, ifEmpty);
        for (Consumer consumer : deliveryEngine.cancelConsumersForQueue(name)) {
            consumer.getChannel().consumerCancelledByBroker(consumer);
        }
        return purged;
    }

    /**
     * Delete an auto-delete queue once its last consumer is gone.
     */
    public void autoDeleteIfUnused(String queueName) {
        Queue queue = topology.getQueue(queueName);
        if (queue == null || !queue.isAutoDelete() || queue.getConsumerCount() > 0) {
            return;
        }
        try {
            int purged = deleteQueueInternal(queueName, true, false);
            logger.info("Auto-deleted queue {} ({} messages) after its last consumer was cancelled", queueName, purged);
        } catch (PreconditionFailedException e) {
            // A consumer registered concurrently
            logger.debug("Queue {} not auto-deleted: {}", queueName, e.getMessage());
        }
    }

    public int purgeQueue(String owner, String name) {
        accessQueue(owner, name);
        return topology.purgeQueue(name);
    }

    public void bindQueue(String owner, String queue, String exchange, String pattern, Map<String, Object> arguments) {
        accessQueue(owner, queue);
        topology.bindQueue(queue, exchange, pattern, arguments);
    }

    public void unbindQueue(String owner, String queue, String exchange, String pattern, Map<String, Object> arguments) {
        accessQueue(owner, queue);
        topology.unbindQueue(queue, exchange, pattern, arguments);
    }

    // ------------------------------------------------------------- exchanges

    public Exchange declareExchange(String name, Exchange.Type type, ExchangeOptions options) {
        return topology.declareExchange(name, type, options != null ? options : ExchangeOptions.defaults());
    }

    public Exchange checkExchange(String name) {
        return topology.checkExchange(name);
    }

    public boolean deleteExchange(String name, boolean ifUnused) {
        return topology.deleteExchange(name, ifUnused);
    }

    public void bindExchange(String destination, String source, String pattern, Map<String, Object> arguments) {
        topology.bindExchange(destination, source, pattern, arguments);
    }

    public void unbindExchange(String destination, String source, String pattern, Map<String, Object> arguments) {
        topology.unbindExchange(destination, source, pattern, arguments);
    }

    // ------------------------------------------------------------ publishing

    /**
     * Route a message and enqueue it on every matching queue.
     *
     * @return the queues the message was enqueued on, in routing order
     */
    public Set<String> publish(String exchange, List<String> routingKeys, Message message) {
        Set<String> targets = router.route(exchange, routingKeys, message.getProperties().getHeaders());
        for (String queueName : targets) {
            Queue queue = topology.getQueue(queueName);
            if (queue != null) {
                deliveryEngine.enqueue(queue, message);
            }
        }
        logger.debug("Published message to {} queues via exchange '{}'", targets.size(), exchange);
        return targets;
    }

    // --------------------------------------------------------------- getters

    public BrokerConfig getConfig() {
        return config;
    }

    public TopologyStore getTopology() {
        return topology;
    }

    public Router getRouter() {
        return router;
    }

    public DeliveryEngine getDeliveryEngine() {
        return deliveryEngine;
    }

    public ConfirmResolver getConfirmResolver() {
        return confirmResolver;
    }

    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    public ExecutorService getWorkerExecutor() {
        return workerExecutor;
    }
}
