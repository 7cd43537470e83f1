package com.minibroker.topology;

import com.minibroker.amqp.AmqpConstants;
import com.minibroker.config.BrokerConfig;
import com.minibroker.exception.AccessRefusedException;
import com.minibroker.exception.NotFoundException;
import com.minibroker.exception.PreconditionFailedException;
import com.minibroker.exception.ResourceLockedException;
import com.minibroker.model.Binding;
import com.minibroker.model.Exchange;
import com.minibroker.model.ExchangeOptions;
import com.minibroker.model.Queue;
import com.minibroker.model.QueueInfo;
import com.minibroker.model.QueueOptions;
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
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Queues, exchanges and bindings of one broker.
 * <p>
 * Mutations are serialized on the store's monitor. Reads go straight to the concurrent
 * maps so routing never waits behind a declare.
 */
public class TopologyStore {
    private static final Logger logger = LoggerFactory.getLogger(TopologyStore.class);

    private final BrokerConfig config;
    private final Map<String, Queue> queues = new ConcurrentHashMap<>();
    private final Map<String, Exchange> exchanges = new ConcurrentHashMap<>();
    // Keyed by source exchange; insertion order is routing order
    private final Map<String, Set<Binding>> bindingsBySource = new ConcurrentHashMap<>();

    public TopologyStore(BrokerConfig config) {
        this.config = config;
        createDefaultExchanges();
    }

    private void createDefaultExchanges() {
        putExchange(new Exchange(AmqpConstants.DEFAULT_EXCHANGE, Exchange.Type.DIRECT, true, false, false));
        putExchange(new Exchange(AmqpConstants.AMQ_DIRECT, Exchange.Type.DIRECT, true, false, false));
        putExchange(new Exchange(AmqpConstants.AMQ_FANOUT, Exchange.Type.FANOUT, true, false, false));
        putExchange(new Exchange(AmqpConstants.AMQ_TOPIC, Exchange.Type.TOPIC, true, false, false));
        putExchange(new Exchange(AmqpConstants.AMQ_HEADERS, Exchange.Type.HEADERS, true, false, false));
        putExchange(new Exchange(AmqpConstants.AMQ_MATCH, Exchange.Type.HEADERS, true, false, false));
    }

    private void putExchange(Exchange exchange) {
        exchanges.put(exchange.getName(), exchange);
        bindingsBySource.put(exchange.getName(), new CopyOnWriteArraySet<>());
    }

    // ---------------------------------------------------------------- queues

    /**
     * Declare a queue, or return the existing one. An empty name generates a unique
     * {@code amq.gen-} name.
     *
     * @param owner name of the declaring connection, used for exclusive queues
     */
    public synchronized Queue declareQueue(String name, QueueOptions options, String owner) {
        if (name == null || name.isEmpty()) {
            name = AmqpConstants.GENERATED_QUEUE_PREFIX + UUID.randomUUID();
        }

        Queue existing = queues.get(name);
        if (existing != null) {
            checkExclusiveAccess(existing, owner);
            if (config.isStrictRedeclare() &&
                (existing.isDurable() != options.isDurable() ||
                 existing.isExclusive() != options.isExclusive() ||
                 existing.isAutoDelete() != options.isAutoDelete())) {
                throw new PreconditionFailedException(
                        "Queue '" + name + "' already exists with different parameters");
            }
            return existing;
        }

        if (!name.startsWith(AmqpConstants.GENERATED_QUEUE_PREFIX)) {
            validateResourceName(name, "Queue");
        }

        Queue queue = new Queue(name, options.isDurable(), options.isExclusive(), options.isAutoDelete(),
                options.getArguments(), owner, config.getDefaultQueueMaxLength());
        queues.put(name, queue);
        logger.info("Declared queue: {}", queue);
        return queue;
    }

    public Queue getQueue(String name) {
        return name == null ? null : queues.get(name);
    }

    /**
     * @throws NotFoundException if the queue does not exist
     */
    public Queue checkQueue(String name) {
        Queue queue = getQueue(name);
        if (queue == null) {
            throw new NotFoundException("No queue '" + name + "'");
        }
        return queue;
    }

    public QueueInfo queueInfo(String name) {
        return QueueInfo.of(checkQueue(name));
    }

    /**
     * Remove a queue and every binding that targets it.
     *
     * @return the number of messages the queue held, 0 if it did not exist
     */
    public synchronized int deleteQueue(String name, boolean ifUnused, boolean ifEmpty) {
        Queue queue = queues.get(name);
        if (queue == null) {
            return 0;
        }
        if (ifUnused && queue.getConsumerCount() > 0) {
            throw new PreconditionFailedException("Queue '" + name + "' in use");
        }
        if (ifEmpty && !queue.isEmpty()) {
            throw new PreconditionFailedException("Queue '" + name + "' not empty");
        }

        queues.remove(name);
        removeBindingsTo(name, Binding.DestinationType.QUEUE);
        int messageCount = queue.purge();
        logger.info("Deleted queue {} with {} messages", name, messageCount);
        return messageCount;
    }

    public int purgeQueue(String name) {
        int purged = checkQueue(name).purge();
        logger.info("Purged {} messages from queue {}", purged, name);
        return purged;
    }

    /**
     * Exclusive queues are usable only by the connection that declared them.
     *
     * @throws ResourceLockedException if {@code owner} is not the declaring connection
     */
    public void checkExclusiveAccess(Queue queue, String owner) {
        if (queue.isExclusive() && queue.getExclusiveOwner() != null &&
            !queue.getExclusiveOwner().equals(owner)) {
            throw new ResourceLockedException(
                    "Cannot obtain access to exclusive queue '" + queue.getName() + "' owned by another connection");
        }
    }

    public List<String> queuesOwnedBy(String owner) {
        List<String> owned = new ArrayList<>();
        for (Queue queue : queues.values()) {
            if (queue.isExclusive() && owner.equals(queue.getExclusiveOwner())) {
                owned.add(queue.getName());
            }
        }
        return owned;
    }

    public Collection<Queue> getQueues() {
        return Collections.unmodifiableCollection(queues.values());
    }

    // ------------------------------------------------------------- exchanges

    public synchronized Exchange declareExchange(String name, Exchange.Type type, ExchangeOptions options) {
        if (name == null) {
            throw new PreconditionFailedException("Exchange name cannot be null");
        }

        Exchange existing = exchanges.get(name);
        if (existing != null) {
            if (existing.getType() != type) {
                throw new PreconditionFailedException("Exchange '" + name + "' already exists with type "
                        + existing.getType() + ", requested " + type);
            }
            if (config.isStrictRedeclare() &&
                (existing.isDurable() != options.isDurable() ||
                 existing.isAutoDelete() != options.isAutoDelete() ||
                 existing.isInternal() != options.isInternal())) {
                throw new PreconditionFailedException(
                        "Exchange '" + name + "' already exists with different parameters");
            }
            return existing;
        }

        if (name.isEmpty()) {
            throw new AccessRefusedException("The default exchange cannot be redeclared");
        }
        validateResourceName(name, "Exchange");

        Exchange exchange = new Exchange(name, type, options.isDurable(), options.isAutoDelete(),
                options.isInternal(), options.getArguments());
        putExchange(exchange);
        logger.info("Declared exchange: {}", exchange);
        return exchange;
    }

    public Exchange getExchange(String name) {
        return name == null ? null : exchanges.get(name);
    }

    /**
     * @throws NotFoundException if the exchange does not exist
     */
    public Exchange checkExchange(String name) {
        Exchange exchange = getExchange(name);
        if (exchange == null) {
            throw new NotFoundException("No exchange '" + name + "'");
        }
        return exchange;
    }

    /**
     * Remove an exchange with every binding it is the source or destination of.
     *
     * @return false if the exchange did not exist
     */
    public synchronized boolean deleteExchange(String name, boolean ifUnused) {
        if (name == null || name.isEmpty() || isPredeclared(name)) {
            throw new AccessRefusedException("Exchange '" + name + "' cannot be deleted");
        }
        Exchange exchange = exchanges.get(name);
        if (exchange == null) {
            return false;
        }
        Set<Binding> outgoing = bindingsBySource.get(name);
        if (ifUnused && outgoing != null && !outgoing.isEmpty()) {
            throw new PreconditionFailedException("Exchange '" + name + "' in use");
        }
        removeExchange(name);
        return true;
    }

    private void removeExchange(String name) {
        exchanges.remove(name);
        bindingsBySource.remove(name);
        removeBindingsTo(name, Binding.DestinationType.EXCHANGE);
        logger.info("Deleted exchange {}", name);
    }

    private boolean isPredeclared(String name) {
        return name.equals(AmqpConstants.AMQ_DIRECT) || name.equals(AmqpConstants.AMQ_FANOUT) ||
               name.equals(AmqpConstants.AMQ_TOPIC) || name.equals(AmqpConstants.AMQ_HEADERS) ||
               name.equals(AmqpConstants.AMQ_MATCH);
    }

    public Collection<Exchange> getExchanges() {
        return Collections.unmodifiableCollection(exchanges.values());
    }

    // -------------------------------------------------------------- bindings

    public synchronized void bindQueue(String queueName, String exchangeName, String pattern,
                                       Map<String, Object> arguments) {
        Exchange source = checkBindableSource(exchangeName);
        checkQueue(queueName);
        Binding binding = Binding.toQueue(source.getName(), queueName, pattern, arguments);
        if (bindingsBySource.get(source.getName()).add(binding)) {
            logger.info("Bound queue {} to exchange {} with pattern {}", queueName, exchangeName, pattern);
        }
    }

    public synchronized void unbindQueue(String queueName, String exchangeName, String pattern,
                                         Map<String, Object> arguments) {
        Exchange source = checkBindableSource(exchangeName);
        checkQueue(queueName);
        removeBinding(Binding.toQueue(source.getName(), queueName, pattern, arguments));
    }

    public synchronized void bindExchange(String destination, String sourceName, String pattern,
                                          Map<String, Object> arguments) {
        Exchange source = checkBindableSource(sourceName);
        Exchange target = checkExchange(destination);
        if (target.isDefault()) {
            throw new AccessRefusedException("The default exchange cannot be a binding destination");
        }
        Binding binding = Binding.toExchange(source.getName(), destination, pattern, arguments);
        if (bindingsBySource.get(source.getName()).add(binding)) {
            logger.info("Bound exchange {} to exchange {} with pattern {}", destination, sourceName, pattern);
        }
    }

    public synchronized void unbindExchange(String destination, String sourceName, String pattern,
                                            Map<String, Object> arguments) {
        Exchange source = checkBindableSource(sourceName);
        checkExchange(destination);
        removeBinding(Binding.toExchange(source.getName(), destination, pattern, arguments));
    }

    /**
     * Bindings whose source is the given exchange, in the order they were added.
     */
    public Collection<Binding> bindingsFrom(String exchangeName) {
        Set<Binding> bindings = bindingsBySource.get(exchangeName);
        return bindings == null ? Collections.emptySet() : Collections.unmodifiableSet(bindings);
    }

    private Exchange checkBindableSource(String exchangeName) {
        Exchange exchange = checkExchange(exchangeName);
        if (exchange.isDefault()) {
            throw new AccessRefusedException("Operation not permitted on the default exchange");
        }
        return exchange;
    }

    private void removeBinding(Binding binding) {
        Set<Binding> bindings = bindingsBySource.get(binding.getSource());
        if (bindings != null && bindings.remove(binding)) {
            logger.info("Removed binding {}", binding);
            autoDeleteIfUnused(binding.getSource());
        }
    }

    private void removeBindingsTo(String destination, Binding.DestinationType type) {
        for (Map.Entry<String, Set<Binding>> entry : new ArrayList<>(bindingsBySource.entrySet())) {
            boolean removed = entry.getValue().removeIf(b ->
                    b.getDestinationType() == type && b.getDestination().equals(destination));
            if (removed) {
                autoDeleteIfUnused(entry.getKey());
            }
        }
    }

    private void autoDeleteIfUnused(String exchangeName) {
        Exchange exchange = exchanges.get(exchangeName);
        Set<Binding> remaining = bindingsBySource.get(exchangeName);
        if (exchange != null && exchange.isAutoDelete() && remaining != null && remaining.isEmpty()) {
            logger.info("Auto-deleting exchange {} after its last binding was removed", exchangeName);
            removeExchange(exchangeName);
        }
    }

    private void validateResourceName(String name, String resourceType) {
        if (name.length() > AmqpConstants.MAX_NAME_LENGTH) {
            throw new PreconditionFailedException(resourceType + " name exceeds maximum length of "
                    + AmqpConstants.MAX_NAME_LENGTH + " characters");
        }
        if (!name.matches("^[a-zA-Z0-9._:\\-]+$")) {
            throw new PreconditionFailedException(resourceType + " name contains invalid characters: " + name);
        }
        if (name.startsWith(AmqpConstants.RESERVED_PREFIX)) {
            throw new AccessRefusedException(resourceType + " name '" + name
                    + "' uses the reserved prefix '" + AmqpConstants.RESERVED_PREFIX + "'");
        }
    }
}
