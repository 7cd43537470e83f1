package com.minibroker.connection;

import com.minibroker.amqp.AmqpConstants;
import com.minibroker.confirms.ConfirmChannel;
import com.minibroker.exception.ConnectionException;
import com.minibroker.exception.ConnectionNotOpenException;
import com.minibroker.server.Broker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A client connection to a broker. Owns its channels: closing the connection closes every
 * channel, then deletes the exclusive queues the connection declared.
 */
public class Connection {
    private static final Logger logger = LoggerFactory.getLogger(Connection.class);

    public enum State {
        DISCONNECTED,
        CONNECTED,
        CLOSED
    }

    private final Broker broker;
    private final String name;
    private final int channelMax;
    private final int heartbeatSeconds;
    private final AtomicReference<State> state = new AtomicReference<>(State.DISCONNECTED);
    private final AtomicInteger lastChannelNumber = new AtomicInteger(0);
    private final ConcurrentMap<Integer, Channel> channels = new ConcurrentHashMap<>();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final List<ChannelListener> channelListeners = new CopyOnWriteArrayList<>();

    // Shared by every channel of the connection
    private volatile int globalPrefetch = 0;
    private final AtomicInteger globalOutstanding = new AtomicInteger(0);

    private volatile ScheduledFuture<?> heartbeatSender;

    public Connection(Broker broker, String name) {
        this.broker = broker;
        this.name = name;
        this.channelMax = broker.getConfig().getChannelMax() > 0
                ? broker.getConfig().getChannelMax() : AmqpConstants.DEFAULT_CHANNEL_MAX;
        this.heartbeatSeconds = broker.getConfig().getHeartbeatSeconds();
    }

    /**
     * Connect. Calling it again on a connected connection does nothing.
     *
     * @throws ConnectionNotOpenException if the connection was closed
     */
    public void connect() {
        if (state.compareAndSet(State.DISCONNECTED, State.CONNECTED)) {
            startHeartbeat();
            logger.info("Connection {} connected", name);
            for (ConnectionListener listener : listeners) {
                listener.onConnect(this);
            }
            return;
        }
        if (state.get() == State.CLOSED) {
            throw new ConnectionNotOpenException("Connection " + name + " is closed");
        }
    }

    private void startHeartbeat() {
        if (heartbeatSeconds <= 0) {
            logger.debug("Heartbeat disabled (interval=0)");
            return;
        }
        heartbeatSender = broker.getScheduler().scheduleAtFixedRate(() -> {
            try {
                if (state.get() == State.CONNECTED) {
                    for (ConnectionListener listener : listeners) {
                        listener.onHeartbeat(this);
                    }
                }
            } catch (Exception e) {
                logger.error("Error emitting heartbeat on {}", name, e);
                fireError(e);
            }
        }, heartbeatSeconds, heartbeatSeconds, TimeUnit.SECONDS);
        logger.info("Heartbeat started: interval={}s", heartbeatSeconds);
    }

    private void stopHeartbeat() {
        ScheduledFuture<?> sender = heartbeatSender;
        if (sender != null) {
            sender.cancel(false);
            heartbeatSender = null;
            logger.debug("Heartbeat stopped");
        }
    }

    public Channel createChannel() {
        ensureConnected();
        return register(new Channel(this, allocateChannelNumber()));
    }

    /**
     * Create a channel with publisher confirms already enabled.
     */
    public ConfirmChannel createConfirmChannel() {
        ensureConnected();
        ConfirmChannel channel = register(new ConfirmChannel(this, allocateChannelNumber()));
        channel.enableConfirms();
        return channel;
    }

    private void ensureConnected() {
        State current = state.get();
        if (current != State.CONNECTED) {
            throw new ConnectionNotOpenException("Connection " + name + " is " + current);
        }
    }

    private int allocateChannelNumber() {
        int number = lastChannelNumber.incrementAndGet();
        if (number > channelMax) {
            throw new ConnectionException(AmqpConstants.REPLY_NOT_ALLOWED,
                    "Channel limit reached on " + name + " (max " + channelMax + ")");
        }
        return number;
    }

    private <T extends Channel> T register(T channel) {
        for (ChannelListener listener : channelListeners) {
            channel.addChannelListener(listener);
        }
        channels.put(channel.getChannelNumber(), channel);
        channel.open();
        logger.debug("Opened channel: {} (total: {}/{})", channel.getChannelNumber(), channels.size(), channelMax);
        return channel;
    }

    void channelClosed(Channel channel) {
        channels.remove(channel.getChannelNumber(), channel);
    }

    /**
     * Close every channel concurrently, stop the heartbeat and delete the exclusive queues
     * of this connection. Channel failures are logged and reported to
     * {@link ConnectionListener#onError}. Closing again does nothing.
     */
    public void close() {
        State previous = state.getAndSet(State.CLOSED);
        if (previous == State.CLOSED) {
            return;
        }
        stopHeartbeat();

        List<Channel> open = new ArrayList<>(channels.values());
        List<CompletableFuture<Void>> closing = new ArrayList<>(open.size());
        for (Channel channel : open) {
            closing.add(closeAsync(channel));
        }
        CompletableFuture.allOf(closing.toArray(new CompletableFuture[0])).join();
        channels.clear();

        broker.connectionClosed(this);
        logger.info("Connection {} closed", name);
        for (ConnectionListener listener : listeners) {
            listener.onClose(this);
        }
    }

    private CompletableFuture<Void> closeAsync(Channel channel) {
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(channel::close, broker.getWorkerExecutor());
        } catch (RejectedExecutionException e) {
            future = new CompletableFuture<>();
            try {
                channel.close();
                future.complete(null);
            } catch (RuntimeException closeError) {
                future.completeExceptionally(closeError);
            }
        }
        return future.exceptionally(e -> {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Failed to close channel {} on {}", channel.getChannelNumber(), name, cause);
            fireError(cause);
            return null;
        });
    }

    private void fireError(Throwable error) {
        for (ConnectionListener listener : listeners) {
            try {
                listener.onError(this, error);
            } catch (RuntimeException e) {
                logger.warn("Connection listener failed handling error on {}", name, e);
            }
        }
    }

    // ------------------------------------------------------ global prefetch

    public int getGlobalPrefetch() {
        return globalPrefetch;
    }

    void setGlobalPrefetch(int globalPrefetch) {
        this.globalPrefetch = globalPrefetch;
    }

    /**
     * Take one unit of the shared prefetch budget.
     *
     * @return false if the budget is used up
     */
    public boolean tryAcquireGlobalCredit() {
        while (true) {
            int limit = globalPrefetch;
            int current = globalOutstanding.get();
            if (limit > 0 && current >= limit) {
                return false;
            }
            if (globalOutstanding.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void releaseGlobalCredit() {
        globalOutstanding.updateAndGet(count -> count > 0 ? count - 1 : 0);
    }

    public int getGlobalOutstanding() {
        return globalOutstanding.get();
    }

    // ------------------------------------------------------------ getters

    public Broker getBroker() {
        return broker;
    }

    public String getName() {
        return name;
    }

    public State getState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == State.CONNECTED;
    }

    public int getHeartbeatSeconds() {
        return heartbeatSeconds;
    }

    public Channel getChannel(int channelNumber) {
        return channels.get(channelNumber);
    }

    public Collection<Channel> getChannels() {
        return Collections.unmodifiableCollection(channels.values());
    }

    public void addConnectionListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    public void removeConnectionListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Listener added to every channel created after this call.
     */
    public void addChannelListener(ChannelListener listener) {
        channelListeners.add(listener);
    }

    @Override
    public String toString() {
        return String.format("Connection{name='%s', state=%s, channels=%d}", name, state.get(), channels.size());
    }
}
