package com.minibroker.confirms;

import com.minibroker.exception.ConfirmTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sequence numbers and pending confirms of one channel.
 * <p>
 * Sequence numbers start at 1 and are never reused. Each one is resolved at most once,
 * by {@link #confirmMessage} or by a timed-out {@link #awaitConfirms}; resolutions for
 * numbers already resolved are ignored.
 */
public class PublisherConfirms {
    private static final Logger logger = LoggerFactory.getLogger(PublisherConfirms.class);

    private volatile boolean confirmMode = false;
    private long lastSequence = 0;
    private final NavigableMap<Long, PendingConfirm> pendingConfirms = new ConcurrentSkipListMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition settled = lock.newCondition();

    public void enableConfirmMode() {
        if (!confirmMode) {
            this.confirmMode = true;
            logger.debug("Publisher confirms enabled");
        }
    }

    public boolean isConfirmMode() {
        return confirmMode;
    }

    /**
     * Take the next sequence number and record it as pending.
     */
    public long register(ConfirmCallback callback, String exchange, String routingKey) {
        lock.lock();
        try {
            long sequence = ++lastSequence;
            pendingConfirms.put(sequence, new PendingConfirm(sequence, callback, exchange, routingKey));
            logger.debug("Added pending confirm for sequence number: {}", sequence);
            return sequence;
        } finally {
            lock.unlock();
        }
    }

    public long getNextPublishSeqNo() {
        lock.lock();
        try {
            return lastSequence + 1;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolve one pending confirm, or with {@code multiple} every pending confirm up to and
     * including {@code sequence}. Callbacks run on the calling thread after the lock is released.
     *
     * @return number of confirms resolved
     */
    public int confirmMessage(long sequence, boolean multiple, boolean ack) {
        List<PendingConfirm> resolved = new ArrayList<>();
        lock.lock();
        try {
            if (multiple) {
                Map<Long, PendingConfirm> head = pendingConfirms.headMap(sequence, true);
                resolved.addAll(head.values());
                head.clear();
            } else {
                PendingConfirm confirm = pendingConfirms.remove(sequence);
                if (confirm != null) {
                    resolved.add(confirm);
                }
            }
            if (pendingConfirms.isEmpty()) {
                settled.signalAll();
            }
        } finally {
            lock.unlock();
        }

        if (resolved.isEmpty()) {
            logger.debug("No pending confirm for sequence number {} (multiple={})", sequence, multiple);
        }
        for (PendingConfirm confirm : resolved) {
            notify(confirm, ack);
        }
        return resolved.size();
    }

    /**
     * Block until nothing is pending. If the oldest pending confirm has been outstanding
     * longer than {@code timeoutMillis}, every pending confirm is nacked and cleared.
     *
     * @throws ConfirmTimeoutException on timeout
     */
    public void awaitConfirms(long timeoutMillis) throws InterruptedException {
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        List<PendingConfirm> expired;
        lock.lock();
        try {
            while (true) {
                Map.Entry<Long, PendingConfirm> oldest = pendingConfirms.firstEntry();
                if (oldest == null) {
                    return;
                }
                long remaining = oldest.getValue().issuedAtNanos + timeoutNanos - System.nanoTime();
                if (remaining <= 0) {
                    expired = new ArrayList<>(pendingConfirms.values());
                    pendingConfirms.clear();
                    settled.signalAll();
                    break;
                }
                settled.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }

        logger.warn("Timed out after {}ms waiting for {} confirms, treating them as nacked",
                timeoutMillis, expired.size());
        for (PendingConfirm confirm : expired) {
            notify(confirm, false);
        }
        throw new ConfirmTimeoutException("Timed out waiting for " + expired.size()
                + " publisher confirms (first sequence number " + expired.get(0).sequence + ")");
    }

    private void notify(PendingConfirm confirm, boolean ack) {
        try {
            confirm.callback.handle(confirm.sequence, ack);
        } catch (RuntimeException e) {
            logger.error("Confirm callback failed for sequence number {} ({} / {})",
                    confirm.sequence, confirm.exchange, confirm.routingKey, e);
        }
    }

    public int getPendingConfirmCount() {
        return pendingConfirms.size();
    }

    public boolean isPending(long sequence) {
        return pendingConfirms.containsKey(sequence);
    }

    private static class PendingConfirm {
        final long sequence;
        final ConfirmCallback callback;
        final String exchange;
        final String routingKey;
        final long issuedAtNanos;

        PendingConfirm(long sequence, ConfirmCallback callback, String exchange, String routingKey) {
            this.sequence = sequence;
            this.callback = callback;
            this.exchange = exchange;
            this.routingKey = routingKey;
            this.issuedAtNanos = System.nanoTime();
        }
    }
}
