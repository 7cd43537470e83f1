package com.minibroker.model;

import java.util.Objects;

/**
 * Result of a queue declare or check: the name (generated names included) and current counts.
 */
public final class QueueInfo {
    private final String queue;
    private final int messageCount;
    private final int consumerCount;

    public QueueInfo(String queue, int messageCount, int consumerCount) {
        this.queue = queue;
        this.messageCount = messageCount;
        this.consumerCount = consumerCount;
    }

    public static QueueInfo of(Queue queue) {
        return new QueueInfo(queue.getName(), queue.size(), queue.getConsumerCount());
    }

    public String getQueue() {
        return queue;
    }

    public int getMessageCount() {
        return messageCount;
    }

    public int getConsumerCount() {
        return consumerCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueInfo that = (QueueInfo) o;
        return messageCount == that.messageCount &&
               consumerCount == that.consumerCount &&
               queue.equals(that.queue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queue, messageCount, consumerCount);
    }

    @Override
    public String toString() {
        return String.format("QueueInfo{queue='%s', messageCount=%d, consumerCount=%d}",
                queue, messageCount, consumerCount);
    }
}
