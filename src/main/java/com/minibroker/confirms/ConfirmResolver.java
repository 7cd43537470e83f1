package com.minibroker.confirms;

import com.minibroker.model.Message;

import java.util.Set;
import java.util.concurrent.CompletionStage;

/**
 * Decides the outcome of a confirmed publish. The stage completes with {@code true} to
 * ack and {@code false} to nack; completing exceptionally also nacks.
 */
public interface ConfirmResolver {

    CompletionStage<Boolean> resolve(long sequenceNumber, Message message, Set<String> routedQueues);
}
