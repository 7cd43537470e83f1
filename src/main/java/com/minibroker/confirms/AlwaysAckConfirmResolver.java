package com.minibroker.confirms;

import com.minibroker.model.Message;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Acks every publish, routed or not.
 */
public class AlwaysAckConfirmResolver implements ConfirmResolver {

    @Override
    public CompletionStage<Boolean> resolve(long sequenceNumber, Message message, Set<String> routedQueues) {
        return CompletableFuture.completedFuture(Boolean.TRUE);
    }
}
