package com.eainde.vocab.service;

import com.eainde.vocab.generation.CancellationToken;
import com.eainde.vocab.merge.MergeResult;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a background table task: a topic generation or a dictionary enrichment pass.
 *
 * @param taskId short id, also put in the MDC of the worker
 * @param topic  topic being generated, or {@code jisho} for enrichment
 * @param result completes with the merge into the table, or exceptionally with the worker failure
 * @param token  cancellation flag observed between generation rounds or between looked-up rows
 */
public record GenerationTask(
        String taskId,
        String topic,
        CompletableFuture<MergeResult> result,
        CancellationToken token
) {

    /**
     * Requests cancellation; takes effect at the next round or row boundary.
     */
    public void cancel() {
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }
}
