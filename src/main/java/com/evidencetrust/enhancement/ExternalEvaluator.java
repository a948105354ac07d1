package com.evidencetrust.enhancement;

import java.util.concurrent.CompletableFuture;

import com.evidencetrust.input.ReviewInput;

/**
 * An independent reviewer consulted after the deterministic baseline. Implementations must not
 * block the caller; cancelling the returned future should abort any in-flight work.
 */
public interface ExternalEvaluator {
    CompletableFuture<EnhancementResult> evaluate(ReviewInput input);
}
