package com.evidencetrust.input;

/**
 * Caller-supplied, read-only input of one review run: either a {@link PipelineBundle} of prior
 * assessment-phase artifacts or a single normalized {@link DocumentBundle}.
 */
public interface ReviewInput {
}
