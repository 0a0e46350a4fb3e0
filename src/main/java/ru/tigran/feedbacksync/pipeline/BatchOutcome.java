package ru.tigran.feedbacksync.pipeline;

import ru.tigran.feedbacksync.exception.BatchProcessingException;

/**
 * Result of one batch call: either a result or the failure that replaced it.
 */
public record BatchOutcome<B, R>(int index, B batch, R result, BatchProcessingException failure) {

    public boolean succeeded() {
        return failure == null;
    }
}
