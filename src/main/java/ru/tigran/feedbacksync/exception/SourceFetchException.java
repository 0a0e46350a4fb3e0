package ru.tigran.feedbacksync.exception;

import ru.tigran.feedbacksync.model.SourceType;

/**
 * Thrown when a source collector fails. Non-fatal: the sync cycle continues
 * and the source contributes zero items.
 */
public class SourceFetchException extends ApplicationException {
    private final SourceType sourceType;

    public SourceFetchException(SourceType sourceType, String message) {
        super(message, ErrorCode.SOURCE_FETCH_FAILED);
        this.sourceType = sourceType;
    }

    public SourceFetchException(SourceType sourceType, String message, Throwable cause) {
        super(message, ErrorCode.SOURCE_FETCH_FAILED, false, cause);
        this.sourceType = sourceType;
    }

    public SourceType getSourceType() {
        return sourceType;
    }
}
