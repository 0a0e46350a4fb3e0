package ru.tigran.feedbacksync.exception;

/**
 * Base class for sync pipeline failures.
 *
 * The {@link ErrorCode} tells the orchestrator how far a failure reaches: source and batch
 * errors are counted in the sync report, store and configuration errors abort the cycle.
 * The retriable flag is read by the Resilience4j retry predicate at the AI and source boundaries.
 */
public abstract class ApplicationException extends RuntimeException {
    private final ErrorCode errorCode;
    private final boolean retriable;

    public ApplicationException(String message, ErrorCode errorCode) {
        this(message, errorCode, false);
    }

    public ApplicationException(String message, ErrorCode errorCode, boolean retriable) {
        super(message);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    public ApplicationException(String message, ErrorCode errorCode, boolean retriable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return true when another attempt may succeed (rate limit, provider overload, open circuit)
     */
    public boolean isRetriable() {
        return retriable;
    }
}
