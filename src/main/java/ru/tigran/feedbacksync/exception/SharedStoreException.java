package ru.tigran.feedbacksync.exception;

/**
 * Thrown when the shared store cannot be read or written. Fatal for the current sync cycle.
 */
public class SharedStoreException extends ApplicationException {
    public SharedStoreException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, errorCode, false, cause);
    }
}
