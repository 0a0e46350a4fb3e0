package ru.tigran.feedbacksync.exception;

/**
 * Failure of an AI provider call (OpenRouter, AgentRouter) or of parsing its answer.
 * Inside a batch stage it turns into a failed batch; it never aborts a sync cycle.
 */
public class AIGatewayException extends ApplicationException {
    public AIGatewayException(String message, ErrorCode errorCode, boolean retriable) {
        super(message, errorCode, retriable);
    }

    public AIGatewayException(String message, ErrorCode errorCode, boolean retriable, Throwable cause) {
        super(message, errorCode, retriable, cause);
    }
}
