package ru.tigran.feedbacksync.exception;

/**
 * Enum for application error codes.
 * Each code has a default message for logging purposes.
 */
public enum ErrorCode {
    // Configuration errors
    MISSING_CREDENTIALS("MISSING_CREDENTIALS", "AI provider credentials are not configured"),
    INVALID_CONFIGURATION("INVALID_CONFIGURATION", "Invalid sync configuration"),

    // Sync lifecycle
    SYNC_IN_PROGRESS("SYNC_IN_PROGRESS", "A sync cycle is already running"),

    // Source errors
    SOURCE_FETCH_FAILED("SOURCE_FETCH_FAILED", "Failed to fetch items from source"),

    // Batch errors
    CLASSIFICATION_BATCH_FAILED("CLASSIFICATION_BATCH_FAILED", "Classification batch failed"),
    GROUPING_BATCH_FAILED("GROUPING_BATCH_FAILED", "Grouping batch failed"),
    TRANSLATION_BATCH_FAILED("TRANSLATION_BATCH_FAILED", "Translation batch failed"),

    // Shared store errors
    STORE_READ_FAILED("STORE_READ_FAILED", "Failed to read from shared store"),
    STORE_WRITE_FAILED("STORE_WRITE_FAILED", "Failed to write to shared store"),

    // AI service errors
    AI_SERVICE_ERROR("AI_SERVICE_ERROR", "AI service error"),
    AI_CIRCUIT_OPEN("AI_CIRCUIT_OPEN", "AI provider circuit breaker is open"),
    INVALID_AI_RESPONSE("INVALID_AI_RESPONSE", "Invalid response from AI service"),
    INVALID_JSON_RESPONSE("INVALID_JSON_RESPONSE", "Failed to parse JSON response from AI");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
