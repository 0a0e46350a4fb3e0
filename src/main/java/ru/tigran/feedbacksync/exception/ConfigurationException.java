package ru.tigran.feedbacksync.exception;

/**
 * Thrown before any fetch when required settings (AI credentials, provider) are missing or invalid.
 */
public class ConfigurationException extends ApplicationException {
    public ConfigurationException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }
}
