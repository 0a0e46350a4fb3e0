package ru.tigran.feedbacksync.exception;

/**
 * Thrown for transient HTTP errors that should be retried, both by the AI gateway
 * and by source collectors.
 * Examples: 429 (Too Many Requests), 502 (Bad Gateway), 503 (Service Unavailable), 504 (Gateway Timeout)
 */
public class RetriableHttpException extends RuntimeException {
    private final int statusCode;

    public RetriableHttpException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public static boolean isRetriableStatus(int statusCode) {
        return statusCode == 429 || statusCode == 502 || statusCode == 503 || statusCode == 504;
    }
}
