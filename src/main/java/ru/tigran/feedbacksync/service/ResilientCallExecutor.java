package ru.tigran.feedbacksync.service;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import ru.tigran.feedbacksync.config.Resilience4jConfig;
import ru.tigran.feedbacksync.exception.AIGatewayException;
import ru.tigran.feedbacksync.exception.ApplicationException;
import ru.tigran.feedbacksync.exception.ErrorCode;
import ru.tigran.feedbacksync.exception.RetriableHttpException;
import ru.tigran.feedbacksync.exception.SourceFetchException;
import ru.tigran.feedbacksync.model.SourceType;

import java.util.function.Supplier;

/**
 * Retry/backoff at the collaborator boundary.
 *
 * AI calls go through retry and then the circuit breaker (retry wraps the breaker, so an open
 * circuit fails fast without further attempts). Source fetches only go through retry.
 * Whatever escapes is translated into the application exception of that boundary.
 */
@Slf4j
@Component
public class ResilientCallExecutor {

    private final Retry aiProviderRetry;
    private final Retry sourceFetchRetry;
    private final CircuitBreaker aiProviderCircuitBreaker;

    public ResilientCallExecutor(
            @Qualifier("aiProviderRetry") Retry aiProviderRetry,
            @Qualifier("sourceFetchRetry") Retry sourceFetchRetry,
            CircuitBreaker aiProviderCircuitBreaker
    ) {
        this.aiProviderRetry = aiProviderRetry;
        this.sourceFetchRetry = sourceFetchRetry;
        this.aiProviderCircuitBreaker = aiProviderCircuitBreaker;
    }

    public <T> T callAiProvider(String operation, Supplier<T> call) {
        Supplier<T> decorated = Retry.decorateSupplier(aiProviderRetry,
                CircuitBreaker.decorateSupplier(aiProviderCircuitBreaker, call));
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            log.warn("AI provider circuit is open, {} call rejected", operation);
            throw new AIGatewayException(
                "AI provider circuit breaker is open, " + operation + " not attempted",
                ErrorCode.AI_CIRCUIT_OPEN,
                true,
                e
            );
        } catch (RetriableHttpException e) {
            throw new AIGatewayException(
                "Max retries exceeded for " + operation + ": HTTP " + e.getStatusCode(),
                ErrorCode.AI_SERVICE_ERROR,
                true,
                e
            );
        } catch (ApplicationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AIGatewayException(
                "AI " + operation + " call failed: " + e.getMessage(),
                ErrorCode.AI_SERVICE_ERROR,
                Resilience4jConfig.isTransientFailure(e),
                e
            );
        }
    }

    public <T> T fetchFromSource(SourceType sourceType, String sourceName, Supplier<T> call) {
        try {
            return Retry.decorateSupplier(sourceFetchRetry, call).get();
        } catch (SourceFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceFetchException(sourceType,
                "Source '" + sourceName + "' failed: " + e.getMessage(), e);
        }
    }
}
