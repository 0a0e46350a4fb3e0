package ru.tigran.feedbacksync.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.ResourceAccessException;
import ru.tigran.feedbacksync.exception.ApplicationException;
import ru.tigran.feedbacksync.exception.RetriableHttpException;

import java.time.Duration;

/**
 * Конфигурация Resilience4j для вызовов AI провайдера и источников.
 * Retry с экспоненциальной задержкой повторяет только временные ошибки (429, 502-504, сетевые).
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    /**
     * CircuitBreaker для защиты вызовов к AI API (OpenRouter, AgentRouter)
     * Открывается при 50% ошибок на окне из 10 вызовов (минимум 5)
     * Остается открытым на 20 секунд, затем переходит в HALF_OPEN для повторной проверки
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(
            CircuitBreakerConfig.custom()
                .failureRateThreshold(50.0f)
                .slowCallRateThreshold(50.0f)
                .slowCallDurationThreshold(Duration.ofSeconds(60))
                .permittedNumberOfCallsInHalfOpenState(3)
                .minimumNumberOfCalls(5)
                .slidingWindowSize(10)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .waitDurationInOpenState(Duration.ofSeconds(20))
                .recordException(Resilience4jConfig::isTransientFailure)
                .build()
        );

        registry.getEventPublisher()
                .onEntryAdded(event -> log.info("CircuitBreaker created: {}", event.getAddedEntry().getName()));

        return registry;
    }

    @Bean
    public CircuitBreaker aiProviderCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker("aiProvider");

        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("CircuitBreaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()))
                .onError(event -> log.debug("CircuitBreaker recorded error: {}", event.getThrowable().getMessage()));

        return circuitBreaker;
    }

    @Bean
    public RetryRegistry retryRegistry(
            @Value("${app.ai.max-retries:3}") int maxRetries,
            @Value("${app.ai.retry-delay-ms:1000}") long retryDelayMs,
            @Value("${app.ai.retry-backoff-multiplier:2}") double backoffMultiplier,
            @Value("${app.ai.max-backoff-ms:10000}") long maxBackoffMs
    ) {
        RetryRegistry registry = RetryRegistry.of(retryConfig(maxRetries, retryDelayMs, backoffMultiplier, maxBackoffMs));
        registry.getEventPublisher()
                .onEntryAdded(event -> log.info("Retry created: {} (max attempts {})",
                    event.getAddedEntry().getName(),
                    event.getAddedEntry().getRetryConfig().getMaxAttempts()));
        return registry;
    }

    /**
     * Retry для AI провайдера (конфигурация реестра по умолчанию)
     */
    @Bean
    public Retry aiProviderRetry(RetryRegistry registry) {
        return withLogging(registry.retry("aiProvider"));
    }

    /**
     * Retry для источников: та же политика, отдельные лимиты
     */
    @Bean
    public Retry sourceFetchRetry(
            RetryRegistry registry,
            @Value("${app.sources.max-retries:3}") int maxRetries,
            @Value("${app.sources.retry-delay-ms:1000}") long retryDelayMs,
            @Value("${app.sources.max-backoff-ms:10000}") long maxBackoffMs
    ) {
        return withLogging(registry.retry("sourceFetch", retryConfig(maxRetries, retryDelayMs, 2.0, maxBackoffMs)));
    }

    /**
     * Builds the shared retry policy: first attempt plus maxRetries retries,
     * delays initial * multiplier^n capped at maxBackoffMs.
     */
    public static RetryConfig retryConfig(int maxRetries, long retryDelayMs, double backoffMultiplier, long maxBackoffMs) {
        return RetryConfig.custom()
                .maxAttempts(maxRetries + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(retryDelayMs, backoffMultiplier, maxBackoffMs))
                .retryOnException(Resilience4jConfig::isTransientFailure)
                .build();
    }

    /**
     * Transient failures: retriable HTTP statuses, network I/O errors and
     * application exceptions flagged as retriable.
     */
    public static boolean isTransientFailure(Throwable throwable) {
        if (throwable instanceof RetriableHttpException || throwable instanceof ResourceAccessException) {
            return true;
        }
        if (throwable instanceof ApplicationException applicationException) {
            return applicationException.isRetriable();
        }
        return false;
    }

    private static Retry withLogging(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Retry '{}' attempt {} in {} ms: {}",
                    event.getName(),
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval().toMillis(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown error"))
                .onError(event -> log.error("Retry '{}' gave up after {} attempts",
                    event.getName(), event.getNumberOfRetryAttempts()));
        return retry;
    }
}
