package ru.tigran.feedbacksync.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.feedbacksync.exception.SharedStoreException;
import ru.tigran.feedbacksync.model.SyncState;
import ru.tigran.feedbacksync.pipeline.SyncOrchestrator;
import ru.tigran.feedbacksync.store.SharedStore;

/**
 * Конфигурация health checks для внешних зависимостей
 */
@Slf4j
@Configuration
public class HealthCheckConfig {

    /**
     * Health check для AI провайдера: ключ настроен и circuit breaker не открыт.
     * Сам API не пингуется, чтобы не тратить квоту.
     */
    @Bean
    public HealthIndicator aiProviderHealthIndicator(ApiKeyValidator apiKeyValidator,
                                                     CircuitBreaker aiProviderCircuitBreaker) {
        return () -> {
            CircuitBreaker.State state = aiProviderCircuitBreaker.getState();
            Health.Builder builder = apiKeyValidator.isConfigured() && state != CircuitBreaker.State.OPEN
                    ? Health.up()
                    : Health.down();
            return builder
                    .withDetail("provider", apiKeyValidator.getProvider())
                    .withDetail("configured", apiKeyValidator.isConfigured())
                    .withDetail("circuitBreaker", state.name())
                    .build();
        };
    }

    /**
     * Health check для общего хранилища: читает состояние синхронизации
     */
    @Bean
    public HealthIndicator sharedStoreHealthIndicator(SharedStore sharedStore, SyncOrchestrator syncOrchestrator) {
        return () -> {
            try {
                Health.Builder builder = Health.up()
                        .withDetail("syncStatus", syncOrchestrator.getStatus().name());
                sharedStore.loadSyncState()
                        .map(SyncState::getLastSync)
                        .ifPresent(lastSync -> builder.withDetail("lastSync", lastSync.toString()));
                return builder.build();
            } catch (SharedStoreException e) {
                log.warn("Shared store health check failed: {}", e.getMessage());
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        };
    }
}
