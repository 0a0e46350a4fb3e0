package ru.tigran.feedbacksync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import ru.tigran.feedbacksync.exception.ConfigurationException;
import ru.tigran.feedbacksync.exception.ErrorCode;

/**
 * Проверяет настройки AI провайдера. Вызывается в начале каждого цикла синхронизации,
 * до обращения к источникам.
 */
@Slf4j
@Component
public class ApiKeyValidator {

    private final String aiProvider;
    private final String openRouterApiKey;
    private final String agentRouterApiKey;

    public ApiKeyValidator(
            @Value("${app.ai.provider:openrouter}") String aiProvider,
            @Value("${app.openrouter.api-key:}") String openRouterApiKey,
            @Value("${app.agentrouter.api-key:}") String agentRouterApiKey
    ) {
        this.aiProvider = aiProvider;
        this.openRouterApiKey = openRouterApiKey;
        this.agentRouterApiKey = agentRouterApiKey;
    }

    /**
     * @throws ConfigurationException if the provider is unknown or its key is missing or a placeholder
     */
    public void validate() {
        log.debug("Validating API key configuration for provider: {}", aiProvider);

        if ("openrouter".equalsIgnoreCase(aiProvider)) {
            validateApiKey("OPENROUTER_API_KEY", openRouterApiKey);
        } else if ("agentrouter".equalsIgnoreCase(aiProvider)) {
            validateApiKey("AGENTROUTER_API_KEY", agentRouterApiKey);
        } else {
            throw new ConfigurationException(
                String.format("Unknown AI provider: %s. Supported: openrouter, agentrouter", aiProvider),
                ErrorCode.INVALID_CONFIGURATION
            );
        }
    }

    public boolean isConfigured() {
        try {
            validate();
            return true;
        } catch (ConfigurationException e) {
            log.debug("AI provider is not configured: {}", e.getMessage());
            return false;
        }
    }

    public String getProvider() {
        return aiProvider;
    }

    private void validateApiKey(String envVarName, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException(
                String.format("%s is not set. Configure it before running a sync, e.g. export %s=sk-or-...",
                    envVarName, envVarName),
                ErrorCode.MISSING_CREDENTIALS
            );
        }

        if (apiKey.contains("YOUR_") || apiKey.contains("PLACEHOLDER")) {
            throw new ConfigurationException(
                String.format("%s contains a placeholder value. Set a real API key.", envVarName),
                ErrorCode.MISSING_CREDENTIALS
            );
        }
    }
}
