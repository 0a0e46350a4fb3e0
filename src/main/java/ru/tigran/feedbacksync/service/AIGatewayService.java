package ru.tigran.feedbacksync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import ru.tigran.feedbacksync.dto.ClassificationResult;
import ru.tigran.feedbacksync.dto.GroupProposal;
import ru.tigran.feedbacksync.dto.MergedGroupProposal;
import ru.tigran.feedbacksync.dto.TranslationResult;
import ru.tigran.feedbacksync.exception.AIGatewayException;
import ru.tigran.feedbacksync.exception.ErrorCode;
import ru.tigran.feedbacksync.exception.RetriableHttpException;
import ru.tigran.feedbacksync.model.FeedbackGroup;
import ru.tigran.feedbacksync.model.FeedbackItem;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AIService поверх chat completions API (OpenRouter или AgentRouter).
 * Каждый вызов проходит через ResilientCallExecutor (retry + circuit breaker).
 */
@Slf4j
@Service
public class AIGatewayService implements AIService {

    static final String OPENROUTER_API_URL = "https://openrouter.ai/api/v1/chat/completions";
    static final String AGENTROUTER_API_URL = "https://api.agentrouter.ai/v1/chat/completions";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AIResponseParser responseParser;
    private final ResilientCallExecutor resilientCalls;
    private final String provider;
    private final String openRouterApiKey;
    private final String openRouterModel;
    private final String agentRouterApiKey;
    private final String agentRouterModel;
    private final double temperature;

    public AIGatewayService(
            RestClient restClient,
            ObjectMapper objectMapper,
            AIResponseParser responseParser,
            ResilientCallExecutor resilientCalls,
            @Value("${app.ai.provider:openrouter}") String provider,
            @Value("${app.openrouter.api-key:}") String openRouterApiKey,
            @Value("${app.openrouter.model:google/gemini-2.0-flash-001}") String openRouterModel,
            @Value("${app.agentrouter.api-key:}") String agentRouterApiKey,
            @Value("${app.agentrouter.model:gpt-4o-mini}") String agentRouterModel,
            @Value("${app.ai.temperature:0.2}") double temperature
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.responseParser = responseParser;
        this.resilientCalls = resilientCalls;
        this.provider = provider;
        this.openRouterApiKey = openRouterApiKey;
        this.openRouterModel = openRouterModel;
        this.agentRouterApiKey = agentRouterApiKey;
        this.agentRouterModel = agentRouterModel;
        this.temperature = temperature;
    }

    @Override
    public Map<String, ClassificationResult> classify(List<FeedbackItem> batch) {
        if (batch.isEmpty()) {
            return Map.of();
        }
        String content = callAIProvider("classify",
                FeedbackPromptBuilder.classificationSystemPrompt(),
                FeedbackPromptBuilder.classificationUserMessage(batch));
        Map<String, ClassificationResult> results = responseParser.parseClassifications(content, idsOf(batch));
        log.debug("Classification returned {}/{} items", results.size(), batch.size());
        return results;
    }

    @Override
    public List<GroupProposal> group(List<FeedbackItem> batch) {
        if (batch.isEmpty()) {
            return List.of();
        }
        String content = callAIProvider("group",
                FeedbackPromptBuilder.groupingSystemPrompt(),
                FeedbackPromptBuilder.groupingUserMessage(batch));
        List<GroupProposal> groups = responseParser.parseGroups(content, idsOf(batch));
        log.debug("Grouping returned {} groups for {} items", groups.size(), batch.size());
        return groups;
    }

    @Override
    public List<MergedGroupProposal> consolidate(List<FeedbackGroup> batchGroups) {
        if (batchGroups.isEmpty()) {
            return List.of();
        }
        String content = callAIProvider("consolidate",
                FeedbackPromptBuilder.consolidationSystemPrompt(),
                FeedbackPromptBuilder.consolidationUserMessage(batchGroups));
        List<MergedGroupProposal> merged = responseParser.parseMergedGroups(content);
        log.debug("Consolidation merged {} groups into {}", batchGroups.size(), merged.size());
        return merged;
    }

    @Override
    public Map<String, TranslationResult> translate(List<FeedbackItem> batch, List<String> targetLanguages) {
        if (batch.isEmpty() || targetLanguages.isEmpty()) {
            return Map.of();
        }
        String content = callAIProvider("translate",
                FeedbackPromptBuilder.translationSystemPrompt(targetLanguages),
                FeedbackPromptBuilder.translationUserMessage(batch));
        return responseParser.parseTranslations(content, idsOf(batch));
    }

    private String callAIProvider(String operation, String systemPrompt, String userMessage) {
        return resilientCalls.callAiProvider(operation, () -> executeRequest(operation, systemPrompt, userMessage));
    }

    /**
     * Single HTTP attempt. 429/502/503/504 raise RetriableHttpException, other error statuses
     * raise a non-retriable AIGatewayException.
     */
    private String executeRequest(String operation, String systemPrompt, String userMessage) {
        boolean agentRouter = "agentrouter".equalsIgnoreCase(provider);
        String apiUrl = agentRouter ? AGENTROUTER_API_URL : OPENROUTER_API_URL;
        String apiKey = agentRouter ? agentRouterApiKey : openRouterApiKey;
        String model = agentRouter ? agentRouterModel : openRouterModel;

        log.debug("callAIProvider - operation={}, provider={}, model={}, key={}",
                operation, provider, model, maskApiKey(apiKey));

        String response = restClient.post()
                .uri(apiUrl)
                .header("Authorization", "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(buildRequestBody(systemPrompt, userMessage, model))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, errorResponse) -> {
                    int statusCode = errorResponse.getStatusCode().value();
                    if (RetriableHttpException.isRetriableStatus(statusCode)) {
                        log.warn("Retriable HTTP error {} from {} during {}", statusCode, provider, operation);
                        throw new RetriableHttpException(
                            statusCode,
                            String.format("Retriable error from %s: %d %s", provider, statusCode, errorResponse.getStatusText())
                        );
                    }
                    log.error("{} API error during {}: {} {}", provider, operation, statusCode, errorResponse.getStatusText());
                    throw new AIGatewayException(
                        provider + " API error: " + statusCode,
                        ErrorCode.AI_SERVICE_ERROR,
                        false
                    );
                })
                .body(String.class);

        return responseParser.extractMessageContent(response);
    }

    private String buildRequestBody(String systemPrompt, String userMessage, String model) {
        try {
            var rootNode = objectMapper.createObjectNode();
            rootNode.put("model", model);
            rootNode.put("temperature", temperature);
            rootNode.putObject("response_format").put("type", "json_object");

            var messagesArray = rootNode.putArray("messages");
            var systemMessage = messagesArray.addObject();
            systemMessage.put("role", "system");
            systemMessage.put("content", systemPrompt);

            var userMsg = messagesArray.addObject();
            userMsg.put("role", "user");
            userMsg.put("content", userMessage);

            return objectMapper.writeValueAsString(rootNode);
        } catch (Exception e) {
            throw new AIGatewayException(
                "Failed to build request body",
                ErrorCode.AI_SERVICE_ERROR,
                false,
                e
            );
        }
    }

    /**
     * Masks API credentials for logging, e.g. "sk-***xyz".
     */
    private String maskApiKey(String apiKey) {
        if (apiKey == null || apiKey.length() <= 6) {
            return "***MASKED***";
        }
        return apiKey.substring(0, 3) + "***" + apiKey.substring(apiKey.length() - 3);
    }

    private static Set<String> idsOf(List<FeedbackItem> batch) {
        return batch.stream().map(FeedbackItem::getId).collect(Collectors.toSet());
    }
}
