package ru.tigran.feedbacksync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.feedbacksync.dto.ClassificationResult;
import ru.tigran.feedbacksync.dto.GroupProposal;
import ru.tigran.feedbacksync.dto.MergedGroupProposal;
import ru.tigran.feedbacksync.dto.TranslationResult;
import ru.tigran.feedbacksync.exception.AIGatewayException;
import ru.tigran.feedbacksync.exception.ErrorCode;
import ru.tigran.feedbacksync.model.FeedbackCategory;
import ru.tigran.feedbacksync.model.Sentiment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Разбор ответов AI провайдера.
 *
 * Конверт chat completions ({@code /choices/0/message/content}) проверяется строго, содержимое -
 * мягко: записи без itemId или с чужими id пропускаются, неизвестные sentiment/category
 * заменяются на neutral/other.
 */
@Slf4j
@Component
public class AIResponseParser {

    // Maximum response size (1 MB) to prevent memory exhaustion
    static final long MAX_RESPONSE_SIZE_BYTES = 1024 * 1024;

    private final ObjectMapper objectMapper;

    public AIResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Extracts the message content from a chat completions response and strips markdown fences.
     */
    public String extractMessageContent(String response) {
        validateResponseSize(response);

        JsonNode root = readTree(response, "Failed to parse API response");
        JsonNode content = root.at("/choices/0/message/content");
        if (content == null || content.isNull() || content.isMissingNode()) {
            log.error("Missing content in API response. Preview: {}",
                    response.length() > 200 ? response.substring(0, 200) : response);
            throw new AIGatewayException(
                "Missing content in API response",
                ErrorCode.INVALID_AI_RESPONSE,
                false
            );
        }
        String rawContent = content.asText();
        log.debug("Successfully extracted content, length: {}", rawContent.length());
        return cleanMarkdownCodeBlocks(rawContent);
    }

    public Map<String, ClassificationResult> parseClassifications(String json, Set<String> batchIds) {
        Map<String, ClassificationResult> results = new LinkedHashMap<>();
        for (JsonNode node : arrayField(readTree(json, "Invalid classification JSON"), "analyses")) {
            String itemId = node.path("itemId").asText(null);
            if (itemId == null || !batchIds.contains(itemId)) {
                log.debug("Skipping classification for unknown item id: {}", itemId);
                continue;
            }
            results.putIfAbsent(itemId, new ClassificationResult(
                Sentiment.fromValue(node.path("sentiment").asText(null)),
                clampConfidence(node.path("sentimentConfidence")),
                FeedbackCategory.fromValue(node.path("category").asText(null)),
                clampConfidence(node.path("categoryConfidence")),
                textOrNull(node, "summary")
            ));
        }
        return results;
    }

    /**
     * Parses batch-local groups. Ids outside the batch are dropped and an item claimed by
     * several groups stays with the first one.
     */
    public List<GroupProposal> parseGroups(String json, Set<String> batchIds) {
        List<GroupProposal> groups = new ArrayList<>();
        Set<String> claimed = new LinkedHashSet<>();
        for (JsonNode node : arrayField(readTree(json, "Invalid grouping JSON"), "groups")) {
            String theme = textOrNull(node, "theme");
            if (theme == null) {
                continue;
            }
            List<String> itemIds = new ArrayList<>();
            for (String id : stringList(node.path("itemIds"))) {
                if (batchIds.contains(id) && claimed.add(id)) {
                    itemIds.add(id);
                }
            }
            if (itemIds.isEmpty()) {
                continue;
            }
            groups.add(new GroupProposal(
                theme,
                textOrNull(node, "summary"),
                Sentiment.fromValue(node.path("sentiment").asText(null)),
                FeedbackCategory.fromValue(node.path("category").asText(null)),
                itemIds
            ));
        }
        return groups;
    }

    public List<MergedGroupProposal> parseMergedGroups(String json) {
        List<MergedGroupProposal> merged = new ArrayList<>();
        for (JsonNode node : arrayField(readTree(json, "Invalid consolidation JSON"), "mergedGroups")) {
            String theme = textOrNull(node, "theme");
            if (theme == null) {
                continue;
            }
            JsonNode itemIds = node.has("allItemIds") ? node.path("allItemIds") : node.path("itemIds");
            merged.add(new MergedGroupProposal(
                theme,
                textOrNull(node, "summary"),
                Sentiment.fromValue(node.path("sentiment").asText(null)),
                FeedbackCategory.fromValue(node.path("category").asText(null)),
                stringList(node.path("originalGroupIds")),
                stringList(itemIds)
            ));
        }
        return merged;
    }

    public Map<String, TranslationResult> parseTranslations(String json, Set<String> batchIds) {
        Map<String, TranslationResult> results = new LinkedHashMap<>();
        for (JsonNode node : arrayField(readTree(json, "Invalid translation JSON"), "items")) {
            String itemId = node.path("itemId").asText(null);
            if (itemId == null || !batchIds.contains(itemId)) {
                continue;
            }
            results.putIfAbsent(itemId, new TranslationResult(
                stringMap(node.path("translations")),
                stringMap(node.path("titles"))
            ));
        }
        return results;
    }

    /**
     * Removes markdown code block syntax from response if present.
     * Handles cases where AI returns ```json ... ``` or ``` ... ``` instead of raw JSON.
     */
    String cleanMarkdownCodeBlocks(String content) {
        if (content == null || content.isEmpty()) {
            return content;
        }

        String cleaned = content.trim();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            if (firstNewline != -1) {
                cleaned = cleaned.substring(firstNewline + 1);
            } else {
                cleaned = cleaned.substring(3);
                if (cleaned.startsWith("json")) {
                    cleaned = cleaned.substring(4);
                }
            }
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.length() - 3);
            }
            cleaned = cleaned.trim();
        }
        return cleaned;
    }

    private void validateResponseSize(String responseBody) {
        if (responseBody == null) {
            throw new AIGatewayException("Empty API response", ErrorCode.INVALID_AI_RESPONSE, false);
        }
        if (responseBody.length() > MAX_RESPONSE_SIZE_BYTES) {
            String errorMsg = String.format(
                "API response exceeds maximum allowed size. Response size: %d bytes, max allowed: %d bytes",
                responseBody.length(), MAX_RESPONSE_SIZE_BYTES
            );
            log.error(errorMsg);
            throw new AIGatewayException(errorMsg, ErrorCode.INVALID_AI_RESPONSE, false);
        }
    }

    private JsonNode readTree(String json, String errorMessage) {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || root.isMissingNode()) {
                throw new AIGatewayException(errorMessage + ": empty content",
                        ErrorCode.INVALID_JSON_RESPONSE, false);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new AIGatewayException(
                errorMessage + ": " + e.getOriginalMessage(),
                ErrorCode.INVALID_JSON_RESPONSE,
                false,
                e
            );
        }
    }

    /**
     * Models sometimes return the bare array instead of the wrapping object.
     */
    private JsonNode arrayField(JsonNode root, String field) {
        JsonNode array = root.isArray() ? root : root.path(field);
        if (!array.isArray()) {
            throw new AIGatewayException(
                "AI response has no '" + field + "' array",
                ErrorCode.INVALID_AI_RESPONSE,
                false
            );
        }
        return array;
    }

    private static double clampConfidence(JsonNode node) {
        if (!node.isNumber()) {
            return 0.5;
        }
        return Math.max(0.0, Math.min(1.0, node.asDouble()));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    private static List<String> stringList(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(element -> {
                if (element.isTextual() && !element.asText().isBlank()) {
                    values.add(element.asText());
                }
            });
        }
        return values;
    }

    private static Map<String, String> stringMap(JsonNode object) {
        Map<String, String> values = new LinkedHashMap<>();
        if (object.isObject()) {
            object.fields().forEachRemaining(entry -> {
                if (entry.getValue().isTextual() && !entry.getValue().asText().isBlank()) {
                    values.put(entry.getKey(), entry.getValue().asText());
                }
            });
        }
        return values;
    }
}
