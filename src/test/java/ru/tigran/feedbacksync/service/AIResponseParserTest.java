package ru.tigran.feedbacksync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.feedbacksync.dto.ClassificationResult;
import ru.tigran.feedbacksync.dto.GroupProposal;
import ru.tigran.feedbacksync.dto.MergedGroupProposal;
import ru.tigran.feedbacksync.dto.TranslationResult;
import ru.tigran.feedbacksync.exception.AIGatewayException;
import ru.tigran.feedbacksync.exception.ErrorCode;
import ru.tigran.feedbacksync.model.FeedbackCategory;
import ru.tigran.feedbacksync.model.Sentiment;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AIResponseParser unit тесты")
class AIResponseParserTest {

    private final AIResponseParser parser = new AIResponseParser(new ObjectMapper());

    // ===== Envelope =====

    @Test
    @DisplayName("Извлекает content и убирает markdown блок")
    void extractsContentWithoutMarkdown() {
        String response = "{\"choices\":[{\"message\":{\"content\":\"```json\\n{\\\"groups\\\":[]}\\n```\"}}]}";

        assertEquals("{\"groups\":[]}", parser.extractMessageContent(response));
    }

    @Test
    @DisplayName("Ответ без content - INVALID_AI_RESPONSE")
    void missingContentIsRejected() {
        AIGatewayException exception = assertThrows(AIGatewayException.class,
                () -> parser.extractMessageContent("{\"choices\":[]}"));

        assertEquals(ErrorCode.INVALID_AI_RESPONSE, exception.getErrorCode());
        assertFalse(exception.isRetriable());
    }

    @Test
    @DisplayName("Слишком большой ответ отклоняется")
    void oversizedResponseIsRejected() {
        String huge = "x".repeat((int) AIResponseParser.MAX_RESPONSE_SIZE_BYTES + 1);

        AIGatewayException exception = assertThrows(AIGatewayException.class, () -> parser.extractMessageContent(huge));
        assertEquals(ErrorCode.INVALID_AI_RESPONSE, exception.getErrorCode());
    }

    @Test
    @DisplayName("Markdown без перевода строки тоже очищается")
    void cleansInlineFence() {
        assertEquals("{}", parser.cleanMarkdownCodeBlocks("```json{}```"));
        assertEquals("{\"a\":1}", parser.cleanMarkdownCodeBlocks("  {\"a\":1}  "));
    }

    // ===== Payloads =====

    @Test
    @DisplayName("Классификация: чужие id пропускаются, значения нормализуются")
    void parsesClassifications() {
        String json = """
                {"analyses": [
                  {"itemId": "i1", "sentiment": "NEGATIVE", "sentimentConfidence": 1.7,
                   "category": "bug_report", "categoryConfidence": 0.6, "summary": " Crash on start "},
                  {"itemId": "i2", "sentiment": "furious", "category": "weird"},
                  {"itemId": "foreign", "sentiment": "positive"},
                  {"sentiment": "positive"}
                ]}
                """;

        Map<String, ClassificationResult> results = parser.parseClassifications(json, Set.of("i1", "i2"));

        assertEquals(Set.of("i1", "i2"), results.keySet());
        assertEquals(new ClassificationResult(Sentiment.NEGATIVE, 1.0, FeedbackCategory.BUG_REPORT, 0.6, "Crash on start"),
                results.get("i1"));
        assertEquals(new ClassificationResult(Sentiment.NEUTRAL, 0.5, FeedbackCategory.OTHER, 0.5, null),
                results.get("i2"));
    }

    @Test
    @DisplayName("Группы: элемент остаётся в первой группе, пустые группы отбрасываются")
    void parsesGroups() {
        String json = """
                {"groups": [
                  {"theme": "Slow streaming", "sentiment": "negative", "category": "performance-issue",
                   "itemIds": ["a", "b", "outsider"]},
                  {"theme": "Duplicates", "itemIds": ["b"]},
                  {"theme": "Docs", "itemIds": ["c"]}
                ]}
                """;

        List<GroupProposal> groups = parser.parseGroups(json, Set.of("a", "b", "c"));

        assertEquals(2, groups.size());
        assertEquals(List.of("a", "b"), groups.get(0).itemIds());
        assertEquals(FeedbackCategory.PERFORMANCE_ISSUE, groups.get(0).category());
        assertEquals("Docs", groups.get(1).theme());
    }

    @Test
    @DisplayName("Консолидация принимает allItemIds и itemIds")
    void parsesMergedGroups() {
        String json = """
                {"mergedGroups": [
                  {"theme": "Auth", "originalGroupIds": ["batch-0-0", "batch-1-2"], "allItemIds": ["a", "b"]},
                  {"theme": "Docs", "originalGroupIds": ["batch-0-1"], "itemIds": ["c"]}
                ]}
                """;

        List<MergedGroupProposal> merged = parser.parseMergedGroups(json);

        assertEquals(List.of("batch-0-0", "batch-1-2"), merged.get(0).originalGroupIds());
        assertEquals(List.of("a", "b"), merged.get(0).itemIds());
        assertEquals(List.of("c"), merged.get(1).itemIds());
    }

    @Test
    @DisplayName("Модель вернула массив без обёртки")
    void acceptsBareArray() {
        Map<String, TranslationResult> results = parser.parseTranslations(
                "[{\"itemId\": \"i1\", \"translations\": {\"en\": \"Hello\", \"de\": \"\"}, \"titles\": {\"en\": \"Hi\"}}]",
                Set.of("i1"));

        assertEquals(Map.of("en", "Hello"), results.get("i1").translations());
        assertEquals(Map.of("en", "Hi"), results.get("i1").titles());
    }

    @Test
    @DisplayName("Некорректный JSON и отсутствие массива дают разные коды ошибок")
    void invalidPayloads() {
        AIGatewayException invalidJson = assertThrows(AIGatewayException.class,
                () -> parser.parseGroups("{not json", Set.of()));
        AIGatewayException missingArray = assertThrows(AIGatewayException.class,
                () -> parser.parseGroups("{\"clusters\": []}", Set.of()));

        assertEquals(ErrorCode.INVALID_JSON_RESPONSE, invalidJson.getErrorCode());
        assertEquals(ErrorCode.INVALID_AI_RESPONSE, missingArray.getErrorCode());
    }
}
