package ru.tigran.feedbacksync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.tigran.feedbacksync.model.FeedbackCategory;
import ru.tigran.feedbacksync.model.FeedbackGroup;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.util.FeedbackIds;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builder for AI prompts used by classification, grouping, consolidation and translation.
 *
 * Usage:
 * String systemPrompt = FeedbackPromptBuilder.classificationSystemPrompt();
 * String userMessage = FeedbackPromptBuilder.classificationUserMessage(batch);
 *
 * Item payloads are serialized as a JSON array so the model can echo ids back verbatim.
 */
public class FeedbackPromptBuilder {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    // Content is truncated to keep batches of 100 within the model context
    private static final int CLASSIFY_CONTENT_LIMIT = 2000;
    private static final int GROUP_CONTENT_LIMIT = 500;
    private static final int TRANSLATE_CONTENT_LIMIT = 4000;

    private static final String JSON_ONLY = """
            OUTPUT FORMAT (NON-NEGOTIABLE):
            - Return ONLY a valid JSON object
            - NO markdown, NO code blocks, NO explanations
            - Use item ids exactly as given
            """;

    private FeedbackPromptBuilder() {
    }

    public static String classificationSystemPrompt() {
        String categories = Arrays.stream(FeedbackCategory.values())
                .map(FeedbackCategory::getValue)
                .collect(Collectors.joining(", "));
        return String.format("""
                You analyze developer feedback about an API and its SDKs.
                For every item decide:
                1. sentiment: positive, neutral or negative, with a confidence from 0 to 1
                2. category: one of [%s], with a confidence from 0 to 1
                3. summary: one short English sentence describing the feedback

                Response shape:
                {"analyses": [{"itemId": "...", "sentiment": "...", "sentimentConfidence": 0.9,
                  "category": "...", "categoryConfidence": 0.8, "summary": "..."}]}

                %s""", categories, JSON_ONLY);
    }

    public static String classificationUserMessage(List<FeedbackItem> batch) {
        ArrayNode items = objectMapper.createArrayNode();
        for (FeedbackItem item : batch) {
            ObjectNode node = items.addObject();
            node.put("itemId", item.getId());
            node.put("source", item.getSourceType().getValue());
            if (item.getTitle() != null) {
                node.put("title", item.getTitle());
            }
            node.put("content", truncate(item.getContent(), CLASSIFY_CONTENT_LIMIT));
            if (item.getLabels() != null && !item.getLabels().isEmpty()) {
                node.put("labels", String.join(", ", item.getLabels()));
            }
        }
        return "Classify these " + batch.size() + " feedback items:\n" + items;
    }

    public static String groupingSystemPrompt() {
        return String.format("""
                You cluster developer feedback into themes.
                Rules:
                1. Put items describing the same problem or request into one group
                2. Every item appears in at most one group
                3. Only use item ids from the input
                4. theme is a short title (max 8 words), summary is 1-2 sentences

                Response shape:
                {"groups": [{"theme": "...", "summary": "...", "sentiment": "negative",
                  "category": "bug-report", "itemIds": ["..."]}]}

                %s""", JSON_ONLY);
    }

    public static String groupingUserMessage(List<FeedbackItem> batch) {
        ArrayNode items = objectMapper.createArrayNode();
        for (FeedbackItem item : batch) {
            ObjectNode node = items.addObject();
            node.put("itemId", item.getId());
            if (item.getCategory() != null) {
                node.put("category", item.getCategory().getValue());
            }
            if (item.getSentiment() != null) {
                node.put("sentiment", item.getSentiment().getValue());
            }
            String text = item.getSummary() != null && !item.getSummary().isBlank()
                    ? item.getSummary()
                    : joinTitle(item.getTitle(), item.getContent());
            node.put("text", truncate(text, GROUP_CONTENT_LIMIT));
        }
        return "Group these " + batch.size() + " analyzed feedback items:\n" + items;
    }

    public static String consolidationSystemPrompt() {
        return String.format("""
                The input is a list of feedback groups produced independently for different batches.
                Merge groups that describe the same theme. Keep distinct themes separate.
                Every input group id must appear in exactly one merged group's originalGroupIds.

                Response shape:
                {"mergedGroups": [{"theme": "...", "summary": "...", "sentiment": "...",
                  "category": "...", "originalGroupIds": ["..."], "allItemIds": ["..."]}]}

                %s""", JSON_ONLY);
    }

    public static String consolidationUserMessage(List<FeedbackGroup> groups) {
        ArrayNode array = objectMapper.createArrayNode();
        for (FeedbackGroup group : groups) {
            ObjectNode node = array.addObject();
            node.put("id", group.getId());
            node.put("theme", group.getTheme());
            node.put("summary", group.getSummary());
            if (group.getCategory() != null) {
                node.put("category", group.getCategory().getValue());
            }
            if (group.getSentiment() != null) {
                node.put("sentiment", group.getSentiment().getValue());
            }
            ArrayNode ids = node.putArray("itemIds");
            group.getItemIds().forEach(ids::add);
        }
        return "Consolidate these " + groups.size() + " groups:\n" + array;
    }

    public static String translationSystemPrompt(List<String> targetLanguages) {
        return String.format("""
                You translate developer feedback. Target languages: %s.
                Translate content (and title when present) into every target language
                except the item's own language. Keep code, identifiers and URLs unchanged.

                Response shape:
                {"items": [{"itemId": "...", "translations": {"en": "..."}, "titles": {"en": "..."}}]}

                %s""", String.join(", ", targetLanguages), JSON_ONLY);
    }

    public static String translationUserMessage(List<FeedbackItem> batch) {
        ArrayNode items = objectMapper.createArrayNode();
        for (FeedbackItem item : batch) {
            ObjectNode node = items.addObject();
            node.put("itemId", item.getId());
            node.put("language", FeedbackIds.normalizeLanguage(item.getLanguage()));
            if (item.getTitle() != null) {
                node.put("title", item.getTitle());
            }
            node.put("content", truncate(item.getContent(), TRANSLATE_CONTENT_LIMIT));
        }
        return "Translate these " + batch.size() + " items:\n" + items;
    }

    private static String joinTitle(String title, String content) {
        if (title == null || title.isBlank()) {
            return content == null ? "" : content;
        }
        return title + ": " + (content == null ? "" : content);
    }

    private static String truncate(String text, int limit) {
        if (text == null) {
            return "";
        }
        return text.length() > limit ? text.substring(0, limit) + "..." : text;
    }
}
