package ru.tigran.feedbacksync.source;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;
import ru.tigran.feedbacksync.exception.SourceFetchException;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.SourceType;
import ru.tigran.feedbacksync.util.FeedbackIds;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Сборщик тем Discourse форумов из app.sources.discourse.forums (базовые URL).
 *
 * Список тем читается из /latest.json постранично, текст берётся из первого поста темы (/t/{id}.json).
 * Темы старше watermark пропускаются до запроса постов. Язык форума задаётся в конфигурации,
 * Discourse его не сообщает.
 */
@Slf4j
@Component
public class DiscourseCollector implements SourceCollector {

    private static final int AVATAR_SIZE = 96;

    private final RestClient restClient;
    private final List<String> forums;
    private final String language;
    private final int maxTopics;
    private final int maxPages;

    public DiscourseCollector(
            RestClient.Builder restClientBuilder,
            @Value("${app.sources.discourse.forums:}") String forums,
            @Value("${app.sources.discourse.language:}") String language,
            @Value("${app.sources.discourse.max-topics:50}") int maxTopics,
            @Value("${app.sources.discourse.max-pages:3}") int maxPages
    ) {
        this.restClient = restClientBuilder.clone().build();
        this.forums = SourceHttp.splitList(forums).stream()
                .map(forum -> forum.endsWith("/") ? forum.substring(0, forum.length() - 1) : forum)
                .toList();
        this.language = FeedbackIds.normalizeLanguage(language);
        this.maxTopics = maxTopics;
        this.maxPages = maxPages;
        for (String forum : this.forums) {
            if (!forum.startsWith("http://") && !forum.startsWith("https://")) {
                throw new IllegalArgumentException("Discourse forum must be an http(s) URL: " + forum);
            }
        }
    }

    @Override
    public SourceType sourceType() {
        return SourceType.DISCOURSE;
    }

    @Override
    public List<FeedbackItem> fetch(Instant since) {
        List<FeedbackItem> items = new ArrayList<>();
        for (String forum : forums) {
            List<FeedbackItem> forumItems = fetchForum(forum, since);
            log.info("Discourse: fetched {} topics from {} (since {})", forumItems.size(), forum, since);
            items.addAll(forumItems);
        }
        return items;
    }

    private List<FeedbackItem> fetchForum(String forum, Instant since) {
        List<JsonNode> topics = new ArrayList<>();
        for (int page = 0; page < maxPages && topics.size() < maxTopics; page++) {
            UriComponentsBuilder latest = UriComponentsBuilder.fromHttpUrl(forum).path("/latest.json");
            if (page > 0) {
                latest.queryParam("page", page);
            }
            JsonNode topicList = get(latest.build().toUri(), forum).path("topic_list");
            for (JsonNode topic : topicList.path("topics")) {
                Instant createdAt = SourceHttp.parseInstant(topic.path("created_at").asText(null));
                if (createdAt == null || (since != null && createdAt.isBefore(since))) {
                    continue;
                }
                if (topics.size() < maxTopics) {
                    topics.add(topic);
                }
            }
            if (!topicList.hasNonNull("more_topics_url")) {
                break;
            }
        }

        String host = URI.create(forum).getHost();
        List<FeedbackItem> items = new ArrayList<>(topics.size());
        for (JsonNode topic : topics) {
            FeedbackItem item = toItem(forum, host, topic);
            if (item != null) {
                items.add(item);
            }
        }
        return items;
    }

    /**
     * One topic: its first post supplies the text and the author. A topic that is gone
     * (404, 403) is skipped; transient errors fail the whole fetch and go to the source retry.
     */
    private FeedbackItem toItem(String forum, String host, JsonNode topic) {
        String topicId = topic.path("id").asText(null);
        if (topicId == null) {
            return null;
        }
        JsonNode firstPost;
        try {
            URI topicUri = UriComponentsBuilder.fromHttpUrl(forum).path("/t/{id}.json").buildAndExpand(topicId).toUri();
            firstPost = get(topicUri, forum).path("post_stream").path("posts").path(0);
        } catch (SourceFetchException e) {
            log.warn("Discourse: skipping topic {} on {}: {}", topicId, forum, e.getMessage());
            return null;
        }

        String title = topic.path("title").asText(null);
        String slug = topic.path("slug").asText("topic");

        FeedbackItem item = new FeedbackItem();
        item.setId(FeedbackIds.itemId(SourceType.DISCOURSE, host, topicId));
        item.setSourceType(SourceType.DISCOURSE);
        item.setSourceId(topicId);
        item.setSourceName(host);
        item.setTitle(title);
        item.setContent(SourceHttp.htmlToText(firstPost.path("cooked").asText(null)));
        String username = firstPost.path("username").asText(null);
        String displayName = firstPost.path("name").asText("");
        item.setAuthor(displayName.isBlank() ? username : displayName);
        item.setAuthorHandle(username);
        item.setAuthorAvatar(avatarUrl(forum, firstPost.path("avatar_template").asText(null)));
        item.setPublishedAt(SourceHttp.parseInstant(topic.path("created_at").asText(null)));
        item.setUrl(forum + "/t/" + slug + "/" + topicId);
        item.setReplyCount(Math.max(0, topic.path("posts_count").asInt(1) - 1));
        item.setReactionCount(topic.path("like_count").asInt(0));
        item.setState(topic.path("closed").asBoolean(false) ? "closed" : "open");
        item.setLanguage(language);

        List<String> tags = new ArrayList<>();
        topic.path("tags").forEach(tag -> {
            // newer Discourse versions send tags as objects
            String name = tag.isTextual() ? tag.asText() : tag.path("name").asText(null);
            if (name != null) {
                tags.add(name);
            }
        });
        item.setLabels(tags);
        return item;
    }

    private JsonNode get(URI uri, String forum) {
        JsonNode body = restClient.get()
                .uri(uri)
                .header("Accept", "application/json")
                .retrieve()
                .onStatus(HttpStatusCode::isError, SourceHttp.statusHandler(SourceType.DISCOURSE, forum))
                .body(JsonNode.class);
        if (body == null) {
            throw new SourceFetchException(SourceType.DISCOURSE, "Empty response from " + uri);
        }
        return body;
    }

    private static String avatarUrl(String forum, String template) {
        if (template == null || template.isBlank()) {
            return null;
        }
        String url = template.replace("{size}", String.valueOf(AVATAR_SIZE));
        return url.startsWith("http") ? url : forum + url;
    }
}
