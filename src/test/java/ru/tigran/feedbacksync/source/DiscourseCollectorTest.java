package ru.tigran.feedbacksync.source;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import ru.tigran.feedbacksync.exception.RetriableHttpException;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.SourceType;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("DiscourseCollector тесты")
class DiscourseCollectorTest {

    private static final String FORUM = "https://forum.test";

    private RestClient.Builder builder;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
    }

    @Test
    @DisplayName("Тема превращается в элемент: текст первого поста без HTML, язык форума из конфигурации")
    void mapsTopicWithFirstPost() {
        server.expect(requestTo(FORUM + "/latest.json"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"topic_list": {"topics": [
                          {"id": 123, "title": "Streaming hangs", "slug": "streaming-hangs",
                           "created_at": "2024-05-01T10:00:00.000Z", "posts_count": 4, "like_count": 6,
                           "closed": false, "tags": ["bug", {"name": "streaming"}]}
                        ]}}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(FORUM + "/t/123.json"))
                .andRespond(withSuccess("""
                        {"post_stream": {"posts": [
                          {"username": "jdoe", "name": "Jane Doe",
                           "avatar_template": "/user_avatar/forum.test/jdoe/{size}/1.png",
                           "cooked": "<p>The stream &amp; the socket<br>never close</p>"}
                        ]}}
                        """, MediaType.APPLICATION_JSON));

        List<FeedbackItem> items = collector("pt_BR").fetch(null);

        server.verify();
        assertEquals(1, items.size());
        FeedbackItem item = items.get(0);
        assertEquals("discourse-forum.test-123", item.getId());
        assertEquals(SourceType.DISCOURSE, item.getSourceType());
        assertEquals("forum.test", item.getSourceName());
        assertEquals("Streaming hangs", item.getTitle());
        assertEquals("The stream & the socket\nnever close", item.getContent());
        assertEquals("Jane Doe", item.getAuthor());
        assertEquals("jdoe", item.getAuthorHandle());
        assertEquals(FORUM + "/user_avatar/forum.test/jdoe/96/1.png", item.getAuthorAvatar());
        assertEquals(FORUM + "/t/streaming-hangs/123", item.getUrl());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), item.getPublishedAt());
        assertEquals(3, item.getReplyCount());
        assertEquals(6, item.getReactionCount());
        assertEquals("open", item.getState());
        assertEquals("pt", item.getLanguage());
        assertEquals(List.of("bug", "streaming"), item.getLabels());
    }

    @Test
    @DisplayName("Темы старше watermark пропускаются, следующая страница читается при more_topics_url")
    void pagesAndFiltersBySince() {
        server.expect(requestTo(FORUM + "/latest.json"))
                .andRespond(withSuccess(topics(true, topic(2, "2024-05-03T10:00:00Z")), MediaType.APPLICATION_JSON));
        server.expect(requestTo(FORUM + "/latest.json?page=1"))
                .andRespond(withSuccess(topics(false, topic(1, "2024-04-01T10:00:00Z")), MediaType.APPLICATION_JSON));
        server.expect(requestTo(FORUM + "/t/2.json"))
                .andRespond(withSuccess(post("author2"), MediaType.APPLICATION_JSON));

        List<FeedbackItem> items = collector("en").fetch(Instant.parse("2024-05-01T00:00:00Z"));

        server.verify();
        assertEquals(List.of("discourse-forum.test-2"), items.stream().map(FeedbackItem::getId).toList());
        assertEquals("author2", items.get(0).getAuthor());
    }

    @Test
    @DisplayName("Удалённая тема пропускается, остальные собираются")
    void skipsMissingTopic() {
        server.expect(requestTo(FORUM + "/latest.json"))
                .andRespond(withSuccess(topics(false, topic(2, "2024-05-03T10:00:00Z") + "," + topic(1, "2024-05-02T10:00:00Z")),
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(FORUM + "/t/2.json")).andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(FORUM + "/t/1.json"))
                .andRespond(withSuccess(post("author1"), MediaType.APPLICATION_JSON));

        List<FeedbackItem> items = collector("en").fetch(null);

        server.verify();
        assertEquals(List.of("discourse-forum.test-1"), items.stream().map(FeedbackItem::getId).toList());
    }

    @Test
    @DisplayName("503 форума временная ошибка всего сбора")
    void serviceUnavailableIsRetriable() {
        server.expect(requestTo(FORUM + "/latest.json")).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        RetriableHttpException e = assertThrows(RetriableHttpException.class, () -> collector("en").fetch(null));

        assertEquals(503, e.getStatusCode());
    }

    @Test
    @DisplayName("Без форумов запросов нет, форум без http схемы отклоняется")
    void forumConfiguration() {
        assertTrue(new DiscourseCollector(builder, "", "en", 50, 3).fetch(null).isEmpty());
        server.verify();
        assertThrows(IllegalArgumentException.class, () -> new DiscourseCollector(builder, "forum.test", "en", 50, 3));
    }

    private static String topics(boolean more, String topics) {
        String moreUrl = more ? ", \"more_topics_url\": \"/latest?page=1\"" : "";
        return "{\"topic_list\": {\"topics\": [" + topics + "]" + moreUrl + "}}";
    }

    private static String topic(int id, String createdAt) {
        return "{\"id\": " + id + ", \"title\": \"Topic " + id + "\", \"slug\": \"topic-" + id + "\", "
                + "\"created_at\": \"" + createdAt + "\", \"posts_count\": 1}";
    }

    private static String post(String username) {
        return "{\"post_stream\": {\"posts\": [{\"username\": \"" + username + "\", \"cooked\": \"<p>Body</p>\"}]}}";
    }

    private DiscourseCollector collector(String language) {
        return new DiscourseCollector(builder, FORUM + "/", language, 50, 3);
    }
}
