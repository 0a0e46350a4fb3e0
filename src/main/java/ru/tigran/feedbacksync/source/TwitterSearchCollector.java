package ru.tigran.feedbacksync.source;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import ru.tigran.feedbacksync.exception.SourceFetchException;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.SourceType;
import ru.tigran.feedbacksync.util.FeedbackIds;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Сборщик твитов через Twitter API v2 recent search по запросам из app.sources.twitter.queries.
 *
 * Ретвиты исключаются в самом запросе. Язык берётся из поля lang твита.
 * Recent search отдаёт только последние 7 дней, поэтому более старый watermark не передаётся.
 */
@Slf4j
@Component
public class TwitterSearchCollector implements SourceCollector {

    private static final Duration SEARCH_WINDOW = Duration.ofDays(7);
    private static final Set<String> UNDETERMINED_LANGUAGES = Set.of("und", "zxx", "qme", "qht", "qam");
    private static final String TWEET_FIELDS = "created_at,public_metrics,author_id,lang,conversation_id,in_reply_to_user_id";

    private final RestClient restClient;
    private final List<String> queries;
    private final String bearerToken;
    private final int maxResults;
    private final int maxPages;
    private final Clock clock;

    public TwitterSearchCollector(
            RestClient.Builder restClientBuilder,
            Clock clock,
            @Value("${app.sources.twitter.api-url:https://api.twitter.com/2}") String apiUrl,
            @Value("${app.sources.twitter.queries:}") String queries,
            @Value("${app.sources.twitter.bearer-token:}") String bearerToken,
            @Value("${app.sources.twitter.max-results:100}") int maxResults,
            @Value("${app.sources.twitter.max-pages:3}") int maxPages
    ) {
        this.restClient = restClientBuilder.clone().baseUrl(apiUrl).build();
        this.clock = clock;
        this.queries = SourceHttp.splitList(queries);
        this.bearerToken = bearerToken;
        this.maxResults = maxResults;
        this.maxPages = maxPages;
    }

    @Override
    public SourceType sourceType() {
        return SourceType.TWITTER_SEARCH;
    }

    @Override
    public List<FeedbackItem> fetch(Instant since) {
        if (queries.isEmpty()) {
            return List.of();
        }
        if (bearerToken == null || bearerToken.isBlank()) {
            throw new SourceFetchException(SourceType.TWITTER_SEARCH,
                    "TWITTER_BEARER_TOKEN is required for Twitter search");
        }
        Instant startTime = startTime(since);
        List<FeedbackItem> items = new ArrayList<>();
        for (String query : queries) {
            List<FeedbackItem> queryItems = search(query, startTime);
            log.info("Twitter: fetched {} tweets for '{}' (start_time {})", queryItems.size(), query, startTime);
            items.addAll(queryItems);
        }
        return items;
    }

    /**
     * The API rejects start_time outside the recent-search window.
     */
    private Instant startTime(Instant since) {
        if (since == null) {
            return null;
        }
        Instant earliest = clock.instant().minus(SEARCH_WINDOW).plus(Duration.ofMinutes(1));
        return since.isAfter(earliest) ? since.truncatedTo(ChronoUnit.SECONDS) : null;
    }

    private List<FeedbackItem> search(String query, Instant startTime) {
        List<FeedbackItem> items = new ArrayList<>();
        String nextToken = null;
        for (int page = 1; page <= maxPages; page++) {
            JsonNode response = requestPage(query, startTime, nextToken);

            Map<String, JsonNode> users = new HashMap<>();
            response.path("includes").path("users").forEach(user -> users.put(user.path("id").asText(), user));
            for (JsonNode tweet : response.path("data")) {
                FeedbackItem item = toItem(query, tweet, users);
                if (item != null) {
                    items.add(item);
                }
            }

            nextToken = response.path("meta").path("next_token").asText(null);
            if (nextToken == null) {
                return items;
            }
        }
        log.warn("Twitter: stopping at {} pages for '{}', more tweets are available", maxPages, query);
        return items;
    }

    private JsonNode requestPage(String query, Instant startTime, String nextToken) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("query", query + " -is:retweet");
        JsonNode response = restClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/tweets/search/recent")
                            .queryParam("query", "{query}")
                            .queryParam("max_results", maxResults)
                            .queryParam("tweet.fields", TWEET_FIELDS)
                            .queryParam("expansions", "author_id")
                            .queryParam("user.fields", "username,name,profile_image_url");
                    if (startTime != null) {
                        uriBuilder.queryParam("start_time", startTime.toString());
                    }
                    if (nextToken != null) {
                        uriBuilder.queryParam("next_token", nextToken);
                    }
                    return uriBuilder.build(variables);
                })
                .headers(headers -> headers.setBearerAuth(bearerToken))
                .retrieve()
                .onStatus(HttpStatusCode::isError, SourceHttp.statusHandler(SourceType.TWITTER_SEARCH, query))
                .body(JsonNode.class);
        if (response == null) {
            throw new SourceFetchException(SourceType.TWITTER_SEARCH, "Empty search response for '" + query + "'");
        }
        return response;
    }

    private FeedbackItem toItem(String query, JsonNode tweet, Map<String, JsonNode> users) {
        String tweetId = tweet.path("id").asText(null);
        Instant createdAt = SourceHttp.parseInstant(tweet.path("created_at").asText(null));
        if (tweetId == null || createdAt == null) {
            return null;
        }
        JsonNode author = users.getOrDefault(tweet.path("author_id").asText(""), tweet.path("author"));
        String username = author.path("username").asText(null);
        JsonNode metrics = tweet.path("public_metrics");

        FeedbackItem item = new FeedbackItem();
        item.setId(FeedbackIds.itemId(SourceType.TWITTER_SEARCH, tweetId));
        item.setSourceType(SourceType.TWITTER_SEARCH);
        item.setSourceId(tweetId);
        item.setSourceName(query);
        item.setContent(tweet.path("text").asText(""));
        item.setAuthor(author.path("name").asText(username));
        item.setAuthorHandle(username);
        item.setAuthorAvatar(author.path("profile_image_url").asText(null));
        item.setPublishedAt(createdAt);
        item.setUrl(username == null ? null : "https://twitter.com/" + username + "/status/" + tweetId);
        item.setReplyCount(metrics.path("reply_count").asInt(0));
        item.setReactionCount(metrics.path("like_count").asInt(0));
        item.setReply(tweet.hasNonNull("in_reply_to_user_id"));

        String conversationId = tweet.path("conversation_id").asText(null);
        if (conversationId != null && !conversationId.equals(tweetId)) {
            item.setParentId(FeedbackIds.itemId(SourceType.TWITTER_SEARCH, conversationId));
        }
        String lang = tweet.path("lang").asText(null);
        if (lang != null && !UNDETERMINED_LANGUAGES.contains(lang)) {
            item.setLanguage(FeedbackIds.normalizeLanguage(lang));
        }
        return item;
    }
}
