package ru.tigran.feedbacksync.source;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import ru.tigran.feedbacksync.exception.SourceFetchException;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.SourceType;
import ru.tigran.feedbacksync.util.FeedbackIds;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Сборщик GitHub Discussions через GraphQL API для тех же репозиториев, что и issues.
 *
 * Обсуждения идут от новых к старым, чтение останавливается на первом обсуждении старше watermark
 * или после app.sources.github.max-pages страниц. GraphQL API требует токен.
 */
@Slf4j
@Component
public class GitHubDiscussionCollector implements SourceCollector {

    static final String DISCUSSIONS_QUERY = """
            query($owner: String!, $name: String!, $first: Int!, $after: String) {
              repository(owner: $owner, name: $name) {
                discussions(first: $first, after: $after, orderBy: {field: CREATED_AT, direction: DESC}) {
                  pageInfo { hasNextPage endCursor }
                  nodes {
                    number
                    title
                    body
                    url
                    createdAt
                    author { login avatarUrl }
                    category { name }
                    comments { totalCount }
                    upvoteCount
                    closed
                  }
                }
              }
            }
            """;

    private final RestClient restClient;
    private final List<String> repos;
    private final String token;
    private final int perPage;
    private final int maxPages;

    public GitHubDiscussionCollector(
            RestClient.Builder restClientBuilder,
            @Value("${app.sources.github.api-url:https://api.github.com}") String apiUrl,
            @Value("${app.sources.github.repos:}") String repos,
            @Value("${app.sources.github.token:}") String token,
            @Value("${app.sources.github.per-page:50}") int perPage,
            @Value("${app.sources.github.max-pages:10}") int maxPages
    ) {
        this.restClient = restClientBuilder.clone().baseUrl(apiUrl).build();
        this.repos = SourceHttp.parseRepos(repos);
        this.token = token;
        this.perPage = perPage;
        this.maxPages = maxPages;
    }

    @Override
    public SourceType sourceType() {
        return SourceType.GITHUB_DISCUSSION;
    }

    @Override
    public List<FeedbackItem> fetch(Instant since) {
        if (repos.isEmpty()) {
            return List.of();
        }
        if (token == null || token.isBlank()) {
            throw new SourceFetchException(SourceType.GITHUB_DISCUSSION,
                    "GITHUB_TOKEN is required for the GitHub discussions GraphQL API");
        }
        List<FeedbackItem> items = new ArrayList<>();
        for (String repo : repos) {
            List<FeedbackItem> repoItems = fetchRepo(repo, since);
            log.info("GitHub discussions: fetched {} items from {} (since {})", repoItems.size(), repo, since);
            items.addAll(repoItems);
        }
        return items;
    }

    private List<FeedbackItem> fetchRepo(String repo, Instant since) {
        String[] parts = repo.split("/");
        List<FeedbackItem> items = new ArrayList<>();
        String cursor = null;
        for (int page = 1; page <= maxPages; page++) {
            JsonNode discussions = query(repo, parts, cursor);
            boolean reachedWatermark = false;
            for (JsonNode node : discussions.path("nodes")) {
                FeedbackItem item = toItem(repo, parts, node);
                if (item == null) {
                    continue;
                }
                if (since != null && item.getPublishedAt().isBefore(since)) {
                    reachedWatermark = true;
                    break;
                }
                items.add(item);
            }
            JsonNode pageInfo = discussions.path("pageInfo");
            if (reachedWatermark || !pageInfo.path("hasNextPage").asBoolean(false)) {
                return items;
            }
            cursor = pageInfo.path("endCursor").asText(null);
        }
        log.warn("GitHub discussions: stopping at {} pages for {}, more discussions are available", maxPages, repo);
        return items;
    }

    private JsonNode query(String repo, String[] parts, String cursor) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("owner", parts[0]);
        variables.put("name", parts[1]);
        variables.put("first", perPage);
        variables.put("after", cursor);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", DISCUSSIONS_QUERY);
        body.put("variables", variables);

        JsonNode response = restClient.post()
                .uri("/graphql")
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> headers.setBearerAuth(token))
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, SourceHttp.statusHandler(SourceType.GITHUB_DISCUSSION, repo))
                .body(JsonNode.class);

        if (response == null) {
            throw new SourceFetchException(SourceType.GITHUB_DISCUSSION, "Empty GraphQL response for " + repo);
        }
        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new SourceFetchException(SourceType.GITHUB_DISCUSSION,
                    "GraphQL error for " + repo + ": " + errors.get(0).path("message").asText("unknown"));
        }
        JsonNode discussions = response.path("data").path("repository").path("discussions");
        if (discussions.isMissingNode() || discussions.isNull()) {
            throw new SourceFetchException(SourceType.GITHUB_DISCUSSION, "Repository not found: " + repo);
        }
        return discussions;
    }

    private FeedbackItem toItem(String repo, String[] parts, JsonNode node) {
        String number = node.path("number").asText(null);
        Instant createdAt = SourceHttp.parseInstant(node.path("createdAt").asText(null));
        if (number == null || createdAt == null) {
            log.warn("Skipping GitHub discussion without number or createdAt in {}", repo);
            return null;
        }

        FeedbackItem item = new FeedbackItem();
        item.setId(FeedbackIds.itemId(SourceType.GITHUB_DISCUSSION, parts[0], parts[1], number));
        item.setSourceType(SourceType.GITHUB_DISCUSSION);
        item.setSourceId(number);
        item.setSourceName(repo);
        item.setRepo(repo);
        item.setTitle(node.path("title").asText(null));
        item.setContent(node.path("body").isTextual() ? node.path("body").asText() : "");
        item.setAuthor(node.path("author").path("login").asText(null));
        item.setAuthorHandle(node.path("author").path("login").asText(null));
        item.setAuthorAvatar(node.path("author").path("avatarUrl").asText(null));
        item.setPublishedAt(createdAt);
        item.setUrl(node.path("url").asText(null));
        item.setReplyCount(node.path("comments").path("totalCount").asInt(0));
        item.setReactionCount(node.path("upvoteCount").asInt(0));
        item.setState(node.path("closed").asBoolean(false) ? "closed" : "open");

        String category = node.path("category").path("name").asText(null);
        item.setLabels(category == null ? new ArrayList<>() : new ArrayList<>(List.of(category)));
        return item;
    }
}
