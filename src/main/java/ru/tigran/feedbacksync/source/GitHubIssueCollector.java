package ru.tigran.feedbacksync.source;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.SourceType;
import ru.tigran.feedbacksync.util.FeedbackIds;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Сборщик GitHub issues через REST API для репозиториев из app.sources.github.repos (owner/repo).
 * Страницы читаются по Link rel="next" (не больше app.sources.github.max-pages на репозиторий).
 * Pull requests отфильтровываются. Без настроенных репозиториев возвращает пустой список.
 */
@Slf4j
@Component
public class GitHubIssueCollector implements SourceCollector {

    private final RestClient restClient;
    private final List<String> repos;
    private final String token;
    private final int perPage;
    private final int maxPages;

    public GitHubIssueCollector(
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
        return SourceType.GITHUB_ISSUE;
    }

    @Override
    public List<FeedbackItem> fetch(Instant since) {
        List<FeedbackItem> items = new ArrayList<>();
        for (String repo : repos) {
            List<FeedbackItem> repoItems = fetchRepo(repo, since);
            log.info("GitHub issues: fetched {} items from {} (since {})", repoItems.size(), repo, since);
            items.addAll(repoItems);
        }
        return items;
    }

    private List<FeedbackItem> fetchRepo(String repo, Instant since) {
        String[] parts = repo.split("/");
        List<FeedbackItem> items = new ArrayList<>();
        ResponseEntity<JsonNode> page = exchange(restClient.get().uri(uriBuilder -> {
            uriBuilder.path("/repos/{owner}/{repo}/issues")
                    .queryParam("state", "all")
                    .queryParam("sort", "created")
                    .queryParam("direction", "desc")
                    .queryParam("per_page", perPage);
            if (since != null) {
                uriBuilder.queryParam("since", since.toString());
            }
            return uriBuilder.build(parts[0], parts[1]);
        }), repo);

        int pages = 1;
        while (true) {
            collect(repo, parts, page.getBody(), items);
            String next = SourceHttp.nextLink(page.getHeaders());
            if (next == null) {
                break;
            }
            if (pages >= maxPages) {
                log.warn("GitHub issues: stopping at {} pages for {}, more issues are available", pages, repo);
                break;
            }
            page = exchange(restClient.get().uri(URI.create(next)), repo);
            pages++;
        }
        log.debug("GitHub issues: {} pages read for {}", pages, repo);
        return items;
    }

    private ResponseEntity<JsonNode> exchange(RestClient.RequestHeadersSpec<?> request, String repo) {
        return request
                .header("Accept", "application/vnd.github+json")
                .headers(headers -> {
                    if (token != null && !token.isBlank()) {
                        headers.setBearerAuth(token);
                    }
                })
                .retrieve()
                .onStatus(HttpStatusCode::isError, SourceHttp.statusHandler(SourceType.GITHUB_ISSUE, repo))
                .toEntity(JsonNode.class);
    }

    private void collect(String repo, String[] parts, JsonNode issues, List<FeedbackItem> items) {
        if (issues == null || !issues.isArray()) {
            return;
        }
        for (JsonNode issue : issues) {
            if (issue.has("pull_request")) {
                continue;
            }
            FeedbackItem item = toItem(repo, parts, issue);
            if (item != null) {
                items.add(item);
            }
        }
    }

    private FeedbackItem toItem(String repo, String[] parts, JsonNode issue) {
        String number = issue.path("number").asText(null);
        Instant createdAt = SourceHttp.parseInstant(issue.path("created_at").asText(null));
        if (number == null || createdAt == null) {
            log.warn("Skipping GitHub issue without number or created_at in {}", repo);
            return null;
        }

        FeedbackItem item = new FeedbackItem();
        item.setId(FeedbackIds.itemId(SourceType.GITHUB_ISSUE, parts[0], parts[1], number));
        item.setSourceType(SourceType.GITHUB_ISSUE);
        item.setSourceId(number);
        item.setSourceName(repo);
        item.setRepo(repo);
        item.setTitle(issue.path("title").asText(null));
        item.setContent(issue.path("body").isTextual() ? issue.path("body").asText() : "");
        item.setAuthor(issue.path("user").path("login").asText(null));
        item.setAuthorHandle(issue.path("user").path("login").asText(null));
        item.setAuthorAvatar(issue.path("user").path("avatar_url").asText(null));
        item.setPublishedAt(createdAt);
        item.setUrl(issue.path("html_url").asText(null));
        item.setReplyCount(issue.path("comments").asInt(0));
        item.setReactionCount(issue.path("reactions").path("total_count").asInt(0));
        item.setState(issue.path("state").asText(null));

        List<String> labels = new ArrayList<>();
        issue.path("labels").forEach(label -> {
            String name = label.path("name").asText(null);
            if (name != null) {
                labels.add(name);
            }
        });
        item.setLabels(labels);
        return item;
    }
}
