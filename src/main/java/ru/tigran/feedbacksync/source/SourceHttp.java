package ru.tigran.feedbacksync.source;

import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.HtmlUtils;
import ru.tigran.feedbacksync.exception.RetriableHttpException;
import ru.tigran.feedbacksync.exception.SourceFetchException;
import ru.tigran.feedbacksync.model.SourceType;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;

/**
 * Общие части HTTP сборщиков: маппинг статусов, разбор дат, Link заголовков и списков из конфигурации.
 */
final class SourceHttp {

    private SourceHttp() {
    }

    /**
     * 429/502/503/504 become {@link RetriableHttpException} (retried by the source retry),
     * every other error status a non-retriable {@link SourceFetchException}.
     */
    static RestClient.ResponseSpec.ErrorHandler statusHandler(SourceType sourceType, String target) {
        return (request, response) -> {
            int statusCode = response.getStatusCode().value();
            String message = sourceType.getDisplayName() + " API returned " + statusCode + " for " + target;
            if (RetriableHttpException.isRetriableStatus(statusCode)) {
                throw new RetriableHttpException(statusCode, message);
            }
            throw new SourceFetchException(sourceType, message);
        };
    }

    /**
     * Extracts the rel="next" target of an RFC 8288 Link header, as sent by the GitHub REST API.
     */
    static String nextLink(HttpHeaders headers) {
        String link = headers.getFirst(HttpHeaders.LINK);
        if (link == null || link.isBlank()) {
            return null;
        }
        for (String part : link.split(",")) {
            String[] segments = part.split(";");
            if (segments.length < 2) {
                continue;
            }
            boolean next = Arrays.stream(segments)
                    .skip(1)
                    .map(String::trim)
                    .anyMatch(param -> param.equals("rel=\"next\"") || param.equals("rel=next"));
            String target = segments[0].trim();
            if (next && target.startsWith("<") && target.endsWith(">")) {
                return target.substring(1, target.length() - 1);
            }
        }
        return null;
    }

    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static List<String> splitList(String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toList();
    }

    /**
     * Parses "owner/repo" entries; anything else is a configuration error.
     */
    static List<String> parseRepos(String value) {
        List<String> repos = splitList(value);
        for (String repo : repos) {
            String[] parts = repo.split("/");
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                throw new IllegalArgumentException("GitHub repo must be in owner/repo form: " + repo);
            }
        }
        return repos;
    }

    /**
     * Rendered post HTML to plain text. Markup is dropped, entities are decoded.
     */
    static String htmlToText(String html) {
        if (html == null) {
            return "";
        }
        String text = html.replaceAll("(?i)<br\\s*/?>|</p>", "\n")
                .replaceAll("<[^>]+>", " ");
        return HtmlUtils.htmlUnescape(text)
                .replaceAll("[ \\t\\x0B\\f\\r]+", " ")
                .replaceAll(" *\n *", "\n")
                .trim();
    }
}
