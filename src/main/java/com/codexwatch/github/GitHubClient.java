package com.codexwatch.github;

import com.codexwatch.config.AppConfig;
import com.codexwatch.error.SourceFetchException;
import com.codexwatch.model.PullRequest;
import com.codexwatch.model.PullRequestDetail;
import com.codexwatch.model.Release;
import com.codexwatch.model.Timestamps;
import com.codexwatch.watermark.WatermarkSelector;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads merged pull requests and releases from the GitHub REST API.
 */
public class GitHubClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);

    private static final String ACCEPT = "application/vnd.github+json";
    private static final String API_VERSION = "2022-11-28";
    private static final int DEFAULT_PAGE_SIZE = 100;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AppConfig config;

    public GitHubClient(AppConfig config) {
        this(config, HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofMillis(config.requestTimeoutMillis()))
                .build());
    }

    public GitHubClient(AppConfig config, HttpClient httpClient) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.config = config;
    }

    public List<PullRequest> fetchMergedPullRequests() {
        return fetchMergedPullRequests(DEFAULT_PAGE_SIZE, 1);
    }

    /**
     * Recently closed pull requests against the configured base branch that
     * were actually merged, oldest first.
     */
    public List<PullRequest> fetchMergedPullRequests(int perPage, int page) {
        requirePaging(perPage, page);

        URI uri = repoUri("/pulls"
                + "?state=closed"
                + "&base=" + encode(config.githubBaseBranch())
                + "&sort=updated"
                + "&direction=desc"
                + "&per_page=" + perPage
                + "&page=" + page);

        JsonNode data = get(uri);
        if (!data.isArray()) {
            throw new SourceFetchException("Unexpected GitHub API response format for " + uri);
        }

        List<PullRequest> pullRequests = new ArrayList<>();
        for (JsonNode item : data) {
            if (!item.isObject()) {
                continue;
            }
            JsonNode mergedAt = item.path("merged_at");
            if (!mergedAt.isTextual()) {
                continue;
            }
            if (!config.githubBaseBranch().equals(item.path("base").path("ref").asText(null))) {
                continue;
            }
            pullRequests.add(new PullRequest(
                    requiredLong(item, "id"),
                    (int) requiredLong(item, "number"),
                    item.path("title").asText(""),
                    item.path("html_url").asText(""),
                    parseTimestamp(mergedAt.asText())
            ));
        }

        pullRequests.sort(WatermarkSelector.DELIVERY_ORDER);
        log.info("Fetched {} merged pull request(s) from {}", pullRequests.size(), config.githubRepo());
        return pullRequests;
    }

    public PullRequestDetail fetchPullRequestDetail(int number) {
        if (number <= 0) {
            throw new IllegalArgumentException("number must be greater than 0");
        }

        URI uri = repoUri("/pulls/" + number);
        JsonNode data = get(uri);
        if (!data.isObject()) {
            throw new SourceFetchException("Unexpected GitHub API response format for " + uri);
        }

        JsonNode mergedAt = data.path("merged_at");
        if (!mergedAt.isTextual()) {
            throw new SourceFetchException("Pull request detail must include merged_at: #" + number);
        }

        return new PullRequestDetail(
                requiredLong(data, "id"),
                (int) requiredLong(data, "number"),
                data.path("title").asText(""),
                data.path("html_url").asText(""),
                parseTimestamp(mergedAt.asText()),
                optionalText(data.path("body"))
        );
    }

    public List<Release> fetchReleases() {
        return fetchReleases(DEFAULT_PAGE_SIZE, 1);
    }

    /**
     * Published, non-draft, non-prerelease releases, oldest first. Alpha
     * releases are skipped as well.
     */
    public List<Release> fetchReleases(int perPage, int page) {
        requirePaging(perPage, page);

        URI uri = repoUri("/releases?per_page=" + perPage + "&page=" + page);
        JsonNode data = get(uri);
        if (!data.isArray()) {
            throw new SourceFetchException("Unexpected GitHub API response format for " + uri);
        }

        List<Release> releases = new ArrayList<>();
        for (JsonNode item : data) {
            if (!item.isObject()) {
                continue;
            }
            Release release = toRelease(item);
            if (release != null) {
                releases.add(release);
            }
        }

        releases.sort(WatermarkSelector.DELIVERY_ORDER);
        log.info("Fetched {} release(s) from {}", releases.size(), config.githubRepo());
        return releases;
    }

    public Release fetchReleaseByTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag must not be blank");
        }

        URI uri = repoUri("/releases/tags/" + encode(tag.strip()));
        JsonNode data = get(uri);
        if (!data.isObject()) {
            throw new SourceFetchException("Unexpected GitHub API response format for " + uri);
        }

        JsonNode publishedAt = data.path("published_at");
        String tagName = optionalText(data.path("tag_name"));
        String htmlUrl = optionalText(data.path("html_url"));
        if (!publishedAt.isTextual() || tagName == null || htmlUrl == null) {
            throw new SourceFetchException("Release " + tag + " is missing published_at, tag_name or html_url");
        }

        String name = optionalText(data.path("name"));
        return new Release(
                requiredLong(data, "id"),
                tagName,
                name == null ? tagName : name,
                htmlUrl,
                parseTimestamp(publishedAt.asText()),
                optionalText(data.path("body")),
                data.path("prerelease").asBoolean(false)
        );
    }

    private Release toRelease(JsonNode item) {
        JsonNode publishedAt = item.path("published_at");
        if (!publishedAt.isTextual()) {
            return null;
        }
        if (item.path("draft").asBoolean(false)) {
            return null;
        }

        String tagName = optionalText(item.path("tag_name"));
        if (tagName == null) {
            return null;
        }

        String name = optionalText(item.path("name"));
        if (name == null) {
            name = tagName;
        }
        boolean prerelease = item.path("prerelease").asBoolean(false);
        if (shouldIgnoreRelease(tagName, name, prerelease)) {
            log.debug("Skipping release {} ({})", tagName, name);
            return null;
        }

        String htmlUrl = optionalText(item.path("html_url"));
        if (htmlUrl == null) {
            return null;
        }

        return new Release(
                requiredLong(item, "id"),
                tagName,
                name,
                htmlUrl,
                parseTimestamp(publishedAt.asText()),
                optionalText(item.path("body")),
                prerelease
        );
    }

    static boolean shouldIgnoreRelease(String tagName, String name, boolean prerelease) {
        if (prerelease) {
            return true;
        }
        String text = (tagName + " " + name).toLowerCase(Locale.ROOT);
        return text.contains("alpha") || text.contains("α");
    }

    private JsonNode get(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", ACCEPT)
                .header("X-GitHub-Api-Version", API_VERSION)
                .timeout(Duration.ofMillis(config.requestTimeoutMillis()))
                .GET();
        if (config.githubToken() != null) {
            builder.header("Authorization", "Bearer " + config.githubToken());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceFetchException("GitHub request failed: " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceFetchException("Interrupted while calling GitHub: " + uri, e);
        }

        log.debug("GitHub GET {} returned status {}", uri, response.statusCode());

        if (response.statusCode() >= 300) {
            throw new SourceFetchException(
                    "GitHub request failed. Status="
                            + response.statusCode()
                            + ", url="
                            + uri
                            + ", body="
                            + response.body()
            );
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new SourceFetchException("GitHub returned invalid JSON for " + uri, e);
        }
    }

    private URI repoUri(String pathAndQuery) {
        return URI.create(config.githubApiUrl() + "/repos/" + config.githubRepo() + pathAndQuery);
    }

    private static void requirePaging(int perPage, int page) {
        if (perPage <= 0) {
            throw new IllegalArgumentException("perPage must be greater than 0");
        }
        if (page <= 0) {
            throw new IllegalArgumentException("page must be greater than 0");
        }
    }

    private static long requiredLong(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.canConvertToLong() || !value.isIntegralNumber()) {
            throw new SourceFetchException("GitHub item is missing integer field '" + field + "'");
        }
        return value.longValue();
    }

    private static Instant parseTimestamp(String text) {
        try {
            return Timestamps.parseUtc(text);
        } catch (DateTimeParseException e) {
            throw new SourceFetchException("GitHub returned an invalid timestamp: '" + text + "'", e);
        }
    }

    private static String optionalText(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText().strip();
        return text.isEmpty() ? null : text;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
