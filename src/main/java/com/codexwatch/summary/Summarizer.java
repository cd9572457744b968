package com.codexwatch.summary;

import com.codexwatch.config.AppConfig;
import com.codexwatch.error.SummarizeException;
import com.codexwatch.model.PullRequest;
import com.codexwatch.model.PullRequestDetail;
import com.codexwatch.model.Release;
import com.codexwatch.model.Summary;
import com.codexwatch.model.Timestamps;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Produces notification summaries through the OpenAI chat completions API.
 *
 * <p>Summaries never fail: any problem with the API yields the static
 * fallback summary for the item kind so the notification still goes out.
 */
public class Summarizer {

    private static final Logger log = LoggerFactory.getLogger(Summarizer.class);

    private static final String COMPLETIONS_PATH = "/chat/completions";
    private static final double TEMPERATURE = 0.2;

    private static final String PULL_REQUEST_SYSTEM_PROMPT =
            "You summarize merged GitHub pull requests. Return valid JSON only with keys "
                    + "overview, feature_details, enabled_outcomes. Keep each value concise.";
    private static final String RELEASE_SYSTEM_PROMPT =
            "You summarize GitHub releases. Return valid JSON only with keys "
                    + "overview, feature_details, enabled_outcomes. Keep each value concise.";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AppConfig config;

    public Summarizer(AppConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.requestTimeoutMillis()))
                .build());
    }

    public Summarizer(AppConfig config, HttpClient httpClient) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.config = config;
    }

    public Summary summarizePullRequest(PullRequest pullRequest, PullRequestDetail detail) {
        try {
            return requestSummary(PULL_REQUEST_SYSTEM_PROMPT, pullRequestPrompt(pullRequest, detail));
        } catch (SummarizeException e) {
            log.warn("Falling back to static summary for PR #{} due to OpenAI failure: {}",
                    pullRequest.number(), e.getMessage());
            return Summary.FALLBACK_PULL_REQUEST;
        }
    }

    public Summary summarizeRelease(Release release) {
        try {
            return requestSummary(RELEASE_SYSTEM_PROMPT, releasePrompt(release));
        } catch (SummarizeException e) {
            log.warn("Falling back to static summary for release {} due to OpenAI failure: {}",
                    release.tagName(), e.getMessage());
            return Summary.FALLBACK_RELEASE;
        }
    }

    Summary requestSummary(String systemPrompt, String userPrompt) {
        if (config.openaiApiKey() == null) {
            throw new SummarizeException("OPENAI_API_KEY is not configured");
        }

        HttpResponse<String> response;
        try {
            response = send(completionRequest(systemPrompt, userPrompt));
        } catch (IllegalArgumentException e) {
            throw new SummarizeException("OpenAI request could not be built: " + e.getMessage(), e);
        }
        if (response.statusCode() >= 300) {
            throw new SummarizeException(
                    "OpenAI request failed. Status="
                            + response.statusCode()
                            + ", body="
                            + response.body()
            );
        }

        JsonNode content = readJson(response.body(), "OpenAI response must be valid JSON")
                .path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new SummarizeException("OpenAI response content must be non-empty text");
        }

        JsonNode payload = readJson(content.asText(), "OpenAI response content must be valid JSON");
        if (!payload.isObject()) {
            throw new SummarizeException("OpenAI response JSON must be an object");
        }

        return new Summary(
                summaryField(payload, "overview"),
                summaryField(payload, "feature_details"),
                summaryField(payload, "enabled_outcomes")
        );
    }

    private HttpRequest completionRequest(String systemPrompt, String userPrompt) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.openaiModel());
        body.put("temperature", TEMPERATURE);
        body.putObject("response_format").put("type", "json_object");
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);

        return HttpRequest.newBuilder()
                .uri(URI.create(config.openaiApiUrl() + COMPLETIONS_PATH))
                .header("Authorization", "Bearer " + config.openaiApiKey())
                .header("Content-Type", "application/json")
                .timeout(Duration.ofMillis(config.requestTimeoutMillis()))
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SummarizeException("OpenAI request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SummarizeException("Interrupted while calling OpenAI", e);
        }
    }

    private JsonNode readJson(String text, String message) {
        try {
            return objectMapper.readTree(text);
        } catch (IOException e) {
            throw new SummarizeException(message, e);
        }
    }

    private static String summaryField(JsonNode payload, String field) {
        JsonNode value = payload.path(field);
        if (!value.isTextual()) {
            throw new SummarizeException("Summary field '" + field + "' must be text");
        }
        String normalized = value.asText().strip();
        if (normalized.isEmpty()) {
            throw new SummarizeException("Summary field '" + field + "' must not be empty");
        }
        return normalized;
    }

    static String pullRequestPrompt(PullRequest pullRequest, PullRequestDetail detail) {
        List<String> lines = new ArrayList<>(List.of(
                "Summarize this merged PR in Japanese.",
                "PR number: " + pullRequest.number(),
                "Title: " + pullRequest.title(),
                "URL: " + pullRequest.htmlUrl()
        ));
        if (detail != null && detail.body() != null && !detail.body().isBlank()) {
            lines.add("Body:");
            lines.add(detail.body().strip());
        }
        return String.join("\n", lines);
    }

    static String releasePrompt(Release release) {
        List<String> lines = new ArrayList<>(List.of(
                "Summarize this GitHub release in Japanese.",
                "Release tag: " + release.tagName(),
                "Release name: " + release.name(),
                "URL: " + release.htmlUrl(),
                "Published at: " + Timestamps.format(release.publishedAt())
        ));
        if (release.body() != null && !release.body().isBlank()) {
            lines.add("Body:");
            lines.add(release.body().strip());
        }
        return String.join("\n", lines);
    }
}
