package com.codexwatch.discord;

import com.codexwatch.config.AppConfig;
import com.codexwatch.error.DeliveryException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Posts messages to a Discord webhook.
 */
public class DiscordClient {

    private static final Logger log = LoggerFactory.getLogger(DiscordClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AppConfig config;

    public DiscordClient(AppConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.requestTimeoutMillis()))
                .build());
    }

    public DiscordClient(AppConfig config, HttpClient httpClient) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.config = config;
    }

    /**
     * Returns normally only when Discord accepted the message.
     *
     * @throws DeliveryException if the webhook call fails or is rejected
     */
    public void send(String content) {
        String normalized = content == null ? "" : content.strip();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Discord message content must not be empty");
        }
        String webhookUrl = config.discordWebhookUrl();
        if (webhookUrl == null) {
            throw new DeliveryException("DISCORD_WEBHOOK_URL is not configured");
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(Map.of("content", normalized));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize Discord message", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(webhookUrl))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofMillis(config.requestTimeoutMillis()))
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException("Discord webhook request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Interrupted while calling Discord webhook", e);
        }

        if (response.statusCode() >= 300) {
            throw new DeliveryException(
                    "Discord webhook rejected message. Status="
                            + response.statusCode()
                            + ", body="
                            + response.body()
            );
        }
        log.debug("Discord webhook accepted message, status {}", response.statusCode());
    }
}
