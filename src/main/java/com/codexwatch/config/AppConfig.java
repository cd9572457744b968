package com.codexwatch.config;

import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class AppConfig {

    public enum CheckpointBackend {
        FILE,
        S3
    }

    private final String githubRepo;
    private final String githubBaseBranch;
    private final String githubApiUrl;
    private final String githubToken;

    private final int pollIntervalMinutes;
    private final boolean dryRun;
    private final int maxNotificationsPerRun;
    private final long requestTimeoutMillis;

    private final String openaiApiKey;
    private final String openaiModel;
    private final String openaiApiUrl;

    private final String discordWebhookUrl;

    private final CheckpointBackend checkpointBackend;
    private final Path statePath;
    private final String s3CheckpointBucketName;
    private final String s3CheckpointKey;
    private final boolean useLocalstack;
    private final String s3Endpoint;
    private final String awsRegion;

    public AppConfig(
            String githubRepo,
            String githubBaseBranch,
            String githubApiUrl,
            String githubToken,
            int pollIntervalMinutes,
            boolean dryRun,
            int maxNotificationsPerRun,
            long requestTimeoutMillis,
            String openaiApiKey,
            String openaiModel,
            String openaiApiUrl,
            String discordWebhookUrl,
            CheckpointBackend checkpointBackend,
            Path statePath,
            String s3CheckpointBucketName,
            String s3CheckpointKey,
            boolean useLocalstack,
            String s3Endpoint,
            String awsRegion
    ) {
        this.githubRepo = require(githubRepo, "githubRepo");
        this.githubBaseBranch = require(githubBaseBranch, "githubBaseBranch");
        this.githubApiUrl = require(githubApiUrl, "githubApiUrl");
        this.githubToken = githubToken;
        this.pollIntervalMinutes = pollIntervalMinutes;
        this.dryRun = dryRun;
        this.maxNotificationsPerRun = maxNotificationsPerRun;
        this.requestTimeoutMillis = requestTimeoutMillis;
        this.openaiApiKey = openaiApiKey;
        this.openaiModel = require(openaiModel, "openaiModel");
        this.openaiApiUrl = require(openaiApiUrl, "openaiApiUrl");
        this.discordWebhookUrl = discordWebhookUrl;
        this.checkpointBackend = require(checkpointBackend, "checkpointBackend");
        this.statePath = require(statePath, "statePath");
        this.s3CheckpointBucketName = s3CheckpointBucketName;
        this.s3CheckpointKey = require(s3CheckpointKey, "s3CheckpointKey");
        this.useLocalstack = useLocalstack;
        this.s3Endpoint = s3Endpoint;
        this.awsRegion = require(awsRegion, "awsRegion");
    }

    private static <T> T require(T value, String name) {
        return Objects.requireNonNull(value, name + " must not be null");
    }

    @JsonProperty
    public String githubRepo() {
        return githubRepo;
    }

    @JsonProperty
    public String githubBaseBranch() {
        return githubBaseBranch;
    }

    @JsonProperty
    public String githubApiUrl() {
        return githubApiUrl;
    }

    @JsonIgnore
    public String githubToken() {
        return githubToken;
    }

    @JsonProperty
    public int pollIntervalMinutes() {
        return pollIntervalMinutes;
    }

    @JsonProperty
    public boolean dryRun() {
        return dryRun;
    }

    @JsonProperty
    public int maxNotificationsPerRun() {
        return maxNotificationsPerRun;
    }

    @JsonProperty
    public long requestTimeoutMillis() {
        return requestTimeoutMillis;
    }

    @JsonIgnore
    public String openaiApiKey() {
        return openaiApiKey;
    }

    @JsonProperty
    public String openaiModel() {
        return openaiModel;
    }

    @JsonProperty
    public String openaiApiUrl() {
        return openaiApiUrl;
    }

    @JsonIgnore
    public String discordWebhookUrl() {
        return discordWebhookUrl;
    }

    @JsonProperty
    public CheckpointBackend checkpointBackend() {
        return checkpointBackend;
    }

    public Path statePath() {
        return statePath;
    }

    @JsonProperty("statePath")
    String statePathText() {
        return statePath.toString();
    }

    @JsonProperty
    public String s3CheckpointBucketName() {
        return s3CheckpointBucketName;
    }

    @JsonProperty
    public String s3CheckpointKey() {
        return s3CheckpointKey;
    }

    @JsonProperty
    public boolean useLocalstack() {
        return useLocalstack;
    }

    @JsonProperty
    public String s3Endpoint() {
        return s3Endpoint;
    }

    @JsonProperty
    public String awsRegion() {
        return awsRegion;
    }

    @JsonProperty("githubTokenConfigured")
    boolean githubTokenConfigured() {
        return githubToken != null;
    }

    @JsonProperty("openaiApiKeyConfigured")
    boolean openaiApiKeyConfigured() {
        return openaiApiKey != null;
    }

    @JsonProperty("discordWebhookConfigured")
    boolean discordWebhookConfigured() {
        return discordWebhookUrl != null;
    }
}
