package com.codexwatch.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class EnvConfigLoader {

    public static final String DRY_RUN = "CODEXWATCH_DRY_RUN";

    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes", "on");
    private static final Set<String> FALSE_VALUES = Set.of("0", "false", "no", "off");

    private EnvConfigLoader() {}

    public static AppConfig load(Map<String, String> env) {

        String githubRepo = string(env, "CODEXWATCH_GITHUB_REPO", "openai/codex");
        String githubBaseBranch = string(env, "CODEXWATCH_GITHUB_BASE_BRANCH", "main");
        String githubApiUrl = string(env, "CODEXWATCH_GITHUB_API_URL", "https://api.github.com");
        String githubToken = optional(env, "GITHUB_TOKEN");

        int pollIntervalMinutes = positiveInteger(env, "CODEXWATCH_POLL_INTERVAL_MINUTES", 10);
        boolean dryRun = bool(env, DRY_RUN, true);
        int maxNotificationsPerRun = positiveInteger(env, "CODEXWATCH_MAX_NOTIFICATIONS_PER_RUN", 5);
        long requestTimeoutMillis = positiveInteger(env, "REQUEST_TIMEOUT_MILLIS", 10000);

        String openaiApiKey = optional(env, "OPENAI_API_KEY");
        String openaiModel = string(env, "CODEXWATCH_OPENAI_MODEL", "gpt-4o-mini");
        String openaiApiUrl = string(env, "CODEXWATCH_OPENAI_API_URL", "https://api.openai.com/v1");

        String discordWebhookUrl = optional(env, "DISCORD_WEBHOOK_URL");

        AppConfig.CheckpointBackend backend = backend(env, "CODEXWATCH_CHECKPOINT_BACKEND");
        Path statePath = Path.of(string(env, "CODEXWATCH_STATE_PATH", "state/state.json"));
        String s3CheckpointBucketName = backend == AppConfig.CheckpointBackend.S3
                ? required(env, "S3_CHECKPOINT_BUCKET")
                : optional(env, "S3_CHECKPOINT_BUCKET");
        String s3CheckpointKey = string(env, "S3_CHECKPOINT_KEY", "codexwatch/state.json");

        boolean useLocalstack = bool(env, "USE_LOCALSTACK", false);
        String s3Endpoint = optional(env, "S3_ENDPOINT");
        if (useLocalstack && s3Endpoint == null) {
            s3Endpoint = "http://localhost:4566";
        }
        String awsRegion = string(env, "AWS_REGION", "us-east-1");

        return new AppConfig(
                githubRepo,
                githubBaseBranch,
                githubApiUrl,
                githubToken,
                pollIntervalMinutes,
                dryRun,
                maxNotificationsPerRun,
                requestTimeoutMillis,
                openaiApiKey,
                openaiModel,
                openaiApiUrl,
                discordWebhookUrl,
                backend,
                statePath,
                s3CheckpointBucketName,
                s3CheckpointKey,
                useLocalstack,
                s3Endpoint,
                awsRegion
        );
    }

    private static String required(Map<String, String> env, String key) {
        String value = optional(env, key);
        if (value == null) {
            throw new IllegalStateException(
                    "Missing required environment variable: " + key
            );
        }
        return value;
    }

    private static String optional(Map<String, String> env, String key) {
        String value = env.get(key);
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static String string(Map<String, String> env, String key, String defaultValue) {
        String value = optional(env, key);
        return value == null ? defaultValue : value;
    }

    private static int positiveInteger(
            Map<String, String> env,
            String key,
            int defaultValue
    ) {
        String value = env.get(key);
        if (value == null) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Invalid integer value for " + key + ": '" + value + "'", e
            );
        }
        if (parsed <= 0) {
            throw new IllegalStateException(
                    key + " must be greater than 0: '" + value + "'"
            );
        }
        return parsed;
    }

    private static boolean bool(Map<String, String> env, String key, boolean defaultValue) {
        String value = env.get(key);
        if (value == null) {
            return defaultValue;
        }
        String lowered = value.strip().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(lowered)) {
            return true;
        }
        if (FALSE_VALUES.contains(lowered)) {
            return false;
        }
        throw new IllegalStateException(
                "Invalid boolean value for " + key + ": '" + value + "'"
        );
    }

    private static AppConfig.CheckpointBackend backend(Map<String, String> env, String key) {
        String value = optional(env, key);
        if (value == null) {
            return AppConfig.CheckpointBackend.FILE;
        }
        try {
            return AppConfig.CheckpointBackend.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                    "Invalid checkpoint backend for " + key + ": '" + value + "' (expected file or s3)", e
            );
        }
    }
}
