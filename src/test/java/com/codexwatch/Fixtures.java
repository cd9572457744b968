package com.codexwatch;

import com.codexwatch.config.AppConfig;
import com.codexwatch.config.EnvConfigLoader;
import com.codexwatch.model.PullRequest;
import com.codexwatch.model.PullRequestDetail;
import com.codexwatch.model.Release;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public final class Fixtures {

    private Fixtures() {}

    public static Instant utc(String text) {
        return Instant.parse(text);
    }

    public static PullRequest pullRequest(long id, String mergedAt) {
        return new PullRequest(id, (int) id, "PR " + id, "https://github.com/openai/codex/pull/" + id, utc(mergedAt));
    }

    public static PullRequestDetail detail(PullRequest pullRequest) {
        return new PullRequestDetail(
                pullRequest.id(),
                pullRequest.number(),
                pullRequest.title(),
                pullRequest.htmlUrl(),
                pullRequest.mergedAt(),
                "body of " + pullRequest.number()
        );
    }

    public static Release release(long id, String publishedAt) {
        return new Release(
                id,
                "rust-v0." + id + ".0",
                "0." + id + ".0",
                "https://github.com/openai/codex/releases/tag/rust-v0." + id + ".0",
                utc(publishedAt),
                "notes " + id,
                false
        );
    }

    public static AppConfig config(Map<String, String> overrides) {
        Map<String, String> env = new HashMap<>();
        env.put("CODEXWATCH_DRY_RUN", "false");
        env.put("DISCORD_WEBHOOK_URL", "https://discord.example/webhook");
        env.putAll(overrides);
        return EnvConfigLoader.load(env);
    }

    public static AppConfig config() {
        return config(Map.of());
    }
}
