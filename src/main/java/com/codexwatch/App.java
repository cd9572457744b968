package com.codexwatch;

import com.codexwatch.config.AppConfig;
import com.codexwatch.config.EnvConfigLoader;
import com.codexwatch.discord.DiscordClient;
import com.codexwatch.github.GitHubClient;
import com.codexwatch.model.CheckpointStore;
import com.codexwatch.model.Release;
import com.codexwatch.model.Summary;
import com.codexwatch.s3.S3CheckpointStore;
import com.codexwatch.store.FileCheckpointStore;
import com.codexwatch.summary.Summarizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.HashMap;
import java.util.Map;

public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out));
    }

    static int run(String[] args, Map<String, String> env, PrintStream out) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(CliOptions.USAGE);
            System.err.println("codexwatch: error: " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            AppConfig config = loadConfig(options, env);

            log.info(
                    "Starting codexwatch runner repo={} branch={} dry_run={} interval_min={}",
                    config.githubRepo(),
                    config.githubBaseBranch(),
                    config.dryRun(),
                    config.pollIntervalMinutes()
            );
            log.debug("Loaded configuration: {}", describe(config));

            if (options.releaseTag() != null) {
                return runReleaseSummary(config, options.releaseTag(), options.sendReleaseToDiscord(), out);
            }

            RunResult result = new DeliveryPipeline(
                    config,
                    checkpointStore(config),
                    new GitHubClient(config),
                    new Summarizer(config),
                    new DiscordClient(config)
            ).run();

            if (!result.success()) {
                log.error("Pipeline failed: {} (delivered {} notification(s))",
                        result.message(), result.deliveredCount());
                return EXIT_FAILURE;
            }

            log.info("Pipeline completed outcome={} delivered_count={} message={}",
                    result.outcome(), result.deliveredCount(), result.message());
            return EXIT_OK;

        } catch (Exception e) {
            log.error("Job failed", e);
            return EXIT_FAILURE;
        }
    }

    /**
     * A dry-run flag on the command line replaces the environment value,
     * even an invalid one.
     */
    static AppConfig loadConfig(CliOptions options, Map<String, String> env) {
        if (options.dryRun() == null) {
            return EnvConfigLoader.load(env);
        }
        Map<String, String> overridden = new HashMap<>(env);
        overridden.put(EnvConfigLoader.DRY_RUN, options.dryRun() ? "true" : "false");
        return EnvConfigLoader.load(overridden);
    }

    static CheckpointStore checkpointStore(AppConfig config) {
        switch (config.checkpointBackend()) {
            case S3:
                return new S3CheckpointStore(config);
            case FILE:
            default:
                return new FileCheckpointStore(config.statePath());
        }
    }

    private static int runReleaseSummary(
            AppConfig config,
            String releaseTag,
            boolean sendToDiscord,
            PrintStream out
    ) {
        Release release;
        String message;
        try {
            release = new GitHubClient(config).fetchReleaseByTag(releaseTag);
            Summary summary = new Summarizer(config).summarizeRelease(release);
            message = MessageRenderer.renderRelease(release, summary);
        } catch (RuntimeException e) {
            log.error("Release summary mode failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
        out.println(message);

        if (!sendToDiscord) {
            return EXIT_OK;
        }
        if (config.dryRun()) {
            log.info("Dry-run enabled; skipping Discord send for release tag={}", release.tagName());
            return EXIT_OK;
        }
        if (config.discordWebhookUrl() == null) {
            log.error("DISCORD_WEBHOOK_URL is required when --send-release-to-discord is used");
            return EXIT_FAILURE;
        }

        try {
            new DiscordClient(config).send(message);
        } catch (RuntimeException e) {
            log.error("Release summary mode failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
        log.info("Release summary sent to Discord for tag={}", release.tagName());
        return EXIT_OK;
    }

    // stringify config to JSON for clearer logging, fallback to toString()
    private static String describe(AppConfig config) {
        try {
            ObjectMapper mapper = new ObjectMapper()
                    .findAndRegisterModules()
                    .enable(SerializationFeature.INDENT_OUTPUT);
            return mapper.writeValueAsString(config);
        } catch (Exception e) {
            log.debug("Could not render configuration as JSON", e);
            return String.valueOf(config);
        }
    }
}
