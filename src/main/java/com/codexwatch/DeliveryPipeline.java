package com.codexwatch;

import com.codexwatch.config.AppConfig;
import com.codexwatch.discord.DiscordClient;
import com.codexwatch.github.GitHubClient;
import com.codexwatch.model.Checkpoint;
import com.codexwatch.model.CheckpointStore;
import com.codexwatch.model.Item;
import com.codexwatch.model.LaneKind;
import com.codexwatch.model.LaneState;
import com.codexwatch.model.PullRequest;
import com.codexwatch.model.PullRequestDetail;
import com.codexwatch.model.Release;
import com.codexwatch.model.Summary;
import com.codexwatch.summary.Summarizer;
import com.codexwatch.watermark.BootstrapPolicy;
import com.codexwatch.watermark.CheckpointAdvancer;
import com.codexwatch.watermark.WatermarkSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One polling run: load checkpoint, fetch, pick unseen items and deliver them
 * one at a time.
 *
 * <p>The checkpoint is saved after every delivered item, so a failure part way
 * through leaves every earlier delivery recorded and the failed item unseen.
 * The first failure ends the run; remaining items wait for the next one.
 */
public final class DeliveryPipeline {

    private static final Logger log = LoggerFactory.getLogger(DeliveryPipeline.class);

    private final AppConfig config;
    private final CheckpointStore checkpointStore;
    private final GitHubClient gitHubClient;
    private final Summarizer summarizer;
    private final DiscordClient discordClient;

    public DeliveryPipeline(
            AppConfig config,
            CheckpointStore checkpointStore,
            GitHubClient gitHubClient,
            Summarizer summarizer,
            DiscordClient discordClient
    ) {
        this.config = config;
        this.checkpointStore = checkpointStore;
        this.gitHubClient = gitHubClient;
        this.summarizer = summarizer;
        this.discordClient = discordClient;
    }

    public RunResult run() {
        if (config.dryRun()) {
            log.info("Dry-run enabled. Skipping GitHub/OpenAI/Discord calls.");
            return new RunResult(RunResult.Outcome.DRY_RUN, 0, "dry-run no-op");
        }
        if (config.discordWebhookUrl() == null) {
            log.error("DISCORD_WEBHOOK_URL is not configured");
            return new RunResult(RunResult.Outcome.FAILED, 0, "missing discord webhook");
        }

        Progress progress = new Progress();
        try {
            Checkpoint checkpoint = checkpointStore.load();

            Lane<PullRequest> pullRequests =
                    new Lane<>(LaneKind.PULL_REQUESTS, gitHubClient.fetchMergedPullRequests(), this::renderPullRequest);
            Lane<Release> releases =
                    new Lane<>(LaneKind.RELEASES, gitHubClient.fetchReleases(), this::renderRelease);
            List<Lane<?>> lanes = List.of(pullRequests, releases);

            List<Planned<?>> plans = new ArrayList<>(lanes.size());
            for (Lane<?> lane : lanes) {
                Planned<?> planned = plan(lane, checkpoint, progress);
                checkpoint = planned.checkpoint();
                plans.add(planned);
            }

            if (progress.unseen == 0) {
                if (progress.bootstrapped) {
                    log.info("Bootstrapped state without backfill notifications");
                    return new RunResult(RunResult.Outcome.BOOTSTRAPPED, 0, "bootstrapped without backfill");
                }
                log.info("No unprocessed merged pull requests or releases");
                return new RunResult(RunResult.Outcome.NO_UPDATES, 0, "no updates");
            }

            for (Planned<?> planned : plans) {
                checkpoint = deliver(planned, checkpoint, progress);
            }

            if (progress.delivered < progress.unseen) {
                log.info("Notification cap of {} reached; {} item(s) left for the next run",
                        config.maxNotificationsPerRun(), progress.unseen - progress.delivered);
            }
            return new RunResult(RunResult.Outcome.DELIVERED, progress.delivered, "processed notifications");

        } catch (RuntimeException e) {
            log.error("Pipeline execution failed after {} delivered notification(s)", progress.delivered, e);
            return RunResult.failure(progress.delivered, describe(e));
        }
    }

    /**
     * Bootstraps a lane that has never advanced, otherwise selects its
     * unseen items.
     */
    private <T extends Item> Planned<T> plan(Lane<T> lane, Checkpoint checkpoint, Progress progress) {
        LaneState state = checkpoint.lane(lane.kind());

        if (BootstrapPolicy.isPending(state)) {
            Optional<LaneState> bootstrapped = BootstrapPolicy.bootstrap(state, lane.batch());
            if (bootstrapped.isPresent()) {
                Checkpoint next = checkpoint.withLane(lane.kind(), bootstrapped.get());
                checkpointStore.save(next);
                progress.bootstrapped = true;
                log.info("[{}] Bootstrapped watermark {} from {} item(s) without notifications",
                        lane.kind(), bootstrapped.get().watermark(), lane.batch().size());
                return new Planned<>(lane, List.of(), next);
            }
            log.info("[{}] Nothing fetched yet; bootstrap deferred to the next run", lane.kind());
            return new Planned<>(lane, List.of(), checkpoint);
        }

        List<T> unseen = WatermarkSelector.selectUnseen(lane.batch(), state);
        progress.unseen += unseen.size();
        log.info("[{}] {} unseen of {} fetched item(s)", lane.kind(), unseen.size(), lane.batch().size());
        return new Planned<>(lane, unseen, checkpoint);
    }

    private <T extends Item> Checkpoint deliver(Planned<T> planned, Checkpoint checkpoint, Progress progress) {
        Lane<T> lane = planned.lane();

        for (T item : planned.unseen()) {
            if (progress.delivered >= config.maxNotificationsPerRun()) {
                return checkpoint;
            }

            String message = lane.render(item);
            discordClient.send(message);

            LaneState next = CheckpointAdvancer.advance(checkpoint.lane(lane.kind()), List.of(item));
            checkpoint = checkpoint.withLane(lane.kind(), next);
            checkpointStore.save(checkpoint);
            progress.delivered++;

            log.info("[{}] Delivered item {} and advanced watermark to {}",
                    lane.kind(), item.id(), next.watermark());
        }
        return checkpoint;
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private String renderPullRequest(PullRequest pullRequest) {
        PullRequestDetail detail = gitHubClient.fetchPullRequestDetail(pullRequest.number());
        Summary summary = summarizer.summarizePullRequest(pullRequest, detail);
        return MessageRenderer.renderPullRequest(detail, summary);
    }

    private String renderRelease(Release release) {
        Summary summary = summarizer.summarizeRelease(release);
        return MessageRenderer.renderRelease(release, summary);
    }

    private record Planned<T extends Item>(Lane<T> lane, List<T> unseen, Checkpoint checkpoint) {
    }

    private static final class Progress {
        private int delivered;
        private int unseen;
        private boolean bootstrapped;
    }
}
