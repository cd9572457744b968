package com.codexwatch;

import static org.assertj.core.api.Assertions.assertThat;

import com.codexwatch.config.AppConfig;
import com.codexwatch.s3.S3CheckpointStore;
import com.codexwatch.store.FileCheckpointStore;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AppTest {

    @TempDir
    Path tempDir;

    private StubHttpServer server;
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);

    @BeforeEach
    void setUp() throws IOException {
        server = new StubHttpServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private Map<String, String> env(String... extra) {
        var env = new HashMap<String, String>();
        env.put("CODEXWATCH_GITHUB_API_URL", server.baseUrl());
        env.put("CODEXWATCH_STATE_PATH", tempDir.resolve("state.json").toString());
        env.put("DISCORD_WEBHOOK_URL", server.baseUrl() + "/webhook");
        for (int i = 0; i < extra.length; i += 2) {
            env.put(extra[i], extra[i + 1]);
        }
        return env;
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldExitWithUsageCodeOnUnknownArgument() {
        // when
        int code = App.run(new String[] {"--bogus"}, env(), out);

        // then
        assertThat(code).isEqualTo(App.EXIT_USAGE);
        assertThat(server.received()).isEmpty();
    }

    @Test
    void shouldDefaultToDryRunWithoutTouchingAnything() {
        // when
        int code = App.run(new String[0], env(), out);

        // then
        assertThat(code).isEqualTo(App.EXIT_OK);
        assertThat(server.received()).isEmpty();
        assertThat(tempDir.resolve("state.json")).doesNotExist();
    }

    @Test
    void shouldLetDryRunFlagOverrideInvalidEnvironmentValue() {
        // when
        int code = App.run(new String[] {"--dry-run"}, env("CODEXWATCH_DRY_RUN", "maybe"), out);

        // then
        assertThat(code).isEqualTo(App.EXIT_OK);
    }

    @Test
    void shouldFailOnInvalidEnvironmentValue() {
        // when
        int code = App.run(new String[0], env("CODEXWATCH_MAX_NOTIFICATIONS_PER_RUN", "0"), out);

        // then
        assertThat(code).isEqualTo(App.EXIT_FAILURE);
    }

    @Test
    void shouldFailLiveRunWithoutWebhook() {
        // given
        var env = env();
        env.remove("DISCORD_WEBHOOK_URL");

        // when
        int code = App.run(new String[] {"--no-dry-run"}, env, out);

        // then
        assertThat(code).isEqualTo(App.EXIT_FAILURE);
        assertThat(server.received()).isEmpty();
    }

    @Test
    void shouldFinishLiveRunWithNothingFetched() {
        // given
        server.respond(200, "[]");

        // when
        int code = App.run(new String[] {"--no-dry-run"}, env(), out);

        // then
        assertThat(code).isEqualTo(App.EXIT_OK);
        assertThat(server.received()).extracting(StubHttpServer.Received::method).containsOnly("GET");
        assertThat(tempDir.resolve("state.json")).doesNotExist();
    }

    @Test
    void shouldExitWithFailureWhenCheckpointIsCorrupt() throws IOException {
        // given
        Files.writeString(tempDir.resolve("state.json"), "{not json");
        server.respond(200, "[]");

        // when
        int code = App.run(new String[] {"--no-dry-run"}, env(), out);

        // then
        assertThat(code).isEqualTo(App.EXIT_FAILURE);
        assertThat(Files.readString(tempDir.resolve("state.json"))).isEqualTo("{not json");
    }

    @Test
    void shouldPrintReleaseSummaryWithoutSending() {
        // given
        server.respond(200, """
                {"id": 5, "tag_name": "rust-v0.5.0", "name": "0.5.0", "html_url": "https://gh/r5",
                 "published_at": "2026-02-17T10:00:00Z", "body": "notes"}
                """);

        // when
        int code = App.run(new String[] {"--release-tag", "rust-v0.5.0"}, env(), out);

        // then
        assertThat(code).isEqualTo(App.EXIT_OK);
        assertThat(printed())
                .contains("### Releaseが公開されました")
                .contains("- Release: rust-v0.5.0 (0.5.0)");
        assertThat(server.received()).hasSize(1);
    }

    @Test
    void shouldSendReleaseSummaryWhenAsked() {
        // given
        server.respond(200, """
                {"id": 5, "tag_name": "rust-v0.5.0", "name": "0.5.0", "html_url": "https://gh/r5",
                 "published_at": "2026-02-17T10:00:00Z"}
                """);

        // when
        int code = App.run(
                new String[] {"--release-tag=rust-v0.5.0", "--send-release-to-discord", "--no-dry-run"},
                env(),
                out);

        // then
        assertThat(code).isEqualTo(App.EXIT_OK);
        var webhookCall = server.lastRequest();
        assertThat(webhookCall.method()).isEqualTo("POST");
        assertThat(webhookCall.uri()).isEqualTo("/webhook");
        assertThat(webhookCall.body()).contains("rust-v0.5.0");
    }

    @Test
    void shouldSkipReleaseSendInDryRun() {
        // given
        server.respond(200, """
                {"id": 5, "tag_name": "rust-v0.5.0", "name": "0.5.0", "html_url": "https://gh/r5",
                 "published_at": "2026-02-17T10:00:00Z"}
                """);

        // when
        int code = App.run(new String[] {"--release-tag", "rust-v0.5.0", "--send-release-to-discord"}, env(), out);

        // then
        assertThat(code).isEqualTo(App.EXIT_OK);
        assertThat(server.received()).extracting(StubHttpServer.Received::method).containsExactly("GET");
    }

    @Test
    void shouldPickCheckpointStoreFromBackend() {
        // given
        AppConfig file = Fixtures.config(env());
        AppConfig s3 = Fixtures.config(env(
                "CODEXWATCH_CHECKPOINT_BACKEND", "s3",
                "S3_CHECKPOINT_BUCKET", "codexwatch-state",
                "USE_LOCALSTACK", "true"));

        // then
        assertThat(App.checkpointStore(file)).isInstanceOf(FileCheckpointStore.class);
        assertThat(App.checkpointStore(s3)).isInstanceOf(S3CheckpointStore.class);
    }
}
