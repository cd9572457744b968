package com.codexwatch.github;

import static com.codexwatch.Fixtures.utc;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codexwatch.Fixtures;
import com.codexwatch.StubHttpServer;
import com.codexwatch.error.SourceFetchException;
import com.codexwatch.model.Item;
import com.codexwatch.model.Release;
import java.io.IOException;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GitHubClientTest {

    private StubHttpServer server;
    private GitHubClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubHttpServer();
        client = new GitHubClient(Fixtures.config(Map.of(
                "CODEXWATCH_GITHUB_API_URL", server.baseUrl(),
                "GITHUB_TOKEN", "ghp_test")));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void shouldKeepOnlyMergedPullRequestsAgainstBaseBranchOldestFirst() {
        // given
        server.respond(200, """
                [
                  {"id": 3, "number": 30, "title": "third", "html_url": "https://gh/30",
                   "merged_at": "2026-02-17T10:00:00Z", "base": {"ref": "main"}},
                  {"id": 2, "number": 20, "title": "closed unmerged", "html_url": "https://gh/20",
                   "merged_at": null, "base": {"ref": "main"}},
                  {"id": 4, "number": 40, "title": "other branch", "html_url": "https://gh/40",
                   "merged_at": "2026-02-17T08:00:00Z", "base": {"ref": "release"}},
                  {"id": 1, "number": 10, "title": "first", "html_url": "https://gh/10",
                   "merged_at": "2026-02-17T09:00:00Z", "base": {"ref": "main"}}
                ]
                """);

        // when
        var pullRequests = client.fetchMergedPullRequests();

        // then
        assertThat(pullRequests).extracting(Item::id).containsExactly(1L, 3L);
        assertThat(pullRequests.get(0).number()).isEqualTo(10);
        assertThat(pullRequests.get(0).mergedAt()).isEqualTo(utc("2026-02-17T09:00:00Z"));

        var request = server.lastRequest();
        assertThat(request.uri())
                .startsWith("/repos/openai/codex/pulls?")
                .contains("state=closed", "base=main", "sort=updated", "direction=desc", "per_page=100", "page=1");
        assertThat(request.authorization()).isEqualTo("Bearer ghp_test");
    }

    @Test
    void shouldReadPullRequestDetailWithNormalizedBody() {
        // given
        server.respond(200, """
                {"id": 1, "number": 10, "title": "first", "html_url": "https://gh/10",
                 "merged_at": "2026-02-17T09:00:00Z", "body": "   "}
                """);

        // when
        var detail = client.fetchPullRequestDetail(10);

        // then
        assertThat(detail.number()).isEqualTo(10);
        assertThat(detail.body()).isNull();
        assertThat(server.lastRequest().uri()).isEqualTo("/repos/openai/codex/pulls/10");
    }

    @Test
    void shouldFilterDraftsPrereleasesAndAlphaReleases() {
        // given
        server.respond(200, """
                [
                  {"id": 5, "tag_name": "rust-v0.5.0", "name": "", "html_url": "https://gh/r5",
                   "published_at": "2026-02-17T10:00:00Z", "draft": false, "prerelease": false, "body": "notes"},
                  {"id": 6, "tag_name": "rust-v0.6.0", "name": "0.6.0", "html_url": "https://gh/r6",
                   "published_at": null, "draft": true},
                  {"id": 7, "tag_name": "rust-v0.7.0-alpha.1", "name": "0.7.0-alpha.1", "html_url": "https://gh/r7",
                   "published_at": "2026-02-17T11:00:00Z", "prerelease": false},
                  {"id": 8, "tag_name": "rust-v0.8.0", "name": "0.8.0", "html_url": "https://gh/r8",
                   "published_at": "2026-02-17T12:00:00Z", "prerelease": true},
                  {"id": 9, "tag_name": "rust-v0.4.0", "name": "0.4.0 α", "html_url": "https://gh/r9",
                   "published_at": "2026-02-17T09:00:00Z"},
                  {"id": 4, "tag_name": "rust-v0.3.0", "name": "0.3.0", "html_url": "https://gh/r4",
                   "published_at": "2026-02-16T09:00:00Z"}
                ]
                """);

        // when
        var releases = client.fetchReleases();

        // then
        assertThat(releases).extracting(Release::id).containsExactly(4L, 5L);
        assertThat(releases.get(1).name()).isEqualTo("rust-v0.5.0");
        assertThat(releases.get(1).body()).isEqualTo("notes");
    }

    @Test
    void shouldFetchReleaseByTag() {
        // given
        server.respond(200, """
                {"id": 5, "tag_name": "rust-v0.5.0", "name": "0.5.0", "html_url": "https://gh/r5",
                 "published_at": "2026-02-17T10:00:00Z"}
                """);

        // when
        var release = client.fetchReleaseByTag("rust-v0.5.0");

        // then
        assertThat(release.tagName()).isEqualTo("rust-v0.5.0");
        assertThat(server.lastRequest().uri()).isEqualTo("/repos/openai/codex/releases/tags/rust-v0.5.0");
    }

    @Test
    void shouldRaiseSourceFetchFailureOnErrorStatus() {
        // given
        server.respond(502, "{\"message\": \"bad gateway\"}");

        // when / then
        assertThatThrownBy(() -> client.fetchReleases())
                .isInstanceOf(SourceFetchException.class)
                .hasMessageContaining("Status=502");
    }

    @Test
    void shouldRaiseSourceFetchFailureOnUnexpectedShape() {
        // given
        server.respond(200, "{\"message\": \"not a list\"}");

        // when / then
        assertThatThrownBy(() -> client.fetchMergedPullRequests()).isInstanceOf(SourceFetchException.class);
    }

    @Test
    void shouldRejectInvalidPaging() {
        assertThatThrownBy(() -> client.fetchReleases(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> client.fetchMergedPullRequests(10, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(server.received()).isEmpty();
    }
}
