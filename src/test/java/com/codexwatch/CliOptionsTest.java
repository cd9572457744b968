package com.codexwatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CliOptionsTest {

    @Test
    void shouldLeaveDryRunUnsetWithoutFlags() {
        // when
        var options = CliOptions.parse(new String[0]);

        // then
        assertThat(options).isEqualTo(new CliOptions(null, null, false));
    }

    @Test
    void shouldParseDryRunFlags() {
        assertThat(CliOptions.parse(new String[] {"--dry-run"}).dryRun()).isTrue();
        assertThat(CliOptions.parse(new String[] {"--no-dry-run"}).dryRun()).isFalse();
    }

    @Test
    void shouldRejectConflictingDryRunFlags() {
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"--dry-run", "--no-dry-run"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not allowed");
    }

    @Test
    void shouldParseReleaseTagInBothForms() {
        // when
        var separate = CliOptions.parse(new String[] {"--release-tag", "rust-v0.5.0", "--send-release-to-discord"});
        var joined = CliOptions.parse(new String[] {"--release-tag=rust-v0.5.0"});

        // then
        assertThat(separate).isEqualTo(new CliOptions(null, "rust-v0.5.0", true));
        assertThat(joined.releaseTag()).isEqualTo("rust-v0.5.0");
        assertThat(joined.sendReleaseToDiscord()).isFalse();
    }

    @Test
    void shouldRequireReleaseTagForDiscordSend() {
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"--send-release-to-discord"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--release-tag");
    }

    @ParameterizedTest
    @ValueSource(strings = {"--release-tag", "--release-tag=", "--verbose", "run"})
    void shouldRejectMalformedArguments(String arg) {
        assertThatThrownBy(() -> CliOptions.parse(new String[] {arg}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
