package com.codexwatch;

import com.codexwatch.model.Item;
import com.codexwatch.model.PullRequestDetail;
import com.codexwatch.model.Release;
import com.codexwatch.model.Summary;
import com.codexwatch.model.Timestamps;

import java.util.List;

/**
 * Builds the Discord message text for an item and its summary.
 */
public final class MessageRenderer {

    private MessageRenderer() {
        // utility class
    }

    public static String renderPullRequest(PullRequestDetail pullRequest, Summary summary) {
        return render(
                "### PRがマージされました",
                "- PR: #" + pullRequest.number() + " " + requireText(pullRequest.title(), "title"),
                pullRequest,
                "- マージ日時: ",
                summary
        );
    }

    public static String renderRelease(Release release, Summary summary) {
        return render(
                "### Releaseが公開されました",
                "- Release: " + requireText(release.tagName(), "tagName")
                        + " (" + requireText(release.name(), "name") + ")",
                release,
                "- 公開日時: ",
                summary
        );
    }

    private static String render(
            String heading,
            String headline,
            Item item,
            String timestampLabel,
            Summary summary
    ) {
        return String.join("\n", List.of(
                heading,
                headline,
                "- URL: " + requireText(item.url(), "url"),
                timestampLabel + Timestamps.format(item.timestamp()),
                "",
                "概要",
                summary.overview(),
                "",
                "機能内容",
                summary.featureDetails(),
                "",
                "できるようになること",
                summary.enabledOutcomes()
        ));
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Item field '" + field + "' must not be empty");
        }
        return value.strip();
    }
}
