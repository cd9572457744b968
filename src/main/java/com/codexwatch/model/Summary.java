package com.codexwatch.model;

/**
 * Three-part text summary attached to every notification.
 */
public record Summary(
        String overview,
        String featureDetails,
        String enabledOutcomes
) {

    public static final Summary FALLBACK_PULL_REQUEST = new Summary(
            "このPRの要約を自動生成できなかったため、PR本文を確認してください。",
            "OpenAI APIの応答取得に失敗したため、機能内容はフォールバック表示です。",
            "通知は継続されるため、PRリンクから変更点を追跡できます。"
    );

    public static final Summary FALLBACK_RELEASE = new Summary(
            "このReleaseの要約を自動生成できなかったため、Release本文を確認してください。",
            "OpenAI APIの応答取得に失敗したため、機能内容はフォールバック表示です。",
            "通知は継続されるため、Releaseリンクから変更点を追跡できます。"
    );
}
