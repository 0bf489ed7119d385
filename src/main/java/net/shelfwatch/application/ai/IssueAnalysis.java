package net.shelfwatch.application.ai;

import jakarta.annotation.Nullable;

/**
 * Per-issue AI output. Verdict fields are only filled when a screenshot was analyzed.
 */
public record IssueAnalysis(
    @Nullable Boolean confirmed,
    @Nullable Double confidence,
    @Nullable String reasoning,
    @Nullable String explanation,
    @Nullable String suggestedFix
) {

    private static final IssueAnalysis NONE = new IssueAnalysis(null, null, null, null, null);

    public static IssueAnalysis none() {
        return NONE;
    }

    public boolean hasVerdict() {
        return confirmed != null;
    }
}
