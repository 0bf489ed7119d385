package net.shelfwatch.domain.issue;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Enrichment attached to an issue by the AI confirmation step.
 *
 * @param confirmed AI verdict; {@code null} when no verdict was produced
 * @param confidence AI confidence for the verdict
 * @param reasoning why the verdict was reached
 * @param explanation merchant-facing explanation
 * @param suggestedFix merchant-facing fix suggestion
 * @param verifiedAt when enrichment last ran; set means the issue is not re-analyzed
 */
public record AiAnnotation(
    @Nullable Boolean confirmed,
    @Nullable Double confidence,
    @Nullable String reasoning,
    @Nullable String explanation,
    @Nullable String suggestedFix,
    @Nullable Instant verifiedAt
) {

    private static final AiAnnotation EMPTY = new AiAnnotation(null, null, null, null, null, null);

    public static AiAnnotation empty() {
        return EMPTY;
    }

    public boolean isConfirmed() {
        return Boolean.TRUE.equals(confirmed);
    }

    public boolean isVerified() {
        return verifiedAt != null;
    }
}
