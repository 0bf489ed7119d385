package net.shelfwatch.application.ai;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Page-level AI verdict.
 *
 * @param findings accepted findings after label mapping and confidence filtering
 * @param summary merchant-facing summary
 * @param pageHealthy AI view of overall page health, when given
 * @param reportedCount findings the AI reported before filtering
 */
public record PageAnalysis(
    List<PageFinding> findings,
    @Nullable String summary,
    @Nullable Boolean pageHealthy,
    int reportedCount
) {

    public PageAnalysis {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
