package net.shelfwatch.application.ai;

import jakarta.annotation.Nullable;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.scan.MonitoredPage;

/**
 * Input for analyzing a single issue. Screenshots are only sent for high-severity issues.
 */
public record IssueAnalysisRequest(MonitoredPage page, String shopDomain, Issue issue, @Nullable byte[] screenshot) {

    public boolean withScreenshot() {
        return screenshot != null && screenshot.length > 0;
    }
}
