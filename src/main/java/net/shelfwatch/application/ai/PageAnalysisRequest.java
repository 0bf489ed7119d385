package net.shelfwatch.application.ai;

import java.util.List;
import net.shelfwatch.domain.scan.MonitoredPage;
import net.shelfwatch.domain.scan.RawFinding;

/**
 * Input for a page-level visual analysis.
 */
public record PageAnalysisRequest(MonitoredPage page, String shopDomain, byte[] screenshot, List<RawFinding> findings) {

    public PageAnalysisRequest {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
