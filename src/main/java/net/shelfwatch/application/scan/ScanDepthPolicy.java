package net.shelfwatch.application.scan;

import jakarta.annotation.Nullable;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import net.shelfwatch.config.ScanProperties;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueStore;
import net.shelfwatch.domain.scan.MonitoredPage;
import net.shelfwatch.domain.scan.ScanDepth;
import net.shelfwatch.domain.scan.ScanRunStore;
import org.springframework.stereotype.Component;

/**
 * Chooses between a quick and a deep scan.
 *
 * <p>Deep when forced, on a page's first scan, while an open high-severity issue exists,
 * or on the weekly deep-scan day.</p>
 */
@Component
public class ScanDepthPolicy {

    private final ScanRunStore scanRunStore;
    private final IssueStore issueStore;
    private final Clock clock;
    private final DayOfWeek deepScanDay;
    private final ZoneId zone;

    public ScanDepthPolicy(ScanRunStore scanRunStore, IssueStore issueStore, ScanProperties properties, Clock clock) {
        this.scanRunStore = scanRunStore;
        this.issueStore = issueStore;
        this.clock = clock;
        this.deepScanDay = properties.getDeepScanDay();
        this.zone = properties.zoneId();
    }

    public ScanDepth decide(MonitoredPage page, @Nullable ScanDepth forcedDepth) {
        if (forcedDepth != null) {
            return forcedDepth;
        }
        if (!scanRunStore.existsForPage(page.id())) {
            return ScanDepth.DEEP;
        }
        boolean openHigh = issueStore.findActiveByPage(page.id()).stream()
            .anyMatch(issue -> issue.isOpen() && issue.severity() == IssueSeverity.HIGH);
        if (openHigh) {
            return ScanDepth.DEEP;
        }
        return LocalDate.ofInstant(clock.instant(), zone).getDayOfWeek() == deepScanDay ? ScanDepth.DEEP : ScanDepth.QUICK;
    }
}
