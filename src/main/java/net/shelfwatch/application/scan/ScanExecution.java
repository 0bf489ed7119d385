package net.shelfwatch.application.scan;

import jakarta.annotation.Nullable;

/**
 * What happened when the orchestrator handled a page.
 */
public record ScanExecution(@Nullable SkipReason skipReason, @Nullable ScanReport report) {

    public static ScanExecution skipped(SkipReason reason) {
        return new ScanExecution(reason, null);
    }

    public static ScanExecution completed(ScanReport report) {
        return new ScanExecution(null, report);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }
}
