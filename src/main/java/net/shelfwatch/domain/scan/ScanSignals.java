package net.shelfwatch.domain.scan;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Raw signals captured by the browser while rendering a page.
 */
public record ScanSignals(
    @Nullable Integer loadTimeMs,
    List<String> jsErrors,
    List<NetworkFailure> networkErrors,
    List<String> consoleLogs,
    @Nullable String htmlSnapshot,
    @Nullable String screenshotRef
) {

    public ScanSignals {
        jsErrors = jsErrors == null ? List.of() : List.copyOf(jsErrors);
        networkErrors = networkErrors == null ? List.of() : List.copyOf(networkErrors);
        consoleLogs = consoleLogs == null ? List.of() : List.copyOf(consoleLogs);
    }

    public static ScanSignals empty() {
        return new ScanSignals(null, List.of(), List.of(), List.of(), null, null);
    }
}
