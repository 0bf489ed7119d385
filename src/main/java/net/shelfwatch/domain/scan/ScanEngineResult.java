package net.shelfwatch.domain.scan;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Everything the browser scan engine returned for one page visit.
 *
 * @param success whether the page could be rendered
 * @param signals raw captured signals
 * @param findings detector output, empty when the engine ran no detectors
 * @param error engine error message on failure
 */
public record ScanEngineResult(
    boolean success,
    ScanSignals signals,
    List<RawFinding> findings,
    @Nullable String error
) {

    public ScanEngineResult {
        signals = signals == null ? ScanSignals.empty() : signals;
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static ScanEngineResult success(ScanSignals signals, List<RawFinding> findings) {
        return new ScanEngineResult(true, signals, findings, null);
    }

    public static ScanEngineResult failure(String error) {
        return new ScanEngineResult(false, ScanSignals.empty(), List.of(), error);
    }
}
