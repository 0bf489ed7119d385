package net.shelfwatch.domain.scan;

import java.util.Locale;

/**
 * How thorough a scan should be. Deep scans run interaction funnels; quick scans only load the page.
 */
public enum ScanDepth {
    QUICK,
    DEEP;

    /**
     * Parses a request parameter such as {@code "deep"}.
     *
     * @throws IllegalArgumentException when the value names no depth
     */
    public static ScanDepth fromParameter(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Scan depth must not be blank");
        }
        return ScanDepth.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
