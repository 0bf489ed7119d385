package net.shelfwatch.domain.scan;

import java.util.Locale;

/**
 * Outcome reported by one detector check.
 */
public enum CheckVerdict {
    PASS,
    FAIL,
    WARNING,
    INCONCLUSIVE;

    /**
     * Maps detector labels ({@code "pass"}, {@code "fail"}, {@code "warning"}, {@code "inconclusive"}).
     * Unknown labels are treated as inconclusive.
     */
    public static CheckVerdict fromLabel(String label) {
        if (label == null) {
            return INCONCLUSIVE;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "pass", "passed", "ok" -> PASS;
            case "fail", "failed", "error" -> FAIL;
            case "warning", "warn" -> WARNING;
            default -> INCONCLUSIVE;
        };
    }
}
