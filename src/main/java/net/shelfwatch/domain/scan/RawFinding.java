package net.shelfwatch.domain.scan;

import java.util.Map;
import java.util.Objects;

/**
 * Output of one detector check against a rendered page.
 *
 * @param check detector check name, e.g. {@code add_to_cart}
 * @param verdict check outcome
 * @param confidence detector confidence in [0, 1]
 * @param message human readable summary
 * @param details technical detail map (evidence, suggestions, raw details)
 */
public record RawFinding(
    String check,
    CheckVerdict verdict,
    double confidence,
    String message,
    Map<String, Object> details
) {

    public RawFinding {
        Objects.requireNonNull(check, "check must not be null");
        verdict = verdict == null ? CheckVerdict.INCONCLUSIVE : verdict;
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        message = message == null ? "" : message;
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static RawFinding of(String check, CheckVerdict verdict, double confidence, String message) {
        return new RawFinding(check, verdict, confidence, message, Map.of());
    }
}
