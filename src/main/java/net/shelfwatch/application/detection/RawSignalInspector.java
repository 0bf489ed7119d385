package net.shelfwatch.application.detection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import net.shelfwatch.config.ScanProperties;
import net.shelfwatch.domain.scan.CheckVerdict;
import net.shelfwatch.domain.scan.NetworkFailure;
import net.shelfwatch.domain.scan.RawFinding;
import net.shelfwatch.domain.scan.ScanSignals;
import org.springframework.stereotype.Component;

/**
 * Derives findings from raw page signals for checks the detector output did not cover.
 *
 * <p>Slow-load and variant-selector checks always run. The remaining rule-based checks only
 * run when the engine returned no detector output at all.</p>
 */
@Component
public class RawSignalInspector {

    private static final double RULE_CONFIDENCE = 1.0;
    private static final int MAX_SAMPLES = 5;

    private static final List<String> NOISE_MARKERS = List.of("favicon", "analytics", "pixel", "gtm", "hotjar");
    private static final List<String> VARIANT_MARKERS = List.of("variant", "option", "swatch");
    private static final List<String> TEMPLATE_ERROR_MARKERS =
        List.of("Liquid error", "Translation missing", "No template found");
    private static final List<String> PURCHASE_CONTROL_MARKERS =
        List.of("name=\"add\"", "add-to-cart", "AddToCart", "product-form__submit");
    private static final Pattern CURRENCY_AMOUNT = Pattern.compile("[$€£][\\d,]+\\.?\\d*");
    private static final Pattern IMAGE_URL = Pattern.compile("\\.(jpg|jpeg|png|gif|webp|avif)");

    private final long slowLoadThresholdMs;

    public RawSignalInspector(ScanProperties properties) {
        this.slowLoadThresholdMs = properties.getSlowLoadThresholdMs();
    }

    /**
     * @param signals raw signals captured for the page
     * @param detectorFindings findings the engine's detectors already produced
     * @return synthesized findings for uncovered checks
     */
    public List<RawFinding> inspect(ScanSignals signals, List<RawFinding> detectorFindings) {
        Set<String> reported = detectorFindings.stream().map(RawFinding::check).collect(Collectors.toSet());
        List<RawFinding> findings = new ArrayList<>();

        if (reported.isEmpty()) {
            findings.add(inspectPurchaseControl(signals));
            findings.add(inspectScriptErrors(signals));
            findings.add(inspectTemplateErrors(signals));
            findings.add(inspectImages(signals));
            findings.add(inspectPrice(signals));
        }
        if (!reported.contains("variant_interaction")) {
            findings.add(inspectVariantErrors(signals));
        }
        if (!reported.contains("page_load")) {
            findings.add(inspectLoadTime(signals));
        }
        return findings;
    }

    private RawFinding inspectPurchaseControl(ScanSignals signals) {
        String html = htmlOf(signals);
        boolean hasControl = PURCHASE_CONTROL_MARKERS.stream().anyMatch(html::contains);
        boolean cartError = signals.jsErrors().stream()
            .anyMatch(error -> error.contains("cart") || error.contains("addToCart"));
        if (hasControl && !cartError) {
            return pass("add_to_cart");
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("has_atc_button", hasControl);
        evidence.put("js_errors_related", cartError);
        evidence.put("detection_method", "legacy");
        return fail("add_to_cart", "We couldn't verify that the Add to Cart button is functioning.", evidence);
    }

    private RawFinding inspectScriptErrors(ScanSignals signals) {
        List<String> critical = signals.jsErrors().stream()
            .filter(error -> !containsAny(error.toLowerCase(Locale.ROOT), NOISE_MARKERS))
            .toList();
        if (critical.isEmpty()) {
            return pass("javascript_errors");
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("error_count", critical.size());
        evidence.put("errors", sample(critical));
        evidence.put("detection_method", "legacy");
        return fail("javascript_errors", "We found JavaScript errors on this page that may affect functionality.",
            evidence);
    }

    private RawFinding inspectTemplateErrors(ScanSignals signals) {
        String html = htmlOf(signals);
        List<String> errors = TEMPLATE_ERROR_MARKERS.stream().filter(html::contains).toList();
        if (errors.isEmpty()) {
            return pass("liquid_errors");
        }
        return fail("liquid_errors", "We found template errors that may cause content to display incorrectly.",
            Map.of("errors", errors, "detection_method", "legacy"));
    }

    private RawFinding inspectImages(ScanSignals signals) {
        List<String> failedImages = signals.networkErrors().stream()
            .filter(RawSignalInspector::isImageFailure)
            .map(NetworkFailure::url)
            .toList();
        if (failedImages.isEmpty()) {
            return pass("product_images");
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("failed_images", sample(failedImages));
        evidence.put("failure_count", failedImages.size());
        evidence.put("detection_method", "legacy");
        return fail("product_images", "Some product images failed to load.", evidence);
    }

    private RawFinding inspectPrice(ScanSignals signals) {
        String html = htmlOf(signals);
        boolean hasPrice = html.contains("price") || html.contains("money") || CURRENCY_AMOUNT.matcher(html).find();
        if (hasPrice) {
            return pass("price_visibility");
        }
        return fail("price_visibility", "We couldn't find a visible price on this page.",
            Map.of("detection_method", "legacy"));
    }

    private RawFinding inspectVariantErrors(ScanSignals signals) {
        List<String> related = signals.jsErrors().stream()
            .filter(error -> containsAny(error.toLowerCase(Locale.ROOT), VARIANT_MARKERS))
            .toList();
        if (related.isEmpty()) {
            return pass("variant_interaction");
        }
        return fail("variant_interaction",
            "We detected errors that may affect the product variant selector.",
            Map.of("related_errors", sample(related)));
    }

    private RawFinding inspectLoadTime(ScanSignals signals) {
        int loadTime = signals.loadTimeMs() == null ? 0 : signals.loadTimeMs();
        if (loadTime <= slowLoadThresholdMs) {
            return pass("page_load");
        }
        String message = String.format(Locale.ROOT,
            "This page took %.1f seconds to load. This may affect customer experience.", loadTime / 1000.0);
        return fail("page_load", message, Map.of("load_time_ms", loadTime, "threshold_ms", slowLoadThresholdMs));
    }

    private static boolean isImageFailure(NetworkFailure failure) {
        String type = failure.resourceType() == null ? "" : failure.resourceType().toLowerCase(Locale.ROOT);
        return "image".equals(type) || IMAGE_URL.matcher(failure.url().toLowerCase(Locale.ROOT)).find();
    }

    private static boolean containsAny(String text, List<String> markers) {
        return markers.stream().anyMatch(text::contains);
    }

    private static String htmlOf(ScanSignals signals) {
        return signals.htmlSnapshot() == null ? "" : signals.htmlSnapshot();
    }

    private static List<String> sample(List<String> values) {
        return values.size() <= MAX_SAMPLES ? values : values.subList(0, MAX_SAMPLES);
    }

    private static RawFinding pass(String check) {
        return RawFinding.of(check, CheckVerdict.PASS, RULE_CONFIDENCE, "");
    }

    private static RawFinding fail(String check, String message, Map<String, Object> evidence) {
        return new RawFinding(check, CheckVerdict.FAIL, RULE_CONFIDENCE, message, Map.of("evidence", evidence));
    }
}
