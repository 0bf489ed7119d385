package net.shelfwatch.application.detection;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import net.shelfwatch.config.ScanProperties;
import net.shelfwatch.domain.scan.CheckVerdict;
import net.shelfwatch.domain.scan.NetworkFailure;
import net.shelfwatch.domain.scan.RawFinding;
import net.shelfwatch.domain.scan.ScanSignals;
import org.junit.jupiter.api.Test;

class RawSignalInspectorTest {

    private static final String HEALTHY_HTML =
        "<form><span class=\"price\">$19.99</span><button name=\"add\" class=\"product-form__submit\">Add</button></form>";

    private final RawSignalInspector inspector = new RawSignalInspector(new ScanProperties());

    @Test
    void should_RunAllRuleChecks_When_EngineReturnedNoDetectorOutput() {
        ScanSignals signals = new ScanSignals(1200, List.of(), List.of(), List.of(), HEALTHY_HTML, null);

        List<RawFinding> findings = inspector.inspect(signals, List.of());

        assertThat(findings).extracting(RawFinding::check).containsExactlyInAnyOrder(
            "add_to_cart", "javascript_errors", "liquid_errors", "product_images", "price_visibility",
            "variant_interaction", "page_load");
        assertThat(findings).allSatisfy(finding -> assertThat(finding.verdict()).isEqualTo(CheckVerdict.PASS));
    }

    @Test
    void should_OnlyAddLoadAndVariantChecks_When_DetectorsReportedOtherChecks() {
        ScanSignals signals = new ScanSignals(7000, List.of("TypeError: variant is undefined"), List.of(), List.of(), "", null);
        List<RawFinding> detectorFindings = List.of(RawFinding.of("add_to_cart", CheckVerdict.PASS, 0.95, "ok"));

        List<RawFinding> findings = inspector.inspect(signals, detectorFindings);

        assertThat(findings).extracting(RawFinding::check).containsExactlyInAnyOrder("variant_interaction", "page_load");
        assertThat(findings).allSatisfy(finding -> {
            assertThat(finding.verdict()).isEqualTo(CheckVerdict.FAIL);
            assertThat(finding.confidence()).isEqualTo(1.0);
        });
        RawFinding slow = findings.stream().filter(finding -> finding.check().equals("page_load")).findFirst().orElseThrow();
        assertThat(slow.message()).startsWith("This page took 7.0 seconds");
        assertThat(slow.details()).containsKey("evidence");
    }

    @Test
    void should_SkipChecksDetectorsAlreadyCovered() {
        ScanSignals signals = new ScanSignals(9000, List.of("swatch failed"), List.of(), List.of(), "", null);
        List<RawFinding> detectorFindings = List.of(
            RawFinding.of("variant_interaction", CheckVerdict.PASS, 0.9, "ok"),
            RawFinding.of("page_load", CheckVerdict.PASS, 0.9, "ok"));

        assertThat(inspector.inspect(signals, detectorFindings)).isEmpty();
    }

    @Test
    void should_FilterNoisyScriptErrors() {
        ScanSignals noisy = new ScanSignals(800, List.of("Failed to load favicon.ico", "analytics blocked"),
            List.of(), List.of(), HEALTHY_HTML, null);
        ScanSignals broken = new ScanSignals(800, List.of("ReferenceError: theme is not defined"),
            List.of(), List.of(), HEALTHY_HTML, null);

        assertThat(verdictOf(inspector.inspect(noisy, List.of()), "javascript_errors")).isEqualTo(CheckVerdict.PASS);
        assertThat(verdictOf(inspector.inspect(broken, List.of()), "javascript_errors")).isEqualTo(CheckVerdict.FAIL);
    }

    @Test
    void should_FlagMissingPurchaseControlPriceAndTemplateErrors() {
        ScanSignals signals = new ScanSignals(800, List.of(),
            List.of(new NetworkFailure("https://cdn.example.com/products/shoe.webp", "image", 404, null)),
            List.of(), "<div>Liquid error: product not found</div>", null);

        List<RawFinding> findings = inspector.inspect(signals, List.of());

        assertThat(verdictOf(findings, "add_to_cart")).isEqualTo(CheckVerdict.FAIL);
        assertThat(verdictOf(findings, "price_visibility")).isEqualTo(CheckVerdict.FAIL);
        assertThat(verdictOf(findings, "liquid_errors")).isEqualTo(CheckVerdict.FAIL);
        assertThat(verdictOf(findings, "product_images")).isEqualTo(CheckVerdict.FAIL);
        RawFinding images = findings.stream().filter(finding -> finding.check().equals("product_images")).findFirst().orElseThrow();
        @SuppressWarnings("unchecked")
        Map<String, Object> evidence = (Map<String, Object>) images.details().get("evidence");
        assertThat(evidence).containsEntry("failure_count", 1);
    }

    private static CheckVerdict verdictOf(List<RawFinding> findings, String check) {
        return findings.stream()
            .filter(finding -> finding.check().equals(check))
            .map(RawFinding::verdict)
            .findFirst()
            .orElseThrow();
    }
}
