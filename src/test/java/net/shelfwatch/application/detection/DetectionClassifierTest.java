package net.shelfwatch.application.detection;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import net.shelfwatch.config.ScanProperties;
import net.shelfwatch.domain.issue.IssueCandidate;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueType;
import net.shelfwatch.domain.scan.CheckVerdict;
import net.shelfwatch.domain.scan.RawFinding;
import org.junit.jupiter.api.Test;

class DetectionClassifierTest {

    private static final UUID SCAN_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");

    private final DetectionClassifier classifier = new DetectionClassifier(new ScanProperties());

    @Test
    void should_CreateHighSeverityCandidate_When_AddToCartFailsConfidently() {
        ClassificationResult result = classifier.classify(SCAN_ID, List.of(
            new RawFinding("add_to_cart", CheckVerdict.FAIL, 0.9, "No add to cart button found",
                Map.of("suggestions", List.of("Check theme template")))));

        assertThat(result.candidates()).hasSize(1);
        IssueCandidate candidate = result.candidates().get(0);
        assertThat(candidate.type()).isEqualTo(IssueType.MISSING_PURCHASE_CONTROL);
        assertThat(candidate.severity()).isEqualTo(IssueSeverity.HIGH);
        assertThat(candidate.title()).isEqualTo("Add to Cart button may not be working");
        assertThat(candidate.description()).isEqualTo("No add to cart button found");
        assertThat(candidate.evidence())
            .containsEntry("check", "add_to_cart")
            .containsEntry("confidence", 0.9)
            .containsEntry("scan_id", SCAN_ID.toString())
            .containsKey("suggestions");
        assertThat(result.passedTypes()).isEmpty();
    }

    @Test
    void should_UseTypeTitleAndKeepFullMessage_When_DetectorMessageIsLong() {
        String message = "Variant picker did not update the price after selecting size 42; ".repeat(4).trim();

        ClassificationResult result = classifier.classify(SCAN_ID, List.of(
            RawFinding.of("variant_interaction", CheckVerdict.FAIL, 0.85, message)));

        assertThat(result.candidates()).singleElement().satisfies(candidate -> {
            assertThat(candidate.title()).isEqualTo(IssueType.VARIANT_SELECTION_BROKEN.defaultTitle());
            assertThat(candidate.description()).isEqualTo(message).hasSizeGreaterThan(100);
        });
    }

    @Test
    void should_AcceptFindingExactlyAtThreshold_And_DropFindingJustBelow() {
        ClassificationResult atThreshold = classifier.classify(SCAN_ID, List.of(
            RawFinding.of("checkout", CheckVerdict.FAIL, 0.7, "Checkout button missing")));
        ClassificationResult belowThreshold = classifier.classify(SCAN_ID, List.of(
            RawFinding.of("checkout", CheckVerdict.FAIL, 0.69, "Checkout button missing")));

        assertThat(atThreshold.candidates()).extracting(IssueCandidate::type).containsExactly(IssueType.BROKEN_CHECKOUT);
        assertThat(belowThreshold.isEmpty()).isTrue();
    }

    @Test
    void should_DowngradeToLowSeverity_When_VerdictIsWarning() {
        ClassificationResult result = classifier.classify(SCAN_ID, List.of(
            RawFinding.of("javascript_errors", CheckVerdict.WARNING, 0.8, "Minor script warnings")));

        assertThat(result.candidates()).singleElement()
            .satisfies(candidate -> {
                assertThat(candidate.type()).isEqualTo(IssueType.SCRIPT_ERROR);
                assertThat(candidate.severity()).isEqualTo(IssueSeverity.LOW);
            });
    }

    @Test
    void should_UseTypeDefaults_When_MediumAndLowChecksFail() {
        ClassificationResult result = classifier.classify(SCAN_ID, List.of(
            RawFinding.of("liquid_errors", CheckVerdict.FAIL, 1.0, ""),
            RawFinding.of("page_load", CheckVerdict.FAIL, 1.0, "Page took 9000ms")));

        assertThat(result.candidates())
            .extracting(IssueCandidate::type, IssueCandidate::severity)
            .containsExactlyInAnyOrder(
                org.assertj.core.groups.Tuple.tuple(IssueType.TEMPLATE_ERROR, IssueSeverity.MEDIUM),
                org.assertj.core.groups.Tuple.tuple(IssueType.SLOW_LOAD, IssueSeverity.LOW));
        IssueCandidate liquid = result.candidates().stream()
            .filter(candidate -> candidate.type() == IssueType.TEMPLATE_ERROR)
            .findFirst()
            .orElseThrow();
        assertThat(liquid.description()).isEqualTo(IssueType.TEMPLATE_ERROR.defaultDescription());
    }

    @Test
    void should_KeepHighestSeverity_When_SameTypeReportedTwice() {
        ClassificationResult result = classifier.classify(SCAN_ID, List.of(
            RawFinding.of("javascript_errors", CheckVerdict.WARNING, 0.9, "warning"),
            RawFinding.of("javascript_errors", CheckVerdict.FAIL, 0.9, "failure")));

        assertThat(result.candidates()).singleElement()
            .satisfies(candidate -> {
                assertThat(candidate.severity()).isEqualTo(IssueSeverity.HIGH);
                assertThat(candidate.description()).isEqualTo("failure");
            });
    }

    @Test
    void should_ReportPassedTypes_When_ChecksPass() {
        ClassificationResult result = classifier.classify(SCAN_ID, List.of(
            RawFinding.of("add_to_cart", CheckVerdict.PASS, 1.0, "ok"),
            RawFinding.of("price_visibility", CheckVerdict.PASS, 1.0, "ok")));

        assertThat(result.candidates()).isEmpty();
        assertThat(result.passedTypes())
            .containsExactlyInAnyOrder(IssueType.MISSING_PURCHASE_CONTROL, IssueType.MISSING_PRICE);
    }

    @Test
    void should_NotReportTypeAsPassed_When_AnotherFindingFlagsIt() {
        ClassificationResult result = classifier.classify(SCAN_ID, List.of(
            RawFinding.of("product_images", CheckVerdict.PASS, 1.0, "ok"),
            RawFinding.of("product_images", CheckVerdict.FAIL, 0.95, "3 images failed")));

        assertThat(result.candidates()).extracting(IssueCandidate::type).containsExactly(IssueType.MISSING_IMAGES);
        assertThat(result.passedTypes()).isEmpty();
    }

    @Test
    void should_IgnoreInconclusiveAndUnmappedFindings() {
        ClassificationResult result = classifier.classify(SCAN_ID, List.of(
            RawFinding.of("variant_interaction", CheckVerdict.INCONCLUSIVE, 1.0, "no variants"),
            RawFinding.of("mobile_layout", CheckVerdict.FAIL, 1.0, "overflow")));

        assertThat(result.isEmpty()).isTrue();
    }

    @Test
    void should_MapKnownCheckNames() {
        assertThat(DetectionClassifier.issueTypeFor("atc_funnel")).contains(IssueType.PURCHASE_CONTROL_NOT_FUNCTIONAL);
        assertThat(DetectionClassifier.issueTypeFor("unknown")).isEmpty();
    }
}
