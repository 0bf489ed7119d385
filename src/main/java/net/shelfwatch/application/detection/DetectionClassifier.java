package net.shelfwatch.application.detection;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import net.shelfwatch.config.ScanProperties;
import net.shelfwatch.domain.issue.IssueCandidate;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueType;
import net.shelfwatch.domain.scan.CheckVerdict;
import net.shelfwatch.domain.scan.RawFinding;
import org.springframework.stereotype.Component;

/**
 * Turns raw detector findings into issue candidates and resolve signals.
 *
 * <p>Stateless: the same findings always produce the same result.</p>
 */
@Slf4j
@Component
public class DetectionClassifier {

    private static final Map<String, CheckMapping> CHECKS = Map.of(
        "add_to_cart", new CheckMapping(IssueType.MISSING_PURCHASE_CONTROL, IssueSeverity.HIGH),
        "atc_funnel", new CheckMapping(IssueType.PURCHASE_CONTROL_NOT_FUNCTIONAL, IssueSeverity.HIGH),
        "checkout", new CheckMapping(IssueType.BROKEN_CHECKOUT, IssueSeverity.HIGH),
        "variant_interaction", new CheckMapping(IssueType.VARIANT_SELECTION_BROKEN, IssueSeverity.HIGH),
        "javascript_errors", new CheckMapping(IssueType.SCRIPT_ERROR, IssueSeverity.HIGH),
        "liquid_errors", new CheckMapping(IssueType.TEMPLATE_ERROR, IssueSeverity.MEDIUM),
        "price_visibility", new CheckMapping(IssueType.MISSING_PRICE, IssueSeverity.HIGH),
        "product_images", new CheckMapping(IssueType.MISSING_IMAGES, IssueSeverity.MEDIUM),
        "page_load", new CheckMapping(IssueType.SLOW_LOAD, IssueSeverity.LOW)
    );

    private final double confidenceThreshold;

    public DetectionClassifier(ScanProperties properties) {
        this.confidenceThreshold = properties.getConfidenceThreshold();
    }

    /**
     * Looks up the issue type a detector check maps to.
     */
    public static Optional<IssueType> issueTypeFor(String check) {
        return Optional.ofNullable(CHECKS.get(check)).map(CheckMapping::type);
    }

    /**
     * Classifies one pass worth of findings.
     *
     * @param scanRunId scan run recorded in candidate evidence
     * @param findings detector and raw-signal findings
     */
    public ClassificationResult classify(UUID scanRunId, List<RawFinding> findings) {
        if (findings == null || findings.isEmpty()) {
            return ClassificationResult.empty();
        }

        Map<IssueType, IssueCandidate> candidates = new EnumMap<>(IssueType.class);
        Set<IssueType> passed = EnumSet.noneOf(IssueType.class);

        for (RawFinding finding : findings) {
            CheckMapping mapping = CHECKS.get(finding.check());
            if (mapping == null) {
                log.warn("Ignoring finding for unmapped check '{}' (scanRunId={})", finding.check(), scanRunId);
                continue;
            }

            switch (finding.verdict()) {
                case PASS -> passed.add(mapping.type());
                case INCONCLUSIVE -> log.debug("Inconclusive {} check leaves ledger unchanged (scanRunId={})",
                    finding.check(), scanRunId);
                case FAIL, WARNING -> {
                    if (finding.confidence() < confidenceThreshold) {
                        log.info("Dropping low-confidence {} {} finding (confidence={}, threshold={}, scanRunId={})",
                            finding.check(), finding.verdict(), finding.confidence(), confidenceThreshold, scanRunId);
                        continue;
                    }
                    IssueSeverity severity = finding.verdict() == CheckVerdict.FAIL
                        ? mapping.defaultSeverity()
                        : IssueSeverity.LOW;
                    IssueCandidate candidate = toCandidate(scanRunId, mapping.type(), severity, finding);
                    candidates.merge(mapping.type(), candidate,
                        (existing, incoming) -> incoming.severity().outranks(existing.severity()) ? incoming : existing);
                }
            }
        }

        passed.removeAll(candidates.keySet());
        return new ClassificationResult(List.copyOf(candidates.values()), passed);
    }

    private IssueCandidate toCandidate(UUID scanRunId, IssueType type, IssueSeverity severity, RawFinding finding) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("confidence", finding.confidence());
        evidence.put("check", finding.check());
        copyDetail(finding, "technical_details", evidence);
        copyDetail(finding, "suggestions", evidence);
        copyDetail(finding, "evidence", evidence);
        if (scanRunId != null) {
            evidence.put("scan_id", scanRunId.toString());
        }

        // Titles come from the issue type; the detector message becomes the description
        return new IssueCandidate(type, severity, finding.confidence(), type.defaultTitle(), finding.message(), evidence,
            finding.verdict());
    }

    private static void copyDetail(RawFinding finding, String key, Map<String, Object> evidence) {
        Object value = finding.details().get(key);
        if (value != null) {
            evidence.put(key, value);
        }
    }

    private record CheckMapping(IssueType type, IssueSeverity defaultSeverity) {
    }
}
