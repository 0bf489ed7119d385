package net.shelfwatch.application.ai;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.shelfwatch.application.detection.DetectionClassifier;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueType;
import net.shelfwatch.domain.scan.CheckVerdict;
import net.shelfwatch.domain.scan.RawFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Parses model output into page and issue analyses.
 *
 * <p>Tolerates markdown fences and leading prose around the JSON object.</p>
 */
class AiResponseJsonParser {

    private static final Logger log = LoggerFactory.getLogger(AiResponseJsonParser.class);

    static final Map<String, IssueType> AI_LABELS = Map.of(
        "missing_atc", IssueType.MISSING_PURCHASE_CONTROL,
        "atc_not_functional", IssueType.PURCHASE_CONTROL_NOT_FUNCTIONAL,
        "missing_price", IssueType.MISSING_PRICE,
        "wrong_price", IssueType.MISSING_PRICE,
        "broken_images", IssueType.MISSING_IMAGES,
        "missing_images", IssueType.MISSING_IMAGES,
        "checkout_broken", IssueType.BROKEN_CHECKOUT,
        "variant_broken", IssueType.VARIANT_SELECTION_BROKEN,
        "layout_broken", IssueType.SCRIPT_ERROR,
        "error_message", IssueType.SCRIPT_ERROR
    );

    private final ObjectMapper objectMapper;
    private final double minFindingConfidence;

    AiResponseJsonParser(ObjectMapper objectMapper, double minFindingConfidence) {
        this.objectMapper = objectMapper;
        this.minFindingConfidence = minFindingConfidence;
    }

    /**
     * Parses a page analysis response.
     *
     * @param responseText raw model output
     * @param detectorFindings findings the page-level prompt was built from; decides which findings are new
     */
    PageAnalysis parsePage(String responseText, List<RawFinding> detectorFindings) {
        JsonNode payload = parseJsonPayload(responseText);
        Set<IssueType> detectedTypes = failingTypes(detectorFindings);

        JsonNode issuesNode = payload.get("issues");
        List<PageFinding> findings = new ArrayList<>();
        int reported = 0;
        if (issuesNode != null && issuesNode.isArray()) {
            for (JsonNode issueNode : issuesNode) {
                reported++;
                toFinding(issueNode, detectedTypes).ifPresent(findings::add);
            }
        }

        JsonNode healthyNode = payload.get("page_healthy");
        Boolean pageHealthy = healthyNode != null && healthyNode.isBoolean() ? healthyNode.booleanValue() : null;
        return new PageAnalysis(findings, text(payload, "summary").orElse(null), pageHealthy, reported);
    }

    /**
     * Parses a single-issue response. Verdict fields are read only when {@code withVerdict} is set.
     */
    IssueAnalysis parseIssue(String responseText, boolean withVerdict) {
        JsonNode payload = parseJsonPayload(responseText);
        String explanation = text(payload, "merchant_explanation").orElse(null);
        String fix = text(payload, "suggested_fix").orElse(null);
        if (!withVerdict) {
            return new IssueAnalysis(null, null, null, explanation, fix);
        }
        JsonNode confirmedNode = payload.get("confirmed");
        Boolean confirmed = confirmedNode != null && confirmedNode.isBoolean() ? confirmedNode.booleanValue() : null;
        JsonNode confidenceNode = payload.get("confidence");
        Double confidence = confidenceNode != null && confidenceNode.isNumber() ? confidenceNode.doubleValue() : null;
        return new IssueAnalysis(confirmed, confidence, text(payload, "reasoning").orElse(null), explanation, fix);
    }

    private Optional<PageFinding> toFinding(JsonNode issueNode, Set<IssueType> detectedTypes) {
        String label = text(issueNode, "type").map(value -> value.toLowerCase(Locale.ROOT)).orElse("");
        IssueType type = AI_LABELS.get(label);
        if (type == null) {
            log.debug("Ignoring AI finding with unknown type '{}'", label);
            return Optional.empty();
        }
        JsonNode confidenceNode = issueNode.get("confidence");
        double confidence = confidenceNode != null && confidenceNode.isNumber() ? confidenceNode.doubleValue() : 0.0;
        if (confidence < minFindingConfidence) {
            log.debug("Ignoring AI finding {} below confidence threshold ({})", label, confidence);
            return Optional.empty();
        }
        IssueSeverity severity = text(issueNode, "severity")
            .map(AiResponseJsonParser::parseSeverity)
            .orElse(IssueSeverity.MEDIUM);
        return Optional.of(new PageFinding(
            type,
            severity,
            confidence,
            text(issueNode, "description").orElse(null),
            text(issueNode, "merchant_explanation").orElse(null),
            text(issueNode, "suggested_fix").orElse(null),
            !detectedTypes.contains(type)
        ));
    }

    private static IssueSeverity parseSeverity(String value) {
        try {
            return IssueSeverity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException unknownSeverity) {
            return IssueSeverity.MEDIUM;
        }
    }

    private static Set<IssueType> failingTypes(List<RawFinding> findings) {
        Set<IssueType> types = EnumSet.noneOf(IssueType.class);
        for (RawFinding finding : findings) {
            if (finding.verdict() == CheckVerdict.FAIL) {
                DetectionClassifier.issueTypeFor(finding.check()).ifPresent(types::add);
            }
        }
        return types;
    }

    private JsonNode parseJsonPayload(String responseText) {
        if (!StringUtils.hasText(responseText)) {
            throw new AiAnalysisException(AiAnalysisException.ErrorCode.INVALID_RESPONSE, "AI response was empty");
        }
        String cleaned = responseText.replace("```json", "").replace("```", "").trim();
        try {
            return requireObject(objectMapper.readTree(cleaned));
        } catch (JacksonException initialParseException) {
            int openBrace = cleaned.indexOf('{');
            int closeBrace = cleaned.lastIndexOf('}');
            if (openBrace < 0 || closeBrace <= openBrace) {
                throw new AiAnalysisException(AiAnalysisException.ErrorCode.INVALID_RESPONSE,
                    "AI response did not include a JSON object");
            }
            log.warn("AI response required brace extraction (initial parse failed: {})",
                initialParseException.getMessage());
            try {
                return requireObject(objectMapper.readTree(cleaned.substring(openBrace, closeBrace + 1)));
            } catch (JacksonException exception) {
                throw new AiAnalysisException(AiAnalysisException.ErrorCode.INVALID_RESPONSE,
                    "AI response JSON parsing failed", exception);
            }
        }
    }

    private static JsonNode requireObject(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new AiAnalysisException(AiAnalysisException.ErrorCode.INVALID_RESPONSE,
                "AI response was not a JSON object");
        }
        return node;
    }

    private static Optional<String> text(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.ofNullable(node.asString(null))
            .filter(StringUtils::hasText)
            .map(String::trim);
    }
}
