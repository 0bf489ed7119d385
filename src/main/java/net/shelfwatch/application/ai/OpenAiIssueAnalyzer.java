package net.shelfwatch.application.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.models.ChatModel;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionContentPart;
import com.openai.models.chat.completions.ChatCompletionContentPartImage;
import com.openai.models.chat.completions.ChatCompletionContentPartText;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionSystemMessageParam;
import com.openai.models.chat.completions.ChatCompletionUserMessageParam;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import net.shelfwatch.config.ScanProperties;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.scan.RawFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * OpenAI-backed page and issue reviewer.
 *
 * <p>Screenshots travel inline as PNG data URLs. Without an API key the analyzer reports
 * itself unavailable and the pipeline runs on detector output alone.</p>
 */
@Component
public class OpenAiIssueAnalyzer implements AiIssueAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(OpenAiIssueAnalyzer.class);
    private static final String DEFAULT_MODEL = "gpt-4o-mini";
    private static final String API_KEY_SENTINEL = "not-configured";
    private static final long MAX_COMPLETION_TOKENS = 1200L;

    private static final String SYSTEM_PROMPT = """
        You review storefront product pages for problems that stop shoppers from buying.
        You write for non-technical merchants: calm, specific, never alarming.
        Reply with a single JSON object and nothing else.
        """;

    private final AiResponseJsonParser parser;
    private final ObjectMapper objectMapper;
    private final OpenAIClient openAiClient;
    private final boolean available;
    private final String configuredModel;
    private final long requestTimeoutSeconds;

    public OpenAiIssueAnalyzer(
        ObjectMapper objectMapper,
        ScanProperties scanProperties,
        @Value("${AI_DEFAULT_OPENAI_API_KEY:${OPENAI_API_KEY:}}") String apiKey,
        @Value("${AI_DEFAULT_OPENAI_BASE_URL:${OPENAI_BASE_URL:https://api.openai.com/v1}}") String baseUrl,
        @Value("${AI_DEFAULT_VISION_MODEL:${OPENAI_MODEL:" + DEFAULT_MODEL + "}}") String model,
        @Value("${AI_DEFAULT_OPENAI_REQUEST_TIMEOUT_SECONDS:30}") long requestTimeoutSeconds
    ) {
        this.objectMapper = objectMapper;
        this.parser = new AiResponseJsonParser(objectMapper, scanProperties.getAiFindingConfidenceThreshold());
        this.configuredModel = StringUtils.hasText(model) ? model.trim() : DEFAULT_MODEL;
        this.requestTimeoutSeconds = Math.max(1L, requestTimeoutSeconds);

        if (StringUtils.hasText(apiKey) && !API_KEY_SENTINEL.equals(apiKey.trim())) {
            this.openAiClient = OpenAIOkHttpClient.builder()
                .apiKey(apiKey.trim())
                .baseUrl(baseUrl.trim())
                .maxRetries(0)
                .build();
            this.available = true;
            log.info("AI issue analyzer configured (model={}, baseUrl={})", configuredModel, baseUrl);
            return;
        }

        this.openAiClient = null;
        this.available = false;
        log.warn("AI issue analyzer is disabled: no API key configured");
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public PageAnalysis analyzePage(PageAnalysisRequest request) {
        ensureAvailable();
        String prompt = pagePrompt(request);
        String response = complete(prompt, request.screenshot());
        PageAnalysis analysis = parser.parsePage(response, request.findings());
        log.info("AI page analysis for pageId={} returned {} finding(s) ({} reported)",
            request.page().id(), analysis.findings().size(), analysis.reportedCount());
        return analysis;
    }

    @Override
    public IssueAnalysis analyzeIssue(IssueAnalysisRequest request) {
        ensureAvailable();
        boolean withVerdict = request.issue().severity() == IssueSeverity.HIGH && request.withScreenshot();
        String prompt = issuePrompt(request, withVerdict);
        String response = complete(prompt, withVerdict ? request.screenshot() : null);
        return parser.parseIssue(response, withVerdict);
    }

    private void ensureAvailable() {
        if (!available) {
            throw new AiAnalysisException(AiAnalysisException.ErrorCode.UNAVAILABLE,
                "AI issue analyzer is not configured");
        }
    }

    private String complete(String prompt, byte[] screenshot) {
        List<ChatCompletionContentPart> parts = new ArrayList<>();
        parts.add(ChatCompletionContentPart.ofText(ChatCompletionContentPartText.builder().text(prompt).build()));
        if (screenshot != null && screenshot.length > 0) {
            String dataUrl = "data:image/png;base64," + Base64.getEncoder().encodeToString(screenshot);
            parts.add(ChatCompletionContentPart.ofImageUrl(ChatCompletionContentPartImage.builder()
                .imageUrl(ChatCompletionContentPartImage.ImageUrl.builder().url(dataUrl).build())
                .build()));
        }

        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
            .model(ChatModel.of(configuredModel))
            .messages(List.of(
                ChatCompletionMessageParam.ofSystem(ChatCompletionSystemMessageParam.builder().content(SYSTEM_PROMPT).build()),
                ChatCompletionMessageParam.ofUser(ChatCompletionUserMessageParam.builder()
                    .contentOfArrayOfContentParts(parts)
                    .build())
            ))
            .maxCompletionTokens(MAX_COMPLETION_TOKENS)
            .build();

        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder().request(Duration.ofSeconds(requestTimeoutSeconds)).build())
            .build();

        try {
            ChatCompletion completion = openAiClient.chat().completions().create(params, options);
            if (completion.choices().isEmpty()) {
                throw new AiAnalysisException(AiAnalysisException.ErrorCode.INVALID_RESPONSE,
                    "AI response contained no choices");
            }
            return completion.choices().get(0).message().content().orElse("");
        } catch (OpenAIException openAiException) {
            String detail = AiAnalysisException.describeApiError(openAiException);
            log.error("AI analysis call failed (model={}): {}", configuredModel, detail);
            throw new AiAnalysisException(AiAnalysisException.ErrorCode.REQUEST_FAILED,
                "AI analysis failed (%s): %s".formatted(configuredModel, detail), openAiException);
        }
    }

    private String pagePrompt(PageAnalysisRequest request) {
        String checks = request.findings().stream()
            .map(OpenAiIssueAnalyzer::describeFinding)
            .collect(Collectors.joining("\n"));
        return """
            Review the attached product page screenshot for anything that would stop a customer from buying.

            Store: %s
            Product: %s

            Automated checks reported:
            %s

            Check whether the Add to Cart button is visible and usable, whether the price is shown and plausible,
            whether product images load, and whether error messages or a broken layout are visible.
            Report only what you can see. Return an empty issues array when the page looks fine.

            JSON shape:
            {"issues": [{"type": "missing_atc|atc_not_functional|missing_price|wrong_price|broken_images|missing_images|checkout_broken|variant_broken|layout_broken|error_message",
                         "severity": "high|medium|low", "confidence": 0.0-1.0, "description": "...",
                         "merchant_explanation": "...", "suggested_fix": "..."}],
             "page_healthy": true|false, "summary": "one or two sentences for the merchant"}
            """.formatted(request.shopDomain(), request.page().displayName(), checks.isEmpty() ? "  (none)" : checks);
    }

    private String issuePrompt(IssueAnalysisRequest request, boolean withVerdict) {
        Issue issue = request.issue();
        String context = """
            Store: %s
            Product: %s

            A scan flagged this issue:
            - Type: %s
            - Severity: %s
            - Title: %s
            - Evidence: %s
            """.formatted(request.shopDomain(), request.page().displayName(), issue.type().code(),
            issue.severity().name().toLowerCase(Locale.ROOT), issue.title(), evidenceJson(issue));
        if (withVerdict) {
            return context + """

                Using the attached screenshot, decide whether the issue is really visible.
                Explain it to the merchant in two or three plain sentences and give numbered, safe, reversible fix steps.

                JSON shape:
                {"confirmed": true|false, "confidence": 0.0-1.0, "reasoning": "...", "merchant_explanation": "...", "suggested_fix": "..."}
                """;
        }
        return context + """

            Explain the issue to the merchant in two or three plain sentences and give numbered, safe, reversible fix steps.

            JSON shape:
            {"merchant_explanation": "...", "suggested_fix": "..."}
            """;
    }

    private String evidenceJson(Issue issue) {
        try {
            return objectMapper.writeValueAsString(issue.evidence());
        } catch (JacksonException ex) {
            log.warn("Could not serialize evidence for issueId={}: {}", issue.id(), ex.getMessage());
            return "{}";
        }
    }

    private static String describeFinding(RawFinding finding) {
        return "  - %s: %s %s".formatted(finding.check(), finding.verdict().name().toLowerCase(Locale.ROOT), finding.message()).stripTrailing();
    }
}
