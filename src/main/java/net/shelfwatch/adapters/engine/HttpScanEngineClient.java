package net.shelfwatch.adapters.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.shelfwatch.application.scan.ScanEngineException;
import net.shelfwatch.domain.scan.CheckVerdict;
import net.shelfwatch.domain.scan.NetworkFailure;
import net.shelfwatch.domain.scan.RawFinding;
import net.shelfwatch.domain.scan.ScanEngine;
import net.shelfwatch.domain.scan.ScanEngineResult;
import net.shelfwatch.domain.scan.ScanRequest;
import net.shelfwatch.domain.scan.ScanSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Calls the browser automation sidecar that renders pages and runs detectors.
 *
 * <p>{@code POST {base-url}/scans} with the page URL and depth; the response carries captured
 * signals and detector results.</p>
 */
@Component
public class HttpScanEngineClient implements ScanEngine {

    private static final Logger log = LoggerFactory.getLogger(HttpScanEngineClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public HttpScanEngineClient(WebClient.Builder webClientBuilder,
                                ObjectMapper objectMapper,
                                @Value("${shelfwatch.engine.base-url:http://localhost:3100}") String baseUrl,
                                @Value("${shelfwatch.engine.timeout:PT90S}") Duration timeout) {
        this.webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public ScanEngineResult run(ScanRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("page_id", request.pageId().toString());
        body.put("url", request.url());
        body.put("depth", request.depth().name().toLowerCase(Locale.ROOT));

        String response;
        try {
            response = webClient.post()
                .uri("/scans")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .block(timeout);
        } catch (WebClientResponseException responseException) {
            log.warn("Scan engine returned HTTP {} for pageId={}", responseException.getStatusCode().value(), request.pageId());
            throw new ScanEngineException(request.pageId(),
                "Scan engine returned HTTP " + responseException.getStatusCode().value(), responseException);
        } catch (WebClientException | IllegalStateException transportException) {
            throw new ScanEngineException(request.pageId(),
                "Scan engine request failed: " + transportException.getMessage(), transportException);
        }

        if (!StringUtils.hasText(response)) {
            throw new ScanEngineException(request.pageId(), "Scan engine returned an empty response");
        }
        try {
            return parse(objectMapper.readTree(response));
        } catch (JacksonException parseException) {
            throw new ScanEngineException(request.pageId(), "Scan engine response was not valid JSON", parseException);
        }
    }

    ScanEngineResult parse(JsonNode root) {
        if (!root.path("success").asBoolean(false)) {
            String error = text(root, "error");
            return ScanEngineResult.failure(error == null ? "Scan engine reported failure" : error);
        }

        JsonNode loadTime = root.get("page_load_time_ms");
        ScanSignals signals = new ScanSignals(
            loadTime != null && loadTime.isNumber() ? loadTime.intValue() : null,
            messages(root.path("js_errors")),
            networkFailures(root.path("network_errors")),
            messages(root.path("console_logs")),
            text(root, "html_snapshot"),
            text(root, "screenshot_url")
        );

        List<RawFinding> findings = new ArrayList<>();
        for (JsonNode result : root.path("detection_results")) {
            String check = text(result, "check");
            if (check == null) {
                continue;
            }
            JsonNode details = result.path("details");
            Map<String, Object> detailMap = new LinkedHashMap<>();
            for (String key : List.of("technical_details", "suggestions", "evidence")) {
                JsonNode value = details.get(key);
                if (value != null && !value.isNull()) {
                    detailMap.put(key, objectMapper.convertValue(value, Object.class));
                }
            }
            String message = text(details, "message");
            findings.add(new RawFinding(
                check,
                CheckVerdict.fromLabel(text(result, "status")),
                result.path("confidence").asDouble(0.0),
                message == null ? "" : message,
                detailMap));
        }
        return ScanEngineResult.success(signals, findings);
    }

    private static List<String> messages(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            String value = element.isObject() ? text(element, "message") : element.asString(null);
            if (StringUtils.hasText(value)) {
                values.add(value);
            }
        }
        return values;
    }

    private static List<NetworkFailure> networkFailures(JsonNode node) {
        List<NetworkFailure> failures = new ArrayList<>();
        for (JsonNode element : node) {
            JsonNode status = element.get("status");
            failures.add(new NetworkFailure(
                text(element, "url"),
                text(element, "resource_type"),
                status != null && status.isNumber() ? status.intValue() : null,
                text(element, "failure")));
        }
        return failures;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asString(null);
        return StringUtils.hasText(text) ? text : null;
    }
}
