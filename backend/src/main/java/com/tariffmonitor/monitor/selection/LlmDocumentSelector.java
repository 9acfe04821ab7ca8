package com.tariffmonitor.monitor.selection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tariffmonitor.config.MonitorProperties;
import com.tariffmonitor.monitor.http.DocumentHttpClient;
import com.tariffmonitor.monitor.model.CandidateLink;
import com.tariffmonitor.monitor.model.DocumentSelection;
import com.tariffmonitor.monitor.model.HttpFetchResult;
import com.tariffmonitor.monitor.model.SelectedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Asks an OpenAI-compatible chat completion endpoint which candidate links are the commercial
 * tariff documents. Urls the model invents are dropped.
 */
public class LlmDocumentSelector implements DocumentSelector {
    private static final Logger log = LoggerFactory.getLogger(LlmDocumentSelector.class);
    private static final long MAX_RESPONSE_BYTES = 2_000_000L;

    private static final String PROMPT_TEMPLATE = """
        Analyze the following list of PDF links found on the website of %s.
        Identify the URL(s) most likely to contain the electric utility commercial tariff rates document.
        Look for keywords like "commercial", "tariff", "rates", "schedule".
        Select at most %d URL(s), copied exactly from the list.
        Respond with JSON only, in this shape:
        {"selected": [{"url": "...", "rationale": "..."}], "overallRationale": "..."}

        Links:
        %s
        """;

    private final MonitorProperties.Selector settings;
    private final DocumentHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public LlmDocumentSelector(
        MonitorProperties.Selector settings,
        DocumentHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public DocumentSelection select(String sourceName, List<CandidateLink> candidates) throws DocumentSelectionException {
        if (candidates == null || candidates.isEmpty()) {
            return DocumentSelection.none("No candidates to select from");
        }
        String endpoint = stripTrailingSlash(settings.getBaseUrl()) + "/chat/completions";
        HttpFetchResult result = httpClient.postJson(
            endpoint,
            buildRequestBody(sourceName, candidates),
            Map.of("Authorization", "Bearer " + settings.getApiKey()),
            MAX_RESPONSE_BYTES
        );
        if (!result.isSuccessful()) {
            String detail = result.errorCode() != null ? result.errorCode() + ": " + result.errorMessage()
                : "HTTP status " + result.statusCode();
            throw new DocumentSelectionException("Selector request failed for " + sourceName + " (" + detail + ")");
        }
        DocumentSelection selection = parseCompletion(result.body(), candidates);
        log.info("LLM selected {} of {} candidate(s) for {}", selection.selected().size(), candidates.size(), sourceName);
        return selection;
    }

    String buildRequestBody(String sourceName, List<CandidateLink> candidates) throws DocumentSelectionException {
        StringBuilder links = new StringBuilder();
        for (CandidateLink candidate : candidates) {
            links.append("Text: ").append(candidate.linkText() == null ? "" : candidate.linkText()).append('\n');
            links.append("URL: ").append(candidate.url()).append('\n');
        }
        String prompt = PROMPT_TEMPLATE.formatted(sourceName, settings.getMaxSelected(), links);

        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", settings.getModel());
        body.put("temperature", 0);
        ArrayNode messages = body.putArray("messages");
        messages.addObject()
            .put("role", "system")
            .put("content", "You select utility tariff documents and answer in strict JSON.");
        messages.addObject()
            .put("role", "user")
            .put("content", prompt);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DocumentSelectionException("Failed to encode selector request", e);
        }
    }

    DocumentSelection parseCompletion(String responseBody, List<CandidateLink> candidates)
        throws DocumentSelectionException {
        String content;
        try {
            JsonNode root = objectMapper.readTree(responseBody == null ? "" : responseBody);
            content = root.path("choices").path(0).path("message").path("content").asText(null);
        } catch (JsonProcessingException e) {
            throw new DocumentSelectionException("Selector response is not JSON", e);
        }
        if (content == null || content.isBlank()) {
            throw new DocumentSelectionException("Selector response has no message content");
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(stripCodeFence(content));
        } catch (JsonProcessingException e) {
            throw new DocumentSelectionException("Selector answer is not the requested JSON: " + abbreviate(content), e);
        }
        if (payload == null || !payload.path("selected").isArray()) {
            throw new DocumentSelectionException("Selector answer has no 'selected' array: " + abbreviate(content));
        }

        Set<String> known = new LinkedHashSet<>();
        candidates.forEach(candidate -> known.add(candidate.url()));
        List<SelectedDocument> selected = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode item : payload.path("selected")) {
            String url = item.path("url").asText("").trim();
            if (!known.contains(url)) {
                log.warn("Dropping selected url not among candidates: {}", url);
                continue;
            }
            if (!seen.add(url) || selected.size() >= settings.getMaxSelected()) {
                continue;
            }
            selected.add(new SelectedDocument(url, item.path("rationale").asText("")));
        }
        return new DocumentSelection(selected, payload.path("overallRationale").asText(""));
    }

    private static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).trim();
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private static String abbreviate(String value) {
        return value.length() <= 120 ? value : value.substring(0, 120) + "...";
    }
}
