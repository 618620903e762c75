package com.mirrorwatch.watch.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.http.HttpFetchResult;
import com.mirrorwatch.watch.http.OutboundHttpClient;
import com.mirrorwatch.watch.model.Analysis;
import com.mirrorwatch.watch.model.Item;
import com.mirrorwatch.watch.util.ReasonCodeClassifier;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Analysis over an OpenAI-compatible chat-completions endpoint.
 */
@Service
public class ChatCompletionAnalysisClient implements AnalysisClient {
    private final OutboundHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final WatchProperties.Analysis settings;
    private final AnalysisSectionParser sectionParser;

    public ChatCompletionAnalysisClient(
        OutboundHttpClient httpClient,
        ObjectMapper objectMapper,
        WatchProperties properties
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.settings = properties.getAnalysis();
        this.sectionParser = new AnalysisSectionParser(settings.getSections());
        if (settings.isEnabled() && (settings.getApiKey() == null || settings.getApiKey().isBlank())) {
            throw new IllegalStateException("watch.analysis.api-key is required when analysis is enabled");
        }
    }

    @Override
    public Analysis analyze(Item item) {
        String text = AnalysisText.prepare(item);
        if (text.isEmpty()) {
            throw new AnalysisUnavailableException("Nothing to analyse for item " + (item == null ? null : item.id()));
        }

        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(buildRequest(text));
        } catch (JsonProcessingException e) {
            throw new AnalysisUnavailableException("Could not encode analysis request", e);
        }

        HttpFetchResult result = httpClient.postJson(
            settings.getUrl(),
            requestBody,
            Map.of("Authorization", "Bearer " + settings.getApiKey())
        );
        if (!result.isSuccessful()) {
            throw new AnalysisUnavailableException(
                "Analysis request failed reason=" + ReasonCodeClassifier.classify(result) + " detail=" + result.describeFailure()
            );
        }
        return sectionParser.parse(extractReply(result.body()));
    }

    private ObjectNode buildRequest(String text) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", settings.getModel());
        ArrayNode messages = request.putArray("messages");
        if (!settings.getSystemPrompt().isBlank()) {
            messages.addObject().put("role", "system").put("content", settings.getSystemPrompt());
        }
        messages.addObject().put("role", "user").put("content", settings.getUserPrompt().replace("{text}", text));
        request.put("temperature", settings.getTemperature());
        request.put("max_tokens", settings.getMaxTokens());
        return request;
    }

    private String extractReply(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new AnalysisUnavailableException("Malformed analysis response: " + e.getOriginalMessage(), e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new AnalysisUnavailableException("Analysis response has no message content");
        }
        return content.asText();
    }
}
