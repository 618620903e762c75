package com.mirrorwatch.watch.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorwatch.watch.http.HttpFetchResult;
import com.mirrorwatch.watch.http.OutboundHttpClient;
import com.mirrorwatch.watch.util.ReasonCodeClassifier;

import java.util.Map;

/**
 * Delegates rendering to a headless-browser backend: {@code POST {base}/render} with
 * {@code {"url": ...}}, answered by {@code {"content": ...}}.
 */
public class RenderServicePageRenderer implements PageRenderer {
    private final OutboundHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String renderUrl;

    public RenderServicePageRenderer(OutboundHttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("watch.renderer.base-url is required when watch.renderer.mode=service");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.renderUrl = stripTrailingSlash(baseUrl.trim()) + "/render";
    }

    @Override
    public String render(String url) {
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(Map.of("url", url));
        } catch (JsonProcessingException e) {
            throw new RenderException(ReasonCodeClassifier.RENDER_FAILED, "Could not encode render request: " + e.getMessage());
        }
        HttpFetchResult result = httpClient.postJson(renderUrl, requestBody, Map.of());
        if (!result.isSuccessful()) {
            throw new RenderException(ReasonCodeClassifier.classify(result), result.describeFailure());
        }
        try {
            JsonNode root = objectMapper.readTree(result.body() == null ? "" : result.body());
            String content = root == null ? null : root.path("content").asText(null);
            if (content == null || content.isBlank()) {
                throw new RenderException(ReasonCodeClassifier.RENDER_FAILED, "Render backend returned no content for " + url);
            }
            return content;
        } catch (JsonProcessingException e) {
            throw new RenderException(ReasonCodeClassifier.RENDER_FAILED, "Malformed render response: " + e.getOriginalMessage());
        }
    }

    private static String stripTrailingSlash(String value) {
        String out = value;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
