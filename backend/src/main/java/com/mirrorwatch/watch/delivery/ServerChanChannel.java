package com.mirrorwatch.watch.delivery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorwatch.watch.http.OutboundHttpClient;
import com.mirrorwatch.watch.model.PushPayload;

import java.util.LinkedHashMap;
import java.util.Map;

public class ServerChanChannel extends HttpNotificationChannel {
    static final String DEFAULT_URL = "https://sctapi.ftqq.com/{key}.send";

    private final String url;
    private final String tagSuffix;

    public ServerChanChannel(
        String name,
        String key,
        String urlTemplate,
        String tags,
        OutboundHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        super(name, httpClient, objectMapper);
        String template = urlTemplate == null || urlTemplate.isBlank() ? DEFAULT_URL : urlTemplate.trim();
        this.url = template.replace("{key}", key);
        this.tagSuffix = tags == null || tags.isBlank() ? "" : " #" + tags.trim().replace("|", "#");
    }

    @Override
    public ChannelType type() {
        return ChannelType.SERVERCHAN;
    }

    @Override
    String targetUrl() {
        return url;
    }

    @Override
    Map<String, Object> requestBody(PushPayload payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", payload.title() + tagSuffix);
        body.put("desp", payload.body());
        body.put("type", "markdown");
        return body;
    }
}
