package com.mirrorwatch.watch.delivery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorwatch.watch.http.OutboundHttpClient;
import com.mirrorwatch.watch.model.PushPayload;

import java.util.LinkedHashMap;
import java.util.Map;

public class WebhookChannel extends HttpNotificationChannel {
    private final String url;

    public WebhookChannel(String name, String url, OutboundHttpClient httpClient, ObjectMapper objectMapper) {
        super(name, httpClient, objectMapper);
        this.url = url.trim();
    }

    @Override
    public ChannelType type() {
        return ChannelType.WEBHOOK;
    }

    @Override
    String targetUrl() {
        return url;
    }

    @Override
    Map<String, Object> requestBody(PushPayload payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("title", payload.title());
        body.put("body", payload.body());
        body.put("itemId", payload.itemId());
        body.put("account", payload.accountHandle());
        return body;
    }
}
