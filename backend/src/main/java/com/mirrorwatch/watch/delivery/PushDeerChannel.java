package com.mirrorwatch.watch.delivery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorwatch.watch.http.OutboundHttpClient;
import com.mirrorwatch.watch.model.PushPayload;

import java.util.LinkedHashMap;
import java.util.Map;

public class PushDeerChannel extends HttpNotificationChannel {
    static final String DEFAULT_URL = "https://api2.pushdeer.com/message/push";

    private final String key;
    private final String url;

    public PushDeerChannel(String name, String key, String url, OutboundHttpClient httpClient, ObjectMapper objectMapper) {
        super(name, httpClient, objectMapper);
        this.key = key;
        this.url = url == null || url.isBlank() ? DEFAULT_URL : url.trim();
    }

    @Override
    public ChannelType type() {
        return ChannelType.PUSHDEER;
    }

    @Override
    String targetUrl() {
        return url;
    }

    @Override
    Map<String, Object> requestBody(PushPayload payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pushkey", key);
        body.put("text", payload.title());
        body.put("desp", payload.body());
        body.put("type", "markdown");
        return body;
    }
}
