package com.mirrorwatch.watch.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorwatch.watch.http.HttpFetchResult;
import com.mirrorwatch.watch.http.OutboundHttpClient;
import com.mirrorwatch.watch.model.PushPayload;
import com.mirrorwatch.watch.util.ReasonCodeClassifier;

import java.util.Map;

/**
 * A channel reached with one JSON POST; any non-2xx answer or transport error is a failed send.
 */
abstract class HttpNotificationChannel implements NotificationChannel {
    private final String name;
    private final OutboundHttpClient httpClient;
    private final ObjectMapper objectMapper;

    HttpNotificationChannel(String name, OutboundHttpClient httpClient, ObjectMapper objectMapper) {
        this.name = name;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void send(PushPayload payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(requestBody(payload));
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Could not encode " + type() + " request: " + e.getOriginalMessage());
        }
        HttpFetchResult result = httpClient.postJson(targetUrl(), body, Map.of());
        if (!result.isSuccessful()) {
            throw new DeliveryException(
                type() + " send failed reason=" + ReasonCodeClassifier.classify(result) + " detail=" + result.describeFailure()
            );
        }
    }

    abstract String targetUrl();

    abstract Map<String, Object> requestBody(PushPayload payload);
}
