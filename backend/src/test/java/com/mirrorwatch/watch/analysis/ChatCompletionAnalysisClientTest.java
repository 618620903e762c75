package com.mirrorwatch.watch.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.http.OutboundHttpClient;
import com.mirrorwatch.watch.model.Analysis;
import com.mirrorwatch.watch.model.Item;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatCompletionAnalysisClientTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ExecutorService executor;
    private ChatCompletionAnalysisClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);

        WatchProperties properties = new WatchProperties();
        properties.getAnalysis().setEnabled(true);
        properties.getAnalysis().setApiKey("sk-test");
        properties.getAnalysis().setUrl(server.url("/chat/completions").toString());
        properties.getAnalysis().setModel("test-model");
        properties.getAnalysis().setSystemPrompt("Be brief.");
        properties.getAnalysis().setUserPrompt("Post:\n{text}");
        properties.getHttp().setPerHostDelayMs(1);
        client = new ChatCompletionAnalysisClient(new OutboundHttpClient(properties, executor), objectMapper, properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void postsChatRequestAndParsesSections() throws Exception {
        String reply = "【Translation】Bonjour\n【Summary】Greeting\n【Tags】#hi\n【Category】Chat";
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody(objectMapper.writeValueAsString(
                objectMapper.createObjectNode()
                    .set("choices", objectMapper.createArrayNode()
                        .add(objectMapper.createObjectNode()
                            .set("message", objectMapper.createObjectNode().put("content", reply))))
            )));

        Analysis analysis = client.analyze(item("Bonjour https://t.co/abc", true));

        assertThat(analysis.translation()).isEqualTo("Bonjour");
        assertThat(analysis.summary()).isEqualTo("Greeting");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("test-model");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(2000);
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.7);
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
        String userContent = body.path("messages").get(1).path("content").asText();
        assertThat(userContent).startsWith("Post:\nBonjour");
        assertThat(userContent).doesNotContain("https://t.co/abc");
        assertThat(userContent).contains("Quoted:\nquoted words").contains("Author: Carol");
    }

    @Test
    void replyWithoutSectionsIsUnavailable() {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setBody("{\"choices\":[{\"message\":{\"content\":\"just prose\"}}]}"));

        assertThatThrownBy(() -> client.analyze(item("Bonjour", false)))
            .isInstanceOf(AnalysisUnavailableException.class);
    }

    @Test
    void httpErrorIsUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));

        assertThatThrownBy(() -> client.analyze(item("Bonjour", false)))
            .isInstanceOf(AnalysisUnavailableException.class)
            .hasMessageContaining("HTTP_5XX");
    }

    @Test
    void linkOnlyPostIsNotSent() {
        assertThatThrownBy(() -> client.analyze(item("https://t.co/abc", false)))
            .isInstanceOf(AnalysisUnavailableException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    private static Item item(String content, boolean quote) {
        Instant now = Instant.parse("2024-06-01T12:00:00Z");
        return new Item(
            "1", "alice", "alice", content, "https://twitter.com/alice/status/1", "1h", now, now, null,
            false, false, null, quote, quote ? "quoted words" : null, quote ? "Carol" : null, List.of()
        );
    }
}
