package com.mirrorwatch.watch.archive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mirrorwatch.watch.model.Analysis;
import com.mirrorwatch.watch.model.DeadLetterRecord;
import com.mirrorwatch.watch.model.DeliveryRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static com.mirrorwatch.watch.support.TestItems.item;
import static org.assertj.core.api.Assertions.assertThat;

class JsonlArchiveSinkTest {
    @TempDir
    Path archiveDir;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void appendsOneDocumentPerLineInOrder() throws Exception {
        Instant at = Instant.parse("2024-06-01T12:00:00Z");
        JsonlArchiveSink sink = new JsonlArchiveSink(archiveDir.resolve("nested"), objectMapper);

        sink.archiveItem(item("alice", "1"));
        sink.archiveItem(item("alice", "2"));
        sink.archiveAnalysis(item("alice", "1"), new Analysis("t", "s", "#g", "c", "raw"));
        sink.archiveDelivery(new DeliveryRecord("alice/1:hook", "hook", "1", "alice", "title", 1, at));
        sink.archiveDeadLetter(new DeadLetterRecord("alice/2:hook", "hook", "2", "alice", "title", 3, "HTTP 500", at));
        sink.close();

        List<String> items = Files.readAllLines(archiveDir.resolve("nested").resolve(JsonlArchiveSink.ITEMS_FILE));
        assertThat(items).hasSize(2);
        assertThat(objectMapper.readTree(items.get(0)).path("id").asText()).isEqualTo("1");
        assertThat(objectMapper.readTree(items.get(1)).path("id").asText()).isEqualTo("2");

        JsonNode analysis = objectMapper.readTree(
            Files.readString(archiveDir.resolve("nested").resolve(JsonlArchiveSink.ANALYSES_FILE))
        );
        assertThat(analysis.path("itemId").asText()).isEqualTo("1");
        assertThat(analysis.path("analysis").path("tags").asText()).isEqualTo("#g");

        JsonNode delivery = objectMapper.readTree(
            Files.readString(archiveDir.resolve("nested").resolve(JsonlArchiveSink.DELIVERIES_FILE))
        );
        assertThat(delivery.path("deliveredAt").asText()).isEqualTo("2024-06-01T12:00:00Z");

        JsonNode deadLetter = objectMapper.readTree(
            Files.readString(archiveDir.resolve("nested").resolve(JsonlArchiveSink.DEAD_LETTERS_FILE))
        );
        assertThat(deadLetter.path("lastError").asText()).isEqualTo("HTTP 500");
        assertThat(deadLetter.path("attempts").asInt()).isEqualTo(3);
    }

    @Test
    void writesAfterCloseAreDropped() throws Exception {
        JsonlArchiveSink sink = new JsonlArchiveSink(archiveDir, objectMapper);
        sink.close();

        sink.archiveItem(item("alice", "1"));

        assertThat(Files.exists(archiveDir.resolve(JsonlArchiveSink.ITEMS_FILE))).isFalse();
    }
}
