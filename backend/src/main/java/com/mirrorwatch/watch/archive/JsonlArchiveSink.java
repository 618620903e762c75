package com.mirrorwatch.watch.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorwatch.watch.model.Analysis;
import com.mirrorwatch.watch.model.DeadLetterRecord;
import com.mirrorwatch.watch.model.DeliveryRecord;
import com.mirrorwatch.watch.model.Item;
import com.mirrorwatch.watch.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Appends one JSON document per line to files under the archive directory. Writes happen on a
 * single background thread, in submission order.
 */
public class JsonlArchiveSink implements ArchiveSink {
    private static final Logger log = LoggerFactory.getLogger(JsonlArchiveSink.class);

    static final String ITEMS_FILE = "items.jsonl";
    static final String ANALYSES_FILE = "analyses.jsonl";
    static final String DELIVERIES_FILE = "deliveries.jsonl";
    static final String DEAD_LETTERS_FILE = "dead_letters.jsonl";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final ExecutorService writer;

    public JsonlArchiveSink(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        this.writer = Executors.newSingleThreadExecutor(new NamedThreadFactory("archive-writer-"));
    }

    @Override
    public void archiveItem(Item item) {
        submit(ITEMS_FILE, item);
    }

    @Override
    public void archiveAnalysis(Item item, Analysis analysis) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("itemId", item.id());
        entry.put("accountHandle", item.accountHandle());
        entry.put("analysis", analysis);
        submit(ANALYSES_FILE, entry);
    }

    @Override
    public void archiveDelivery(DeliveryRecord record) {
        submit(DELIVERIES_FILE, record);
    }

    @Override
    public void archiveDeadLetter(DeadLetterRecord record) {
        submit(DEAD_LETTERS_FILE, record);
    }

    private void submit(String fileName, Object document) {
        if (document == null) {
            return;
        }
        try {
            writer.execute(() -> append(fileName, document));
        } catch (RejectedExecutionException e) {
            log.warn("Archive writer stopped; dropping {} entry", fileName);
        }
    }

    private void append(String fileName, Object document) {
        try {
            String line = objectMapper.writeValueAsString(document);
            Files.createDirectories(directory);
            try (Writer out = Files.newBufferedWriter(
                directory.resolve(fileName),
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            )) {
                out.write(line);
                out.write('\n');
            }
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {} archive entry", fileName, e);
        } catch (IOException e) {
            log.warn("Could not append to archive {}", directory.resolve(fileName), e);
        }
    }

    /**
     * Waits for queued writes to finish.
     */
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Archive writer did not drain within 5s");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
