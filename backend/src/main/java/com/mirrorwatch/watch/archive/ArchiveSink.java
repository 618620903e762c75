package com.mirrorwatch.watch.archive;

import com.mirrorwatch.watch.model.Analysis;
import com.mirrorwatch.watch.model.DeadLetterRecord;
import com.mirrorwatch.watch.model.DeliveryRecord;
import com.mirrorwatch.watch.model.Item;

/**
 * Fire-and-forget record of what the watcher saw and sent. Implementations never throw to the caller.
 */
public interface ArchiveSink extends AutoCloseable {
    void archiveItem(Item item);

    void archiveAnalysis(Item item, Analysis analysis);

    void archiveDelivery(DeliveryRecord record);

    void archiveDeadLetter(DeadLetterRecord record);

    @Override
    default void close() {
    }
}
