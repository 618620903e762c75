package com.mirrorwatch.watch.archive;

import com.mirrorwatch.watch.model.Analysis;
import com.mirrorwatch.watch.model.DeadLetterRecord;
import com.mirrorwatch.watch.model.DeliveryRecord;
import com.mirrorwatch.watch.model.Item;

public class NoopArchiveSink implements ArchiveSink {
    @Override
    public void archiveItem(Item item) {
    }

    @Override
    public void archiveAnalysis(Item item, Analysis analysis) {
    }

    @Override
    public void archiveDelivery(DeliveryRecord record) {
    }

    @Override
    public void archiveDeadLetter(DeadLetterRecord record) {
    }
}
