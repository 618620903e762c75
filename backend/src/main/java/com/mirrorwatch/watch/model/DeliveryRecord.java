package com.mirrorwatch.watch.model;

import java.time.Instant;

public record DeliveryRecord(
    String taskId,
    String channel,
    String itemId,
    String accountHandle,
    String title,
    int attempts,
    Instant deliveredAt
) {
}
