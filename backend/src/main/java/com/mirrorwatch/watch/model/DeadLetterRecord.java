package com.mirrorwatch.watch.model;

import java.time.Instant;

public record DeadLetterRecord(
    String taskId,
    String channel,
    String itemId,
    String accountHandle,
    String title,
    int attempts,
    String lastError,
    Instant failedAt
) {
}
