package com.mirrorwatch.watch.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record CycleSummary(
    long cycleNumber,
    Instant startedAt,
    Instant finishedAt,
    Duration duration,
    int accountsChecked,
    int accountsFailed,
    int newItems,
    int enqueuedTasks,
    List<AccountCheckResult> results
) {
}
