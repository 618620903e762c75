package com.mirrorwatch.watch.model;

import java.time.Instant;

public record EndpointHealth(
    String address,
    int consecutiveFailures,
    Instant lastCheckedAt,
    Instant disabledUntil,
    long successCount,
    long failureCount
) {
}
