package com.mirrorwatch.watch.model;

public record DeliveryQueueStats(
    int pending,
    int inFlight,
    long delivered,
    long failed
) {
}
