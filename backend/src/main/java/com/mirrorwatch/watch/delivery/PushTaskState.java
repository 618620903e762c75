package com.mirrorwatch.watch.delivery;

public enum PushTaskState {
    PENDING,
    IN_FLIGHT,
    DELIVERED,
    FAILED
}
