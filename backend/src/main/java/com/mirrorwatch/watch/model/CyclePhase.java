package com.mirrorwatch.watch.model;

/**
 * {@code IDLE} and {@code CHECKING} describe the cycle; the other phases describe one account
 * inside a running cycle.
 */
public enum CyclePhase {
    IDLE,
    CHECKING,
    FETCHING,
    DEDUPING,
    ENRICHING,
    ENQUEUING
}
