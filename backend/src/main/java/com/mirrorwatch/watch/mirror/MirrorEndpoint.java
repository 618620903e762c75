package com.mirrorwatch.watch.mirror;

import com.mirrorwatch.watch.model.EndpointHealth;

import java.time.Instant;

/**
 * Health record of one mirror. Mutated only by {@link EndpointPool} while holding its lock.
 */
public final class MirrorEndpoint {
    private final String address;
    private int consecutiveFailures;
    private Instant lastCheckedAt;
    private Instant disabledUntil;
    private long successCount;
    private long failureCount;

    MirrorEndpoint(String address) {
        this.address = address;
    }

    public String getAddress() {
        return address;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public Instant getLastCheckedAt() {
        return lastCheckedAt;
    }

    public Instant getDisabledUntil() {
        return disabledUntil;
    }

    boolean isAvailableAt(Instant now) {
        return disabledUntil == null || !disabledUntil.isAfter(now);
    }

    void recordSuccess(Instant now) {
        consecutiveFailures = 0;
        disabledUntil = null;
        lastCheckedAt = now;
        successCount++;
    }

    int recordFailure(Instant now) {
        consecutiveFailures++;
        lastCheckedAt = now;
        failureCount++;
        return consecutiveFailures;
    }

    void disableUntil(Instant until) {
        this.disabledUntil = until;
    }

    void restore(EndpointHealth health) {
        this.consecutiveFailures = Math.max(0, health.consecutiveFailures());
        this.lastCheckedAt = health.lastCheckedAt();
        this.disabledUntil = health.disabledUntil();
        this.successCount = Math.max(0, health.successCount());
        this.failureCount = Math.max(0, health.failureCount());
    }

    EndpointHealth toHealth() {
        return new EndpointHealth(address, consecutiveFailures, lastCheckedAt, disabledUntil, successCount, failureCount);
    }

    @Override
    public String toString() {
        return address;
    }
}
