package com.mirrorwatch.watch.delivery;

import com.mirrorwatch.watch.model.PushPayload;
import com.mirrorwatch.watch.util.ExponentialBackoff;

import java.time.Instant;

/**
 * Delivery of one payload to one channel. State changes are atomic per task.
 */
public final class PushTask {
    private final String id;
    private final PushPayload payload;
    private final NotificationChannel channel;
    private final Instant createdAt;
    private int attempt;
    private Instant nextAttemptAt;
    private PushTaskState state = PushTaskState.PENDING;
    private String lastError;

    PushTask(PushPayload payload, NotificationChannel channel, Instant now) {
        this.id = idFor(payload, channel);
        this.payload = payload;
        this.channel = channel;
        this.createdAt = now;
        this.nextAttemptAt = now;
    }

    static String idFor(PushPayload payload, NotificationChannel channel) {
        return payload.dedupKey() + ":" + channel.name();
    }

    /**
     * {@code PENDING -> IN_FLIGHT} when due. At most one caller wins.
     */
    synchronized boolean tryClaim(Instant now) {
        if (state != PushTaskState.PENDING || nextAttemptAt.isAfter(now)) {
            return false;
        }
        state = PushTaskState.IN_FLIGHT;
        return true;
    }

    /**
     * Returns a claimed task to {@code PENDING} without counting an attempt.
     */
    synchronized void release() {
        if (state == PushTaskState.IN_FLIGHT) {
            state = PushTaskState.PENDING;
        }
    }

    synchronized void markDelivered() {
        if (state != PushTaskState.IN_FLIGHT) {
            throw new IllegalStateException("Task " + id + " is " + state + ", not IN_FLIGHT");
        }
        attempt++;
        state = PushTaskState.DELIVERED;
    }

    /**
     * Counts a failed attempt and either schedules the next one or gives up.
     *
     * @return {@code true} when the task became {@link PushTaskState#FAILED}
     */
    synchronized boolean recordFailure(String error, Instant now, int maxAttempts, ExponentialBackoff backoff) {
        if (state != PushTaskState.IN_FLIGHT) {
            throw new IllegalStateException("Task " + id + " is " + state + ", not IN_FLIGHT");
        }
        attempt++;
        lastError = error;
        if (attempt >= maxAttempts) {
            state = PushTaskState.FAILED;
            return true;
        }
        nextAttemptAt = now.plus(backoff.delayFor(attempt));
        state = PushTaskState.PENDING;
        return false;
    }

    public String getId() {
        return id;
    }

    public PushPayload getPayload() {
        return payload;
    }

    public NotificationChannel getChannel() {
        return channel;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized int getAttempt() {
        return attempt;
    }

    public synchronized Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public synchronized PushTaskState getState() {
        return state;
    }

    public synchronized String getLastError() {
        return lastError;
    }
}
