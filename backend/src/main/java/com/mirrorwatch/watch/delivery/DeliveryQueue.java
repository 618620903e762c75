package com.mirrorwatch.watch.delivery;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.archive.ArchiveSink;
import com.mirrorwatch.watch.model.DeadLetterRecord;
import com.mirrorwatch.watch.model.DeliveryQueueStats;
import com.mirrorwatch.watch.model.DeliveryRecord;
import com.mirrorwatch.watch.model.PushPayload;
import com.mirrorwatch.watch.util.ExponentialBackoff;
import com.mirrorwatch.watch.util.NamedThreadFactory;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class DeliveryQueue {
    private static final Logger log = LoggerFactory.getLogger(DeliveryQueue.class);
    private static final Logger deadLetterLog = LoggerFactory.getLogger("com.mirrorwatch.deadletter");

    private final Map<String, PushTask> tasks = new ConcurrentHashMap<>();
    private final Deque<DeadLetterRecord> recentDeadLetters = new ArrayDeque<>();
    private final AtomicLong deliveredTotal = new AtomicLong();
    private final AtomicLong failedTotal = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private final WatchProperties.Delivery settings;
    private final Clock clock;
    private final ExecutorService deliveryExecutor;
    private final ArchiveSink archiveSink;
    private final ExponentialBackoff backoff;

    private ScheduledExecutorService drainTimer;
    private ScheduledFuture<?> drainHandle;

    public DeliveryQueue(
        WatchProperties properties,
        Clock clock,
        @Qualifier("deliveryExecutor") ExecutorService deliveryExecutor,
        ArchiveSink archiveSink
    ) {
        this.settings = properties.getDelivery();
        this.clock = clock;
        this.deliveryExecutor = deliveryExecutor;
        this.archiveSink = archiveSink;
        this.backoff = new ExponentialBackoff(
            Duration.ofMillis(settings.getBackoffBaseMs()),
            Duration.ofMillis(settings.getBackoffMaxMs())
        );
    }

    @PostConstruct
    public void startIfEnabled() {
        if (settings.isDrainEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            long interval = settings.getDrainIntervalMs();
            drainTimer = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("delivery-drain-"));
            drainHandle = drainTimer.scheduleWithFixedDelay(this::drainSafely, interval, interval, TimeUnit.MILLISECONDS);
            running.set(true);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (drainHandle != null) {
                drainHandle.cancel(false);
                drainHandle = null;
            }
            if (drainTimer != null) {
                drainTimer.shutdownNow();
                try {
                    drainTimer.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                drainTimer = null;
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Creates one pending task per channel, due now. Channels that already hold an active task
     * for this payload are skipped.
     *
     * @return the newly created tasks
     */
    public List<PushTask> enqueue(PushPayload payload, List<NotificationChannel> channels) {
        List<PushTask> created = new ArrayList<>();
        if (payload == null || channels == null) {
            return created;
        }
        Instant now = clock.instant();
        for (NotificationChannel channel : channels) {
            PushTask task = new PushTask(payload, channel, now);
            if (tasks.putIfAbsent(task.getId(), task) == null) {
                created.add(task);
            } else {
                log.debug("Task {} already queued", task.getId());
            }
        }
        return created;
    }

    /**
     * Sends every due task once. Each send gets its own timeout, counted from the moment a worker
     * picks it up. A task still waiting for a worker when the drain gives up is released without
     * counting an attempt.
     *
     * @return number of tasks attempted
     */
    public int drainOnce() {
        Instant now = clock.instant();
        List<PushTask> claimed = new ArrayList<>();
        for (PushTask task : tasks.values()) {
            if (task.tryClaim(now)) {
                claimed.add(task);
            }
        }
        if (claimed.isEmpty()) {
            return 0;
        }

        long timeoutNanos = TimeUnit.SECONDS.toNanos(settings.getSendTimeoutSeconds());
        // one worker running every send back to back finishes within this bound
        long queueDeadline = System.nanoTime() + timeoutNanos * claimed.size();
        List<Dispatch> dispatches = new ArrayList<>(claimed.size());
        for (PushTask task : claimed) {
            Dispatch dispatch = new Dispatch(task);
            try {
                dispatch.future = deliveryExecutor.submit(() -> {
                    dispatch.startNanos = System.nanoTime();
                    dispatch.started.countDown();
                    task.getChannel().send(task.getPayload());
                });
            } catch (RejectedExecutionException e) {
                log.debug("Delivery executor rejected {}; left pending", task.getId());
            }
            dispatches.add(dispatch);
        }

        int attempted = 0;
        for (int i = 0; i < dispatches.size(); i++) {
            Dispatch dispatch = dispatches.get(i);
            PushTask task = dispatch.task;
            if (dispatch.future == null) {
                task.release();
                continue;
            }
            try {
                if (!awaitStart(dispatch, queueDeadline)) {
                    log.debug("Send of {} never started within the drain; left pending", task.getId());
                    task.release();
                    continue;
                }
                attempted++;
                dispatch.future.get(Math.max(0L, dispatch.startNanos + timeoutNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
                onDelivered(task);
            } catch (TimeoutException e) {
                dispatch.future.cancel(true);
                onFailed(task, "send timed out after " + settings.getSendTimeoutSeconds() + "s");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                onFailed(task, cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (int j = i; j < dispatches.size(); j++) {
                    Dispatch rest = dispatches.get(j);
                    if (rest.future != null) {
                        rest.future.cancel(true);
                    }
                    rest.task.release();
                }
                break;
            }
        }
        return attempted;
    }

    /**
     * Waits until a worker picks up the send.
     *
     * @return {@code false} when the send was withdrawn before it started
     */
    private static boolean awaitStart(Dispatch dispatch, long queueDeadline) throws InterruptedException {
        long left = Math.max(0L, queueDeadline - System.nanoTime());
        if (!dispatch.started.await(left, TimeUnit.NANOSECONDS)) {
            if (dispatch.future.cancel(false)) {
                return false;
            }
            // lost the race: the worker has already taken it
            dispatch.started.await();
        }
        return true;
    }

    public DeliveryQueueStats stats() {
        int pending = 0;
        int inFlight = 0;
        for (PushTask task : tasks.values()) {
            PushTaskState state = task.getState();
            if (state == PushTaskState.PENDING) {
                pending++;
            } else if (state == PushTaskState.IN_FLIGHT) {
                inFlight++;
            }
        }
        return new DeliveryQueueStats(pending, inFlight, deliveredTotal.get(), failedTotal.get());
    }

    /**
     * Most recent dead letters, newest first.
     */
    public List<DeadLetterRecord> recentDeadLetters() {
        synchronized (recentDeadLetters) {
            return new ArrayList<>(recentDeadLetters);
        }
    }

    private void drainSafely() {
        try {
            drainOnce();
        } catch (RuntimeException e) {
            log.error("Delivery drain failed", e);
        }
    }

    private void onDelivered(PushTask task) {
        task.markDelivered();
        tasks.remove(task.getId(), task);
        deliveredTotal.incrementAndGet();
        PushPayload payload = task.getPayload();
        log.info(
            "Delivered {} via {} (attempt {}, {}s after enqueue)",
            payload.dedupKey(),
            task.getChannel().name(),
            task.getAttempt(),
            Duration.between(task.getCreatedAt(), clock.instant()).toSeconds()
        );
        archiveSink.archiveDelivery(new DeliveryRecord(
            task.getId(),
            task.getChannel().name(),
            payload.itemId(),
            payload.accountHandle(),
            payload.title(),
            task.getAttempt(),
            clock.instant()
        ));
    }

    private void onFailed(PushTask task, String error) {
        Instant now = clock.instant();
        boolean terminal = task.recordFailure(error, now, settings.getMaxAttempts(), backoff);
        if (!terminal) {
            log.warn(
                "Delivery of {} via {} failed (attempt {}/{}), retry at {}: {}",
                task.getPayload().dedupKey(),
                task.getChannel().name(),
                task.getAttempt(),
                settings.getMaxAttempts(),
                task.getNextAttemptAt(),
                error
            );
            return;
        }

        tasks.remove(task.getId(), task);
        failedTotal.incrementAndGet();
        PushPayload payload = task.getPayload();
        DeadLetterRecord record = new DeadLetterRecord(
            task.getId(),
            task.getChannel().name(),
            payload.itemId(),
            payload.accountHandle(),
            payload.title(),
            task.getAttempt(),
            error,
            now
        );
        deadLetterLog.error(
            "Giving up on {} via {} after {} attempts: {}",
            payload.dedupKey(),
            task.getChannel().name(),
            task.getAttempt(),
            error
        );
        synchronized (recentDeadLetters) {
            recentDeadLetters.addFirst(record);
            while (recentDeadLetters.size() > settings.getDeadLetterHistory()) {
                recentDeadLetters.removeLast();
            }
        }
        archiveSink.archiveDeadLetter(record);
    }

    private static final class Dispatch {
        private final PushTask task;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startNanos;
        private Future<?> future;

        private Dispatch(PushTask task) {
            this.task = task;
        }
    }
}
