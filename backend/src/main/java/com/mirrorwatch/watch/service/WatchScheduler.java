package com.mirrorwatch.watch.service;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.delivery.DeliveryQueue;
import com.mirrorwatch.watch.mirror.EndpointPool;
import com.mirrorwatch.watch.mirror.MirrorDirectoryClient;
import com.mirrorwatch.watch.model.AccountCheckResult;
import com.mirrorwatch.watch.model.CyclePhase;
import com.mirrorwatch.watch.model.CycleSummary;
import com.mirrorwatch.watch.model.TrackedAccount;
import com.mirrorwatch.watch.model.WatchStatusResponse;
import com.mirrorwatch.watch.state.WatchStateStore;
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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the poll cycle. A fixed-rate tick starts a cycle on a dedicated thread unless the previous
 * cycle is still running, in which case the tick is dropped.
 */
@Service
public class WatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(WatchScheduler.class);

    private final AccountCheckService accountCheckService;
    private final WatchProperties properties;
    private final ExecutorService accountExecutor;
    private final EndpointPool endpointPool;
    private final MirrorDirectoryClient directoryClient;
    private final DeliveryQueue deliveryQueue;
    private final WatchStateStore stateStore;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cycleActive = new AtomicBoolean(false);
    private final AtomicBoolean stateRestored = new AtomicBoolean(false);
    private final AtomicLong skippedCycles = new AtomicLong();
    private final AtomicLong cycleCounter = new AtomicLong();
    private final Object lifecycleLock = new Object();

    private volatile CyclePhase phase = CyclePhase.IDLE;
    private volatile CycleSummary lastCycle;
    private volatile Instant lastDirectoryRefresh;

    private ScheduledExecutorService ticker;
    private ExecutorService cycleExecutor;

    public WatchScheduler(
        AccountCheckService accountCheckService,
        WatchProperties properties,
        @Qualifier("accountExecutor") ExecutorService accountExecutor,
        EndpointPool endpointPool,
        MirrorDirectoryClient directoryClient,
        DeliveryQueue deliveryQueue,
        WatchStateStore stateStore,
        Clock clock
    ) {
        this.accountCheckService = accountCheckService;
        this.properties = properties;
        this.accountExecutor = accountExecutor;
        this.endpointPool = endpointPool;
        this.directoryClient = directoryClient;
        this.deliveryQueue = deliveryQueue;
        this.stateStore = stateStore;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
        stateStore.save();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            if (stateRestored.compareAndSet(false, true)) {
                stateStore.restore();
            }
            int interval = properties.getScheduler().getPollIntervalSeconds();
            cycleExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("watch-cycle-"));
            ticker = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("watch-tick-"));
            ticker.scheduleAtFixedRate(this::tick, 0, interval, TimeUnit.SECONDS);
            running.set(true);
            log.info(
                "Watch scheduler started: {} accounts, poll every {}s, {} mirrors",
                properties.trackedAccounts().size(),
                interval,
                endpointPool.size()
            );
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            shutdown(ticker);
            shutdown(cycleExecutor);
            ticker = null;
            cycleExecutor = null;
            log.info("Watch scheduler stopped");
        }
    }

    /**
     * Runs one cycle on the calling thread.
     *
     * @throws CycleInProgressException when a cycle is already running
     */
    public CycleSummary runNow() {
        if (!cycleActive.compareAndSet(false, true)) {
            throw new CycleInProgressException("A watch cycle is already running");
        }
        try {
            return runCycle();
        } finally {
            cycleActive.set(false);
        }
    }

    public WatchStatusResponse getStatus() {
        return new WatchStatusResponse(
            running.get(),
            phase,
            accountCheckService.accountPhases(),
            skippedCycles.get(),
            lastCycle,
            endpointPool.snapshot(),
            deliveryQueue.stats(),
            deliveryQueue.recentDeadLetters()
        );
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getSkippedCycles() {
        return skippedCycles.get();
    }

    void tick() {
        if (!cycleActive.compareAndSet(false, true)) {
            long skipped = skippedCycles.incrementAndGet();
            log.warn("Previous watch cycle still running; skipping this tick ({} skipped so far)", skipped);
            return;
        }
        ExecutorService executor = cycleExecutor;
        if (executor == null) {
            cycleActive.set(false);
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    runCycle();
                } catch (RuntimeException e) {
                    log.error("Watch cycle failed", e);
                } finally {
                    cycleActive.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            cycleActive.set(false);
            log.debug("Cycle executor is shut down; tick ignored");
        }
    }

    private CycleSummary runCycle() {
        long cycleNumber = cycleCounter.incrementAndGet();
        Instant startedAt = clock.instant();
        phase = CyclePhase.CHECKING;
        try {
            refreshDirectoryIfDue(startedAt);
            List<TrackedAccount> accounts = properties.trackedAccounts();
            List<CompletableFuture<AccountCheckResult>> checks = new ArrayList<>(accounts.size());
            for (TrackedAccount account : accounts) {
                checks.add(CompletableFuture.supplyAsync(() -> accountCheckService.check(account), accountExecutor));
            }
            List<AccountCheckResult> results = new ArrayList<>(checks.size());
            for (CompletableFuture<AccountCheckResult> check : checks) {
                results.add(check.join());
            }

            Instant finishedAt = clock.instant();
            int failed = 0;
            int newItems = 0;
            int enqueued = 0;
            for (AccountCheckResult result : results) {
                if (!result.isSuccessful()) {
                    failed++;
                }
                newItems += result.newCount();
                enqueued += result.enqueuedTaskCount();
            }
            CycleSummary summary = new CycleSummary(
                cycleNumber,
                startedAt,
                finishedAt,
                Duration.between(startedAt, finishedAt),
                results.size(),
                failed,
                newItems,
                enqueued,
                List.copyOf(results)
            );
            lastCycle = summary;
            log.info(
                "Watch cycle {} done in {}ms: accounts={} failed={} newItems={} tasks={}",
                cycleNumber,
                summary.duration().toMillis(),
                results.size(),
                failed,
                newItems,
                enqueued
            );
            stateStore.save();
            return summary;
        } finally {
            phase = CyclePhase.IDLE;
        }
    }

    private void refreshDirectoryIfDue(Instant now) {
        if (!directoryClient.isConfigured()) {
            return;
        }
        Duration every = Duration.ofHours(properties.getMirror().getDirectoryRefreshHours());
        Instant last = lastDirectoryRefresh;
        if (last != null && now.isBefore(last.plus(every))) {
            return;
        }
        lastDirectoryRefresh = now;
        int added = endpointPool.addEndpoints(directoryClient.fetchHealthyMirrors());
        if (added > 0) {
            log.info("Added {} mirrors from the directory ({} total)", added, endpointPool.size());
        }
    }

    private void shutdown(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
