package com.mirrorwatch.watch.service;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.delivery.DeliveryQueue;
import com.mirrorwatch.watch.mirror.EndpointPool;
import com.mirrorwatch.watch.mirror.MirrorDirectoryClient;
import com.mirrorwatch.watch.model.AccountCheckOutcome;
import com.mirrorwatch.watch.model.AccountCheckResult;
import com.mirrorwatch.watch.model.CyclePhase;
import com.mirrorwatch.watch.model.CycleSummary;
import com.mirrorwatch.watch.model.DeliveryQueueStats;
import com.mirrorwatch.watch.model.TrackedAccount;
import com.mirrorwatch.watch.model.WatchStatusResponse;
import com.mirrorwatch.watch.state.WatchStateStore;
import com.mirrorwatch.watch.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WatchSchedulerTest {
    private static final TrackedAccount ALICE = TrackedAccount.of("alice", "alice");
    private static final TrackedAccount BOB = TrackedAccount.of("bob", "bob");

    @Mock
    private AccountCheckService accountCheckService;
    @Mock
    private MirrorDirectoryClient directoryClient;
    @Mock
    private DeliveryQueue deliveryQueue;
    @Mock
    private WatchStateStore stateStore;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
    private ExecutorService accountExecutor;
    private WatchProperties properties;
    private EndpointPool endpointPool;
    private WatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        accountExecutor = Executors.newFixedThreadPool(2);
        properties = new WatchProperties();
        properties.setAccountList("alice:alice,bob:bob");
        properties.getScheduler().setPollIntervalSeconds(3600);
        properties.getMirror().setEndpoints(List.of("https://mirror-a.example"));
        endpointPool = new EndpointPool(properties, clock);
        lenient().when(deliveryQueue.stats()).thenReturn(new DeliveryQueueStats(0, 0, 0, 0));
        lenient().when(deliveryQueue.recentDeadLetters()).thenReturn(List.of());
        scheduler = new WatchScheduler(
            accountCheckService,
            properties,
            accountExecutor,
            endpointPool,
            directoryClient,
            deliveryQueue,
            stateStore,
            clock
        );
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        accountExecutor.shutdownNow();
    }

    @Test
    void runNowChecksEveryAccountAndSummarizes() {
        when(accountCheckService.check(ALICE)).thenReturn(
            new AccountCheckResult("alice", "alice", AccountCheckOutcome.CHECKED, 3, 1, 0, 0, 2, "https://mirror-a.example", null)
        );
        when(accountCheckService.check(BOB)).thenReturn(
            AccountCheckResult.skipped(BOB, AccountCheckOutcome.NO_HEALTHY_ENDPOINT, "NO_HEALTHY_ENDPOINT")
        );

        CycleSummary summary = scheduler.runNow();

        assertThat(summary.cycleNumber()).isEqualTo(1);
        assertThat(summary.accountsChecked()).isEqualTo(2);
        assertThat(summary.accountsFailed()).isEqualTo(1);
        assertThat(summary.newItems()).isEqualTo(1);
        assertThat(summary.enqueuedTasks()).isEqualTo(2);
        assertThat(summary.results()).extracting(AccountCheckResult::handle).containsExactly("alice", "bob");
        verify(stateStore).save();

        WatchStatusResponse status = scheduler.getStatus();
        assertThat(status.phase()).isEqualTo(CyclePhase.IDLE);
        assertThat(status.lastCycle()).isEqualTo(summary);
        assertThat(status.endpoints()).hasSize(1);
    }

    @Test
    void overlappingCycleIsRefusedAndTickIsSkipped() throws Exception {
        CountDownLatch checking = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(accountCheckService.check(any())).thenAnswer(invocation -> {
            checking.countDown();
            release.await(10, TimeUnit.SECONDS);
            TrackedAccount account = invocation.getArgument(0);
            return AccountCheckResult.skipped(account, AccountCheckOutcome.CHECKED, null);
        });

        CompletableFuture<CycleSummary> running = CompletableFuture.supplyAsync(scheduler::runNow);
        assertThat(checking.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(scheduler.getStatus().phase()).isEqualTo(CyclePhase.CHECKING);
        assertThatThrownBy(scheduler::runNow).isInstanceOf(CycleInProgressException.class);
        scheduler.tick();
        scheduler.tick();
        assertThat(scheduler.getSkippedCycles()).isEqualTo(2);

        release.countDown();
        CycleSummary summary = running.get(10, TimeUnit.SECONDS);
        assertThat(summary.accountsChecked()).isEqualTo(2);
        verify(accountCheckService, times(2)).check(any());

        scheduler.runNow();
        verify(accountCheckService, times(4)).check(any());
    }

    @Test
    void startRestoresStateOnceAndStopIsIdempotent() {
        properties.setAccountList("");

        scheduler.start();
        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();
        scheduler.stop();
        scheduler.stop();
        scheduler.start();

        assertThat(scheduler.isRunning()).isTrue();
        verify(stateStore, times(1)).restore();
    }

    @Test
    void directoryMirrorsAreAddedBeforeTheCycle() {
        properties.setAccountList("");
        when(directoryClient.isConfigured()).thenReturn(true);
        when(directoryClient.fetchHealthyMirrors()).thenReturn(List.of("https://mirror-a.example", "https://mirror-c.example"));

        scheduler.runNow();
        scheduler.runNow();

        assertThat(endpointPool.size()).isEqualTo(2);
        verify(directoryClient, times(1)).fetchHealthyMirrors();
    }
}
