package com.mirrorwatch.watch.mirror;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.model.EndpointHealth;
import com.mirrorwatch.watch.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointPoolTest {
    private static final String A = "https://mirror-a.example";
    private static final String B = "https://mirror-b.example";

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));

    @Test
    void failingEndpointIsSkippedUntilItsBackoffElapses() {
        EndpointPool pool = pool(5, List.of(A, B));
        MirrorEndpoint a = find(pool, A);

        for (int i = 0; i < 5; i++) {
            pool.reportFailure(a);
        }

        assertThat(a.getDisabledUntil()).isEqualTo(clock.instant().plusSeconds(60));
        for (int i = 0; i < 10; i++) {
            assertThat(pool.select().getAddress()).isEqualTo(B);
        }

        clock.advance(Duration.ofSeconds(59));
        assertThat(pool.select().getAddress()).isEqualTo(B);
        assertThat(pool.select().getAddress()).isEqualTo(B);

        clock.advance(Duration.ofSeconds(1));
        assertThat(List.of(pool.select().getAddress(), pool.select().getAddress())).containsExactlyInAnyOrder(A, B);
    }

    @Test
    void endpointStaysEnabledBelowThreshold() {
        EndpointPool pool = pool(3, List.of(A));
        MirrorEndpoint a = find(pool, A);

        pool.reportFailure(a);
        pool.reportFailure(a);

        assertThat(a.getConsecutiveFailures()).isEqualTo(2);
        assertThat(a.getDisabledUntil()).isNull();
        assertThat(pool.select()).isSameAs(a);
    }

    @Test
    void backoffDoublesPerFailureAndIsCapped() {
        EndpointPool pool = pool(1, List.of(A));
        MirrorEndpoint a = find(pool, A);
        Instant now = clock.instant();

        pool.reportFailure(a);
        assertThat(a.getDisabledUntil()).isEqualTo(now.plusSeconds(60));
        pool.reportFailure(a);
        assertThat(a.getDisabledUntil()).isEqualTo(now.plusSeconds(120));
        pool.reportFailure(a);
        assertThat(a.getDisabledUntil()).isEqualTo(now.plusSeconds(240));

        for (int i = 0; i < 20; i++) {
            pool.reportFailure(a);
        }
        assertThat(a.getDisabledUntil()).isEqualTo(now.plusSeconds(3600));
    }

    @Test
    void successClearsFailuresAndReenables() {
        EndpointPool pool = pool(1, List.of(A));
        MirrorEndpoint a = find(pool, A);
        pool.reportFailure(a);
        assertThatThrownBy(pool::select).isInstanceOf(NoHealthyEndpointException.class);

        pool.reportSuccess(a);

        assertThat(a.getConsecutiveFailures()).isZero();
        assertThat(a.getDisabledUntil()).isNull();
        assertThat(pool.select()).isSameAs(a);
    }

    @Test
    void throwsWhenEveryEndpointIsDisabled() {
        EndpointPool pool = pool(1, List.of(A, B));
        pool.reportFailure(find(pool, A));
        pool.reportFailure(find(pool, B));

        assertThatThrownBy(pool::select).isInstanceOf(NoHealthyEndpointException.class);
    }

    @Test
    void selectRoundRobinsAndHonoursExclusions() {
        EndpointPool pool = pool(3, List.of(A, B));

        assertThat(pool.select().getAddress()).isEqualTo(A);
        assertThat(pool.select().getAddress()).isEqualTo(B);
        assertThat(pool.select().getAddress()).isEqualTo(A);
        assertThat(pool.select(Set.of(A, "https://unknown.example")).getAddress()).isEqualTo(B);
        assertThatThrownBy(() -> pool.select(Set.of(A, B))).isInstanceOf(NoHealthyEndpointException.class);
    }

    @Test
    void addEndpointsNormalizesAndIgnoresDuplicates() {
        EndpointPool pool = pool(3, List.of(A));

        int added = pool.addEndpoints(List.of("mirror-a.example/", "HTTPS://Mirror-C.example", " ", B));

        assertThat(added).isEqualTo(2);
        assertThat(pool.snapshot()).extracting(EndpointHealth::address)
            .containsExactly(A, "https://mirror-c.example", B);
    }

    @Test
    void restoreAppliesSavedHealthToKnownEndpoints() {
        EndpointPool pool = pool(3, List.of(A, B));
        Instant until = clock.instant().plusSeconds(300);

        pool.restore(List.of(
            new EndpointHealth(A, 4, clock.instant(), until, 10, 4),
            new EndpointHealth("https://gone.example", 9, null, null, 0, 9)
        ));

        EndpointHealth restored = pool.snapshot().get(0);
        assertThat(restored.consecutiveFailures()).isEqualTo(4);
        assertThat(restored.disabledUntil()).isEqualTo(until);
        assertThat(restored.successCount()).isEqualTo(10);
        assertThat(pool.size()).isEqualTo(2);
        assertThat(pool.select().getAddress()).isEqualTo(B);
    }

    @Test
    void startupFailsWithoutMirrors() {
        WatchProperties properties = new WatchProperties();

        assertThatThrownBy(() -> new EndpointPool(properties, clock))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("watch.mirror.endpoints");
    }

    private EndpointPool pool(int threshold, List<String> addresses) {
        WatchProperties properties = new WatchProperties();
        properties.getMirror().setEndpoints(addresses);
        properties.getMirror().setFailureThreshold(threshold);
        properties.getMirror().setBackoffBaseSeconds(60);
        properties.getMirror().setBackoffMaxSeconds(3600);
        return new EndpointPool(properties, clock);
    }

    private static MirrorEndpoint find(EndpointPool pool, String address) {
        for (int i = 0; i < pool.size(); i++) {
            MirrorEndpoint endpoint = pool.select();
            if (endpoint.getAddress().equals(address)) {
                return endpoint;
            }
        }
        throw new AssertionError("No endpoint " + address);
    }
}
