package com.mirrorwatch.watch.mirror;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.model.EndpointHealth;
import com.mirrorwatch.watch.util.ExponentialBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
public class EndpointPool {
    private static final Logger log = LoggerFactory.getLogger(EndpointPool.class);

    private final Object lock = new Object();
    private final List<MirrorEndpoint> endpoints = new ArrayList<>();
    private final Clock clock;
    private final int failureThreshold;
    private final ExponentialBackoff backoff;
    private int cursor;

    public EndpointPool(WatchProperties properties, Clock clock) {
        WatchProperties.Mirror mirror = properties.getMirror();
        this.clock = clock;
        this.failureThreshold = mirror.getFailureThreshold();
        this.backoff = new ExponentialBackoff(
            Duration.ofSeconds(mirror.getBackoffBaseSeconds()),
            Duration.ofSeconds(mirror.getBackoffMaxSeconds())
        );
        addEndpoints(mirror.getEndpoints());
        if (endpoints.isEmpty() && mirror.getDirectoryUrl().isBlank()) {
            throw new IllegalStateException("No mirror endpoints configured (watch.mirror.endpoints)");
        }
    }

    public MirrorEndpoint select() {
        return select(Set.of());
    }

    /**
     * Next available endpoint in round-robin order, skipping disabled ones and the given addresses.
     */
    public MirrorEndpoint select(Set<String> excludedAddresses) {
        Set<String> excluded = excludedAddresses == null ? Set.of() : excludedAddresses;
        synchronized (lock) {
            Instant now = clock.instant();
            int total = endpoints.size();
            for (int i = 0; i < total; i++) {
                int index = (cursor + i) % total;
                MirrorEndpoint candidate = endpoints.get(index);
                if (excluded.contains(candidate.getAddress()) || !candidate.isAvailableAt(now)) {
                    continue;
                }
                cursor = (index + 1) % total;
                return candidate;
            }
        }
        throw new NoHealthyEndpointException("All mirror endpoints are disabled or excluded");
    }

    public void reportSuccess(MirrorEndpoint endpoint) {
        if (endpoint == null) {
            return;
        }
        synchronized (lock) {
            endpoint.recordSuccess(clock.instant());
        }
    }

    public void reportFailure(MirrorEndpoint endpoint) {
        if (endpoint == null) {
            return;
        }
        Instant disabledUntil = null;
        int failures;
        synchronized (lock) {
            Instant now = clock.instant();
            failures = endpoint.recordFailure(now);
            if (failures >= failureThreshold) {
                disabledUntil = now.plus(backoff.delayFor(failures - failureThreshold + 1));
                endpoint.disableUntil(disabledUntil);
            }
        }
        if (disabledUntil != null) {
            log.warn("Mirror {} disabled until {} after {} consecutive failures", endpoint.getAddress(), disabledUntil, failures);
        }
    }

    /**
     * Adds addresses not already in the pool. Existing health records are left untouched.
     */
    public int addEndpoints(Collection<String> addresses) {
        if (addresses == null) {
            return 0;
        }
        int added = 0;
        synchronized (lock) {
            for (String address : addresses) {
                String normalized = normalizeAddress(address);
                if (normalized == null || findLocked(normalized) != null) {
                    continue;
                }
                endpoints.add(new MirrorEndpoint(normalized));
                added++;
            }
        }
        return added;
    }

    public List<EndpointHealth> snapshot() {
        synchronized (lock) {
            List<EndpointHealth> out = new ArrayList<>(endpoints.size());
            for (MirrorEndpoint endpoint : endpoints) {
                out.add(endpoint.toHealth());
            }
            return out;
        }
    }

    public void restore(Collection<EndpointHealth> snapshots) {
        if (snapshots == null) {
            return;
        }
        synchronized (lock) {
            for (EndpointHealth health : snapshots) {
                if (health == null) {
                    continue;
                }
                MirrorEndpoint endpoint = findLocked(normalizeAddress(health.address()));
                if (endpoint != null) {
                    endpoint.restore(health);
                }
            }
        }
    }

    public int size() {
        synchronized (lock) {
            return endpoints.size();
        }
    }

    private MirrorEndpoint findLocked(String address) {
        if (address == null) {
            return null;
        }
        for (MirrorEndpoint endpoint : endpoints) {
            if (endpoint.getAddress().equals(address)) {
                return endpoint;
            }
        }
        return null;
    }

    static String normalizeAddress(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        String value = address.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        if (!value.contains("://")) {
            value = "https://" + value;
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
