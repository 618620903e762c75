package com.mirrorwatch.watch.service;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.analysis.EnrichmentService;
import com.mirrorwatch.watch.archive.ArchiveSink;
import com.mirrorwatch.watch.dedup.DedupCache;
import com.mirrorwatch.watch.dedup.SimilarContentFilter;
import com.mirrorwatch.watch.delivery.ChannelRegistry;
import com.mirrorwatch.watch.delivery.DeliveryQueue;
import com.mirrorwatch.watch.delivery.PushMessageFormatter;
import com.mirrorwatch.watch.delivery.PushTask;
import com.mirrorwatch.watch.fetch.FetchException;
import com.mirrorwatch.watch.fetch.TimelineFetch;
import com.mirrorwatch.watch.fetch.TimelineFetcher;
import com.mirrorwatch.watch.mirror.NoHealthyEndpointException;
import com.mirrorwatch.watch.model.AccountCheckOutcome;
import com.mirrorwatch.watch.model.AccountCheckResult;
import com.mirrorwatch.watch.model.CyclePhase;
import com.mirrorwatch.watch.model.EnrichedItem;
import com.mirrorwatch.watch.model.Item;
import com.mirrorwatch.watch.model.TrackedAccount;
import com.mirrorwatch.watch.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One account's pass of a cycle: fetch, dedup, enrich, enqueue. Never throws; every outcome is
 * reported as an {@link AccountCheckResult}.
 */
@Service
public class AccountCheckService {
    private static final Logger log = LoggerFactory.getLogger(AccountCheckService.class);

    private final TimelineFetcher fetcher;
    private final DedupCache dedupCache;
    private final SimilarContentFilter similarContentFilter;
    private final EnrichmentService enrichmentService;
    private final PushMessageFormatter formatter;
    private final DeliveryQueue deliveryQueue;
    private final ChannelRegistry channelRegistry;
    private final ArchiveSink archiveSink;
    private final WatchProperties properties;
    private final Clock clock;
    private final Map<String, CyclePhase> accountPhases = new ConcurrentHashMap<>();

    public AccountCheckService(
        TimelineFetcher fetcher,
        DedupCache dedupCache,
        SimilarContentFilter similarContentFilter,
        EnrichmentService enrichmentService,
        PushMessageFormatter formatter,
        DeliveryQueue deliveryQueue,
        ChannelRegistry channelRegistry,
        ArchiveSink archiveSink,
        WatchProperties properties,
        Clock clock
    ) {
        this.fetcher = fetcher;
        this.dedupCache = dedupCache;
        this.similarContentFilter = similarContentFilter;
        this.enrichmentService = enrichmentService;
        this.formatter = formatter;
        this.deliveryQueue = deliveryQueue;
        this.channelRegistry = channelRegistry;
        this.archiveSink = archiveSink;
        this.properties = properties;
        this.clock = clock;
    }

    public AccountCheckResult check(TrackedAccount account) {
        try {
            return checkUnsafe(account);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while checking {}", account.handle(), e);
            return AccountCheckResult.skipped(account, AccountCheckOutcome.ERROR, ReasonCodeClassifier.UNKNOWN);
        } finally {
            accountPhases.remove(account.handle());
        }
    }

    /**
     * Phase of every account currently being checked, keyed by handle.
     */
    public Map<String, CyclePhase> accountPhases() {
        return Map.copyOf(accountPhases);
    }

    private AccountCheckResult checkUnsafe(TrackedAccount account) {
        TimelineFetch fetch;
        accountPhases.put(account.handle(), CyclePhase.FETCHING);
        try {
            fetch = fetchWithRetry(account);
        } catch (NoHealthyEndpointException e) {
            log.warn("Skipping {} this cycle: {}", account.handle(), e.getMessage());
            return AccountCheckResult.skipped(account, AccountCheckOutcome.NO_HEALTHY_ENDPOINT, ReasonCodeClassifier.NO_HEALTHY_ENDPOINT);
        } catch (FetchException e) {
            return new AccountCheckResult(
                account.alias(),
                account.handle(),
                AccountCheckOutcome.FETCH_FAILED,
                0,
                0,
                0,
                0,
                0,
                e.getEndpoint(),
                e.getReasonCode()
            );
        }

        accountPhases.put(account.handle(), CyclePhase.DEDUPING);
        List<Item> fresh = dedupCache.filterNew(account.handle(), fetch.items());
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getScheduler().getMaxItemAgeDays()));
        int stale = 0;
        int suppressed = 0;
        int enqueued = 0;
        int forwarded = 0;
        for (Item item : fresh) {
            if (item.publishedAt() != null && item.publishedAt().isBefore(cutoff)) {
                stale++;
                log.debug("Not forwarding {} from {}: published {}", item.id(), account.handle(), item.publishedAt());
                continue;
            }
            if (similarContentFilter.isNearDuplicate(item)) {
                suppressed++;
                continue;
            }
            accountPhases.put(account.handle(), CyclePhase.ENRICHING);
            EnrichedItem enriched = enrichmentService.enrich(item);
            archiveSink.archiveItem(item);
            if (enriched.analysisAvailable()) {
                archiveSink.archiveAnalysis(item, enriched.analysis());
            }
            accountPhases.put(account.handle(), CyclePhase.ENQUEUING);
            List<PushTask> tasks = deliveryQueue.enqueue(formatter.format(enriched), channelRegistry.enabledChannels());
            enqueued += tasks.size();
            forwarded++;
        }

        log.info(
            "Checked {} ({}) via {}: fetched={} new={} stale={} similar={} forwarded={} tasks={}",
            account.alias(),
            account.handle(),
            fetch.endpoint(),
            fetch.items().size(),
            fresh.size(),
            stale,
            suppressed,
            forwarded,
            enqueued
        );
        return new AccountCheckResult(
            account.alias(),
            account.handle(),
            AccountCheckOutcome.CHECKED,
            fetch.items().size(),
            fresh.size(),
            stale,
            suppressed,
            enqueued,
            fetch.endpoint(),
            null
        );
    }

    private TimelineFetch fetchWithRetry(TrackedAccount account) {
        try {
            return fetcher.fetch(account, Set.of());
        } catch (FetchException first) {
            if (!properties.getScheduler().isRetryWithAlternateEndpoint() || first.getEndpoint() == null) {
                throw first;
            }
            log.warn("Retrying {} on another mirror after {} from {}", account.handle(), first.getReasonCode(), first.getEndpoint());
            try {
                return fetcher.fetch(account, Set.of(first.getEndpoint()));
            } catch (NoHealthyEndpointException none) {
                log.warn("No other mirror available for {}: {}", account.handle(), none.getMessage());
                throw first;
            }
        }
    }
}
