package com.mirrorwatch.watch.dedup;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.model.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catches the same post re-published under a new id. A post whose word set overlaps a recently
 * forwarded post of the same account by more than the threshold (Jaccard) is a near duplicate.
 */
@Service
public class SimilarContentFilter {
    private static final Logger log = LoggerFactory.getLogger(SimilarContentFilter.class);

    private final Map<String, Deque<RecentPost>> recent = new ConcurrentHashMap<>();
    private final boolean enabled;
    private final Duration window;
    private final double threshold;
    private final int maxEntries;
    private final Clock clock;

    public SimilarContentFilter(WatchProperties properties, Clock clock) {
        WatchProperties.Dedup dedup = properties.getDedup();
        this.enabled = dedup.isSimilarityEnabled();
        this.window = Duration.ofMinutes(dedup.getSimilarityWindowMinutes());
        this.threshold = dedup.getSimilarityThreshold();
        this.maxEntries = dedup.getMaxCacheSize();
        this.clock = clock;
    }

    /**
     * Checks {@code item} against the account's recent posts and, when it is not a near duplicate,
     * remembers it for later checks.
     *
     * @return {@code true} when the item repeats a recent post and should not be forwarded
     */
    public boolean isNearDuplicate(Item item) {
        if (!enabled || item == null || !item.hasText()) {
            return false;
        }
        Set<String> words = words(item.content());
        Instant now = clock.instant();
        Deque<RecentPost> posts = recent.computeIfAbsent(item.accountHandle(), ignored -> new ArrayDeque<>());
        synchronized (posts) {
            Instant horizon = now.minus(window);
            while (!posts.isEmpty() && posts.peekFirst().recordedAt().isBefore(horizon)) {
                posts.removeFirst();
            }
            for (RecentPost post : posts) {
                if (post.id().equals(item.id())) {
                    continue;
                }
                double similarity = similarity(words, post.words());
                if (similarity > threshold) {
                    log.warn(
                        "Suppressing {} from {}: {}% similar to {} forwarded at {}",
                        item.id(),
                        item.accountHandle(),
                        Math.round(similarity * 100),
                        post.id(),
                        post.recordedAt()
                    );
                    return true;
                }
            }
            posts.addLast(new RecentPost(item.id(), words, now));
            while (posts.size() > maxEntries) {
                posts.removeFirst();
            }
        }
        return false;
    }

    static Set<String> words(String text) {
        Set<String> out = new HashSet<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        out.addAll(Arrays.asList(text.strip().split("\\s+")));
        return out;
    }

    /**
     * Jaccard index of two word sets; {@code 0} when either is empty.
     */
    static double similarity(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int common = 0;
        for (String word : a) {
            if (b.contains(word)) {
                common++;
            }
        }
        int union = a.size() + b.size() - common;
        return (double) common / union;
    }

    private record RecentPost(String id, Set<String> words, Instant recordedAt) {
    }
}
