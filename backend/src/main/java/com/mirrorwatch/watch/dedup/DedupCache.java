package com.mirrorwatch.watch.dedup;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.model.Item;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-account record of item ids already seen, bounded to the most recent ids (oldest evicted first).
 * Each account has its own lock; accounts never block one another.
 */
@Service
public class DedupCache {
    private final int maxCacheSize;
    private final Map<String, SeenIds> records = new ConcurrentHashMap<>();

    public DedupCache(WatchProperties properties) {
        this.maxCacheSize = properties.getDedup().getMaxCacheSize();
    }

    /**
     * Returns the items whose id was not seen before for {@code accountHandle}, in input order, and
     * records their ids. An id repeated within {@code items} is returned once.
     */
    public List<Item> filterNew(String accountHandle, List<Item> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        SeenIds seen = records.computeIfAbsent(accountHandle, ignored -> new SeenIds());
        List<Item> fresh = new ArrayList<>();
        synchronized (seen) {
            for (Item item : items) {
                if (item == null || item.id() == null || item.id().isBlank()) {
                    continue;
                }
                if (seen.ids.contains(item.id())) {
                    continue;
                }
                seen.add(item.id(), maxCacheSize);
                fresh.add(item);
            }
        }
        return fresh;
    }

    public boolean contains(String accountHandle, String itemId) {
        SeenIds seen = records.get(accountHandle);
        if (seen == null) {
            return false;
        }
        synchronized (seen) {
            return seen.ids.contains(itemId);
        }
    }

    public int size(String accountHandle) {
        SeenIds seen = records.get(accountHandle);
        if (seen == null) {
            return 0;
        }
        synchronized (seen) {
            return seen.ids.size();
        }
    }

    /**
     * Ids per account, oldest first.
     */
    public Map<String, List<String>> snapshot() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, SeenIds> entry : records.entrySet()) {
            SeenIds seen = entry.getValue();
            synchronized (seen) {
                out.put(entry.getKey(), new ArrayList<>(seen.ids));
            }
        }
        return out;
    }

    public void restore(Map<String, ? extends Collection<String>> snapshot) {
        if (snapshot == null) {
            return;
        }
        for (Map.Entry<String, ? extends Collection<String>> entry : snapshot.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            SeenIds seen = records.computeIfAbsent(entry.getKey(), ignored -> new SeenIds());
            synchronized (seen) {
                for (String id : entry.getValue()) {
                    if (id != null && !id.isBlank()) {
                        seen.add(id, maxCacheSize);
                    }
                }
            }
        }
    }

    private static final class SeenIds {
        private final LinkedHashSet<String> ids = new LinkedHashSet<>();

        void add(String id, int capacity) {
            ids.add(id);
            Iterator<String> oldest = ids.iterator();
            while (ids.size() > capacity && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
            }
        }
    }
}
