package com.mirrorwatch.watch.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.dedup.DedupCache;
import com.mirrorwatch.watch.mirror.EndpointPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;

/**
 * Keeps endpoint health and seen item ids across restarts in a single JSON file.
 */
@Service
public class WatchStateStore {
    private static final Logger log = LoggerFactory.getLogger(WatchStateStore.class);
    static final String STATE_FILE = "watch-state.json";

    private final boolean enabled;
    private final Path file;
    private final ObjectMapper objectMapper;
    private final EndpointPool endpointPool;
    private final DedupCache dedupCache;
    private final Clock clock;

    public WatchStateStore(
        WatchProperties properties,
        ObjectMapper objectMapper,
        EndpointPool endpointPool,
        DedupCache dedupCache,
        Clock clock
    ) {
        this.enabled = properties.getState().isEnabled();
        this.file = Paths.get(properties.getState().getDir()).resolve(STATE_FILE);
        this.objectMapper = objectMapper;
        this.endpointPool = endpointPool;
        this.dedupCache = dedupCache;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void save() {
        if (!enabled) {
            return;
        }
        WatchState state = new WatchState(clock.instant(), endpointPool.snapshot(), dedupCache.snapshot());
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Path temp = file.resolveSibling(STATE_FILE + ".tmp");
            objectMapper.writeValue(temp.toFile(), state);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.warn("Failed to save watch state to {}", file, e);
        }
    }

    /**
     * @return {@code true} when a saved state was found and applied
     */
    public boolean restore() {
        if (!enabled || !Files.isRegularFile(file)) {
            return false;
        }
        try {
            WatchState state = objectMapper.readValue(file.toFile(), WatchState.class);
            endpointPool.restore(state.endpoints());
            dedupCache.restore(state.seenIds());
            log.info(
                "Restored watch state saved at {} ({} endpoints, {} accounts)",
                state.savedAt(),
                state.endpoints().size(),
                state.seenIds().size()
            );
            return true;
        } catch (IOException e) {
            log.warn("Ignoring unreadable watch state {}", file, e);
            return false;
        }
    }
}
