package com.mirrorwatch.watch.analysis;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.model.Analysis;
import com.mirrorwatch.watch.model.EnrichedItem;
import com.mirrorwatch.watch.model.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Attaches an analysis to an item. Never fails: when analysis is disabled, pointless or
 * unavailable the item goes on without one.
 */
@Service
public class EnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    private final AnalysisClient analysisClient;
    private final boolean enabled;

    public EnrichmentService(AnalysisClient analysisClient, WatchProperties properties) {
        this.analysisClient = analysisClient;
        this.enabled = properties.getAnalysis().isEnabled();
    }

    public EnrichedItem enrich(Item item) {
        if (!enabled) {
            return EnrichedItem.unavailable(item);
        }
        if (AnalysisText.prepare(item).isEmpty()) {
            log.debug("Skipping analysis of {} ({}): no text beyond links and media", item.id(), item.accountHandle());
            return EnrichedItem.unavailable(item);
        }
        try {
            Analysis analysis = analysisClient.analyze(item);
            return EnrichedItem.analyzed(item, analysis);
        } catch (AnalysisUnavailableException e) {
            log.warn("Analysis unavailable for {} ({}): {}", item.id(), item.accountHandle(), e.getMessage());
            return EnrichedItem.unavailable(item);
        } catch (RuntimeException e) {
            log.warn("Analysis failed for {} ({})", item.id(), item.accountHandle(), e);
            return EnrichedItem.unavailable(item);
        }
    }
}
