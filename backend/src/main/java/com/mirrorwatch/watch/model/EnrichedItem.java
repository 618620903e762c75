package com.mirrorwatch.watch.model;

public record EnrichedItem(
    Item item,
    Analysis analysis,
    boolean analysisAvailable
) {
    public static EnrichedItem analyzed(Item item, Analysis analysis) {
        return new EnrichedItem(item, analysis, true);
    }

    public static EnrichedItem unavailable(Item item) {
        return new EnrichedItem(item, null, false);
    }
}
