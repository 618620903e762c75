package com.mirrorwatch.watch.fetch;

import com.mirrorwatch.watch.model.Item;

import java.util.List;

/**
 * @param entryCount timeline entries found in the markup, including ones that could not be read
 * @param items      entries turned into items, in page order
 */
public record ParsedTimeline(
    int entryCount,
    List<Item> items
) {
}
