package com.mirrorwatch.watch.fetch;

import com.mirrorwatch.watch.model.Item;

import java.util.List;

public record TimelineFetch(
    String endpoint,
    List<Item> items
) {
}
