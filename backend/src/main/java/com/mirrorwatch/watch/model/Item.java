package com.mirrorwatch.watch.model;

import java.time.Instant;
import java.util.List;

public record Item(
    String id,
    String accountHandle,
    String accountAlias,
    String content,
    String url,
    String publishedLabel,
    Instant publishedAt,
    Instant capturedAt,
    String screenshotRef,
    boolean pinned,
    boolean retweet,
    String retweetAuthor,
    boolean quote,
    String quoteText,
    String quoteAuthor,
    List<String> media
) {
    public Item {
        media = media == null ? List.of() : List.copyOf(media);
    }

    public boolean hasText() {
        return content != null && !content.isBlank();
    }
}
