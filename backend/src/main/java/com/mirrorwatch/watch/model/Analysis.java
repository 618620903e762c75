package com.mirrorwatch.watch.model;

public record Analysis(
    String translation,
    String summary,
    String tags,
    String category,
    String raw
) {
}
