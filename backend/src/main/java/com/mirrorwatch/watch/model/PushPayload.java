package com.mirrorwatch.watch.model;

public record PushPayload(
    String itemId,
    String accountHandle,
    String title,
    String body
) {
    public String dedupKey() {
        return accountHandle + "/" + itemId;
    }
}
