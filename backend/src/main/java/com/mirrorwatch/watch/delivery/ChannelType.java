package com.mirrorwatch.watch.delivery;

public enum ChannelType {
    SERVERCHAN,
    PUSHDEER,
    WEBHOOK
}
