package com.mirrorwatch.watch.model;

public enum AccountCheckOutcome {
    CHECKED,
    NO_HEALTHY_ENDPOINT,
    FETCH_FAILED,
    ERROR
}
