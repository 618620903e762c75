package com.mirrorwatch.watch.state;

import com.mirrorwatch.watch.model.EndpointHealth;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record WatchState(
    Instant savedAt,
    List<EndpointHealth> endpoints,
    Map<String, List<String>> seenIds
) {
    public WatchState {
        endpoints = endpoints == null ? List.of() : endpoints;
        seenIds = seenIds == null ? Map.of() : seenIds;
    }
}
