package com.mirrorwatch.watch.model;

import java.util.List;
import java.util.Map;

public record WatchStatusResponse(
    boolean running,
    CyclePhase phase,
    Map<String, CyclePhase> accountPhases,
    long skippedCycles,
    CycleSummary lastCycle,
    List<EndpointHealth> endpoints,
    DeliveryQueueStats delivery,
    List<DeadLetterRecord> recentDeadLetters
) {
}
