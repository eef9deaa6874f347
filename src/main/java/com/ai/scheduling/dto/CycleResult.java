package com.ai.scheduling.dto;

import java.util.List;

/**
 * Summary of one queue processing cycle.
 */
public record CycleResult(int processedCount,
                          int scheduledCount,
                          int failedCount,
                          boolean stoppedOnCapacity,
                          boolean rejected,
                          List<Failure> failures) {

    public CycleResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static CycleResult rejectedCycle() {
        return new CycleResult(0, 0, 0, false, true, List.of());
    }

    public static CycleResult paused() {
        return new CycleResult(0, 0, 0, false, false, List.of());
    }

    public record Failure(Long queueEntryId, Long candidateId, String reason) {
    }
}
