package com.ai.scheduling.dto;

import com.ai.scheduling.entity.QueueEntry;

import java.time.Instant;
import java.util.Map;

public record SchedulingStatus(boolean stopped,
                               boolean cycleRunning,
                               long todayScheduled,
                               long todayCompleted,
                               long queueLength,
                               long highPriorityQueue,
                               CapacityCheck capacity,
                               Map<QueueEntry.Status, Long> queue,
                               Instant lastUpdate) {
}
