package com.ai.scheduling.config;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable capacity settings for one scheduling run. Built from
 * {@link SchedulingProperties} and never changed while a run is in progress.
 */
public record CapacityConfig(int slotDurationMinutes,
                             int bufferMinutes,
                             boolean enforceBuffer,
                             int maxDailyBookings,
                             int maxWeeklyBookings,
                             List<WorkingBlock> workingHours,
                             Set<DayOfWeek> workingDays) {

    public CapacityConfig {
        if (slotDurationMinutes <= 0) {
            throw new IllegalArgumentException("slotDurationMinutes must be positive");
        }
        if (bufferMinutes < 0) {
            throw new IllegalArgumentException("bufferMinutes must not be negative");
        }
        if (maxDailyBookings < 0 || maxWeeklyBookings < 0) {
            throw new IllegalArgumentException("booking ceilings must not be negative");
        }
        workingHours = workingHours == null ? List.of() : List.copyOf(workingHours);
        workingDays = workingDays == null || workingDays.isEmpty()
                ? EnumSet.noneOf(DayOfWeek.class)
                : EnumSet.copyOf(workingDays);
    }

    public static CapacityConfig defaults() {
        return new CapacityConfig(30, 15, false, 20, 100,
                List.of(new WorkingBlock(LocalTime.of(9, 0), LocalTime.of(13, 0)),
                        new WorkingBlock(LocalTime.of(14, 0), LocalTime.of(18, 0))),
                EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));
    }

    public CapacityConfig withMaxDailyBookings(int max) {
        return new CapacityConfig(slotDurationMinutes, bufferMinutes, enforceBuffer, max, maxWeeklyBookings,
                workingHours, workingDays);
    }

    public CapacityConfig withMaxWeeklyBookings(int max) {
        return new CapacityConfig(slotDurationMinutes, bufferMinutes, enforceBuffer, maxDailyBookings, max,
                workingHours, workingDays);
    }

    public record WorkingBlock(LocalTime start, LocalTime end) {

        public WorkingBlock {
            if (start == null || end == null || !start.isBefore(end)) {
                throw new IllegalArgumentException("Working block start must be before end: " + start + "-" + end);
            }
        }

        /** Parses "HH:mm-HH:mm". */
        public static WorkingBlock parse(String raw) {
            String[] parts = raw.trim().split("-");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Working block must look like HH:mm-HH:mm: " + raw);
            }
            return new WorkingBlock(LocalTime.parse(parts[0].trim()), LocalTime.parse(parts[1].trim()));
        }
    }
}
