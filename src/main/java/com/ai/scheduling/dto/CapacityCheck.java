package com.ai.scheduling.dto;

public record CapacityCheck(boolean canSchedule, String reason, long dailyRemaining, long weeklyRemaining) {

    public static CapacityCheck available(long dailyRemaining, long weeklyRemaining) {
        return new CapacityCheck(true, null, dailyRemaining, weeklyRemaining);
    }

    public static CapacityCheck exhausted(String reason, long dailyRemaining, long weeklyRemaining) {
        return new CapacityCheck(false, reason, dailyRemaining, weeklyRemaining);
    }
}
