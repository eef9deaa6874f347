package com.ai.scheduling.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * Interview outcomes over a trailing period, newest day first.
 */
public record SchedulingAnalytics(int days, LocalDate since, Summary summary, List<DailyStats> dailyBreakdown) {

    public record Summary(long totalScheduled,
                          long totalCompleted,
                          long totalNoShows,
                          double avgDurationMinutes,
                          long conversions,
                          double completionRate,
                          double noShowRate,
                          double conversionRate) {
    }

    public record DailyStats(LocalDate date, long scheduled, long completed, long noShows, double avgDurationMinutes) {
    }
}
