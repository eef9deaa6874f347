package com.ai.scheduling.dto;

import java.time.DayOfWeek;

/**
 * Observed no-show rate for one (resource, hour of day, day of week) bucket.
 */
public record RiskProfile(String resourceId,
                          int hourOfDay,
                          DayOfWeek dayOfWeek,
                          int sampleSize,
                          int noShows,
                          double observedNoShowRate) {
}
