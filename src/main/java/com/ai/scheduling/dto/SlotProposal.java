package com.ai.scheduling.dto;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A bookable increment returned by slot search. {@code softDenied} marks a
 * fallback chosen even though its no-show risk was above threshold.
 */
public record SlotProposal(String resourceId,
                           LocalDate date,
                           LocalTime startTime,
                           LocalTime endTime,
                           double riskScore,
                           boolean softDenied) {

    public int durationMinutes() {
        return endTime.toSecondOfDay() / 60 - startTime.toSecondOfDay() / 60;
    }
}
