package com.ai.scheduling.service;

import com.ai.scheduling.dto.CandidateProfile;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Heuristic risk score for a candidate increment. Must be side-effect free.
 * Scores above the configured no-show threshold make the increment a soft deny.
 */
@FunctionalInterface
public interface SlotRiskScorer {

    double score(SlotContext context);

    record SlotContext(CandidateProfile candidate, String resourceId, LocalDate date, LocalTime startTime) {
    }
}
