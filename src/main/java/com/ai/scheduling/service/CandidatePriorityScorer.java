package com.ai.scheduling.service;

import com.ai.scheduling.entity.Candidate;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Lead priority heuristic used when a candidate is queued without an explicit score.
 * Result is clamped to [0, 1].
 */
@Component
public class CandidatePriorityScorer {

    static final double BASE = 0.5;

    private final Clock clock;

    public CandidatePriorityScorer(Clock clock) {
        this.clock = clock;
    }

    public double score(Candidate candidate) {
        double score = BASE;

        if (candidate.getCreatedAt() != null) {
            double daysPending = Duration.between(candidate.getCreatedAt(), clock.instant()).toMinutes() / 1440.0;
            if (daysPending > 2) score += 0.2;
            if (daysPending < 1) score += 0.1;
        }

        boolean hasEmail = StringUtils.isNotBlank(candidate.getEmail());
        boolean hasPhone = StringUtils.isNotBlank(candidate.getPhone());
        if (hasEmail && hasPhone) score += 0.1;
        if (!hasEmail && !hasPhone) score -= 0.3;

        return Math.min(1.0, Math.max(0.0, score));
    }
}
