package com.ai.scheduling.service;

import org.springframework.stereotype.Component;

/**
 * Scores an increment by the observed no-show rate of its (resource, hour, weekday) bucket.
 * Buckets without enough history score 0.
 */
@Component
public class NoShowRiskScorer implements SlotRiskScorer {

    private final RiskOptimizer riskOptimizer;

    public NoShowRiskScorer(RiskOptimizer riskOptimizer) {
        this.riskOptimizer = riskOptimizer;
    }

    @Override
    public double score(SlotContext context) {
        return riskOptimizer.observedRate(
                        context.resourceId(),
                        context.startTime().getHour(),
                        context.date().getDayOfWeek())
                .orElse(0.0);
    }
}
