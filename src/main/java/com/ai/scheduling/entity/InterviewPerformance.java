package com.ai.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One row per calendar day of interview outcomes. Rewritten in place when the
 * day is recomputed.
 */
@Entity
@Table(name = "interview_performance", uniqueConstraints = {
    @UniqueConstraint(name = "uk_performance_date", columnNames = {"metric_date"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InterviewPerformance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "metric_date", nullable = false)
    private LocalDate metricDate;

    @Column(name = "total_scheduled", nullable = false)
    private long totalScheduled;

    @Column(name = "total_completed", nullable = false)
    private long totalCompleted;

    @Column(name = "total_no_shows", nullable = false)
    private long totalNoShows;

    @Column(name = "total_conversions", nullable = false)
    private long totalConversions;

    @Column(name = "avg_interview_duration", nullable = false)
    private double avgInterviewDuration;

    /** Completed interviews per hour of completed interview time. */
    @Column(name = "efficiency_score", nullable = false)
    private double efficiencyScore;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
    }
}
