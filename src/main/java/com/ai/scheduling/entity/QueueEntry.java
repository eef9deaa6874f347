package com.ai.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

@Entity
@Table(name = "interview_queue", indexes = {
    @Index(name = "idx_queue_status_priority", columnList = "status, priority_score, added_at"),
    @Index(name = "idx_queue_candidate", columnList = "candidate_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueueEntry {

    public enum Status { WAITING, CONTACTED, SCHEDULED, PAUSED, PROCESSED }

    public enum UrgencyLevel {
        LOW, NORMAL, HIGH, URGENT;

        public static UrgencyLevel fromPriority(double priority) {
            if (priority > 0.8) return HIGH;
            if (priority > 0.6) return NORMAL;
            return LOW;
        }
    }

    /** Statuses in which an entry still counts as the candidate's open queue position. */
    public static final Set<Status> OPEN_STATUSES =
            EnumSet.of(Status.WAITING, Status.CONTACTED, Status.SCHEDULED, Status.PAUSED);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "candidate_id", nullable = false)
    private Long candidateId;

    @Column(name = "priority_score", nullable = false)
    @Builder.Default
    private double priorityScore = 0.5;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.WAITING;

    @Column(name = "contact_attempts", nullable = false)
    private int contactAttempts;

    @Column(name = "last_contact_at")
    private Instant lastContactAt;

    /** JSON array of preferred time labels, as captured at enqueue time. */
    @Column(name = "preferred_times", length = 1000)
    private String preferredTimes;

    @Enumerated(EnumType.STRING)
    @Column(name = "urgency_level", nullable = false, length = 20)
    @Builder.Default
    private UrgencyLevel urgencyLevel = UrgencyLevel.NORMAL;

    @Column(name = "added_at", nullable = false, updatable = false)
    private Instant addedAt;

    @Column(name = "scheduled_for")
    private LocalDateTime scheduledFor;

    @Column(name = "paused_by_stop", nullable = false)
    private boolean pausedByStop;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (addedAt == null) addedAt = Instant.now();
    }
}
