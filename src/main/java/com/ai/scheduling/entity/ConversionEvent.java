package com.ai.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Append-only funnel log row. Never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "conversion_event", indexes = {
    @Index(name = "idx_conversion_candidate", columnList = "candidate_id")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversionEvent {

    public enum Stage { PENDING, CONTACTED, SCHEDULED, INTERVIEWED, ACTIVE, REJECTED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "candidate_id", nullable = false, updatable = false)
    private Long candidateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_stage", nullable = false, updatable = false, length = 20)
    private Stage fromStage;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_stage", nullable = false, updatable = false, length = 20)
    private Stage toStage;

    @Column(nullable = false, updatable = false, length = 50)
    private String method;

    @Column(updatable = false, length = 1000)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
