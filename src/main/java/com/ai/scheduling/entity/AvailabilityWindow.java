package com.ai.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

@Entity
@Table(name = "availability_window", indexes = {
    @Index(name = "idx_window_resource_date", columnList = "resource_id, window_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AvailabilityWindow {

    public enum Kind { INTERVIEW, BREAK, BLOCKED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", nullable = false, length = 50)
    private String resourceId;

    @Column(name = "window_date", nullable = false)
    private LocalDate windowDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(nullable = false)
    @Builder.Default
    private boolean available = true;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Kind kind = Kind.INTERVIEW;

    @Column(length = 500)
    private String notes;

    /** Set only when the emergency stop disabled this window, so resume can restore it. */
    @Column(name = "disabled_by_stop", nullable = false)
    @Builder.Default
    private boolean disabledByStop = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isWellFormed() {
        return startTime != null && endTime != null && startTime.isBefore(endTime);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
