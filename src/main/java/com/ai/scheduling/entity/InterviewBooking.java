package com.ai.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Set;

@Entity
@Table(name = "interview_booking", indexes = {
    @Index(name = "idx_booking_resource_date", columnList = "resource_id, booking_date"),
    @Index(name = "idx_booking_candidate", columnList = "candidate_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_booking_live_slot", columnNames = {"live_slot_key"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InterviewBooking {

    public enum Status {
        SCHEDULED, CONFIRMED, COMPLETED, CANCELLED, NO_SHOW;

        public boolean isLive() {
            return this == SCHEDULED || this == CONFIRMED;
        }
    }

    public enum InterviewType { ONBOARDING, SCREENING, FOLLOW_UP }

    public static final Set<Status> LIVE_STATUSES = EnumSet.of(Status.SCHEDULED, Status.CONFIRMED);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "candidate_id", nullable = false)
    private Long candidateId;

    @Column(name = "resource_id", nullable = false, length = 50)
    private String resourceId;

    @Column(name = "booking_date", nullable = false)
    private LocalDate bookingDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.SCHEDULED;

    @Enumerated(EnumType.STRING)
    @Column(name = "interview_type", nullable = false, length = 20)
    @Builder.Default
    private InterviewType interviewType = InterviewType.ONBOARDING;

    @Column(name = "meeting_reference", length = 200)
    private String meetingReference;

    @Column(name = "reminder_sent", nullable = false)
    private boolean reminderSent;

    /**
     * Set once the BOOKING_SCHEDULED event has been published. Delivery to the
     * candidate belongs to whoever listens for that event, not to this flag.
     */
    @Column(name = "confirmation_sent", nullable = false)
    private boolean confirmationSent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(length = 2000)
    private String notes;

    /**
     * resourceId|date|HH:mm while the booking is live, null otherwise.
     * Unique, so the database refuses a second live booking on the same start.
     */
    @Column(name = "live_slot_key", length = 100)
    private String liveSlotKey;

    @Version
    private Long version;

    public LocalDateTime startsAt() {
        return LocalDateTime.of(bookingDate, startTime);
    }

    public LocalTime endTime() {
        return startTime.plusMinutes(durationMinutes);
    }

    public boolean isLive() {
        return status != null && status.isLive();
    }

    public void syncLiveSlotKey() {
        liveSlotKey = isLive() ? slotKey(resourceId, bookingDate, startTime) : null;
    }

    public static String slotKey(String resourceId, LocalDate date, LocalTime time) {
        return resourceId + "|" + date + "|" + time.withSecond(0).withNano(0);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        syncLiveSlotKey();
    }
}
