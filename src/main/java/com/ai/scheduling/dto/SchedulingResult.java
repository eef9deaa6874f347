package com.ai.scheduling.dto;

import com.ai.scheduling.entity.InterviewBooking;

/**
 * Outcome of a booking operation. Recoverable failures are reported here rather than thrown.
 */
public record SchedulingResult(Outcome outcome, Reason reason, String message, InterviewBooking booking) {

    public enum Outcome { SUCCESS, NOT_FOUND, POLICY_VIOLATION, CONFLICT }

    public enum Reason {
        NONE,
        UNCHANGED,
        NO_SLOT_AVAILABLE,
        BOOKING_NOT_FOUND,
        SLOT_TAKEN,
        SLOT_IN_PAST,
        DAILY_CAPACITY_REACHED,
        WEEKLY_CAPACITY_REACHED,
        RESCHEDULE_LOCKED,
        NOT_RESCHEDULABLE,
        ILLEGAL_TRANSITION,
        ENTRY_NOT_WAITING,
        SCHEDULING_PAUSED
    }

    public boolean success() {
        return outcome == Outcome.SUCCESS;
    }

    public static SchedulingResult success(InterviewBooking booking) {
        return new SchedulingResult(Outcome.SUCCESS, Reason.NONE, null, booking);
    }

    public static SchedulingResult unchanged(InterviewBooking booking) {
        return new SchedulingResult(Outcome.SUCCESS, Reason.UNCHANGED, "Booking already in requested status.", booking);
    }

    public static SchedulingResult notFound(Reason reason, String message) {
        return new SchedulingResult(Outcome.NOT_FOUND, reason, message, null);
    }

    public static SchedulingResult policyViolation(Reason reason, String message) {
        return new SchedulingResult(Outcome.POLICY_VIOLATION, reason, message, null);
    }

    public static SchedulingResult conflict(Reason reason, String message) {
        return new SchedulingResult(Outcome.CONFLICT, reason, message, null);
    }
}
