package com.ai.scheduling.dto;

import com.ai.scheduling.entity.InterviewBooking;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured event handed to the notification collaborator.
 * Carries type and payload only; rendering and delivery happen elsewhere.
 */
public final class SchedulingEvent {

    public enum Type {
        BOOKING_SCHEDULED,
        BOOKING_CONFIRMED,
        BOOKING_COMPLETED,
        BOOKING_CANCELLED,
        BOOKING_NO_SHOW,
        BOOKING_RESCHEDULED,
        INTERVIEW_REMINDER,
        SCHEDULING_PAUSED,
        SCHEDULING_RESUMED
    }

    private final Type type;
    private final Long bookingId;
    private final Long candidateId;
    private final Map<String, Object> payload;

    private SchedulingEvent(Type type, Long bookingId, Long candidateId, Map<String, Object> payload) {
        this.type = type;
        this.bookingId = bookingId;
        this.candidateId = candidateId;
        this.payload = payload == null ? Collections.emptyMap() : new HashMap<>(payload);
    }

    public Type getType() {
        return type;
    }

    public Long getBookingId() {
        return bookingId;
    }

    public Long getCandidateId() {
        return candidateId;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public String getString(String key) {
        Object v = payload.get(key);
        return v == null ? null : v.toString();
    }

    public static SchedulingEvent of(Type type) {
        return new SchedulingEvent(type, null, null, null);
    }

    public static SchedulingEvent of(Type type, Map<String, Object> payload) {
        return new SchedulingEvent(type, null, null, payload);
    }

    public static SchedulingEvent forBooking(Type type, InterviewBooking booking) {
        Map<String, Object> p = new HashMap<>();
        p.put("resourceId", booking.getResourceId());
        p.put("date", booking.getBookingDate().toString());
        p.put("time", booking.getStartTime().toString());
        p.put("durationMinutes", booking.getDurationMinutes());
        p.put("status", booking.getStatus().name());
        if (booking.getMeetingReference() != null) {
            p.put("meetingReference", booking.getMeetingReference());
        }
        return new SchedulingEvent(type, booking.getId(), booking.getCandidateId(), p);
    }

    public static SchedulingEvent rescheduled(InterviewBooking booking, String previousDate, String previousTime) {
        SchedulingEvent base = forBooking(Type.BOOKING_RESCHEDULED, booking);
        Map<String, Object> p = new HashMap<>(base.payload);
        p.put("previousDate", previousDate);
        p.put("previousTime", previousTime);
        return new SchedulingEvent(Type.BOOKING_RESCHEDULED, booking.getId(), booking.getCandidateId(), p);
    }

    public static Type forStatus(InterviewBooking.Status status) {
        switch (status) {
            case SCHEDULED: return Type.BOOKING_SCHEDULED;
            case CONFIRMED: return Type.BOOKING_CONFIRMED;
            case COMPLETED: return Type.BOOKING_COMPLETED;
            case CANCELLED: return Type.BOOKING_CANCELLED;
            case NO_SHOW: return Type.BOOKING_NO_SHOW;
            default: throw new IllegalArgumentException("Unknown status " + status);
        }
    }

    @Override
    public String toString() {
        return "SchedulingEvent{type=" + type + ", bookingId=" + bookingId + ", candidateId=" + candidateId
                + ", payload=" + payload + "}";
    }
}
