package com.ai.scheduling.dto;

import com.ai.scheduling.entity.InterviewBooking;

import java.time.LocalDate;
import java.time.LocalTime;

public record BookingRequest(Long candidateId,
                             String resourceId,
                             LocalDate date,
                             LocalTime startTime,
                             InterviewBooking.InterviewType interviewType,
                             String notes) {

    public static BookingRequest fromProposal(Long candidateId, SlotProposal slot, String notes) {
        return new BookingRequest(candidateId, slot.resourceId(), slot.date(), slot.startTime(),
                InterviewBooking.InterviewType.ONBOARDING, notes);
    }
}
