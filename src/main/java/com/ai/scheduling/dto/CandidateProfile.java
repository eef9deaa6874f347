package com.ai.scheduling.dto;

import com.ai.scheduling.entity.QueueEntry;

import java.util.List;

public record CandidateProfile(Long candidateId, QueueEntry.UrgencyLevel urgencyLevel, List<String> preferredTimes) {

    public CandidateProfile {
        preferredTimes = preferredTimes == null ? List.of() : List.copyOf(preferredTimes);
    }

    public static CandidateProfile of(Long candidateId) {
        return new CandidateProfile(candidateId, QueueEntry.UrgencyLevel.NORMAL, List.of());
    }
}
