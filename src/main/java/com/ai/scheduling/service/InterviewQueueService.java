package com.ai.scheduling.service;

import com.ai.scheduling.component.SchedulingCriticalSection;
import com.ai.scheduling.dto.CandidateProfile;
import com.ai.scheduling.entity.Candidate;
import com.ai.scheduling.entity.QueueEntry;
import com.ai.scheduling.exception.SchedulingIntegrityException;
import com.ai.scheduling.repository.CandidateRepository;
import com.ai.scheduling.repository.QueueEntryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point into the interview queue. A candidate holds at most one open entry.
 */
@Service
public class InterviewQueueService {

    private static final Logger log = LoggerFactory.getLogger(InterviewQueueService.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final QueueEntryRepository queueRepository;
    private final CandidateRepository candidateRepository;
    private final CandidatePriorityScorer priorityScorer;
    private final ControlSwitch controlSwitch;
    private final SchedulingCriticalSection criticalSection;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InterviewQueueService(QueueEntryRepository queueRepository,
                                 CandidateRepository candidateRepository,
                                 CandidatePriorityScorer priorityScorer,
                                 ControlSwitch controlSwitch,
                                 SchedulingCriticalSection criticalSection,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.queueRepository = queueRepository;
        this.candidateRepository = candidateRepository;
        this.priorityScorer = priorityScorer;
        this.controlSwitch = controlSwitch;
        this.criticalSection = criticalSection;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Queues a candidate, or returns the candidate's existing open entry unchanged.
     * A null priority is derived from the candidate record.
     * <p>
     * Runs under the queue key so it cannot interleave with an emergency stop sweep;
     * the candidate row lock keeps one open entry per candidate across instances.
     */
    public QueueEntry enqueue(Long candidateId, Double priority, List<String> preferredTimes) {
        if (candidateId == null) {
            throw new IllegalArgumentException("candidateId is required");
        }
        if (priority != null && (priority.isNaN() || priority < 0.0 || priority > 1.0)) {
            throw new IllegalArgumentException("priority must be between 0 and 1");
        }
        String preferredJson = toJson(preferredTimes);

        return criticalSection.execute(SchedulingCriticalSection.QUEUE_KEY, () -> {
            Candidate candidate = candidateRepository.findByIdForUpdate(candidateId)
                    .orElseThrow(() -> new SchedulingIntegrityException("Candidate " + candidateId + " does not exist"));

            Optional<QueueEntry> existing = queueRepository.findFirstByCandidateIdAndStatusInOrderByAddedAtDesc(
                    candidateId, QueueEntry.OPEN_STATUSES);
            if (existing.isPresent()) {
                log.info("Candidate {} already queued as entry {} ({})", candidateId,
                        existing.get().getId(), existing.get().getStatus());
                return existing.get();
            }

            double score = priority != null ? priority : priorityScorer.score(candidate);
            boolean stopped = controlSwitch.isStopped();
            QueueEntry entry = queueRepository.save(QueueEntry.builder()
                    .candidateId(candidateId)
                    .priorityScore(score)
                    .urgencyLevel(QueueEntry.UrgencyLevel.fromPriority(score))
                    .preferredTimes(preferredJson)
                    .status(stopped ? QueueEntry.Status.PAUSED : QueueEntry.Status.WAITING)
                    .pausedByStop(stopped)
                    .addedAt(clock.instant())
                    .build());
            log.info("Queued candidate {} as entry {} priority={} urgency={}{}", candidateId, entry.getId(),
                    score, entry.getUrgencyLevel(), stopped ? " (paused: scheduling stopped)" : "");
            return entry;
        });
    }

    public CandidateProfile profileOf(QueueEntry entry) {
        return new CandidateProfile(entry.getCandidateId(), entry.getUrgencyLevel(),
                parsePreferredTimes(entry.getPreferredTimes()));
    }

    @Transactional(readOnly = true)
    public List<QueueEntry> waiting() {
        return queueRepository.findByStatus(QueueEntry.Status.WAITING);
    }

    @Transactional(readOnly = true)
    public Map<QueueEntry.Status, Long> statusCounts() {
        Map<QueueEntry.Status, Long> counts = new EnumMap<>(QueueEntry.Status.class);
        for (QueueEntry.Status s : QueueEntry.Status.values()) {
            counts.put(s, queueRepository.countByStatus(s));
        }
        return counts;
    }

    List<String> parsePreferredTimes(String json) {
        if (StringUtils.isBlank(json)) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable preferred times '{}': {}", json, e.getOriginalMessage());
            return List.of();
        }
    }

    private String toJson(List<String> preferredTimes) {
        if (preferredTimes == null || preferredTimes.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(preferredTimes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("preferredTimes cannot be serialized", e);
        }
    }
}
