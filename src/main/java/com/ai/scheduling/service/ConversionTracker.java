package com.ai.scheduling.service;

import com.ai.scheduling.entity.ConversionEvent;
import com.ai.scheduling.repository.ConversionEventRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Funnel audit log. Advisory only: nothing in scheduling reads it back to make a decision.
 */
@Service
public class ConversionTracker {

    private static final Logger log = LoggerFactory.getLogger(ConversionTracker.class);

    private final ConversionEventRepository repository;
    private final Clock clock;

    public ConversionTracker(ConversionEventRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional
    public ConversionEvent record(Long candidateId, ConversionEvent.Stage toStage, String method, String notes) {
        if (candidateId == null || toStage == null) {
            throw new IllegalArgumentException("candidateId and toStage are required");
        }
        ConversionEvent.Stage fromStage = repository.findFirstByCandidateIdOrderByIdDesc(candidateId)
                .map(ConversionEvent::getToStage)
                .orElse(ConversionEvent.Stage.PENDING);
        ConversionEvent saved = repository.save(ConversionEvent.builder()
                .candidateId(candidateId)
                .fromStage(fromStage)
                .toStage(toStage)
                .method(StringUtils.defaultIfBlank(method, "manual"))
                .notes(StringUtils.abbreviate(notes, 1000))
                .createdAt(clock.instant())
                .build());
        log.debug("Conversion candidate={} {} -> {} via {}", candidateId, fromStage, toStage, saved.getMethod());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ConversionEvent> history(Long candidateId) {
        return repository.findByCandidateIdOrderByIdAsc(candidateId);
    }

    /** Count of events reaching each stage over the last {@code days} days. */
    @Transactional(readOnly = true)
    public Map<ConversionEvent.Stage, Long> stageCounts(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        Instant since = clock.instant().minus(Duration.ofDays(days));
        Map<ConversionEvent.Stage, Long> counts = new EnumMap<>(ConversionEvent.Stage.class);
        for (ConversionEvent.Stage s : ConversionEvent.Stage.values()) {
            counts.put(s, 0L);
        }
        for (ConversionEvent e : repository.findByCreatedAtGreaterThanEqual(since)) {
            counts.merge(e.getToStage(), 1L, Long::sum);
        }
        return counts;
    }
}
