package com.ai.scheduling.repository;

import com.ai.scheduling.entity.ConversionEvent;
import org.springframework.data.repository.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only: deliberately exposes no update or delete methods.
 */
public interface ConversionEventRepository extends Repository<ConversionEvent, Long> {

    ConversionEvent save(ConversionEvent event);

    Optional<ConversionEvent> findFirstByCandidateIdOrderByIdDesc(Long candidateId);

    List<ConversionEvent> findByCandidateIdOrderByIdAsc(Long candidateId);

    List<ConversionEvent> findByCreatedAtGreaterThanEqual(Instant since);

    List<ConversionEvent> findByToStageAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(
            ConversionEvent.Stage toStage,
            Instant from,
            Instant to
    );
}
