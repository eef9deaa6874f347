package com.ai.scheduling.repository;

import com.ai.scheduling.entity.QueueEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface QueueEntryRepository extends JpaRepository<QueueEntry, Long> {

    List<QueueEntry> findByStatusOrderByPriorityScoreDescAddedAtAscIdAsc(QueueEntry.Status status, Pageable pageable);

    Optional<QueueEntry> findFirstByCandidateIdAndStatusInOrderByAddedAtDesc(
            Long candidateId,
            Collection<QueueEntry.Status> statuses
    );

    List<QueueEntry> findByStatus(QueueEntry.Status status);

    List<QueueEntry> findByStatusAndPausedByStopTrue(QueueEntry.Status status);

    boolean existsByPausedByStopTrue();

    long countByStatus(QueueEntry.Status status);

    long countByStatusAndUrgencyLevelIn(QueueEntry.Status status, Collection<QueueEntry.UrgencyLevel> levels);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT q FROM QueueEntry q WHERE q.status = :status ORDER BY q.id")
    List<QueueEntry> findByStatusForUpdate(@Param("status") QueueEntry.Status status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT q FROM QueueEntry q WHERE q.id = :id")
    Optional<QueueEntry> findByIdForUpdate(@Param("id") Long id);
}
