package com.ai.scheduling.repository;

import com.ai.scheduling.entity.Candidate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.Optional;

public interface CandidateRepository extends JpaRepository<Candidate, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Candidate c WHERE c.id = :id")
    Optional<Candidate> findByIdForUpdate(@Param("id") Long id);
}
