package com.ai.scheduling.repository;

import com.ai.scheduling.entity.InterviewBooking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface InterviewBookingRepository extends JpaRepository<InterviewBooking, Long> {

    List<InterviewBooking> findByResourceIdAndBookingDateAndStatusIn(
            String resourceId,
            LocalDate date,
            Collection<InterviewBooking.Status> statuses
    );

    long countByResourceIdAndBookingDateAndStatusIn(
            String resourceId,
            LocalDate date,
            Collection<InterviewBooking.Status> statuses
    );

    long countByResourceIdAndBookingDateBetweenAndStatusIn(
            String resourceId,
            LocalDate from,
            LocalDate to,
            Collection<InterviewBooking.Status> statuses
    );

    List<InterviewBooking> findByCreatedAtGreaterThanEqual(Instant since);

    List<InterviewBooking> findByBookingDateGreaterThanEqual(LocalDate since);

    List<InterviewBooking> findByBookingDate(LocalDate date);

    List<InterviewBooking> findByBookingDateAndStatusInAndReminderSentFalse(
            LocalDate date,
            Collection<InterviewBooking.Status> statuses
    );

    List<InterviewBooking> findByCandidateIdOrderByBookingDateDescStartTimeDesc(Long candidateId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM InterviewBooking b WHERE b.id = :id")
    Optional<InterviewBooking> findByIdForUpdate(@Param("id") Long id);
}
