package com.ai.scheduling.repository;

import com.ai.scheduling.entity.InterviewPerformance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface InterviewPerformanceRepository extends JpaRepository<InterviewPerformance, Long> {

    Optional<InterviewPerformance> findByMetricDate(LocalDate metricDate);

    List<InterviewPerformance> findByMetricDateGreaterThanEqualOrderByMetricDateDesc(LocalDate since);
}
