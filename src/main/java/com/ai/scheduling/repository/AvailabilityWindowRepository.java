package com.ai.scheduling.repository;

import com.ai.scheduling.entity.AvailabilityWindow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface AvailabilityWindowRepository extends JpaRepository<AvailabilityWindow, Long> {

    List<AvailabilityWindow> findByResourceIdAndWindowDateBetweenAndAvailableTrueAndKindOrderByWindowDateAscStartTimeAsc(
            String resourceId,
            LocalDate from,
            LocalDate to,
            AvailabilityWindow.Kind kind
    );

    List<AvailabilityWindow> findByWindowDateAndAvailableTrue(LocalDate date);

    List<AvailabilityWindow> findByDisabledByStopTrue();

    boolean existsByDisabledByStopTrue();

    boolean existsByResourceId(String resourceId);

    boolean existsByResourceIdAndWindowDateGreaterThanEqual(String resourceId, LocalDate date);
}
