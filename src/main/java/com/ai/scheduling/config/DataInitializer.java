package com.ai.scheduling.config;

import com.ai.scheduling.entity.AvailabilityWindow;
import com.ai.scheduling.repository.AvailabilityWindowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent seeder: creates interview windows for the default resource on working
 * days if none exist from today onward. Safe to re-run.
 */
@Component
@ConditionalOnProperty(prefix = "scheduling.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final AvailabilityWindowRepository windowRepository;
    private final SchedulingProperties properties;
    private final Clock clock;

    public DataInitializer(AvailabilityWindowRepository windowRepository,
                           SchedulingProperties properties,
                           Clock clock) {
        this.windowRepository = windowRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    @Transactional
    public void seed() {
        String resourceId = properties.getDefaultResourceId();
        LocalDate today = LocalDate.now(clock);
        if (windowRepository.existsByResourceIdAndWindowDateGreaterThanEqual(resourceId, today)) {
            log.info("DataInitializer: availability for {} already present, nothing to seed", resourceId);
            return;
        }

        CapacityConfig config = properties.capacitySnapshot();
        List<AvailabilityWindow> windows = new ArrayList<>();
        for (int i = 0; i < properties.getSeed().getDaysAhead(); i++) {
            LocalDate date = today.plusDays(i);
            if (!config.workingDays().contains(date.getDayOfWeek())) continue;
            for (CapacityConfig.WorkingBlock block : config.workingHours()) {
                windows.add(AvailabilityWindow.builder()
                        .resourceId(resourceId)
                        .windowDate(date)
                        .startTime(block.start())
                        .endTime(block.end())
                        .kind(AvailabilityWindow.Kind.INTERVIEW)
                        .available(true)
                        .build());
            }
        }
        windowRepository.saveAll(windows);
        log.info("DataInitializer: seeded {} availability windows for {} over {} days",
                windows.size(), resourceId, properties.getSeed().getDaysAhead());
    }
}
