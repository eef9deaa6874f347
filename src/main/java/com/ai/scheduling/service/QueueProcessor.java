package com.ai.scheduling.service;

import com.ai.scheduling.component.SchedulingCriticalSection;
import com.ai.scheduling.config.CapacityConfig;
import com.ai.scheduling.config.SchedulingProperties;
import com.ai.scheduling.dto.BookingRequest;
import com.ai.scheduling.dto.CapacityCheck;
import com.ai.scheduling.dto.CycleResult;
import com.ai.scheduling.dto.SchedulingResult;
import com.ai.scheduling.dto.SearchWindow;
import com.ai.scheduling.dto.SlotProposal;
import com.ai.scheduling.entity.ConversionEvent;
import com.ai.scheduling.entity.InterviewBooking;
import com.ai.scheduling.entity.QueueEntry;
import com.ai.scheduling.exception.SchedulingIntegrityException;
import com.ai.scheduling.repository.QueueEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Allocates interview slots to waiting queue entries in priority order.
 * One cycle at a time; entries inside a cycle are handled strictly in sequence.
 */
@Service
public class QueueProcessor {

    private static final Logger log = LoggerFactory.getLogger(QueueProcessor.class);

    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    private final QueueEntryRepository queueRepository;
    private final SlotAllocator slotAllocator;
    private final BookingStateMachine stateMachine;
    private final InterviewQueueService queueService;
    private final ConversionTracker conversionTracker;
    private final ControlSwitch controlSwitch;
    private final SchedulingCriticalSection criticalSection;
    private final SchedulingProperties properties;
    private final Clock clock;

    public QueueProcessor(QueueEntryRepository queueRepository,
                          SlotAllocator slotAllocator,
                          BookingStateMachine stateMachine,
                          InterviewQueueService queueService,
                          ConversionTracker conversionTracker,
                          ControlSwitch controlSwitch,
                          SchedulingCriticalSection criticalSection,
                          SchedulingProperties properties,
                          Clock clock) {
        this.queueRepository = queueRepository;
        this.slotAllocator = slotAllocator;
        this.stateMachine = stateMachine;
        this.queueService = queueService;
        this.conversionTracker = conversionTracker;
        this.controlSwitch = controlSwitch;
        this.criticalSection = criticalSection;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs one cycle. Returns a rejected result without doing anything if
     * another cycle is still running.
     */
    public CycleResult runCycle() {
        if (!inFlight.compareAndSet(false, true)) {
            log.warn("Queue cycle requested while another cycle is running; rejected");
            return CycleResult.rejectedCycle();
        }
        try {
            return processBatch();
        } finally {
            inFlight.set(false);
        }
    }

    public boolean isCycleRunning() {
        return inFlight.get();
    }

    private CycleResult processBatch() {
        if (controlSwitch.isStopped()) {
            log.info("Queue cycle skipped: scheduling stopped");
            return CycleResult.paused();
        }

        CapacityConfig config = properties.capacitySnapshot();
        SearchWindow window = SearchWindow.days(properties.getDefaultResourceId(), LocalDate.now(clock),
                properties.getSearchDays());
        List<QueueEntry> batch = queueRepository.findByStatusOrderByPriorityScoreDescAddedAtAscIdAsc(
                QueueEntry.Status.WAITING, PageRequest.of(0, properties.getQueue().getBatchSize()));
        log.info("Queue cycle: {} waiting entries, window {}..{} on {}", batch.size(), window.from(), window.to(),
                window.resourceId());

        int processed = 0;
        int scheduled = 0;
        int failed = 0;
        boolean stoppedOnCapacity = false;
        List<CycleResult.Failure> failures = new ArrayList<>();

        for (QueueEntry entry : batch) {
            if (controlSwitch.isStopped()) {
                log.warn("Scheduling stopped mid-cycle; leaving {} entries for later", batch.size() - processed);
                break;
            }
            CapacityCheck capacity = slotAllocator.checkCapacity(window, config);
            if (!capacity.canSchedule()) {
                log.info("Capacity exhausted ({}); stopping batch after {} entries", capacity.reason(), processed);
                stoppedOnCapacity = true;
                break;
            }

            processed++;
            try {
                SchedulingResult result = criticalSection.executeWithRetry(window.resourceId(), "queue-allocate",
                        () -> allocate(entry.getId(), window, config));
                if (result.success()) {
                    scheduled++;
                } else if (result.reason() != SchedulingResult.Reason.ENTRY_NOT_WAITING
                        && (result.outcome() == SchedulingResult.Outcome.CONFLICT
                        || result.outcome() == SchedulingResult.Outcome.POLICY_VIOLATION)) {
                    failed++;
                    failures.add(new CycleResult.Failure(entry.getId(), entry.getCandidateId(), result.reason().name()));
                }
            } catch (SchedulingIntegrityException e) {
                failed++;
                failures.add(new CycleResult.Failure(entry.getId(), entry.getCandidateId(), e.getMessage()));
                log.error("Queue entry {} (candidate {}) failed integrity check: {}",
                        entry.getId(), entry.getCandidateId(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                failures.add(new CycleResult.Failure(entry.getId(), entry.getCandidateId(), e.getMessage()));
                log.error("Queue entry {} (candidate {}) failed", entry.getId(), entry.getCandidateId(), e);
            }
        }

        CycleResult result = new CycleResult(processed, scheduled, failed, stoppedOnCapacity, false, failures);
        log.info("Queue cycle done: processed={}, scheduled={}, failed={}, stoppedOnCapacity={}",
                processed, scheduled, failed, stoppedOnCapacity);
        return result;
    }

    private SchedulingResult allocate(Long entryId, SearchWindow window, CapacityConfig config) {
        QueueEntry entry = queueRepository.findByIdForUpdate(entryId).orElse(null);
        if (entry == null || entry.getStatus() != QueueEntry.Status.WAITING) {
            log.debug("Queue entry {} is no longer waiting; skipped", entryId);
            return SchedulingResult.policyViolation(SchedulingResult.Reason.ENTRY_NOT_WAITING,
                    "Queue entry is no longer waiting.");
        }

        Optional<SlotProposal> slot = slotAllocator.findSlot(queueService.profileOf(entry), window, config);
        if (slot.isEmpty()) {
            entry.setContactAttempts(entry.getContactAttempts() + 1);
            entry.setLastContactAt(clock.instant());
            queueRepository.save(entry);
            log.info("No slot for candidate {} (attempt {})", entry.getCandidateId(), entry.getContactAttempts());
            return SchedulingResult.notFound(SchedulingResult.Reason.NO_SLOT_AVAILABLE, "No slot available.");
        }

        SchedulingResult booked = stateMachine.bookWithinSection(
                BookingRequest.fromProposal(entry.getCandidateId(), slot.get(), "Auto-scheduled from interview queue"),
                config);
        if (!booked.success()) {
            return booked;
        }

        InterviewBooking booking = booked.booking();
        entry.setStatus(QueueEntry.Status.SCHEDULED);
        entry.setScheduledFor(booking.startsAt());
        queueRepository.save(entry);
        conversionTracker.record(entry.getCandidateId(), ConversionEvent.Stage.SCHEDULED, "queue_auto",
                "Interview " + booking.getId() + " on " + booking.getBookingDate() + " " + booking.getStartTime());
        return booked;
    }
}
