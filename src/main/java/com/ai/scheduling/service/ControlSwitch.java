package com.ai.scheduling.service;

import com.ai.scheduling.component.SchedulingCriticalSection;
import com.ai.scheduling.dto.ControlState;
import com.ai.scheduling.dto.SchedulingEvent;
import com.ai.scheduling.entity.AvailabilityWindow;
import com.ai.scheduling.entity.QueueEntry;
import com.ai.scheduling.repository.AvailabilityWindowRepository;
import com.ai.scheduling.repository.QueueEntryRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Whole-system scheduling gate. Stop pauses waiting queue entries and disables
 * today's open windows; resume reverses exactly the rows the stop flagged.
 */
@Service
public class ControlSwitch {

    private static final Logger log = LoggerFactory.getLogger(ControlSwitch.class);
    static final String STOP_NOTE = "Emergency pause activated";

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private final QueueEntryRepository queueRepository;
    private final AvailabilityWindowRepository windowRepository;
    private final SchedulingCriticalSection criticalSection;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ControlSwitch(QueueEntryRepository queueRepository,
                         AvailabilityWindowRepository windowRepository,
                         SchedulingCriticalSection criticalSection,
                         ApplicationEventPublisher eventPublisher,
                         Clock clock) {
        this.queueRepository = queueRepository;
        this.windowRepository = windowRepository;
        this.criticalSection = criticalSection;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @PostConstruct
    void restoreFromStore() {
        boolean flagged = queueRepository.existsByPausedByStopTrue() || windowRepository.existsByDisabledByStopTrue();
        stopped.set(flagged);
        if (flagged) {
            log.warn("Scheduling starts STOPPED: rows flagged by an earlier emergency stop are still present");
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * Stops scheduling. The flag flips first so allocation fails closed at once;
     * the sweep then pauses waiting entries and disables today's open windows.
     * The sweep also runs when already stopped, so repeating a stop finishes one
     * that failed half way or catches rows that slipped in since.
     */
    public synchronized ControlState emergencyStop() {
        boolean alreadyStopped = !stopped.compareAndSet(false, true);
        LocalDate today = LocalDate.now(clock);

        int paused;
        int disabled;
        try {
            paused = pauseWaitingEntries();
            disabled = disableOpenWindows(today);
        } catch (RuntimeException e) {
            log.error("Emergency stop sweep failed; scheduling stays stopped until the stop is repeated or resumed", e);
            throw e;
        }

        if (alreadyStopped) {
            if (paused > 0 || disabled > 0) {
                log.warn("Repeated emergency stop caught up: paused {} queue entries, disabled {} windows", paused, disabled);
            } else {
                log.info("Emergency stop requested while already stopped");
            }
            return new ControlState(true, paused, disabled, "Scheduling already stopped.");
        }

        log.warn("EMERGENCY STOP: paused {} queue entries, disabled {} windows for {}", paused, disabled, today);
        eventPublisher.publishEvent(SchedulingEvent.of(SchedulingEvent.Type.SCHEDULING_PAUSED,
                Map.of("queueEntriesPaused", paused, "windowsDisabled", disabled)));
        return new ControlState(true, paused, disabled, "Scheduling stopped.");
    }

    private int pauseWaitingEntries() {
        try {
            return criticalSection.execute(SchedulingCriticalSection.QUEUE_KEY, this::pauseWaitingInTransaction);
        } catch (ConcurrencyFailureException e) {
            log.warn("Pausing the queue raced a concurrent update, retrying once: {}", e.getMessage());
            return criticalSection.execute(SchedulingCriticalSection.QUEUE_KEY, this::pauseWaitingInTransaction);
        }
    }

    // row locks make the sweep wait for an in-flight allocation instead of overwriting it
    private int pauseWaitingInTransaction() {
        List<QueueEntry> waiting = queueRepository.findByStatusForUpdate(QueueEntry.Status.WAITING);
        for (QueueEntry e : waiting) {
            e.setStatus(QueueEntry.Status.PAUSED);
            e.setPausedByStop(true);
        }
        queueRepository.saveAll(waiting);
        return waiting.size();
    }

    private int disableOpenWindows(LocalDate today) {
        Map<String, List<Long>> windowsByResource = windowRepository.findByWindowDateAndAvailableTrue(today).stream()
                .collect(Collectors.groupingBy(AvailabilityWindow::getResourceId, TreeMap::new,
                        Collectors.mapping(AvailabilityWindow::getId, Collectors.toList())));
        int disabled = 0;
        for (Map.Entry<String, List<Long>> e : windowsByResource.entrySet()) {
            disabled += criticalSection.execute(e.getKey(), () -> {
                List<AvailabilityWindow> windows = windowRepository.findAllById(e.getValue()).stream()
                        .filter(AvailabilityWindow::isAvailable)
                        .collect(Collectors.toList());
                for (AvailabilityWindow w : windows) {
                    w.setAvailable(false);
                    w.setDisabledByStop(true);
                    if (w.getNotes() == null) w.setNotes(STOP_NOTE);
                }
                windowRepository.saveAll(windows);
                return windows.size();
            });
        }
        return disabled;
    }

    public synchronized ControlState resume() {
        if (!stopped.get()) {
            log.info("Resume requested while scheduling is running");
            return new ControlState(false, 0, 0, "Scheduling already running.");
        }

        int resumed = criticalSection.execute(SchedulingCriticalSection.QUEUE_KEY, () -> {
            List<QueueEntry> paused = queueRepository.findByStatusAndPausedByStopTrue(QueueEntry.Status.PAUSED);
            for (QueueEntry e : paused) {
                e.setStatus(QueueEntry.Status.WAITING);
                e.setPausedByStop(false);
            }
            queueRepository.saveAll(paused);
            return paused.size();
        });

        Map<String, List<Long>> windowsByResource = windowRepository.findByDisabledByStopTrue().stream()
                .collect(Collectors.groupingBy(AvailabilityWindow::getResourceId, TreeMap::new,
                        Collectors.mapping(AvailabilityWindow::getId, Collectors.toList())));
        int enabled = 0;
        for (Map.Entry<String, List<Long>> e : windowsByResource.entrySet()) {
            enabled += criticalSection.execute(e.getKey(), () -> {
                List<AvailabilityWindow> windows = windowRepository.findAllById(e.getValue());
                for (AvailabilityWindow w : windows) {
                    w.setAvailable(true);
                    w.setDisabledByStop(false);
                    if (STOP_NOTE.equals(w.getNotes())) w.setNotes(null);
                }
                windowRepository.saveAll(windows);
                return windows.size();
            });
        }

        stopped.set(false);
        log.info("Scheduling resumed: {} queue entries back to WAITING, {} windows re-enabled", resumed, enabled);
        eventPublisher.publishEvent(SchedulingEvent.of(SchedulingEvent.Type.SCHEDULING_RESUMED,
                Map.of("queueEntriesResumed", resumed, "windowsEnabled", enabled)));
        return new ControlState(false, resumed, enabled, "Scheduling resumed.");
    }
}
