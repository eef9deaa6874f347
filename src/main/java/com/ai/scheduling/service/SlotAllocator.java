package com.ai.scheduling.service;

import com.ai.scheduling.config.CapacityConfig;
import com.ai.scheduling.config.SchedulingProperties;
import com.ai.scheduling.dto.CandidateProfile;
import com.ai.scheduling.dto.CapacityCheck;
import com.ai.scheduling.dto.SearchWindow;
import com.ai.scheduling.dto.SlotProposal;
import com.ai.scheduling.entity.AvailabilityWindow;
import com.ai.scheduling.entity.InterviewBooking;
import com.ai.scheduling.repository.AvailabilityWindowRepository;
import com.ai.scheduling.repository.InterviewBookingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Slot search and the conflict/capacity oracle. Never writes; callers that
 * commit the result must hold the resource's critical section.
 *
 * Allocation is first-fit: the earliest increment that passes every check wins,
 * except that increments whose no-show risk is above threshold are only used
 * when nothing else survives.
 */
@Service
public class SlotAllocator {

    private static final Logger log = LoggerFactory.getLogger(SlotAllocator.class);

    private final AvailabilityWindowRepository windowRepository;
    private final InterviewBookingRepository bookingRepository;
    private final ControlSwitch controlSwitch;
    private final SlotRiskScorer riskScorer;
    private final SchedulingProperties properties;
    private final Clock clock;

    public SlotAllocator(AvailabilityWindowRepository windowRepository,
                         InterviewBookingRepository bookingRepository,
                         ControlSwitch controlSwitch,
                         SlotRiskScorer riskScorer,
                         SchedulingProperties properties,
                         Clock clock) {
        this.windowRepository = windowRepository;
        this.bookingRepository = bookingRepository;
        this.controlSwitch = controlSwitch;
        this.riskScorer = riskScorer;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Optional<SlotProposal> findSlot(CandidateProfile profile, SearchWindow window) {
        return findSlot(profile, window, properties.capacitySnapshot());
    }

    /**
     * Earliest free increment in the window, or empty when none survives.
     * Returns empty while scheduling is stopped.
     */
    @Transactional(readOnly = true)
    public Optional<SlotProposal> findSlot(CandidateProfile profile, SearchWindow window, CapacityConfig config) {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(window, "window");
        if (controlSwitch.isStopped()) {
            log.debug("findSlot for candidate {} refused: scheduling stopped", profile.candidateId());
            return Optional.empty();
        }

        List<AvailabilityWindow> windows = windowRepository
                .findByResourceIdAndWindowDateBetweenAndAvailableTrueAndKindOrderByWindowDateAscStartTimeAsc(
                        window.resourceId(), window.from(), window.to(), AvailabilityWindow.Kind.INTERVIEW);

        LocalDateTime now = LocalDateTime.now(clock);
        double threshold = properties.getRisk().getNoShowThreshold();
        int duration = config.slotDurationMinutes();
        BookingLedger ledger = new BookingLedger(window.resourceId());
        SlotProposal fallback = null;

        for (AvailabilityWindow w : windows) {
            if (!w.isWellFormed()) {
                log.warn("Skipping malformed availability window {} ({} {}-{})",
                        w.getId(), w.getWindowDate(), w.getStartTime(), w.getEndTime());
                continue;
            }
            LocalDate date = w.getWindowDate();
            int endMin = minuteOfDay(w.getEndTime());
            for (int m = minuteOfDay(w.getStartTime()); m + duration <= endMin; m += duration) {
                LocalTime start = LocalTime.of(m / 60, m % 60);
                if (LocalDateTime.of(date, start).isBefore(now)) continue;

                if (overlapsLive(ledger.live(date), m, duration, config, null)) continue;
                if (ledger.live(date).size() >= config.maxDailyBookings()) continue;
                if (ledger.week(date) >= config.maxWeeklyBookings()) continue;

                double risk = riskScorer.score(new SlotRiskScorer.SlotContext(profile, window.resourceId(), date, start));
                SlotProposal proposal = new SlotProposal(window.resourceId(), date, start, start.plusMinutes(duration),
                        risk, risk > threshold);
                if (!proposal.softDenied()) {
                    return Optional.of(proposal);
                }
                if (fallback == null || risk < fallback.riskScore()) {
                    fallback = proposal;
                }
            }
        }

        if (fallback != null) {
            log.info("All free increments for candidate {} are high risk; falling back to {} {} (risk {})",
                    profile.candidateId(), fallback.date(), fallback.startTime(), fallback.riskScore());
        }
        return Optional.ofNullable(fallback);
    }

    @Transactional(readOnly = true)
    public boolean isSlotFree(String resourceId, LocalDate date, LocalTime time, int durationSlots) {
        return isSlotFree(resourceId, date, time, durationSlots, null, properties.capacitySnapshot());
    }

    /**
     * True when [time, time + durationSlots * slotDuration) lies inside one open interview
     * window and overlaps no live booking other than {@code excludeBookingId}.
     */
    @Transactional(readOnly = true)
    public boolean isSlotFree(String resourceId, LocalDate date, LocalTime time, int durationSlots,
                              Long excludeBookingId, CapacityConfig config) {
        if (durationSlots <= 0) {
            throw new IllegalArgumentException("durationSlots must be positive");
        }
        int start = minuteOfDay(time);
        int length = durationSlots * config.slotDurationMinutes();
        boolean covered = windowRepository
                .findByResourceIdAndWindowDateBetweenAndAvailableTrueAndKindOrderByWindowDateAscStartTimeAsc(
                        resourceId, date, date, AvailabilityWindow.Kind.INTERVIEW)
                .stream()
                .filter(AvailabilityWindow::isWellFormed)
                .anyMatch(w -> minuteOfDay(w.getStartTime()) <= start && start + length <= minuteOfDay(w.getEndTime()));
        if (!covered) {
            return false;
        }
        List<InterviewBooking> live = bookingRepository.findByResourceIdAndBookingDateAndStatusIn(
                resourceId, date, InterviewBooking.LIVE_STATUSES);
        return !overlapsLive(live, start, length, config, excludeBookingId);
    }

    @Transactional(readOnly = true)
    public CapacityCheck checkCapacity(String resourceId, LocalDate date, CapacityConfig config) {
        long daily = bookingRepository.countByResourceIdAndBookingDateAndStatusIn(
                resourceId, date, InterviewBooking.LIVE_STATUSES);
        LocalDate monday = date.with(DayOfWeek.MONDAY);
        long weekly = bookingRepository.countByResourceIdAndBookingDateBetweenAndStatusIn(
                resourceId, monday, monday.plusDays(6), InterviewBooking.LIVE_STATUSES);
        long dailyRemaining = Math.max(0, config.maxDailyBookings() - daily);
        long weeklyRemaining = Math.max(0, config.maxWeeklyBookings() - weekly);
        if (dailyRemaining == 0) {
            return CapacityCheck.exhausted("Daily capacity reached for " + date, dailyRemaining, weeklyRemaining);
        }
        if (weeklyRemaining == 0) {
            return CapacityCheck.exhausted("Weekly capacity reached for week of " + monday, dailyRemaining, weeklyRemaining);
        }
        return CapacityCheck.available(dailyRemaining, weeklyRemaining);
    }

    /**
     * Capacity predicate over a whole search window: schedulable while at least one
     * date still has both daily and weekly room. Remaining counts are summed over open dates.
     */
    @Transactional(readOnly = true)
    public CapacityCheck checkCapacity(SearchWindow window, CapacityConfig config) {
        long dailyRemaining = 0;
        Map<LocalDate, Long> weeklyByMonday = new HashMap<>();
        for (LocalDate d = window.from(); !d.isAfter(window.to()); d = d.plusDays(1)) {
            CapacityCheck day = checkCapacity(window.resourceId(), d, config);
            weeklyByMonday.putIfAbsent(d.with(DayOfWeek.MONDAY), day.weeklyRemaining());
            if (day.canSchedule()) {
                dailyRemaining += day.dailyRemaining();
            }
        }
        long weeklyRemaining = weeklyByMonday.values().stream().mapToLong(Long::longValue).sum();
        if (dailyRemaining == 0) {
            return CapacityCheck.exhausted("No capacity left between " + window.from() + " and " + window.to(),
                    0, weeklyRemaining);
        }
        return CapacityCheck.available(dailyRemaining, weeklyRemaining);
    }

    private boolean overlapsLive(List<InterviewBooking> live, int start, int length, CapacityConfig config,
                                 Long excludeBookingId) {
        int buffer = config.enforceBuffer() ? config.bufferMinutes() : 0;
        for (InterviewBooking b : live) {
            if (excludeBookingId != null && excludeBookingId.equals(b.getId())) continue;
            int bStart = minuteOfDay(b.getStartTime());
            if (start < bStart + b.getDurationMinutes() + buffer && bStart < start + length + buffer) {
                return true;
            }
        }
        return false;
    }

    private static int minuteOfDay(LocalTime t) {
        return t.getHour() * 60 + t.getMinute();
    }

    /** Live bookings per date and per ISO week, loaded lazily once per search. */
    private final class BookingLedger {
        private final String resourceId;
        private final Map<LocalDate, List<InterviewBooking>> byDate = new HashMap<>();
        private final Map<LocalDate, Long> byWeek = new HashMap<>();

        private BookingLedger(String resourceId) {
            this.resourceId = resourceId;
        }

        List<InterviewBooking> live(LocalDate date) {
            return byDate.computeIfAbsent(date, d -> bookingRepository.findByResourceIdAndBookingDateAndStatusIn(
                    resourceId, d, InterviewBooking.LIVE_STATUSES));
        }

        long week(LocalDate date) {
            LocalDate monday = date.with(DayOfWeek.MONDAY);
            return byWeek.computeIfAbsent(monday, m -> bookingRepository.countByResourceIdAndBookingDateBetweenAndStatusIn(
                    resourceId, m, m.plusDays(6), InterviewBooking.LIVE_STATUSES));
        }
    }
}
