package com.ai.scheduling.service;

import com.ai.scheduling.config.SchedulingProperties;
import com.ai.scheduling.dto.CapacityCheck;
import com.ai.scheduling.dto.SchedulingAnalytics;
import com.ai.scheduling.dto.SchedulingStatus;
import com.ai.scheduling.entity.ConversionEvent;
import com.ai.scheduling.entity.InterviewBooking;
import com.ai.scheduling.entity.InterviewPerformance;
import com.ai.scheduling.entity.QueueEntry;
import com.ai.scheduling.repository.ConversionEventRepository;
import com.ai.scheduling.repository.InterviewBookingRepository;
import com.ai.scheduling.repository.InterviewPerformanceRepository;
import com.ai.scheduling.repository.QueueEntryRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read-side reporting over bookings, the queue and the conversion log, plus the
 * daily performance rollup. Nothing here feeds back into allocation.
 */
@Service
public class SchedulingAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(SchedulingAnalyticsService.class);
    private static final double DEFAULT_DURATION_MINUTES = 30.0;
    private static final EnumSet<QueueEntry.UrgencyLevel> HIGH_PRIORITY =
            EnumSet.of(QueueEntry.UrgencyLevel.HIGH, QueueEntry.UrgencyLevel.URGENT);

    private final InterviewBookingRepository bookingRepository;
    private final ConversionEventRepository conversionRepository;
    private final QueueEntryRepository queueRepository;
    private final InterviewPerformanceRepository performanceRepository;
    private final InterviewQueueService queueService;
    private final SlotAllocator slotAllocator;
    private final ControlSwitch controlSwitch;
    private final QueueProcessor queueProcessor;
    private final SchedulingProperties properties;
    private final Clock clock;

    public SchedulingAnalyticsService(InterviewBookingRepository bookingRepository,
                                      ConversionEventRepository conversionRepository,
                                      QueueEntryRepository queueRepository,
                                      InterviewPerformanceRepository performanceRepository,
                                      InterviewQueueService queueService,
                                      SlotAllocator slotAllocator,
                                      ControlSwitch controlSwitch,
                                      QueueProcessor queueProcessor,
                                      SchedulingProperties properties,
                                      Clock clock) {
        this.bookingRepository = bookingRepository;
        this.conversionRepository = conversionRepository;
        this.queueRepository = queueRepository;
        this.performanceRepository = performanceRepository;
        this.queueService = queueService;
        this.slotAllocator = slotAllocator;
        this.controlSwitch = controlSwitch;
        this.queueProcessor = queueProcessor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Bookings dated from {@code days} days ago onward, grouped per day, with
     * completion and no-show rates over all of them. Conversion rate is candidates
     * reaching ACTIVE in the period per completed interview.
     */
    @Transactional(readOnly = true)
    public SchedulingAnalytics analytics(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate since = today.minusDays(days);

        Map<LocalDate, List<InterviewBooking>> byDate = bookingRepository.findByBookingDateGreaterThanEqual(since)
                .stream()
                .collect(Collectors.groupingBy(InterviewBooking::getBookingDate,
                        () -> new TreeMap<LocalDate, List<InterviewBooking>>(Comparator.reverseOrder()),
                        Collectors.toList()));

        List<SchedulingAnalytics.DailyStats> daily = new ArrayList<>();
        long scheduled = 0;
        long completed = 0;
        long noShows = 0;
        long totalMinutes = 0;
        for (Map.Entry<LocalDate, List<InterviewBooking>> e : byDate.entrySet()) {
            List<InterviewBooking> bookings = e.getValue();
            long dayCompleted = countStatus(bookings, InterviewBooking.Status.COMPLETED);
            long dayNoShows = countStatus(bookings, InterviewBooking.Status.NO_SHOW);
            daily.add(new SchedulingAnalytics.DailyStats(e.getKey(), bookings.size(), dayCompleted, dayNoShows,
                    averageDuration(bookings)));
            scheduled += bookings.size();
            completed += dayCompleted;
            noShows += dayNoShows;
            totalMinutes += bookings.stream().mapToLong(InterviewBooking::getDurationMinutes).sum();
        }

        long conversions = conversionRepository.findByToStageAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(
                ConversionEvent.Stage.ACTIVE, startOf(since), startOf(today.plusDays(1))).size();

        SchedulingAnalytics.Summary summary = new SchedulingAnalytics.Summary(
                scheduled, completed, noShows,
                scheduled > 0 ? (double) totalMinutes / scheduled : 0.0,
                conversions,
                ratio(completed, scheduled),
                ratio(noShows, scheduled),
                ratio(conversions, completed));
        return new SchedulingAnalytics(days, since, summary, daily);
    }

    /** Snapshot for the operator dashboard. */
    @Transactional(readOnly = true)
    public SchedulingStatus currentStatus() {
        LocalDate today = LocalDate.now(clock);
        List<InterviewBooking> todays = bookingRepository.findByBookingDate(today);
        CapacityCheck capacity = slotAllocator.checkCapacity(properties.getDefaultResourceId(), today,
                properties.capacitySnapshot());
        return new SchedulingStatus(
                controlSwitch.isStopped(),
                queueProcessor.isCycleRunning(),
                todays.size(),
                countStatus(todays, InterviewBooking.Status.COMPLETED),
                queueRepository.countByStatus(QueueEntry.Status.WAITING),
                queueRepository.countByStatusAndUrgencyLevelIn(QueueEntry.Status.WAITING, HIGH_PRIORITY),
                capacity,
                queueService.statusCounts(),
                clock.instant());
    }

    /** Rolls up yesterday, the last complete day. */
    @Transactional
    public InterviewPerformance recordDailyPerformance() {
        return recordDailyPerformance(LocalDate.now(clock).minusDays(1));
    }

    /**
     * Writes the performance row for {@code date}, replacing any earlier one.
     * Conversions are ACTIVE transitions that day reached through an interview.
     */
    @Transactional
    public InterviewPerformance recordDailyPerformance(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        List<InterviewBooking> bookings = bookingRepository.findByBookingDate(date);
        long completed = countStatus(bookings, InterviewBooking.Status.COMPLETED);
        long completedMinutes = bookings.stream()
                .filter(b -> b.getStatus() == InterviewBooking.Status.COMPLETED)
                .mapToLong(InterviewBooking::getDurationMinutes)
                .sum();
        double efficiency = completedMinutes > 0 ? round2(completed / (completedMinutes / 60.0)) : 0.0;
        long conversions = conversionRepository.findByToStageAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(
                        ConversionEvent.Stage.ACTIVE, startOf(date), startOf(date.plusDays(1))).stream()
                .filter(e -> StringUtils.containsIgnoreCase(e.getMethod(), "interview"))
                .count();

        InterviewPerformance row = performanceRepository.findByMetricDate(date)
                .orElseGet(() -> InterviewPerformance.builder().metricDate(date).createdAt(clock.instant()).build());
        row.setTotalScheduled(bookings.size());
        row.setTotalCompleted(completed);
        row.setTotalNoShows(countStatus(bookings, InterviewBooking.Status.NO_SHOW));
        row.setTotalConversions(conversions);
        row.setAvgInterviewDuration(bookings.isEmpty() ? DEFAULT_DURATION_MINUTES : averageDuration(bookings));
        row.setEfficiencyScore(efficiency);
        row.setUpdatedAt(clock.instant());
        row = performanceRepository.save(row);

        log.info("Performance for {}: scheduled={}, completed={}, noShows={}, conversions={}, efficiency={}",
                date, row.getTotalScheduled(), row.getTotalCompleted(), row.getTotalNoShows(),
                row.getTotalConversions(), row.getEfficiencyScore());
        return row;
    }

    @Transactional(readOnly = true)
    public List<InterviewPerformance> performanceHistory(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        return performanceRepository.findByMetricDateGreaterThanEqualOrderByMetricDateDesc(
                LocalDate.now(clock).minusDays(days));
    }

    private Instant startOf(LocalDate date) {
        return date.atStartOfDay(clock.getZone()).toInstant();
    }

    private static long countStatus(Collection<InterviewBooking> bookings, InterviewBooking.Status status) {
        return bookings.stream().filter(b -> b.getStatus() == status).count();
    }

    private static double averageDuration(List<InterviewBooking> bookings) {
        return bookings.stream().mapToInt(InterviewBooking::getDurationMinutes).average().orElse(0.0);
    }

    private static double ratio(long part, long whole) {
        return whole > 0 ? (double) part / whole : 0.0;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
