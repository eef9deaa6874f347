package com.ai.scheduling.service;

import com.ai.scheduling.dto.SchedulingAnalytics;
import com.ai.scheduling.dto.SchedulingStatus;
import com.ai.scheduling.entity.Candidate;
import com.ai.scheduling.entity.ConversionEvent;
import com.ai.scheduling.entity.InterviewBooking.Status;
import com.ai.scheduling.entity.InterviewPerformance;
import com.ai.scheduling.entity.QueueEntry;
import com.ai.scheduling.support.AbstractSchedulingIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SchedulingAnalyticsServiceIntegrationTest extends AbstractSchedulingIntegrationTest {

    private static final LocalDate JUNE_3 = LocalDate.of(2024, 6, 3);
    private static final LocalDate JUNE_4 = LocalDate.of(2024, 6, 4);

    @Autowired private SchedulingAnalyticsService analyticsService;
    @Autowired private ConversionTracker conversionTracker;
    @Autowired private InterviewQueueService queueService;

    private Candidate first;
    private Candidate second;
    private Candidate third;
    private Candidate fourth;

    @BeforeEach
    void setUp() {
        first = candidate("First");
        second = candidate("Second");
        third = candidate("Third");
        fourth = candidate("Fourth");
    }

    @Nested
    @DisplayName("analytics")
    class Analytics {

        @BeforeEach
        void bookings() {
            clock.set(LocalDateTime.of(2024, 5, 20, 12, 0));
            existingBooking(fourth.getId(), LocalDate.of(2024, 5, 20), "09:00", 30, Status.COMPLETED);
            conversionTracker.record(fourth.getId(), ConversionEvent.Stage.ACTIVE, "interview_completed", null);

            clock.set(LocalDateTime.of(2024, 6, 5, 10, 0));
            existingBooking(first.getId(), JUNE_3, "09:00", 30, Status.COMPLETED);
            existingBooking(second.getId(), JUNE_3, "09:30", 30, Status.NO_SHOW);
            existingBooking(third.getId(), JUNE_4, "09:00", 45, Status.COMPLETED);
            existingBooking(fourth.getId(), JUNE_4, "10:00", 30, Status.SCHEDULED);
            conversionTracker.record(first.getId(), ConversionEvent.Stage.ACTIVE, "interview_completed", null);
        }

        @Test
        @DisplayName("breaks the period down per day, newest first")
        void dailyBreakdown() {
            SchedulingAnalytics analytics = analyticsService.analytics(7);

            assertThat(analytics.since()).isEqualTo(LocalDate.of(2024, 5, 29));
            assertThat(analytics.dailyBreakdown()).extracting(SchedulingAnalytics.DailyStats::date)
                    .containsExactly(JUNE_4, JUNE_3);
            SchedulingAnalytics.DailyStats june4 = analytics.dailyBreakdown().get(0);
            assertThat(june4.scheduled()).isEqualTo(2);
            assertThat(june4.completed()).isEqualTo(1);
            assertThat(june4.noShows()).isZero();
            assertThat(june4.avgDurationMinutes()).isCloseTo(37.5, within(1e-9));
        }

        @Test
        @DisplayName("rates are taken over every booking in the period")
        void summaryRates() {
            SchedulingAnalytics.Summary summary = analyticsService.analytics(7).summary();

            assertThat(summary.totalScheduled()).isEqualTo(4);
            assertThat(summary.totalCompleted()).isEqualTo(2);
            assertThat(summary.totalNoShows()).isEqualTo(1);
            assertThat(summary.avgDurationMinutes()).isCloseTo(33.75, within(1e-9));
            assertThat(summary.completionRate()).isCloseTo(0.5, within(1e-9));
            assertThat(summary.noShowRate()).isCloseTo(0.25, within(1e-9));
            assertThat(summary.conversions()).isEqualTo(1);
            assertThat(summary.conversionRate()).isCloseTo(0.5, within(1e-9));
        }

        @Test
        @DisplayName("an empty period reports zero rates")
        void emptyPeriod() {
            clock.set(LocalDateTime.of(2024, 7, 1, 10, 0));

            SchedulingAnalytics analytics = analyticsService.analytics(3);

            assertThat(analytics.dailyBreakdown()).isEmpty();
            assertThat(analytics.summary().completionRate()).isZero();
            assertThat(analytics.summary().conversionRate()).isZero();
        }

        @Test
        @DisplayName("a non-positive period is rejected")
        void badPeriod() {
            assertThatThrownBy(() -> analyticsService.analytics(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("daily performance")
    class DailyPerformance {

        @BeforeEach
        void dayOfInterviews() {
            clock.set(LocalDateTime.of(2024, 6, 4, 12, 0));
            existingBooking(first.getId(), JUNE_4, "09:00", 45, Status.COMPLETED);
            existingBooking(second.getId(), JUNE_4, "10:00", 30, Status.NO_SHOW);
            existingBooking(third.getId(), JUNE_4, "11:00", 30, Status.CANCELLED);
            conversionTracker.record(first.getId(), ConversionEvent.Stage.ACTIVE, "interview_completed", null);
            conversionTracker.record(fourth.getId(), ConversionEvent.Stage.ACTIVE, "manual", null);
            clock.set(LocalDateTime.of(2024, 6, 5, 0, 5));
        }

        @Test
        @DisplayName("yesterday is rolled up with interview-driven conversions only")
        void rollsUpYesterday() {
            InterviewPerformance row = analyticsService.recordDailyPerformance();

            assertThat(row.getMetricDate()).isEqualTo(JUNE_4);
            assertThat(row.getTotalScheduled()).isEqualTo(3);
            assertThat(row.getTotalCompleted()).isEqualTo(1);
            assertThat(row.getTotalNoShows()).isEqualTo(1);
            assertThat(row.getTotalConversions()).isEqualTo(1);
            assertThat(row.getAvgInterviewDuration()).isCloseTo(35.0, within(1e-9));
            assertThat(row.getEfficiencyScore()).isCloseTo(1.33, within(1e-9));
        }

        @Test
        @DisplayName("recomputing a day replaces its row")
        void oneRowPerDay() {
            InterviewPerformance firstRun = analyticsService.recordDailyPerformance();
            existingBooking(fourth.getId(), JUNE_4, "14:00", 30, Status.COMPLETED);

            InterviewPerformance secondRun = analyticsService.recordDailyPerformance(JUNE_4);

            assertThat(secondRun.getId()).isEqualTo(firstRun.getId());
            assertThat(secondRun.getTotalCompleted()).isEqualTo(2);
            assertThat(performanceRepository.count()).isEqualTo(1);
            assertThat(analyticsService.performanceHistory(30)).singleElement()
                    .satisfies(p -> assertThat(p.getTotalScheduled()).isEqualTo(4));
        }

        @Test
        @DisplayName("a day without interviews records zero efficiency")
        void quietDay() {
            InterviewPerformance row = analyticsService.recordDailyPerformance(JUNE_3);

            assertThat(row.getTotalScheduled()).isZero();
            assertThat(row.getEfficiencyScore()).isZero();
            assertThat(row.getAvgInterviewDuration()).isCloseTo(30.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("current status counts today's bookings, the waiting queue and remaining capacity")
    void currentStatus() {
        clock.set(LocalDateTime.of(2024, 6, 3, 8, 0));
        window(JUNE_3, "09:00", "13:00");
        existingBooking(first.getId(), JUNE_3, "09:00", 30, Status.SCHEDULED);
        existingBooking(second.getId(), JUNE_3, "09:30", 30, Status.COMPLETED);
        queueService.enqueue(third.getId(), 0.9, null);
        queueService.enqueue(fourth.getId(), 0.5, null);

        SchedulingStatus status = analyticsService.currentStatus();

        assertThat(status.stopped()).isFalse();
        assertThat(status.cycleRunning()).isFalse();
        assertThat(status.todayScheduled()).isEqualTo(2);
        assertThat(status.todayCompleted()).isEqualTo(1);
        assertThat(status.queueLength()).isEqualTo(2);
        assertThat(status.highPriorityQueue()).isEqualTo(1);
        assertThat(status.capacity().canSchedule()).isTrue();
        assertThat(status.capacity().dailyRemaining()).isEqualTo(19);
        assertThat(status.queue()).containsEntry(QueueEntry.Status.WAITING, 2L);
    }
}
