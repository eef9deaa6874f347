package com.ai.scheduling.service;

import com.ai.scheduling.config.SchedulingProperties;
import com.ai.scheduling.dto.RiskProfile;
import com.ai.scheduling.entity.InterviewBooking;
import com.ai.scheduling.entity.InterviewBooking.Status;
import com.ai.scheduling.repository.InterviewBookingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RiskOptimizerTest {

    private static final Instant NOW = Instant.parse("2024-06-20T00:00:00Z");
    private static final LocalDate MONDAY = LocalDate.of(2024, 6, 10);
    private static final LocalDate TUESDAY = LocalDate.of(2024, 6, 11);

    @Mock private InterviewBookingRepository bookingRepository;

    private RiskOptimizer optimizer;

    @BeforeEach
    void setUp() {
        optimizer = new RiskOptimizer(bookingRepository, new SchedulingProperties(),
                Clock.fixed(NOW, ZoneId.of("Asia/Singapore")));
    }

    private static InterviewBooking booking(LocalDate date, int hour, Status status) {
        return InterviewBooking.builder()
                .resourceId("primary").bookingDate(date).startTime(LocalTime.of(hour, 0))
                .durationMinutes(30).status(status).build();
    }

    private static List<InterviewBooking> history() {
        List<InterviewBooking> list = new ArrayList<>();
        // Monday 10:00: 2 of 6 no-shows
        for (int i = 0; i < 4; i++) list.add(booking(MONDAY, 10, Status.COMPLETED));
        list.add(booking(MONDAY, 10, Status.NO_SHOW));
        list.add(booking(MONDAY, 10, Status.NO_SHOW));
        // Monday 14:00: 0 of 5
        for (int i = 0; i < 5; i++) list.add(booking(MONDAY, 14, Status.COMPLETED));
        // Tuesday 09:00: 4 of 4, below the sample minimum
        for (int i = 0; i < 4; i++) list.add(booking(TUESDAY, 9, Status.NO_SHOW));
        return list;
    }

    @Test
    @DisplayName("groups by resource, hour and weekday, trusting only groups with enough samples")
    void recompute() {
        when(bookingRepository.findByCreatedAtGreaterThanEqual(any())).thenReturn(history());

        List<RiskProfile> profiles = optimizer.recompute(30);

        assertThat(profiles).hasSize(2);
        RiskProfile worst = profiles.get(0);
        assertThat(worst.dayOfWeek()).isEqualTo(DayOfWeek.MONDAY);
        assertThat(worst.hourOfDay()).isEqualTo(10);
        assertThat(worst.sampleSize()).isEqualTo(6);
        assertThat(worst.noShows()).isEqualTo(2);
        assertThat(worst.observedNoShowRate()).isCloseTo(1.0 / 3, within(1e-9));
        verify(bookingRepository).findByCreatedAtGreaterThanEqual(NOW.minus(Duration.ofDays(30)));
    }

    @Test
    @DisplayName("observed rates feed the scorer; unknown buckets score zero")
    void scorerUsesSnapshot() {
        when(bookingRepository.findByCreatedAtGreaterThanEqual(any())).thenReturn(history());
        optimizer.recompute(30);

        assertThat(optimizer.observedRate("primary", 10, DayOfWeek.MONDAY).getAsDouble())
                .isCloseTo(1.0 / 3, within(1e-9));
        assertThat(optimizer.observedRate("primary", 9, DayOfWeek.TUESDAY)).isEmpty();
        assertThat(optimizer.highRiskProfiles()).singleElement()
                .satisfies(p -> assertThat(p.hourOfDay()).isEqualTo(10));

        NoShowRiskScorer scorer = new NoShowRiskScorer(optimizer);
        assertThat(scorer.score(new SlotRiskScorer.SlotContext(null, "primary", LocalDate.of(2024, 6, 17),
                LocalTime.of(10, 30)))).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(scorer.score(new SlotRiskScorer.SlotContext(null, "primary", TUESDAY.plusWeeks(1),
                LocalTime.of(9, 0)))).isZero();
    }

    @Test
    @DisplayName("a recompute replaces the previous snapshot")
    void replacesSnapshot() {
        when(bookingRepository.findByCreatedAtGreaterThanEqual(any())).thenReturn(history(), List.of());
        optimizer.recompute(30);

        optimizer.recompute(30);

        assertThat(optimizer.observedRate("primary", 10, DayOfWeek.MONDAY)).isEmpty();
        assertThat(optimizer.highRiskProfiles()).isEmpty();
    }

    @Test
    @DisplayName("window must be positive")
    void invalidWindow() {
        assertThatThrownBy(() -> optimizer.recompute(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
