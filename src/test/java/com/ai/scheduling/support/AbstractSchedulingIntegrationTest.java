package com.ai.scheduling.support;

import com.ai.scheduling.config.SchedulingProperties;
import com.ai.scheduling.entity.AvailabilityWindow;
import com.ai.scheduling.entity.Candidate;
import com.ai.scheduling.entity.InterviewBooking;
import com.ai.scheduling.repository.AvailabilityWindowRepository;
import com.ai.scheduling.repository.CandidateRepository;
import com.ai.scheduling.repository.InterviewBookingRepository;
import com.ai.scheduling.repository.InterviewPerformanceRepository;
import com.ai.scheduling.repository.QueueEntryRepository;
import com.ai.scheduling.service.ControlSwitch;
import com.ai.scheduling.service.RiskOptimizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Full context against in-memory H2. Tables are emptied before each test; the
 * clock starts at 2024-06-01 08:00 Singapore time.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class AbstractSchedulingIntegrationTest {

    protected static final String RESOURCE = "primary";

    @Autowired protected MutableClock clock;
    @Autowired protected SchedulingProperties properties;
    @Autowired protected ControlSwitch controlSwitch;
    @Autowired protected RiskOptimizer riskOptimizer;
    @Autowired protected CandidateRepository candidateRepository;
    @Autowired protected AvailabilityWindowRepository windowRepository;
    @Autowired protected InterviewBookingRepository bookingRepository;
    @Autowired protected QueueEntryRepository queueRepository;
    @Autowired protected InterviewPerformanceRepository performanceRepository;
    @Autowired protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetState() {
        clock.set(LocalDateTime.of(2024, 6, 1, 8, 0));
        if (controlSwitch.isStopped()) {
            controlSwitch.resume();
        }
        // conversion_event is append-only through its repository
        jdbcTemplate.update("DELETE FROM conversion_event");
        performanceRepository.deleteAll();
        bookingRepository.deleteAll();
        queueRepository.deleteAll();
        windowRepository.deleteAll();
        candidateRepository.deleteAll();
        riskOptimizer.recompute();
    }

    @AfterEach
    void restoreProperties() {
        properties.setCapacity(new SchedulingProperties.Capacity());
        properties.setQueue(new SchedulingProperties.Queue());
        properties.setSearchDays(7);
    }

    protected Candidate candidate(String name) {
        return candidateRepository.save(Candidate.builder()
                .name(name)
                .email(name.toLowerCase() + "@example.com")
                .phone("+6591234567")
                .createdAt(clock.instant())
                .build());
    }

    protected AvailabilityWindow window(LocalDate date, String start, String end) {
        return window(date, start, end, AvailabilityWindow.Kind.INTERVIEW, true);
    }

    protected AvailabilityWindow window(LocalDate date, String start, String end,
                                        AvailabilityWindow.Kind kind, boolean available) {
        return windowRepository.save(AvailabilityWindow.builder()
                .resourceId(RESOURCE)
                .windowDate(date)
                .startTime(LocalTime.parse(start))
                .endTime(LocalTime.parse(end))
                .kind(kind)
                .available(available)
                .build());
    }

    protected InterviewBooking existingBooking(Long candidateId, LocalDate date, String start, int minutes,
                                               InterviewBooking.Status status) {
        return bookingRepository.save(InterviewBooking.builder()
                .candidateId(candidateId)
                .resourceId(RESOURCE)
                .bookingDate(date)
                .startTime(LocalTime.parse(start))
                .durationMinutes(minutes)
                .status(status)
                .createdAt(clock.instant())
                .build());
    }
}
