package com.ai.scheduling.service;

import com.ai.scheduling.config.SchedulingProperties;
import com.ai.scheduling.dto.RiskProfile;
import com.ai.scheduling.entity.InterviewBooking;
import com.ai.scheduling.repository.InterviewBookingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Rolling no-show analysis. Profiles live in memory only and are replaced
 * wholesale on every recompute.
 */
@Service
public class RiskOptimizer {

    private static final Logger log = LoggerFactory.getLogger(RiskOptimizer.class);

    private final InterviewBookingRepository bookingRepository;
    private final SchedulingProperties properties;
    private final Clock clock;

    private volatile Map<BucketKey, RiskProfile> profiles = Map.of();

    public RiskOptimizer(InterviewBookingRepository bookingRepository,
                         SchedulingProperties properties,
                         Clock clock) {
        this.bookingRepository = bookingRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<RiskProfile> recompute() {
        return recompute(properties.getRisk().getWindowDays());
    }

    /**
     * Recomputes no-show rates over bookings created in the last {@code windowDays} days.
     * Buckets under the minimum sample size are left out (unknown, never penalized).
     */
    @Transactional(readOnly = true)
    public List<RiskProfile> recompute(int windowDays) {
        if (windowDays <= 0) {
            throw new IllegalArgumentException("windowDays must be positive");
        }
        Instant since = clock.instant().minus(Duration.ofDays(windowDays));
        List<InterviewBooking> history = bookingRepository.findByCreatedAtGreaterThanEqual(since);

        Map<BucketKey, int[]> counts = new HashMap<>();
        for (InterviewBooking b : history) {
            BucketKey key = new BucketKey(b.getResourceId(), b.getStartTime().getHour(),
                    b.getBookingDate().getDayOfWeek());
            int[] c = counts.computeIfAbsent(key, k -> new int[2]);
            c[0]++;
            if (b.getStatus() == InterviewBooking.Status.NO_SHOW) c[1]++;
        }

        int minSample = properties.getRisk().getMinSampleSize();
        Map<BucketKey, RiskProfile> next = new HashMap<>();
        for (Map.Entry<BucketKey, int[]> e : counts.entrySet()) {
            int total = e.getValue()[0];
            if (total < minSample) continue;
            int noShows = e.getValue()[1];
            BucketKey k = e.getKey();
            next.put(k, new RiskProfile(k.resourceId(), k.hourOfDay(), k.dayOfWeek(), total, noShows,
                    (double) noShows / total));
        }
        profiles = Map.copyOf(next);

        List<RiskProfile> result = new ArrayList<>(next.values());
        result.sort(Comparator.comparingDouble(RiskProfile::observedNoShowRate).reversed()
                .thenComparing(RiskProfile::resourceId)
                .thenComparing(RiskProfile::dayOfWeek)
                .thenComparingInt(RiskProfile::hourOfDay));

        double threshold = properties.getRisk().getNoShowThreshold();
        long highRisk = 0;
        for (RiskProfile p : result) {
            if (p.observedNoShowRate() > threshold) {
                highRisk++;
                log.warn("High no-show rate: resource={} {} {}:00 rate={} ({}/{})", p.resourceId(), p.dayOfWeek(),
                        p.hourOfDay(), String.format("%.2f", p.observedNoShowRate()), p.noShows(), p.sampleSize());
            }
        }
        log.info("Risk recompute over {} days: bookings={}, trusted buckets={}, high risk={}",
                windowDays, history.size(), result.size(), highRisk);
        return result;
    }

    public OptionalDouble observedRate(String resourceId, int hourOfDay, DayOfWeek dayOfWeek) {
        RiskProfile p = profiles.get(new BucketKey(resourceId, hourOfDay, dayOfWeek));
        return p == null ? OptionalDouble.empty() : OptionalDouble.of(p.observedNoShowRate());
    }

    public List<RiskProfile> highRiskProfiles() {
        double threshold = properties.getRisk().getNoShowThreshold();
        return profiles.values().stream()
                .filter(p -> p.observedNoShowRate() > threshold)
                .sorted(Comparator.comparingDouble(RiskProfile::observedNoShowRate).reversed())
                .toList();
    }

    private record BucketKey(String resourceId, int hourOfDay, DayOfWeek dayOfWeek) {
    }
}
