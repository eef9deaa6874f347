package com.ai.scheduling.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "scheduling")
public class SchedulingProperties {

    private String defaultResourceId = "primary";
    private String zoneId = "Asia/Singapore";

    /** Days after today that queue allocation searches (inclusive). */
    private int searchDays = 7;

    private Capacity capacity = new Capacity();
    private Queue queue = new Queue();
    private Risk risk = new Risk();
    private Booking booking = new Booking();
    private Seed seed = new Seed();

    public CapacityConfig capacitySnapshot() {
        return new CapacityConfig(
                capacity.getSlotDurationMinutes(),
                capacity.getBufferMinutes(),
                capacity.isEnforceBuffer(),
                capacity.getMaxDailyBookings(),
                capacity.getMaxWeeklyBookings(),
                capacity.getWorkingHours().stream().map(CapacityConfig.WorkingBlock::parse).toList(),
                Set.copyOf(capacity.getWorkingDays()));
    }

    @Getter
    @Setter
    public static class Capacity {
        private int slotDurationMinutes = 30;
        private int bufferMinutes = 15;
        private boolean enforceBuffer = false;
        private int maxDailyBookings = 20;
        private int maxWeeklyBookings = 100;
        private List<String> workingHours = new ArrayList<>(List.of("09:00-13:00", "14:00-18:00"));
        private List<DayOfWeek> workingDays = new ArrayList<>(List.of(
                DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY));
    }

    @Getter
    @Setter
    public static class Queue {
        private int batchSize = 50;
    }

    @Getter
    @Setter
    public static class Risk {
        private int windowDays = 30;
        private int minSampleSize = 5;
        private double noShowThreshold = 0.20;
    }

    @Getter
    @Setter
    public static class Booking {
        private int rescheduleLockHours = 24;
        private String meetingBaseUrl = "https://meet.worklink.com/interview";
    }

    @Getter
    @Setter
    public static class Seed {
        private boolean enabled = true;
        private int daysAhead = 30;
    }
}
