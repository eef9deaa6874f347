package com.ai.scheduling.job;

import com.ai.scheduling.dto.CycleResult;
import com.ai.scheduling.service.QueueProcessor;
import com.ai.scheduling.service.ReminderService;
import com.ai.scheduling.service.RiskOptimizer;
import com.ai.scheduling.service.SchedulingAnalyticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic triggers. Each job only calls into a service; locking and
 * transactions are handled there.
 */
@Component
@ConditionalOnProperty(prefix = "scheduling.jobs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingJobs {

    private static final Logger log = LoggerFactory.getLogger(SchedulingJobs.class);

    private final QueueProcessor queueProcessor;
    private final RiskOptimizer riskOptimizer;
    private final ReminderService reminderService;
    private final SchedulingAnalyticsService analyticsService;

    public SchedulingJobs(QueueProcessor queueProcessor,
                          RiskOptimizer riskOptimizer,
                          ReminderService reminderService,
                          SchedulingAnalyticsService analyticsService) {
        this.queueProcessor = queueProcessor;
        this.riskOptimizer = riskOptimizer;
        this.reminderService = reminderService;
        this.analyticsService = analyticsService;
    }

    @Scheduled(fixedDelayString = "${scheduling.queue.cycle-interval-ms:300000}",
            initialDelayString = "${scheduling.queue.initial-delay-ms:60000}")
    public void processQueue() {
        CycleResult result = queueProcessor.runCycle();
        if (result.rejected()) {
            log.warn("Scheduled queue cycle skipped: previous cycle still running");
        }
    }

    @Scheduled(cron = "${scheduling.risk.recompute-cron:0 0 * * * *}", zone = "${scheduling.zone-id:Asia/Singapore}")
    public void recomputeRisk() {
        riskOptimizer.recompute();
    }

    @Scheduled(cron = "${scheduling.reminders.cron:0 0 18 * * *}", zone = "${scheduling.zone-id:Asia/Singapore}")
    public void sendReminders() {
        reminderService.sendReminders();
    }

    @Scheduled(cron = "${scheduling.metrics.cron:0 5 0 * * *}", zone = "${scheduling.zone-id:Asia/Singapore}")
    public void recordDailyPerformance() {
        analyticsService.recordDailyPerformance();
    }
}
