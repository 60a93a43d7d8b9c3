package com.scanq.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process replacement for an external cron hitting {@code GET /api/scheduler/run}.
 */
@Component
@ConditionalOnProperty(prefix = "scanq.scheduler.auto-trigger", name = "enabled", havingValue = "true")
public class SchedulerTrigger {

    private static final Logger log = LoggerFactory.getLogger(SchedulerTrigger.class);

    private final SchedulerDriver driver;

    public SchedulerTrigger(SchedulerDriver driver) {
        this.driver = driver;
    }

    @Scheduled(initialDelayString = "${scanq.scheduler.auto-trigger.poll-interval-in-seconds:60}000",
            fixedDelayString = "${scanq.scheduler.auto-trigger.poll-interval-in-seconds:60}000")
    public void tick() {
        try {
            ExecutionReport report = driver.runDueSchedules();
            if (report.executed() > 0) {
                log.info("Scheduler tick handled {} schedule(s)", report.executed());
            }
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }
}
