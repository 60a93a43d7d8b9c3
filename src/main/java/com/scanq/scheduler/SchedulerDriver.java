package com.scanq.scheduler;

import com.scanq.config.ScanQProperties;
import com.scanq.config.ScanQProperties.Scheduler.DispatchMode;
import com.scanq.error.ClassifiedError;
import com.scanq.error.ErrorClassifier;
import com.scanq.queue.JobPriority;
import com.scanq.queue.JobSpec;
import com.scanq.queue.JobStatus;
import com.scanq.queue.ScanJob;
import com.scanq.queue.ScanJobQueue;
import com.scanq.retry.RetryExecutor;
import com.scanq.scan.ScanDispatcher;
import com.scanq.scan.ScanResult;
import com.scanq.schedule.OnFailureAction;
import com.scanq.schedule.Schedule;
import com.scanq.schedule.ScheduleRepository;
import com.scanq.schedule.ScheduleResolver;
import com.scanq.schedule.ScheduleStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the schedules that are due. Each tick lists at most {@code scanq.scheduler.batch-size}
 * active schedules whose {@code nextRunAt} has passed, executes them and writes the outcome back.
 *
 * <p>In {@code inline} dispatch mode scans run on the calling thread through the
 * {@link RetryExecutor}. In {@code queue} mode they are handed to the {@link ScanJobQueue} and the
 * schedule is updated once the job finishes; a schedule that already has a job in flight is
 * skipped. Ticks never overlap.
 */
@Component
public class SchedulerDriver {

    private static final Logger log = LoggerFactory.getLogger(SchedulerDriver.class);

    private final ScheduleRepository repository;
    private final ScheduleResolver resolver;
    private final ScanDispatcher dispatcher;
    private final RetryExecutor retryExecutor;
    private final ScanJobQueue jobQueue;
    private final ErrorClassifier errorClassifier;
    private final Clock clock;
    private final int batchSize;
    private final DispatchMode dispatchMode;
    private final String triggeredBy;
    private final ReentrantLock tickLock = new ReentrantLock();

    public SchedulerDriver(
            ScheduleRepository repository,
            ScheduleResolver resolver,
            ScanDispatcher dispatcher,
            RetryExecutor retryExecutor,
            ScanJobQueue jobQueue,
            ErrorClassifier errorClassifier,
            ScanQProperties properties,
            Clock clock) {
        this.repository = repository;
        this.resolver = resolver;
        this.dispatcher = dispatcher;
        this.retryExecutor = retryExecutor;
        this.jobQueue = jobQueue;
        this.errorClassifier = errorClassifier;
        this.clock = clock;
        this.batchSize = properties.getScheduler().getBatchSize();
        this.dispatchMode = properties.getScheduler().getDispatchMode();
        this.triggeredBy = properties.getScan().getTriggeredBy();
        jobQueue.addCompletionListener(this::onJobFinished);
    }

    public ExecutionReport runDueSchedules() {
        if (!tickLock.tryLock()) {
            log.debug("Scheduler tick skipped, previous tick still running");
            return ExecutionReport.tickInProgress();
        }
        try {
            OffsetDateTime now = OffsetDateTime.now(clock);
            List<Schedule> due = repository.listDue(now, batchSize);
            if (due.isEmpty()) {
                log.debug("No schedules due at {}", now);
                return ExecutionReport.noneDue();
            }
            log.info("Found {} due schedule(s), dispatch mode {}", due.size(), dispatchMode);

            List<ScheduleRun> runs = new ArrayList<>(due.size());
            for (Schedule schedule : due) {
                runs.add(runSchedule(schedule));
            }
            return ExecutionReport.of(runs);
        } finally {
            tickLock.unlock();
        }
    }

    public void runNow(String scheduleId) {
        repository.forceRunNow(scheduleId, OffsetDateTime.now(clock));
        log.info("Schedule {} will run on the next tick", scheduleId);
    }

    private ScheduleRun runSchedule(Schedule schedule) {
        String table = schedule.getTarget().qualifiedName();
        try {
            boolean inFlight = jobQueue.hasActiveJobFor(schedule.getId());
            if (inFlight && (schedule.isSkipIfRunning() || dispatchMode == DispatchMode.QUEUE)) {
                log.info("Skipping schedule {} for {}, a previous run is still active", schedule.getId(), table);
                return ScheduleRun.skipped(schedule.getId(), schedule.getScanType(), table,
                        "Previous run still active");
            }

            if (dispatchMode == DispatchMode.QUEUE) {
                UUID jobId = jobQueue.enqueue(new JobSpec(schedule.getId(), schedule.getScanType(),
                        schedule.getTarget(), JobPriority.NORMAL, null, triggeredBy));
                return ScheduleRun.enqueued(schedule.getId(), schedule.getScanType(), table, jobId);
            }

            log.info("Executing scheduled {} scan for {}", schedule.getScanType().value(), table);
            ScanResult result = retryExecutor.retry(
                    () -> dispatcher.dispatch(schedule.getScanType(), schedule.getTarget(), triggeredBy),
                    "Schedule " + schedule.getId());
            recordSuccess(schedule);
            return ScheduleRun.completed(schedule.getId(), schedule.getScanType(), table, result.runId());
        } catch (Exception e) {
            ClassifiedError classified = errorClassifier.classify(e);
            log.error("Schedule {} for {} failed with {}: {}", schedule.getId(), table, classified.kind(),
                    classified.message(), e);
            recordFailureQuietly(schedule, classified.message());
            return ScheduleRun.failed(schedule.getId(), schedule.getScanType(), table, classified.message());
        }
    }

    private void recordSuccess(Schedule schedule) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime nextRunAt = schedule.isRecurring() ? resolver.nextRunFor(schedule) : null;
        repository.markExecuted(schedule.getId(), now, nextRunAt);
        if (nextRunAt == null) {
            log.info("Schedule {} has no further runs", schedule.getId());
        } else {
            log.debug("Schedule {} next runs at {}", schedule.getId(), nextRunAt);
        }
    }

    private void recordFailure(Schedule schedule, String error) {
        int failures = repository.incrementFailure(schedule.getId(), error, OffsetDateTime.now(clock));
        if (failures >= schedule.getMaxFailures() && schedule.getOnFailureAction() == OnFailureAction.PAUSE) {
            repository.updateStatus(schedule.getId(), ScheduleStatus.PAUSED, OffsetDateTime.now(clock));
            log.warn("Schedule {} paused after {} consecutive failure(s)", schedule.getId(), failures);
        }
    }

    private void recordFailureQuietly(Schedule schedule, String error) {
        try {
            recordFailure(schedule, error);
        } catch (RuntimeException e) {
            log.error("Could not record failure for schedule {}", schedule.getId(), e);
        }
    }

    private void onJobFinished(ScanJob job) {
        if (job.getScheduleId() == null) {
            return;
        }
        Optional<Schedule> schedule = repository.findById(job.getScheduleId());
        if (schedule.isEmpty() || schedule.get().getStatus() == ScheduleStatus.DELETED) {
            log.debug("Job {} finished for schedule {} which no longer exists", job.getId(), job.getScheduleId());
            return;
        }
        if (job.getStatus() == JobStatus.COMPLETED) {
            try {
                recordSuccess(schedule.get());
            } catch (RuntimeException e) {
                ClassifiedError classified = errorClassifier.classify(e);
                log.error("Could not reschedule {} after job {}", job.getScheduleId(), job.getId(), e);
                recordFailureQuietly(schedule.get(), classified.message());
            }
        } else {
            recordFailureQuietly(schedule.get(), job.getError());
        }
    }
}
