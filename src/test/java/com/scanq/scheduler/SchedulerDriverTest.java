package com.scanq.scheduler;

import com.scanq.MutableClock;
import com.scanq.config.ScanQProperties;
import com.scanq.config.ScanQProperties.Scheduler.DispatchMode;
import com.scanq.error.ErrorClassifier;
import com.scanq.error.WarehouseException;
import com.scanq.queue.JobPriority;
import com.scanq.queue.JobSpec;
import com.scanq.queue.ScanJobQueue;
import com.scanq.retry.RetryExecutor;
import com.scanq.retry.RetryPolicy;
import com.scanq.scan.ScanDispatcher;
import com.scanq.scan.ScanRequest;
import com.scanq.scan.ScanResult;
import com.scanq.scan.ScanTarget;
import com.scanq.scan.ScanType;
import com.scanq.scan.ScanWorker;
import com.scanq.scan.ScanWorkerRegistry;
import com.scanq.schedule.InMemoryScheduleRepository;
import com.scanq.schedule.OnFailureAction;
import com.scanq.schedule.RecurrenceType;
import com.scanq.schedule.Schedule;
import com.scanq.schedule.ScheduleResolver;
import com.scanq.schedule.ScheduleStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class SchedulerDriverTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2024-01-01T10:00:00Z");
    private static final ScanTarget TARGET = new ScanTarget("DQ", "PUBLIC", "ORDERS");

    private MutableClock clock;
    private ScanQProperties properties;
    private InMemoryScheduleRepository repository;
    private StubWorker profiling;
    private StubWorker checks;
    private ScanJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(NOW.toInstant().toString());
        properties = new ScanQProperties();
        properties.getQueue().setRetryDelayStep(Duration.ofMillis(5));
        repository = new InMemoryScheduleRepository();
        profiling = new StubWorker(ScanType.PROFILING);
        checks = new StubWorker(ScanType.CHECKS);
    }

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.shutdown();
        }
    }

    @Test
    void successfulHourlyRunAdvancesSchedule() {
        repository.create(schedule("hourly", NOW.minusSeconds(1)));
        SchedulerDriver driver = newDriver();

        assertThat(repository.listDue(NOW, 5)).extracting(Schedule::getId).containsExactly("hourly");

        ExecutionReport report = driver.runDueSchedules();

        assertEquals(1, report.executed());
        ScheduleRun run = report.runs().get(0);
        assertEquals(RunStatus.COMPLETED, run.status());
        assertEquals("profiling-run-1", run.runId());
        assertEquals("DQ.PUBLIC.ORDERS", run.table());

        Schedule stored = repository.findById("hourly").orElseThrow();
        assertEquals(NOW, stored.getLastRunAt());
        assertEquals(OffsetDateTime.parse("2024-01-01T11:00:00Z"), stored.getNextRunAt());
        assertEquals(0, stored.getFailureCount());
        assertThat(profiling.requests).singleElement()
                .satisfies(request -> assertEquals("scheduled", request.triggeredBy()));
    }

    @Test
    void reportsWhenNothingIsDue() {
        repository.create(schedule("later", NOW.plusMinutes(5)));

        ExecutionReport report = newDriver().runDueSchedules();

        assertEquals(0, report.executed());
        assertEquals("No schedules due", report.message());
    }

    @Test
    void tickIsLimitedByBatchSize() {
        properties.getScheduler().setBatchSize(2);
        for (int i = 0; i < 4; i++) {
            repository.create(schedule("s-" + i, NOW.minusMinutes(10 - i)));
        }

        ExecutionReport report = newDriver().runDueSchedules();

        assertThat(report.runs()).extracting(ScheduleRun::scheduleId).containsExactly("s-0", "s-1");
        assertThat(repository.listDue(NOW, 10)).extracting(Schedule::getId).containsExactly("s-2", "s-3");
    }

    @Test
    void failureIncrementsCounterAndPausesAtThreshold() {
        Schedule schedule = schedule("fragile", NOW.minusSeconds(1));
        schedule.setOnFailureAction(OnFailureAction.PAUSE);
        schedule.setMaxFailures(2);
        repository.create(schedule);
        profiling.failWith(new WarehouseException("Incorrect username or password", "390100"));
        SchedulerDriver driver = newDriver();

        ScheduleRun first = driver.runDueSchedules().runs().get(0);

        assertEquals(RunStatus.FAILED, first.status());
        assertEquals("Incorrect username or password", first.error());
        Schedule afterFirst = repository.findById("fragile").orElseThrow();
        assertEquals(1, afterFirst.getFailureCount());
        assertEquals(ScheduleStatus.ACTIVE, afterFirst.getStatus());
        assertEquals(NOW.minusSeconds(1), afterFirst.getNextRunAt());
        assertEquals(1, profiling.calls.get());

        driver.runDueSchedules();

        Schedule afterSecond = repository.findById("fragile").orElseThrow();
        assertEquals(2, afterSecond.getFailureCount());
        assertEquals(ScheduleStatus.PAUSED, afterSecond.getStatus());
        assertEquals("No schedules due", driver.runDueSchedules().message());
    }

    @Test
    void continueActionKeepsFailingScheduleActive() {
        Schedule schedule = schedule("stubborn", NOW.minusSeconds(1));
        schedule.setMaxFailures(1);
        repository.create(schedule);
        profiling.failWith(new WarehouseException("SQL compilation error: invalid identifier", "001003"));
        SchedulerDriver driver = newDriver();

        driver.runDueSchedules();
        driver.runDueSchedules();

        Schedule stored = repository.findById("stubborn").orElseThrow();
        assertEquals(2, stored.getFailureCount());
        assertEquals(ScheduleStatus.ACTIVE, stored.getStatus());
    }

    @Test
    void transientFailureIsRetriedWithinTheTick() {
        repository.create(schedule("flaky", NOW.minusSeconds(1)));
        profiling.failTimes(2, new IllegalStateException("ECONNREFUSED"));

        ScheduleRun run = newDriver().runDueSchedules().runs().get(0);

        assertEquals(RunStatus.COMPLETED, run.status());
        assertEquals(3, profiling.calls.get());
        assertEquals(0, repository.findById("flaky").orElseThrow().getFailureCount());
    }

    @Test
    void reportedScanFailureCountsAsFailure() {
        repository.create(schedule("rejected", NOW.minusSeconds(1)));
        profiling.respond(ScanResult.failed("Table is locked"));

        ScheduleRun run = newDriver().runDueSchedules().runs().get(0);

        assertEquals(RunStatus.FAILED, run.status());
        assertThat(run.error()).contains("Table is locked");
        Schedule stored = repository.findById("rejected").orElseThrow();
        assertEquals(1, stored.getFailureCount());
        assertNull(stored.getLastRunAt());
    }

    @Test
    void oneTimeScheduleHasNoNextRunAfterSuccess() {
        Schedule schedule = schedule("once", NOW.minusSeconds(1));
        schedule.setRecurring(false);
        schedule.setRecurrenceType(RecurrenceType.NONE);
        schedule.setScanType(ScanType.FULL);
        repository.create(schedule);

        ScheduleRun run = newDriver().runDueSchedules().runs().get(0);

        assertEquals(RunStatus.COMPLETED, run.status());
        assertEquals("checks-run-1", run.runId());
        Schedule stored = repository.findById("once").orElseThrow();
        assertNull(stored.getNextRunAt());
        assertEquals(NOW, stored.getLastRunAt());
        assertThat(repository.listDue(NOW.plusDays(30), 5)).isEmpty();
    }

    @Test
    void skipsScheduleWithActiveJobWhenRequested() throws Exception {
        Schedule schedule = schedule("busy", NOW.minusSeconds(1));
        schedule.setSkipIfRunning(true);
        repository.create(schedule);
        CountDownLatch release = new CountDownLatch(1);
        queue = new ScanJobQueue(job -> {
            release.await(10, TimeUnit.SECONDS);
            return ScanResult.succeeded("queued");
        }, new ErrorClassifier(), properties, clock);
        queue.enqueue(new JobSpec("busy", ScanType.PROFILING, TARGET, JobPriority.HIGH, 0, "manual"));
        SchedulerDriver driver = newDriver();

        ScheduleRun run = driver.runDueSchedules().runs().get(0);
        release.countDown();

        assertEquals(RunStatus.SKIPPED, run.status());
        assertEquals(0, profiling.calls.get());
        Schedule stored = repository.findById("busy").orElseThrow();
        assertEquals(0, stored.getFailureCount());
        assertNull(stored.getLastRunAt());
    }

    @Test
    void queueModeUpdatesScheduleWhenJobFinishes() {
        properties.getScheduler().setDispatchMode(DispatchMode.QUEUE);
        repository.create(schedule("queued", NOW.minusSeconds(1)));
        SchedulerDriver driver = newDriver();

        ScheduleRun run = driver.runDueSchedules().runs().get(0);

        assertEquals(RunStatus.ENQUEUED, run.status());
        assertNotNull(run.jobId());
        await().atMost(Duration.ofSeconds(10)).untilAsserted(
                () -> assertEquals(NOW, repository.findById("queued").orElseThrow().getLastRunAt()));
        Schedule stored = repository.findById("queued").orElseThrow();
        assertEquals(OffsetDateTime.parse("2024-01-01T11:00:00Z"), stored.getNextRunAt());
        assertEquals(1, profiling.calls.get());
    }

    @Test
    void queueModeRecordsFailureAfterRetriesAreExhausted() {
        properties.getScheduler().setDispatchMode(DispatchMode.QUEUE);
        properties.getQueue().setDefaultMaxRetries(1);
        repository.create(schedule("doomed", NOW.minusSeconds(1)));
        profiling.failWith(new IllegalStateException("Connection timeout"));

        newDriver().runDueSchedules();

        await().atMost(Duration.ofSeconds(10)).untilAsserted(
                () -> assertEquals(1, repository.findById("doomed").orElseThrow().getFailureCount()));
        assertEquals(2, profiling.calls.get());
        assertEquals("Connection timeout", repository.findById("doomed").orElseThrow().getLastError());
    }

    @Test
    void queueModeSkipsScheduleWhileItsCompletionIsBeingRecorded() throws Exception {
        properties.getScheduler().setDispatchMode(DispatchMode.QUEUE);
        repository.create(schedule("queued", NOW.minusSeconds(1)));
        CountDownLatch finishing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        jobQueue().addCompletionListener(job -> {
            finishing.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        SchedulerDriver driver = newDriver();

        assertEquals(RunStatus.ENQUEUED, driver.runDueSchedules().runs().get(0).status());
        assertThat(finishing.await(10, TimeUnit.SECONDS)).isTrue();

        ScheduleRun second = driver.runDueSchedules().runs().get(0);
        release.countDown();

        assertEquals(RunStatus.SKIPPED, second.status());
        await().atMost(Duration.ofSeconds(10)).untilAsserted(
                () -> assertEquals(NOW, repository.findById("queued").orElseThrow().getLastRunAt()));
        assertEquals(1, profiling.calls.get());
    }

    @Test
    void overlappingTickReturnsImmediately() throws Exception {
        repository.create(schedule("slow", NOW.minusSeconds(1)));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        profiling.blockOn(entered, release);
        SchedulerDriver driver = newDriver();

        CompletableFuture<ExecutionReport> first = CompletableFuture.supplyAsync(driver::runDueSchedules);
        entered.await(10, TimeUnit.SECONDS);

        ExecutionReport overlapping = driver.runDueSchedules();
        release.countDown();

        assertEquals(0, overlapping.executed());
        assertEquals("Previous scheduler run still in progress", overlapping.message());
        assertEquals(1, first.get(10, TimeUnit.SECONDS).executed());
    }

    @Test
    void runNowMakesScheduleDue() {
        repository.create(schedule("tomorrow", NOW.plusDays(1)));
        SchedulerDriver driver = newDriver();

        driver.runNow("tomorrow");

        assertEquals(1, driver.runDueSchedules().executed());
    }

    private SchedulerDriver newDriver() {
        ErrorClassifier classifier = new ErrorClassifier();
        ScanDispatcher dispatcher = dispatcher();
        RetryExecutor retryExecutor = new RetryExecutor(classifier, RetryPolicy.defaults(), delay -> { });
        return new SchedulerDriver(repository, new ScheduleResolver(clock), dispatcher, retryExecutor, jobQueue(),
                classifier, properties, clock);
    }

    private ScanJobQueue jobQueue() {
        if (queue == null) {
            queue = new ScanJobQueue(dispatcher(), new ErrorClassifier(), properties, clock);
        }
        return queue;
    }

    private ScanDispatcher dispatcher() {
        return new ScanDispatcher(new ScanWorkerRegistry(List.of(profiling, checks)), properties);
    }

    private static Schedule schedule(String id, OffsetDateTime nextRunAt) {
        Schedule schedule = new Schedule(id, TARGET, ScanType.PROFILING);
        schedule.setRecurring(true);
        schedule.setRecurrenceType(RecurrenceType.HOURLY);
        schedule.setNextRunAt(nextRunAt);
        schedule.setCreatedAt(NOW.minusDays(1));
        return schedule;
    }

    static final class StubWorker implements ScanWorker {

        private final ScanType scanType;
        final AtomicInteger calls = new AtomicInteger();
        final List<ScanRequest> requests = new CopyOnWriteArrayList<>();
        private volatile Exception failure;
        private volatile int failuresLeft = Integer.MAX_VALUE;
        private volatile ScanResult response;
        private volatile CountDownLatch entered;
        private volatile CountDownLatch release;

        StubWorker(ScanType scanType) {
            this.scanType = scanType;
        }

        void failWith(Exception error) {
            this.failure = error;
        }

        void failTimes(int times, Exception error) {
            this.failure = error;
            this.failuresLeft = times;
        }

        void respond(ScanResult result) {
            this.response = result;
        }

        void blockOn(CountDownLatch entered, CountDownLatch release) {
            this.entered = entered;
            this.release = release;
        }

        @Override
        public ScanType getScanType() {
            return scanType;
        }

        @Override
        public ScanResult run(ScanRequest request) throws Exception {
            int call = calls.incrementAndGet();
            requests.add(request);
            if (entered != null) {
                entered.countDown();
                release.await(10, TimeUnit.SECONDS);
            }
            if (failure != null && call <= failuresLeft) {
                throw failure;
            }
            if (response != null) {
                return response;
            }
            return ScanResult.succeeded(scanType.value() + "-run-" + call);
        }
    }
}
