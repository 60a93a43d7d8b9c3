package com.scanq.queue;

import com.scanq.config.ScanQProperties;
import com.scanq.error.ClassifiedError;
import com.scanq.error.ErrorClassifier;
import com.scanq.scan.ScanDispatcher;
import com.scanq.scan.ScanResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory, priority ordered scan queue with bounded concurrency.
 *
 * <p>Waiting jobs are ordered HIGH, NORMAL, LOW and FIFO within a tier. At most
 * {@code scanq.queue.max-concurrent} jobs run at once on a fixed worker pool. A failed job is
 * retried up to its {@code maxRetries} whatever the error kind, after
 * {@code retry-delay-step * retryCount}, and goes back to the front of its priority tier. Job
 * state does not survive a restart.
 */
@Component
public class ScanJobQueue {

    private static final Logger log = LoggerFactory.getLogger(ScanJobQueue.class);

    private final JobRunner runner;
    private final ErrorClassifier errorClassifier;
    private final Clock clock;
    private final int maxConcurrent;
    private final int defaultMaxRetries;
    private final Duration retryDelayStep;
    private final String defaultTriggeredBy;

    private final Object lock = new Object();
    private final LinkedList<ScanJob> waiting = new LinkedList<>();
    private final Map<UUID, ScanJob> running = new LinkedHashMap<>();
    private final Map<UUID, ScanJob> retrying = new LinkedHashMap<>();
    // terminal jobs whose completion listeners have not returned yet
    private final Map<UUID, ScanJob> finishing = new LinkedHashMap<>();
    private final Map<UUID, ScanJob> recent;
    private final List<JobCompletionListener> listeners = new CopyOnWriteArrayList<>();

    private final ExecutorService workers;
    private final ScheduledExecutorService retryTimer;
    private boolean shuttingDown;

    @Autowired
    public ScanJobQueue(ScanDispatcher dispatcher, ErrorClassifier errorClassifier, ScanQProperties properties,
            Clock clock) {
        this(job -> dispatcher.dispatch(job.getScanType(), job.getTarget(), job.getTriggeredBy()),
                errorClassifier, properties, clock);
    }

    public ScanJobQueue(JobRunner runner, ErrorClassifier errorClassifier, ScanQProperties properties, Clock clock) {
        ScanQProperties.Queue queue = properties.getQueue();
        if (queue.getMaxConcurrent() < 1) {
            throw new IllegalArgumentException("scanq.queue.max-concurrent must be >= 1");
        }
        if (queue.getDefaultMaxRetries() < 0) {
            throw new IllegalArgumentException("scanq.queue.default-max-retries must be >= 0");
        }
        this.runner = runner;
        this.errorClassifier = errorClassifier;
        this.clock = clock;
        this.maxConcurrent = queue.getMaxConcurrent();
        this.defaultMaxRetries = queue.getDefaultMaxRetries();
        this.retryDelayStep = queue.getRetryDelayStep();
        this.defaultTriggeredBy = properties.getScan().getTriggeredBy();

        int recentLimit = Math.max(0, queue.getRecentJobsLimit());
        this.recent = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<UUID, ScanJob> eldest) {
                return size() > recentLimit;
            }
        };
        this.workers = Executors.newFixedThreadPool(maxConcurrent, namedThreads("scanq-worker-"));
        this.retryTimer = Executors.newSingleThreadScheduledExecutor(namedThreads("scanq-retry-"));
        log.info("Scan job queue started with max-concurrent={}, default-max-retries={}, retry-delay-step={}",
                maxConcurrent, defaultMaxRetries, retryDelayStep);
    }

    public void addCompletionListener(JobCompletionListener listener) {
        listeners.add(listener);
    }

    public UUID enqueue(JobSpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("Job spec must not be null");
        }
        int maxRetries = spec.maxRetries() == null ? defaultMaxRetries : spec.maxRetries();
        String triggeredBy = spec.triggeredBy() == null ? defaultTriggeredBy : spec.triggeredBy();
        ScanJob job = new ScanJob(UUID.randomUUID(), spec, maxRetries, triggeredBy, now());

        synchronized (lock) {
            if (shuttingDown) {
                throw new IllegalStateException("Scan job queue is shut down");
            }
            insertByPriority(job);
            log.info("Enqueued job {} ({} {} at {} priority), {} waiting", job.getId(), job.getScanType().value(),
                    job.getTarget(), job.getPriority(), waiting.size());
            dispatch();
        }
        return job.getId();
    }

    public Optional<ScanJob> getJob(UUID jobId) {
        synchronized (lock) {
            ScanJob job = running.get(jobId);
            if (job == null) {
                job = retrying.get(jobId);
            }
            if (job == null) {
                job = recent.get(jobId);
            }
            if (job == null) {
                job = waiting.stream().filter(candidate -> candidate.getId().equals(jobId)).findFirst().orElse(null);
            }
            return Optional.ofNullable(job).map(ScanJob::copy);
        }
    }

    public QueueStats getStats() {
        synchronized (lock) {
            return new QueueStats(waiting.size(), running.size(), retrying.size(), waiting.size() + running.size());
        }
    }

    /**
     * Ids of waiting jobs in the order they will be started.
     */
    public List<UUID> pendingJobIds() {
        synchronized (lock) {
            List<UUID> ids = new ArrayList<>(waiting.size());
            waiting.forEach(job -> ids.add(job.getId()));
            return ids;
        }
    }

    /**
     * Whether a job for the schedule is waiting, running, waiting out a retry backoff, or finished
     * with its completion listeners still running.
     */
    public boolean hasActiveJobFor(String scheduleId) {
        if (scheduleId == null) {
            return false;
        }
        synchronized (lock) {
            return waiting.stream().anyMatch(job -> scheduleId.equals(job.getScheduleId()))
                    || running.values().stream().anyMatch(job -> scheduleId.equals(job.getScheduleId()))
                    || retrying.values().stream().anyMatch(job -> scheduleId.equals(job.getScheduleId()))
                    || finishing.values().stream().anyMatch(job -> scheduleId.equals(job.getScheduleId()));
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            shuttingDown = true;
            if (!waiting.isEmpty() || !retrying.isEmpty()) {
                log.warn("Shutting down scan job queue, dropping {} waiting and {} retrying job(s)", waiting.size(),
                        retrying.size());
            }
            waiting.clear();
            retrying.clear();
            finishing.clear();
        }
        retryTimer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Scan workers did not finish within 10s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    // callers hold the lock
    private void insertByPriority(ScanJob job) {
        ListIterator<ScanJob> it = waiting.listIterator();
        while (it.hasNext()) {
            if (it.next().getPriority().rank() > job.getPriority().rank()) {
                it.previous();
                break;
            }
        }
        it.add(job);
    }

    // callers hold the lock
    private void insertAtFrontOfTier(ScanJob job) {
        ListIterator<ScanJob> it = waiting.listIterator();
        while (it.hasNext()) {
            if (it.next().getPriority().rank() >= job.getPriority().rank()) {
                it.previous();
                break;
            }
        }
        it.add(job);
    }

    // callers hold the lock
    private void dispatch() {
        while (!shuttingDown && running.size() < maxConcurrent && !waiting.isEmpty()) {
            ScanJob job = waiting.removeFirst();
            job.markRunning(now());
            running.put(job.getId(), job);
            try {
                workers.execute(() -> execute(job));
            } catch (RejectedExecutionException e) {
                running.remove(job.getId());
                job.markFailed("Queue is shutting down", null, now());
                recent.put(job.getId(), job);
                log.warn("Job {} rejected by worker pool", job.getId());
                return;
            }
            log.debug("Started job {} ({} running)", job.getId(), running.size());
        }
    }

    private void execute(ScanJob job) {
        ScanResult result;
        try {
            result = runner.run(job);
        } catch (Exception e) {
            onFailure(job, e);
            return;
        } catch (Error e) {
            onFailure(job, e);
            throw e;
        }
        onSuccess(job, result);
    }

    private void onSuccess(ScanJob job, ScanResult result) {
        ScanJob finished;
        synchronized (lock) {
            running.remove(job.getId());
            job.markCompleted(result, now());
            recent.put(job.getId(), job);
            finishing.put(job.getId(), job);
            finished = job.copy();
            dispatch();
        }
        log.info("Job {} completed ({} {})", job.getId(), job.getScanType().value(), job.getTarget());
        notifyListeners(finished);
    }

    private void onFailure(ScanJob job, Throwable error) {
        ClassifiedError classified = errorClassifier.classify(error);
        ScanJob finished = null;
        synchronized (lock) {
            running.remove(job.getId());
            if (job.canRetry() && !(error instanceof Error)) {
                job.markRetrying(classified.message(), classified.kind());
                retrying.put(job.getId(), job);
                Duration delay = retryDelayStep.multipliedBy(job.getRetryCount());
                log.warn("Job {} failed with {} (attempt {}/{}), retrying in {} ms: {}", job.getId(),
                        classified.kind(), job.getRetryCount(), job.getMaxRetries() + 1, delay.toMillis(),
                        classified.message());
                scheduleRetry(job, delay);
            } else {
                job.markFailed(classified.message(), classified.kind(), now());
                recent.put(job.getId(), job);
                finishing.put(job.getId(), job);
                finished = job.copy();
                log.error("Job {} failed after {} attempt(s): {}", job.getId(), job.getRetryCount() + 1,
                        classified.message());
            }
            dispatch();
        }
        if (finished != null) {
            notifyListeners(finished);
        }
    }

    // callers hold the lock
    private void scheduleRetry(ScanJob job, Duration delay) {
        try {
            retryTimer.schedule(() -> requeue(job), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            retrying.remove(job.getId());
            job.markFailed("Queue is shutting down", job.getErrorKind(), now());
            recent.put(job.getId(), job);
        }
    }

    private void requeue(ScanJob job) {
        synchronized (lock) {
            if (retrying.remove(job.getId()) == null || shuttingDown) {
                return;
            }
            job.markPending();
            insertAtFrontOfTier(job);
            log.debug("Job {} re-queued for retry {}", job.getId(), job.getRetryCount());
            dispatch();
        }
    }

    private void notifyListeners(ScanJob job) {
        try {
            for (JobCompletionListener listener : listeners) {
                try {
                    listener.onJobFinished(job);
                } catch (RuntimeException e) {
                    log.error("Completion listener failed for job {}", job.getId(), e);
                }
            }
        } finally {
            synchronized (lock) {
                finishing.remove(job.getId());
            }
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
