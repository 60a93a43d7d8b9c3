package com.scanq.internal;

import com.scanq.cache.ResultCache;
import com.scanq.queue.JobStatus;
import com.scanq.queue.QueueStats;
import com.scanq.queue.ScanJobQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.ToIntFunction;

public class ScanQMetrics {

    private static final Logger log = LoggerFactory.getLogger(ScanQMetrics.class);

    private final ScanJobQueue jobQueue;
    private final ResultCache resultCache;
    private final MeterRegistry meterRegistry;

    public ScanQMetrics(ScanJobQueue jobQueue, ResultCache resultCache, MeterRegistry meterRegistry) {
        this.jobQueue = jobQueue;
        this.resultCache = resultCache;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering ScanQ meters...");

        registerJobGauge(JobStatus.PENDING, QueueStats::pending);
        registerJobGauge(JobStatus.RUNNING, QueueStats::running);
        registerJobGauge(JobStatus.RETRYING, QueueStats::retrying);

        Gauge.builder("scanq.jobs.total", jobQueue, queue -> queue.getStats().total())
                .description("Pending plus running scan jobs")
                .register(meterRegistry);

        Counter completed = finishedCounter(JobStatus.COMPLETED);
        Counter failed = finishedCounter(JobStatus.FAILED);
        jobQueue.addCompletionListener(job -> {
            if (job.getStatus() == JobStatus.COMPLETED) {
                completed.increment();
            } else {
                failed.increment();
            }
        });

        Gauge.builder("scanq.cache.size", resultCache, ResultCache::size)
                .description("Entries held by the result cache, including expired ones not yet read")
                .register(meterRegistry);

        FunctionCounter.builder("scanq.cache.requests", resultCache, ResultCache::hitCount)
                .description("Result cache lookups")
                .tag("result", "hit")
                .register(meterRegistry);

        FunctionCounter.builder("scanq.cache.requests", resultCache, ResultCache::missCount)
                .description("Result cache lookups")
                .tag("result", "miss")
                .register(meterRegistry);
    }

    private void registerJobGauge(JobStatus status, ToIntFunction<QueueStats> count) {
        Gauge.builder("scanq.jobs.count", jobQueue, queue -> count.applyAsInt(queue.getStats()))
                .description("Number of scan jobs in the queue")
                .tag("status", status.name())
                .register(meterRegistry);
    }

    private Counter finishedCounter(JobStatus status) {
        return Counter.builder("scanq.jobs.finished")
                .description("Scan jobs that reached a terminal state")
                .tag("status", status.name())
                .register(meterRegistry);
    }
}
