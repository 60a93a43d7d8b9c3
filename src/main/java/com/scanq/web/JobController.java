package com.scanq.web;

import com.scanq.queue.QueueStats;
import com.scanq.queue.ScanJob;
import com.scanq.queue.ScanJobQueue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private final ScanJobQueue jobQueue;

    public JobController(ScanJobQueue jobQueue) {
        this.jobQueue = jobQueue;
    }

    @GetMapping("/stats")
    public ApiResponse<QueueStats> stats() {
        return ApiResponse.ok(jobQueue.getStats());
    }

    @GetMapping("/{jobId}")
    public ApiResponse<ScanJob> get(@PathVariable("jobId") UUID jobId) {
        return ApiResponse.ok(jobQueue.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId)));
    }
}
