package com.scanq.web;

import com.scanq.scheduler.ExecutionReport;
import com.scanq.scheduler.SchedulerDriver;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {

    private final SchedulerDriver driver;

    public SchedulerController(SchedulerDriver driver) {
        this.driver = driver;
    }

    /**
     * One scheduler tick; meant to be called by an external cron.
     */
    @GetMapping("/run")
    public ApiResponse<ExecutionReport> run() {
        return ApiResponse.ok(driver.runDueSchedules());
    }

    @PostMapping("/run")
    public ApiResponse<Map<String, String>> runNow(@RequestBody RunNowRequest request) {
        if (request == null || request.scheduleId() == null || request.scheduleId().isBlank()) {
            throw new IllegalArgumentException("Missing scheduleId");
        }
        driver.runNow(request.scheduleId());
        return ApiResponse.message("Schedule marked for immediate execution");
    }

    public record RunNowRequest(String scheduleId) {
    }
}
