package com.scanq.web;

import com.scanq.scan.ScanTarget;
import com.scanq.schedule.NewSchedule;
import com.scanq.schedule.Schedule;
import com.scanq.schedule.ScheduleCreated;
import com.scanq.schedule.ScheduleService;
import com.scanq.schedule.ScheduleStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private final ScheduleService scheduleService;

    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @GetMapping
    public ApiResponse<Map<String, List<Schedule>>> list(
            @RequestParam("database") String database,
            @RequestParam("schema") String schema,
            @RequestParam("table") String table) {
        return ApiResponse.ok(Map.of("schedules", scheduleService.listForTable(new ScanTarget(database, schema, table))));
    }

    @GetMapping("/{scheduleId}")
    public ApiResponse<Schedule> get(@PathVariable("scheduleId") String scheduleId) {
        return ApiResponse.ok(scheduleService.get(scheduleId));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ScheduleCreated> create(@RequestBody NewSchedule request) {
        return ApiResponse.ok(scheduleService.create(request));
    }

    /**
     * Pause, resume, delete or force a run. {@code status} and {@code forceRunNow} may be combined.
     */
    @PutMapping
    public ApiResponse<Map<String, String>> update(@RequestBody UpdateScheduleRequest request) {
        if (request == null || request.scheduleId() == null || request.scheduleId().isBlank()) {
            throw new IllegalArgumentException("Missing scheduleId");
        }
        boolean forceRunNow = Boolean.TRUE.equals(request.forceRunNow());
        scheduleService.update(request.scheduleId(), request.status(), forceRunNow);
        if (forceRunNow) {
            return ApiResponse.message("Schedule marked for immediate execution");
        }
        if (request.status() == null) {
            return ApiResponse.message("Schedule updated");
        }
        return ApiResponse.message("Schedule " + request.status().value());
    }

    @DeleteMapping
    public ApiResponse<Map<String, String>> delete(@RequestParam("scheduleId") String scheduleId) {
        scheduleService.softDelete(scheduleId);
        return ApiResponse.message("Schedule deleted");
    }

    public record UpdateScheduleRequest(String scheduleId, ScheduleStatus status, Boolean forceRunNow) {
    }
}
