package com.scanq.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionReport(int executed, List<ScheduleRun> runs, String message) {

    public ExecutionReport {
        runs = runs == null ? List.of() : List.copyOf(runs);
    }

    static ExecutionReport of(List<ScheduleRun> runs) {
        return new ExecutionReport(runs.size(), runs, null);
    }

    static ExecutionReport noneDue() {
        return new ExecutionReport(0, List.of(), "No schedules due");
    }

    static ExecutionReport tickInProgress() {
        return new ExecutionReport(0, List.of(), "Previous scheduler run still in progress");
    }
}
