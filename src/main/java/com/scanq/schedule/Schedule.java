package com.scanq.schedule;

import com.scanq.scan.ScanTarget;
import com.scanq.scan.ScanType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "scanq_schedules")
public class Schedule {

    public static final String DEFAULT_TIMEZONE = "UTC";
    public static final int DEFAULT_MAX_FAILURES = 3;

    @Id
    @Column(name = "schedule_id", length = 36)
    private String id;

    @Column(name = "database_name", nullable = false)
    private String databaseName;

    @Column(name = "schema_name", nullable = false)
    private String schemaName;

    @Column(name = "table_name", nullable = false)
    private String tableName;

    @Enumerated(EnumType.STRING)
    @Column(name = "scan_type", nullable = false)
    private ScanType scanType;

    @Column(name = "is_recurring")
    private boolean recurring;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_type")
    private RecurrenceType recurrenceType;

    @Column(name = "schedule_time")
    private String timeOfDay;

    @Convert(converter = DaysOfWeekConverter.class)
    @Column(name = "schedule_days")
    private List<String> daysOfWeek = new ArrayList<>();

    @Column(name = "timezone")
    private String timezone = DEFAULT_TIMEZONE;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "skip_if_running")
    private boolean skipIfRunning;

    @Enumerated(EnumType.STRING)
    @Column(name = "on_failure_action")
    private OnFailureAction onFailureAction = OnFailureAction.CONTINUE;

    @Column(name = "max_failures")
    private int maxFailures = DEFAULT_MAX_FAILURES;

    @Column(name = "failure_count")
    private int failureCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ScheduleStatus status = ScheduleStatus.ACTIVE;

    @Column(name = "next_run_at")
    private OffsetDateTime nextRunAt;

    @Column(name = "last_run_at")
    private OffsetDateTime lastRunAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public Schedule() {
    }

    public Schedule(String id, ScanTarget target, ScanType scanType) {
        this.id = id;
        setTarget(target);
        this.scanType = scanType;
    }

    /**
     * Copy used by the in-memory repository so callers never share mutable state with the store.
     */
    public Schedule copy() {
        Schedule copy = new Schedule();
        copy.id = id;
        copy.databaseName = databaseName;
        copy.schemaName = schemaName;
        copy.tableName = tableName;
        copy.scanType = scanType;
        copy.recurring = recurring;
        copy.recurrenceType = recurrenceType;
        copy.timeOfDay = timeOfDay;
        copy.daysOfWeek = daysOfWeek == null ? new ArrayList<>() : new ArrayList<>(daysOfWeek);
        copy.timezone = timezone;
        copy.startDate = startDate;
        copy.endDate = endDate;
        copy.skipIfRunning = skipIfRunning;
        copy.onFailureAction = onFailureAction;
        copy.maxFailures = maxFailures;
        copy.failureCount = failureCount;
        copy.status = status;
        copy.nextRunAt = nextRunAt;
        copy.lastRunAt = lastRunAt;
        copy.lastError = lastError;
        copy.createdBy = createdBy;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }

    @PrePersist
    void fillTimestamps() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @Transient
    public ScanTarget getTarget() {
        return new ScanTarget(databaseName, schemaName, tableName);
    }

    /**
     * Warehouse identifiers are persisted upper-cased.
     */
    public void setTarget(ScanTarget target) {
        ScanTarget normalized = target.normalized();
        this.databaseName = normalized.database();
        this.schemaName = normalized.schema();
        this.tableName = normalized.table();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getTableName() {
        return tableName;
    }

    public ScanType getScanType() {
        return scanType;
    }

    public void setScanType(ScanType scanType) {
        this.scanType = scanType;
    }

    public boolean isRecurring() {
        return recurring;
    }

    public void setRecurring(boolean recurring) {
        this.recurring = recurring;
    }

    public RecurrenceType getRecurrenceType() {
        return recurrenceType;
    }

    public void setRecurrenceType(RecurrenceType recurrenceType) {
        this.recurrenceType = recurrenceType;
    }

    public String getTimeOfDay() {
        return timeOfDay;
    }

    public void setTimeOfDay(String timeOfDay) {
        this.timeOfDay = timeOfDay;
    }

    public List<String> getDaysOfWeek() {
        return daysOfWeek;
    }

    public void setDaysOfWeek(List<String> daysOfWeek) {
        this.daysOfWeek = daysOfWeek == null ? new ArrayList<>() : new ArrayList<>(daysOfWeek);
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public void setEndDate(LocalDate endDate) {
        this.endDate = endDate;
    }

    public boolean isSkipIfRunning() {
        return skipIfRunning;
    }

    public void setSkipIfRunning(boolean skipIfRunning) {
        this.skipIfRunning = skipIfRunning;
    }

    public OnFailureAction getOnFailureAction() {
        return onFailureAction;
    }

    public void setOnFailureAction(OnFailureAction onFailureAction) {
        this.onFailureAction = onFailureAction == null ? OnFailureAction.CONTINUE : onFailureAction;
    }

    public int getMaxFailures() {
        return maxFailures;
    }

    public void setMaxFailures(int maxFailures) {
        this.maxFailures = maxFailures;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public void setFailureCount(int failureCount) {
        this.failureCount = failureCount;
    }

    public ScheduleStatus getStatus() {
        return status;
    }

    public void setStatus(ScheduleStatus status) {
        this.status = status;
    }

    public OffsetDateTime getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(OffsetDateTime nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public OffsetDateTime getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(OffsetDateTime lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "Schedule{" + id + ", " + scanType + " " + databaseName + "." + schemaName + "." + tableName
                + ", status=" + status + ", nextRunAt=" + nextRunAt + "}";
    }
}
