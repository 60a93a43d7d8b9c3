package com.scanq.schedule;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;

public interface ScheduleJpaRepository extends JpaRepository<Schedule, String> {

    @Query("""
            SELECT s FROM Schedule s
            WHERE s.status = com.scanq.schedule.ScheduleStatus.ACTIVE
              AND s.nextRunAt IS NOT NULL
              AND s.nextRunAt <= :now
            ORDER BY s.nextRunAt ASC
            """)
    List<Schedule> findDue(@Param("now") OffsetDateTime now, Pageable pageable);

    @Query("""
            SELECT s FROM Schedule s
            WHERE s.databaseName = :databaseName
              AND s.schemaName = :schemaName
              AND s.tableName = :tableName
              AND s.status <> com.scanq.schedule.ScheduleStatus.DELETED
            ORDER BY s.createdAt DESC
            """)
    List<Schedule> findByTable(@Param("databaseName") String databaseName,
            @Param("schemaName") String schemaName,
            @Param("tableName") String tableName);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Schedule s
            SET s.lastRunAt = :lastRunAt,
                s.nextRunAt = :nextRunAt,
                s.failureCount = 0,
                s.lastError = NULL,
                s.updatedAt = :lastRunAt
            WHERE s.id = :id
            """)
    int markExecuted(@Param("id") String id,
            @Param("lastRunAt") OffsetDateTime lastRunAt,
            @Param("nextRunAt") OffsetDateTime nextRunAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Schedule s
            SET s.failureCount = s.failureCount + 1,
                s.lastError = :error,
                s.updatedAt = :failedAt
            WHERE s.id = :id
            """)
    int incrementFailure(@Param("id") String id,
            @Param("error") String error,
            @Param("failedAt") OffsetDateTime failedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Schedule s SET s.nextRunAt = :now, s.updatedAt = :now WHERE s.id = :id")
    int forceRunNow(@Param("id") String id, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Schedule s SET s.status = :status, s.updatedAt = :updatedAt WHERE s.id = :id")
    int updateStatus(@Param("id") String id,
            @Param("status") ScheduleStatus status,
            @Param("updatedAt") OffsetDateTime updatedAt);

    @Query("SELECT s.failureCount FROM Schedule s WHERE s.id = :id")
    Integer findFailureCount(@Param("id") String id);
}
