package com.libragraph.chunkstore.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record ScheduleStateRecord(
        @ColumnName("last_run_at") Instant lastRunAt,
        @ColumnName("last_success_at") Instant lastSuccessAt,
        @ColumnName("last_mark_sweep_at") Instant lastMarkSweepAt,
        @ColumnName("last_old_generation_at") Instant lastOldGenerationAt,
        @ColumnName("next_scheduled_at") Instant nextScheduledAt,
        @ColumnName("followup_due_at") Instant followupDueAt,
        @ColumnName("halted") boolean halted,
        @ColumnName("halted_reason") String haltedReason,
        @ColumnName("halted_at") Instant haltedAt
) {}
