package com.libragraph.chunkstore.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;

/**
 * The single persisted row driving collection scheduling and the emergency halt.
 */
@RegisterConstructorMapper(ScheduleStateRecord.class)
public interface ScheduleStateDao {

    @SqlQuery("SELECT * FROM gc_schedule_state WHERE id = 1")
    ScheduleStateRecord get();

    @SqlUpdate("UPDATE gc_schedule_state SET last_run_at = :now, next_scheduled_at = :next WHERE id = 1")
    void recordRun(@Bind("now") Instant now, @Bind("next") Instant next);

    @SqlUpdate("UPDATE gc_schedule_state SET last_success_at = :now WHERE id = 1")
    void recordSuccess(@Bind("now") Instant now);

    @SqlUpdate("UPDATE gc_schedule_state SET last_mark_sweep_at = :now WHERE id = 1")
    void recordMarkSweep(@Bind("now") Instant now);

    @SqlUpdate("UPDATE gc_schedule_state SET last_old_generation_at = :now WHERE id = 1")
    void recordOldGeneration(@Bind("now") Instant now);

    @SqlUpdate("UPDATE gc_schedule_state SET next_scheduled_at = :next WHERE id = 1")
    void setNextScheduled(@Bind("next") Instant next);

    @SqlUpdate("UPDATE gc_schedule_state SET followup_due_at = :due WHERE id = 1")
    void setFollowupDue(@Bind("due") Instant due);

    @SqlUpdate("UPDATE gc_schedule_state SET halted = TRUE, halted_reason = :reason, halted_at = :now WHERE id = 1")
    void halt(@Bind("reason") String reason, @Bind("now") Instant now);

    @SqlUpdate("UPDATE gc_schedule_state SET halted = FALSE, halted_reason = NULL, halted_at = NULL WHERE id = 1")
    void resume();
}
