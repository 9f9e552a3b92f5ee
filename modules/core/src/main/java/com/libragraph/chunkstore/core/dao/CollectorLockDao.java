package com.libragraph.chunkstore.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.Optional;

/**
 * Leased mutual exclusion rows. Every state change is a single conditional UPDATE,
 * so acquisition is compare-and-set and release is compare-and-delete on the token.
 */
@RegisterConstructorMapper(CollectorLockRecord.class)
public interface CollectorLockDao {

    @SqlUpdate("INSERT INTO collector_lock (lock_key) VALUES (:key) ON CONFLICT DO NOTHING")
    void ensure(@Bind("key") String key);

    @SqlUpdate("UPDATE collector_lock SET holder = :holder, token = :token, acquired_at = :now, " +
            "expires_at = :expiresAt WHERE lock_key = :key AND (token IS NULL OR expires_at <= :now)")
    int tryAcquire(@Bind("key") String key,
                   @Bind("holder") String holder,
                   @Bind("token") String token,
                   @Bind("now") Instant now,
                   @Bind("expiresAt") Instant expiresAt);

    @SqlUpdate("UPDATE collector_lock SET expires_at = :expiresAt " +
            "WHERE lock_key = :key AND token = :token AND expires_at > :now")
    int renew(@Bind("key") String key,
              @Bind("token") String token,
              @Bind("now") Instant now,
              @Bind("expiresAt") Instant expiresAt);

    @SqlUpdate("UPDATE collector_lock SET holder = NULL, token = NULL, acquired_at = NULL, expires_at = NULL " +
            "WHERE lock_key = :key AND token = :token")
    int release(@Bind("key") String key, @Bind("token") String token);

    @SqlQuery("SELECT * FROM collector_lock WHERE lock_key = :key")
    Optional<CollectorLockRecord> find(@Bind("key") String key);
}
