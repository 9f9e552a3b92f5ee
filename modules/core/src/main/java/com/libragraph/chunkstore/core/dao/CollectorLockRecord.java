package com.libragraph.chunkstore.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record CollectorLockRecord(
        @ColumnName("lock_key") String lockKey,
        @ColumnName("holder") String holder,
        @ColumnName("token") String token,
        @ColumnName("acquired_at") Instant acquiredAt,
        @ColumnName("expires_at") Instant expiresAt
) {}
