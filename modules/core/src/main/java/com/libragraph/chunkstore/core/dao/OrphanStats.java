package com.libragraph.chunkstore.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record OrphanStats(
        @ColumnName("orphan_count") long count,
        @ColumnName("orphan_bytes") long bytes
) {}
