package com.libragraph.chunkstore.core.testutil;

import com.libragraph.chunkstore.core.db.JdbiProducer;
import org.flywaydb.core.Flyway;
import org.jdbi.v3.core.Jdbi;

import java.util.UUID;

/**
 * A private, migrated in-memory H2 database per call, in PostgreSQL mode.
 */
public final class TestDatabase {

    private TestDatabase() {
    }

    public static Jdbi create() {
        String url = "jdbc:h2:mem:" + UUID.randomUUID()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE"
                + ";DEFAULT_NULL_ORDERING=HIGH;LOCK_TIMEOUT=10000";
        Flyway.configure()
                .dataSource(url, "sa", "")
                .locations("classpath:db/migration")
                .load()
                .migrate();
        return JdbiProducer.configure(Jdbi.create(url, "sa", ""));
    }
}
