package com.libragraph.chunkstore.core.db;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import java.sql.SQLException;

@ApplicationScoped
public class JdbiProducer {

    private static final Logger log = Logger.getLogger(JdbiProducer.class);

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource) {
        return configure(Jdbi.create(dataSource));
    }

    /**
     * Installs the plugins every DAO relies on. The PostgreSQL plugin is only added when
     * the datasource really is PostgreSQL, so the same DAOs run against H2 in tests.
     */
    public static Jdbi configure(Jdbi jdbi) {
        jdbi.installPlugin(new SqlObjectPlugin())
                .setSqlLogger(new Slf4JSqlLogger());
        String product;
        try {
            product = jdbi.withHandle(h -> h.getConnection().getMetaData().getDatabaseProductName());
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to inspect datasource", e);
        }
        if ("PostgreSQL".equalsIgnoreCase(product)) {
            jdbi.installPlugin(new PostgresPlugin());
        }
        log.infof("JDBI configured for %s", product);
        return jdbi;
    }
}
