package com.libragraph.chunkstore.core.health;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Ledger database reachable and migrated: the schedule state row must exist.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    AgroalDataSource dataSource;

    @Override
    public HealthCheckResponse call() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT halted FROM gc_schedule_state WHERE id = 1")) {
            DatabaseMetaData meta = conn.getMetaData();
            if (!rs.next()) {
                return HealthCheckResponse.named("ledger-database")
                        .down()
                        .withData("error", "schedule state row missing")
                        .build();
            }
            return HealthCheckResponse.named("ledger-database")
                    .up()
                    .withData("product", meta.getDatabaseProductName())
                    .withData("version", meta.getDatabaseProductVersion())
                    .withData("halted", rs.getBoolean(1))
                    .build();
        } catch (SQLException e) {
            return HealthCheckResponse.named("ledger-database")
                    .down()
                    .withData("error", e.getMessage())
                    .build();
        }
    }
}
