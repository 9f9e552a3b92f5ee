package com.libragraph.chunkstore.core.health;

import com.libragraph.chunkstore.core.status.GcAlert;
import com.libragraph.chunkstore.core.status.GcStatusService;
import io.smallrye.health.api.Wellness;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;

import java.util.List;

/**
 * Down while any collection alert is active.
 */
@Wellness
@ApplicationScoped
public class CollectionHealthCheck implements HealthCheck {

    @Inject
    GcStatusService statusService;

    @Override
    public HealthCheckResponse call() {
        List<GcAlert> alerts = statusService.alerts();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("collection").status(alerts.isEmpty());
        for (GcAlert alert : alerts) {
            builder.withData(alert.kind().name(), alert.message());
        }
        return builder.build();
    }
}
