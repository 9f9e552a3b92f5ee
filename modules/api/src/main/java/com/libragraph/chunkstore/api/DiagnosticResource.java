package com.libragraph.chunkstore.api;

import com.libragraph.chunkstore.core.cluster.NodeService;
import com.libragraph.chunkstore.core.config.GcSettings;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator diagnostics: liveness ping, build and node identity, and the cluster's
 * registered nodes.
 */
@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @ConfigProperty(name = "chunkstore.object-store.type")
    String objectStoreType;

    @Inject
    NodeService nodeService;

    @Inject
    GcSettings settings;

    @Inject
    Clock clock;

    public record NodeView(int id, String hostname, Instant lastSeen, boolean self, boolean stale) {
    }

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of("status", "ok", "message", "Chunk store is running");
    }

    @GET
    @Path("/info")
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", appName);
        info.put("version", appVersion);
        info.put("java", System.getProperty("java.version"));
        info.put("profile", profile);
        info.put("objectStore", objectStoreType);
        info.put("node", nodeService.holderId());
        info.put("startedAt", nodeService.startedAt());
        info.put("gracePeriod", settings.gracePeriod().toString());
        info.put("defaultStrategy", settings.defaultStrategy());
        return info;
    }

    /**
     * Registered nodes. A node is stale once its last heartbeat is older than the
     * collector lease TTL.
     */
    @GET
    @Path("/nodes")
    public List<NodeView> nodes() {
        Instant staleBefore = clock.instant().minus(settings.lockTtl());
        String self = nodeService.holderId();
        return nodeService.nodes().stream()
                .map(node -> new NodeView(node.id(), node.hostname(), node.lastSeen(),
                        node.holderId().equals(self), node.lastSeen().isBefore(staleBefore)))
                .toList();
    }
}
