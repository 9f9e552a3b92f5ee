package com.libragraph.chunkstore.api;

import com.libragraph.chunkstore.core.audit.AuditLog;
import com.libragraph.chunkstore.core.audit.RecoveryService;
import com.libragraph.chunkstore.core.dao.AuditRecord;
import com.libragraph.chunkstore.core.dao.GcRunRecord;
import com.libragraph.chunkstore.core.gc.CollectionResult;
import com.libragraph.chunkstore.core.schedule.CollectionScheduler;
import com.libragraph.chunkstore.core.status.GcStatus;
import com.libragraph.chunkstore.core.status.GcStatusService;
import com.libragraph.chunkstore.util.ContentHash;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;
import java.util.Map;

@Path("/api/gc")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class GcResource {

    private static final int MAX_AUDIT = 1000;

    @Inject
    CollectionScheduler scheduler;

    @Inject
    GcStatusService statusService;

    @Inject
    AuditLog auditLog;

    @Inject
    RecoveryService recoveryService;

    @POST
    @Path("/collect")
    public CollectionResult collect(CollectRequest body) {
        CollectRequest request = body != null ? body : new CollectRequest(false, null, null, null);
        return scheduler.requestManual(request.toCollectionRequest());
    }

    @GET
    @Path("/status")
    public GcStatus status() {
        return statusService.status();
    }

    @GET
    @Path("/history")
    public List<GcRunRecord> history(@QueryParam("limit") @DefaultValue("20") int limit) {
        return statusService.history(limit);
    }

    /**
     * Audit entries for one chunk ({@code hash}), one run ({@code run}), or the most
     * recent ones.
     */
    @GET
    @Path("/audit")
    public List<AuditRecord> audit(@QueryParam("hash") String hash,
                                   @QueryParam("run") Long runId,
                                   @QueryParam("limit") @DefaultValue("100") int limit) {
        if (hash != null) {
            return auditLog.forChunk(ContentHash.fromHex(hash).toHex());
        }
        if (runId != null) {
            return auditLog.forRun(runId);
        }
        return auditLog.recent(Math.max(1, Math.min(limit, MAX_AUDIT)));
    }

    @POST
    @Path("/halt")
    public Map<String, Object> halt(HaltRequest body) {
        int cleared = recoveryService.emergencyHalt(body != null ? body.reason() : null);
        return Map.of("halted", true, "pendingDeletionsCancelled", cleared);
    }

    @POST
    @Path("/resume")
    public Map<String, Object> resume() {
        recoveryService.resume();
        return Map.of("halted", false);
    }

    @POST
    @Path("/purge")
    public Map<String, Object> purge() {
        return Map.of("purged", recoveryService.purgeExpired());
    }
}
