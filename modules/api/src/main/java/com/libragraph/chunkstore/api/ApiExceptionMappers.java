package com.libragraph.chunkstore.api;

import com.libragraph.chunkstore.core.coordination.CoordinationException;
import com.libragraph.chunkstore.core.gc.CollectionHaltedException;
import com.libragraph.chunkstore.core.gc.ConsistencyException;
import com.libragraph.chunkstore.core.storage.ChunkNotFoundException;
import com.libragraph.chunkstore.core.storage.ChunkValidationException;
import com.libragraph.chunkstore.core.storage.StorageException;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestResponse;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Maps the chunk store's exceptions to HTTP statuses with a JSON error body.
 */
public class ApiExceptionMappers {

    private static final Logger log = Logger.getLogger(ApiExceptionMappers.class);

    @ServerExceptionMapper({ChunkValidationException.class, IllegalArgumentException.class,
            DateTimeParseException.class})
    public RestResponse<Map<String, String>> badRequest(RuntimeException e) {
        return error(Response.Status.BAD_REQUEST, e);
    }

    @ServerExceptionMapper
    public RestResponse<Map<String, String>> notFound(ChunkNotFoundException e) {
        return error(Response.Status.NOT_FOUND, e);
    }

    @ServerExceptionMapper({CollectionHaltedException.class, ConsistencyException.class,
            CoordinationException.class})
    public RestResponse<Map<String, String>> conflict(RuntimeException e) {
        return error(Response.Status.CONFLICT, e);
    }

    @ServerExceptionMapper
    public RestResponse<Map<String, String>> storageUnavailable(StorageException e) {
        log.warnf("Object store failure: %s", e.getMessage());
        return error(Response.Status.SERVICE_UNAVAILABLE, e);
    }

    private static RestResponse<Map<String, String>> error(Response.Status status, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return RestResponse.status(status, Map.of(
                "error", e.getClass().getSimpleName(),
                "message", message));
    }
}
