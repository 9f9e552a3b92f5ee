package com.libragraph.chunkstore;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class GcResourceTest {

    @Test
    void collect_dryRun_reportsWithoutDeleting() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"dryRun\":true,\"strategy\":\"REFERENCE_COUNT\"}")
                .when().post("/api/gc/collect")
                .then()
                .statusCode(200)
                .body("lockAcquired", is(true))
                .body("dryRun", is(true))
                .body("status", is("COMPLETED"))
                .body("chunksDeleted", is(0))
                .body("runId", notNullValue());
    }

    @Test
    void collect_markAndSweep_completes() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"dryRun\":false,\"strategy\":\"MARK_AND_SWEEP\"}")
                .when().post("/api/gc/collect")
                .then()
                .statusCode(200)
                .body("strategy", is("MARK_AND_SWEEP"))
                .body("status", is("COMPLETED"));
    }

    @Test
    void collect_withNegativeBatch_returns400() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"batchSizeOverride\":-1}")
                .when().post("/api/gc/collect")
                .then()
                .statusCode(400);
    }

    @Test
    void status_returnsSchedulerState() {
        given()
                .when().get("/api/gc/status")
                .then()
                .statusCode(200)
                .body("halted", is(false))
                .body("orphanedCount", greaterThanOrEqualTo(0))
                .body("alerts", notNullValue());
    }

    @Test
    void history_listsRunsNewestFirst() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"dryRun\":true}")
                .when().post("/api/gc/collect")
                .then()
                .statusCode(200);

        given()
                .queryParam("limit", 1)
                .when().get("/api/gc/history")
                .then()
                .statusCode(200)
                .body("size()", is(1))
                .body("[0].dryRun", is(true))
                .body("[0].trigger", is("MANUAL"));
    }

    @Test
    void halt_blocksLiveRunsUntilResume() {
        try {
            given()
                    .contentType(ContentType.JSON)
                    .body("{\"reason\":\"integration test\"}")
                    .when().post("/api/gc/halt")
                    .then()
                    .statusCode(200)
                    .body("halted", is(true))
                    .body("pendingDeletionsCancelled", greaterThanOrEqualTo(0));

            given()
                    .when().get("/api/gc/status")
                    .then()
                    .body("halted", is(true))
                    .body("haltedReason", is("integration test"))
                    .body("pendingDeletionCount", is(0));

            given()
                    .contentType(ContentType.JSON)
                    .body("{\"dryRun\":false}")
                    .when().post("/api/gc/collect")
                    .then()
                    .statusCode(409)
                    .body("error", is("CollectionHaltedException"));

            given()
                    .contentType(ContentType.JSON)
                    .body("{\"dryRun\":true}")
                    .when().post("/api/gc/collect")
                    .then()
                    .statusCode(200);
        } finally {
            given()
                    .when().post("/api/gc/resume")
                    .then()
                    .statusCode(200)
                    .body("halted", is(false));
        }

        given()
                .when().get("/api/gc/audit")
                .then()
                .statusCode(200)
                .body("action", hasItems("HALTED", "RESUMED"));
    }

    @Test
    void purge_reportsCount() {
        given()
                .when().post("/api/gc/purge")
                .then()
                .statusCode(200)
                .body("purged", greaterThanOrEqualTo(0));
    }
}
