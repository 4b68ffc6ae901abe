package com.aegis.allocation.service;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;

/**
 * Integration tests for the allocation REST endpoints with Fast-Track disabled.
 */
@QuarkusTest
public class AllocationResourceTest {

    @Test
    public void testHealthEndpoint() {
        given()
            .when().get("/health/ready")
            .then()
            .statusCode(200)
            .body("status", equalTo("UP"));
    }

    @Test
    public void testAllocateExternalPii() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"request_id\": \"req-42\", \"selection\": {\"pii\": true, \"system_scope\": \"EXTERNAL\"}}")
            .when().post("/allocate")
            .then()
            .statusCode(200)
            .body("request_id", equalTo("req-42"))
            .body("path", equalTo("RULE_CHAIN"))
            .body("result.control_count", equalTo(70))
            .body("result.loe_level", equalTo("D"))
            .body("result.reason", equalTo("LOE D - External System (RTX Non-DFARS)"));
    }

    @Test
    public void testCompleteTemplateIgnoredWhenFastTrackDisabled() {
        given()
            .contentType(ContentType.JSON)
            .body("""
                {"selection": {"public_data": true},
                 "template_fields": {"system_name": "a", "system_owner": "b", "business_unit": "c",
                   "program_name": "d", "hosting_environment": "e", "data_description": "f",
                   "user_population": "g", "intended_use_duration": "h"}}
                """)
            .when().post("/allocate")
            .then()
            .statusCode(200)
            .body("path", equalTo("RULE_CHAIN"))
            .body("result.control_count", equalTo(38))
            .body("request_id", notNullValue());
    }

    @Test
    public void testInvalidSelection() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"selection\": {\"system_scope\": \"HYBRID\"}}")
            .when().post("/allocate")
            .then()
            .statusCode(400)
            .body("error", equalTo("Invalid selection"))
            .body("field", equalTo("system_scope"));
    }

    @Test
    public void testBatch() {
        given()
            .contentType(ContentType.JSON)
            .body("[{\"selection\": {\"cui\": true}}, {\"selection\": {\"proprietary\": true, \"system_scope\": \"INTERNAL\"}}]")
            .when().post("/allocate/batch")
            .then()
            .statusCode(200)
            .body("decisions", hasSize(2))
            .body("decisions[0].result.loe_level", equalTo("DFARS"))
            .body("decisions[1].result.control_count", equalTo(56))
            .body("stats.total_requests", equalTo(2));
    }

    @Test
    public void testExplain() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"cui\": true, \"public_data\": true}")
            .when().post("/allocate/explain")
            .then()
            .statusCode(200)
            .body("matched_rule_code", equalTo("CUI_OVERRIDE"))
            .body("rule_checks", hasSize(7))
            .body("rule_checks[1].status", equalTo("SKIPPED"));
    }

    @Test
    public void testRulesAndInfo() {
        given()
            .when().get("/rules")
            .then()
            .statusCode(200)
            .body("rules", hasSize(7))
            .body("rules[6].catch_all", equalTo(true))
            .body("fast_track.enabled", equalTo(false));

        given()
            .when().get("/")
            .then()
            .statusCode(200)
            .body("message", equalTo("Aegis Control Allocator"))
            .body("rule_count", equalTo(7));
    }

    @Test
    public void testMetrics() {
        given()
            .when().get("/monitoring/metrics")
            .then()
            .statusCode(200)
            .body("totalAllocations", notNullValue())
            .body("allocationsByLevel.DFARS", notNullValue());
    }

    @Test
    public void testCorsPreflight() {
        given()
            .header("Origin", "http://localhost:3000")
            .when().options("/preflight")
            .then()
            .statusCode(200)
            .header("Access-Control-Allow-Origin", equalTo("http://localhost:3000"));
    }
}
