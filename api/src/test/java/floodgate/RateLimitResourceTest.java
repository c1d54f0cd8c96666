package floodgate;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

import java.util.UUID;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Integration tests for the decision endpoints.
 *
 * <p>The test profile limits {@code /check/**} to 10 requests per minute and
 * {@code /api/echo/slow} to 2 concurrent requests.
 */
@QuarkusTest
@DisplayName("Rate Limit Resource Tests")
class RateLimitResourceTest {

    private static String newIdentifier() {
        return "user:" + UUID.randomUUID();
    }

    private static String checkBody(String identifier, String endpoint) {
        return """
                {"identifier": "%s", "ruleType": "user", "endpoint": "%s"}
                """.formatted(identifier, endpoint);
    }

    @Nested
    @DisplayName("Check")
    class CheckTests {

        @Test
        @DisplayName("should allow up to the limit and then deny")
        void shouldAllowThenDeny() {
            var id = newIdentifier();

            for (int i = 0; i < 10; i++) {
                given().contentType(ContentType.JSON)
                        .body(checkBody(id, "/check/orders"))
                        .when()
                        .post("/ratelimit/check")
                        .then()
                        .statusCode(200)
                        .body("allowed", equalTo(true))
                        .body("remaining", equalTo(9 - i))
                        .body("rule", equalTo("check-per-minute"))
                        .body("limit", equalTo(10));
            }

            given().contentType(ContentType.JSON)
                    .body(checkBody(id, "/check/orders"))
                    .when()
                    .post("/ratelimit/check")
                    .then()
                    .statusCode(200)
                    .body("allowed", equalTo(false))
                    .body("remaining", equalTo(0))
                    .body("retryAfter", greaterThan(0))
                    .body("retryAfter", lessThanOrEqualTo(60))
                    .body("rule", equalTo("check-per-minute"));
        }

        @Test
        @DisplayName("should report held slots for concurrency rules")
        void shouldReportHeldSlots() {
            var id = newIdentifier();

            given().contentType(ContentType.JSON)
                    .body(checkBody(id, "/api/echo/slow"))
                    .when()
                    .post("/ratelimit/check")
                    .then()
                    .statusCode(200)
                    .body("allowed", equalTo(true))
                    .body("heldSlots", hasSize(1));
        }

        @Test
        @DisplayName("should reject a missing identifier")
        void shouldRejectMissingIdentifier() {
            given().contentType(ContentType.JSON)
                    .body("{\"ruleType\": \"user\"}")
                    .when()
                    .post("/ratelimit/check")
                    .then()
                    .statusCode(400);
        }
    }

    @Nested
    @DisplayName("Release")
    class ReleaseTests {

        @Test
        @DisplayName("should free a slot for the next check")
        void shouldFreeSlot() {
            var id = newIdentifier();
            var body = checkBody(id, "/api/echo/slow");

            String slot = given().contentType(ContentType.JSON)
                    .body(body)
                    .when()
                    .post("/ratelimit/check")
                    .then()
                    .statusCode(200)
                    .extract()
                    .path("heldSlots[0]");
            given().contentType(ContentType.JSON).body(body).when().post("/ratelimit/check").then()
                    .body("allowed", equalTo(true));
            given().contentType(ContentType.JSON).body(body).when().post("/ratelimit/check").then()
                    .body("allowed", equalTo(false))
                    .body("rule", equalTo("slow-concurrent"));

            given().contentType(ContentType.JSON)
                    .body("{\"identifier\": \"%s\", \"rule\": \"%s\"}".formatted(id, slot))
                    .when()
                    .post("/ratelimit/release")
                    .then()
                    .statusCode(204);

            given().contentType(ContentType.JSON).body(body).when().post("/ratelimit/check").then()
                    .body("allowed", equalTo(true));
        }

        @Test
        @DisplayName("should accept releases of unknown rules")
        void shouldAcceptUnknownRelease() {
            given().contentType(ContentType.JSON)
                    .body("{\"identifier\": \"%s\", \"rule\": \"nothing-here\"}".formatted(newIdentifier()))
                    .when()
                    .post("/ratelimit/release")
                    .then()
                    .statusCode(204);
        }
    }

    @Nested
    @DisplayName("Status and reset")
    class StatusTests {

        @Test
        @DisplayName("should report usage without consuming quota")
        void shouldReportStatus() {
            var id = newIdentifier();
            given().contentType(ContentType.JSON).body(checkBody(id, "/check/a")).when().post("/ratelimit/check");

            for (int i = 0; i < 2; i++) {
                given().queryParam("identifier", id)
                        .queryParam("endpoint", "/check/a")
                        .when()
                        .get("/ratelimit/status")
                        .then()
                        .statusCode(200)
                        .body("'check-per-minute'.limit", equalTo(10))
                        .body("'check-per-minute'.remaining", equalTo(9))
                        .body("'check-per-minute'.resetTime", notNullValue());
            }
        }

        @Test
        @DisplayName("should require an identifier for status")
        void shouldRequireIdentifier() {
            given().when().get("/ratelimit/status").then().statusCode(400);
        }

        @Test
        @DisplayName("should reset every counter of an identifier")
        void shouldResetCounters() {
            var id = newIdentifier();
            for (int i = 0; i < 10; i++) {
                given().contentType(ContentType.JSON).body(checkBody(id, "/check/r")).when().post("/ratelimit/check");
            }

            given().when()
                    .delete("/ratelimit/{identifier}", id)
                    .then()
                    .statusCode(200)
                    .body("identifier", equalTo(id))
                    .body("reset", greaterThan(0));

            given().contentType(ContentType.JSON)
                    .body(checkBody(id, "/check/r"))
                    .when()
                    .post("/ratelimit/check")
                    .then()
                    .body("allowed", equalTo(true))
                    .body("retryAfter", nullValue());
        }
    }
}
