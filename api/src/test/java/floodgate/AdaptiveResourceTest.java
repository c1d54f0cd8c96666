package floodgate;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.lessThan;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Integration tests for the adaptive controller endpoints.
 *
 * <p>The test profile makes {@code elastic-per-minute} adaptive between 50 and
 * 200 with no cooldown.
 */
@QuarkusTest
@DisplayName("Adaptive Resource Tests")
class AdaptiveResourceTest {

    @Nested
    @DisplayName("Rules")
    class RuleTests {

        @Test
        @DisplayName("should list configured adaptive rules")
        void shouldListConfiguredRules() {
            given().when()
                    .get("/admin/adaptive/rules")
                    .then()
                    .statusCode(200)
                    .body("ruleName", hasItem("elastic-per-minute"))
                    .body("find { it.ruleName == 'elastic-per-minute' }.minLimit", equalTo(50))
                    .body("find { it.ruleName == 'elastic-per-minute' }.maxLimit", equalTo(200));
        }

        @Test
        @DisplayName("should register and unregister bounds")
        void shouldRegisterAndUnregister() {
            given().contentType(ContentType.JSON)
                    .body(
                            """
                            {"scope": "global", "ruleName": "global-per-minute",
                             "minLimit": 1000, "maxLimit": 200000, "cooldownSeconds": 600}
                            """)
                    .when()
                    .post("/admin/adaptive/rules")
                    .then()
                    .statusCode(201)
                    .body("adjustmentFactor", equalTo(0.2f))
                    .body("cooldownSeconds", equalTo(600));

            given().when().delete("/admin/adaptive/rules/global/global-per-minute").then().statusCode(204);
            given().when().delete("/admin/adaptive/rules/global/global-per-minute").then().statusCode(404);
        }

        @Test
        @DisplayName("should reject bounds for unknown rules")
        void shouldRejectUnknownRule() {
            given().contentType(ContentType.JSON)
                    .body("{\"scope\": \"global\", \"ruleName\": \"nope\", \"minLimit\": 1, \"maxLimit\": 10}")
                    .when()
                    .post("/admin/adaptive/rules")
                    .then()
                    .statusCode(400);
        }

        @Test
        @DisplayName("should reject inverted bounds")
        void shouldRejectInvertedBounds() {
            given().contentType(ContentType.JSON)
                    .body(
                            """
                            {"scope": "global", "ruleName": "global-per-minute", "minLimit": 500, "maxLimit": 10}
                            """)
                    .when()
                    .post("/admin/adaptive/rules")
                    .then()
                    .statusCode(400);
        }
    }

    @Nested
    @DisplayName("Metrics")
    class MetricsTests {

        @Test
        @DisplayName("should tighten adaptive rules under load and record history")
        void shouldTightenUnderLoad() {
            given().contentType(ContentType.JSON)
                    .body("{\"cpuUsage\": 0.99, \"memoryUsage\": 0.99, \"errorRate\": 0.0, \"p95ResponseTime\": 0.1}")
                    .when()
                    .post("/admin/adaptive/metrics")
                    .then()
                    .statusCode(200)
                    .body("ruleName", everyItem(equalTo("elastic-per-minute")))
                    .body("direction", everyItem(equalTo("TIGHTEN")))
                    .body("newLimit", everyItem(greaterThanOrEqualTo(50)));

            given().when()
                    .get("/admin/adaptive/history")
                    .then()
                    .statusCode(200)
                    .body("ruleName", hasItem("elastic-per-minute"));
        }

        @Test
        @DisplayName("should not adjust anything for a sample without load metrics")
        void shouldIgnoreEmptySample() {
            given().contentType(ContentType.JSON)
                    .body("{}")
                    .when()
                    .post("/admin/adaptive/metrics")
                    .then()
                    .statusCode(200)
                    .body("size()", equalTo(0));
        }

        @Test
        @DisplayName("should apply adjusted limits to checks")
        void shouldApplyAdjustedLimits() {
            given().contentType(ContentType.JSON)
                    .body("{\"cpuUsage\": 0.99, \"memoryUsage\": 0.99}")
                    .when()
                    .post("/admin/adaptive/metrics")
                    .then()
                    .statusCode(200);

            given().contentType(ContentType.JSON)
                    .body("{\"identifier\": \"user:adaptive-elastic\", \"endpoint\": \"/elastic/x\"}")
                    .when()
                    .post("/ratelimit/check")
                    .then()
                    .statusCode(200)
                    .body("rule", equalTo("elastic-per-minute"))
                    .body("limit", lessThan(100));
        }
    }
}
