package floodgate;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.startsWith;

import java.util.UUID;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Integration tests for analytics endpoints.
 */
@QuarkusTest
@DisplayName("Monitoring Resource Tests")
class MonitoringResourceTest {

    private String identifier;

    @BeforeEach
    void generateTraffic() {
        identifier = "user:" + UUID.randomUUID();
        var body = "{\"identifier\": \"%s\", \"endpoint\": \"/check/monitor\", \"apiProvider\": \"openai\"}"
                .formatted(identifier);
        for (int i = 0; i < 11; i++) {
            given().contentType(ContentType.JSON).body(body).when().post("/ratelimit/check");
        }
    }

    @Test
    @DisplayName("should summarize violations")
    void shouldSummarizeViolations() {
        given().queryParam("range", "1h")
                .when()
                .get("/admin/monitoring/violations")
                .then()
                .statusCode(200)
                .body("range", equalTo("1h"))
                .body("violations", greaterThan(0))
                .body("violationsByRule", hasKey("check-per-minute"));
    }

    @Test
    @DisplayName("should summarize usage per provider")
    void shouldSummarizeUsage() {
        given().when()
                .get("/admin/monitoring/usage")
                .then()
                .statusCode(200)
                .body("totalRequests", greaterThanOrEqualTo(11))
                .body("byProvider", hasKey("openai"));
    }

    @Test
    @DisplayName("should build a combined summary")
    void shouldBuildSummary() {
        given().queryParam("range", "24h")
                .when()
                .get("/admin/monitoring/summary")
                .then()
                .statusCode(200)
                .body("generatedAt", notNullValue())
                .body("violations.range", equalTo("24h"))
                .body("bufferedEvents", greaterThan(0));
    }

    @Test
    @DisplayName("should report 24 hourly buckets")
    void shouldReportHourlyBuckets() {
        given().queryParam("days", 1)
                .when()
                .get("/admin/monitoring/hourly")
                .then()
                .statusCode(200)
                .body("$", hasSize(24));
    }

    @Test
    @DisplayName("should reject a non-positive day count")
    void shouldRejectNonPositiveDays() {
        given().queryParam("days", 0).when().get("/admin/monitoring/hourly").then().statusCode(400);
    }

    @Test
    @DisplayName("should reject malformed and oversized ranges")
    void shouldRejectMalformedRange() {
        given().queryParam("range", "soon").when().get("/admin/monitoring/violations").then().statusCode(400);
        given().queryParam("range", "99999999999999d")
                .when()
                .get("/admin/monitoring/violations")
                .then()
                .statusCode(400);
    }

    @Test
    @DisplayName("should export events as CSV")
    void shouldExportCsv() {
        given().queryParam("format", "csv")
                .when()
                .get("/admin/monitoring/export")
                .then()
                .statusCode(200)
                .contentType(startsWith("text/csv"))
                .body(startsWith("timestamp,"));
    }

    @Test
    @DisplayName("should export events as JSON")
    void shouldExportJson() {
        given().when()
                .get("/admin/monitoring/export")
                .then()
                .statusCode(200)
                .body("identifier", org.hamcrest.Matchers.hasItem(identifier));
    }
}
