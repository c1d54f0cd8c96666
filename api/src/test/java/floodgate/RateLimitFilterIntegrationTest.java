package floodgate;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

import java.util.UUID;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Integration tests for admission control on protected paths.
 *
 * <p>The test profile limits {@code /api/echo/**} to 3 requests per minute and
 * {@code /api/echo/slow} to 2 concurrent requests. Every test uses a fresh
 * client identity so counters never leak between tests.
 */
@QuarkusTest
@DisplayName("Rate Limit Filter Integration Tests")
class RateLimitFilterIntegrationTest {

    private static String newUser() {
        return "it-" + UUID.randomUUID();
    }

    @Nested
    @DisplayName("Window limits")
    class WindowLimitTests {

        @Test
        @DisplayName("should admit up to the limit then reject with 429")
        void shouldRejectOverLimit() {
            var user = newUser();

            for (int i = 0; i < 3; i++) {
                given().header("X-User-ID", user)
                        .when()
                        .get("/api/echo/ping")
                        .then()
                        .statusCode(200)
                        .body(equalTo("pong"))
                        .header("X-RateLimit-Limit", "3")
                        .header("X-RateLimit-Remaining", String.valueOf(2 - i));
            }

            given().header("X-User-ID", user)
                    .when()
                    .get("/api/echo/ping")
                    .then()
                    .statusCode(429)
                    .header("Retry-After", notNullValue())
                    .header("X-RateLimit-Remaining", "0")
                    .body("title", equalTo("Too Many Requests"))
                    .body("rule", equalTo("echo-per-minute"));
        }

        @Test
        @DisplayName("should count clients independently")
        void shouldCountClientsIndependently() {
            var first = newUser();
            var second = newUser();

            for (int i = 0; i < 3; i++) {
                given().header("X-User-ID", first).when().get("/api/echo/ping").then().statusCode(200);
            }
            given().header("X-User-ID", first).when().get("/api/echo/ping").then().statusCode(429);

            given().header("X-User-ID", second).when().get("/api/echo/ping").then().statusCode(200);
        }

        @Test
        @DisplayName("should identify anonymous clients by forwarded address")
        void shouldIdentifyByForwardedAddress() {
            var address = "198.51.100." + (int) (Math.random() * 200 + 1);
            var forwarded = "for=\"" + address + ":4711\"";

            given().header("Forwarded", forwarded).when().get("/api/echo/ping").then().statusCode(200);

            given().queryParam("identifier", "ip:" + address)
                    .queryParam("ruleType", "ip")
                    .queryParam("endpoint", "/api/echo/ping")
                    .when()
                    .get("/ratelimit/status")
                    .then()
                    .statusCode(200)
                    .body("'echo-per-minute'.remaining", equalTo(2));
        }

        @Test
        @DisplayName("should not limit unprotected paths")
        void shouldNotLimitUnprotectedPaths() {
            given().when()
                    .get("/admin/policies")
                    .then()
                    .statusCode(200)
                    .header("X-RateLimit-Limit", nullValue());
        }
    }

    @Nested
    @DisplayName("Concurrency limits")
    class ConcurrencyLimitTests {

        @Test
        @DisplayName("should release slots when requests complete")
        void shouldReleaseSlotsOnCompletion() {
            var user = newUser();

            // three sequential requests against a limit of two only pass when slots are returned
            for (int i = 0; i < 3; i++) {
                given().header("X-User-ID", user)
                        .when()
                        .get("/api/echo/slow")
                        .then()
                        .statusCode(200)
                        .body(equalTo("done"));
            }

            given().queryParam("identifier", "user:" + user)
                    .queryParam("endpoint", "/api/echo/slow")
                    .when()
                    .get("/ratelimit/status")
                    .then()
                    .statusCode(200)
                    .body("'slow-concurrent'.remaining", equalTo(2));
        }
    }
}
