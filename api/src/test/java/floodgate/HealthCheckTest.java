package floodgate;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@QuarkusTest
@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Test
    @DisplayName("should report the in-memory counter store as ready")
    void shouldReportCounterStoreReady() {
        given().when()
                .get("/q/health/ready")
                .then()
                .statusCode(200)
                .body("status", equalTo("UP"))
                .body("checks.name", hasItem("counter-store"))
                .body("checks.find { it.name == 'counter-store' }.data.store", equalTo("memory"));
    }
}
