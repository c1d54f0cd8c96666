package floodgate.adapter.in.health;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import floodgate.core.config.RateLimitingConfig;
import floodgate.core.port.out.CounterStore;

/**
 * Readiness check for the counter store.
 *
 * <p>Reports DOWN when the store does not answer. The limiter keeps deciding
 * while the store is down (throughput rules fail open, security rules fail
 * closed), so this only signals degraded enforcement to the orchestrator.
 */
@Readiness
@ApplicationScoped
public class CounterStoreHealthCheck implements AsyncHealthCheck {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private final CounterStore store;
    private final RateLimitingConfig config;

    @Inject
    public CounterStoreHealthCheck(CounterStore store, RateLimitingConfig config) {
        this.store = store;
        this.config = config;
    }

    @Override
    public Uni<HealthCheckResponse> call() {
        return store.isHealthy()
                .ifNoItem()
                .after(TIMEOUT)
                .recoverWithItem(false)
                .onFailure()
                .recoverWithItem(false)
                .map(healthy -> HealthCheckResponse.builder()
                        .name("counter-store")
                        .withData("store", store.name())
                        .withData("rateLimiting.enabled", config.enabled())
                        .status(healthy)
                        .build());
    }
}
