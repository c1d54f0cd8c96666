package floodgate.adapter.in.scheduler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import org.jboss.logging.Logger;

import floodgate.core.service.adaptive.AdaptiveService;

/**
 * Re-evaluates adaptive rules against the latest metrics on a timer.
 *
 * <p>Metrics pushed through the API are evaluated right away; this job keeps
 * limits moving when samples arrive less often than cooldowns expire. Runs on
 * the scheduler's worker thread, never on request threads.
 */
@ApplicationScoped
public class AdaptiveEvaluationScheduler {

    private static final Logger LOG = Logger.getLogger(AdaptiveEvaluationScheduler.class);

    private final AdaptiveService adaptiveService;

    @Inject
    public AdaptiveEvaluationScheduler(AdaptiveService adaptiveService) {
        this.adaptiveService = adaptiveService;
    }

    @Scheduled(
            every = "${floodgate.adaptive.evaluation-interval:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void evaluate() {
        try {
            final var applied = adaptiveService.evaluateLatest();
            if (!applied.isEmpty()) {
                LOG.debugv("Scheduled adaptive evaluation applied {0} adjustment(s)", applied.size());
            }
        } catch (RuntimeException e) {
            LOG.error("Scheduled adaptive evaluation failed", e);
        }
    }
}
