package floodgate.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import floodgate.core.config.TelemetryConfig;
import floodgate.core.port.out.SecurityEventPublisher;
import floodgate.spi.SecurityEvent;
import floodgate.spi.SecurityEventHandler;

/**
 * Publishes security events to the handlers found through {@link ServiceLoader}.
 *
 * <p>Handlers run in priority order (highest first) on one daemon thread fed by a
 * bounded queue. A denial storm produces an event per rejected request, so when
 * the queue is full new events are dropped and counted in
 * {@code floodgate.security.events.dropped} instead of slowing admission checks.
 */
@ApplicationScoped
public class SecurityEventDispatcher implements SecurityEventPublisher {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);

    private final List<SecurityEventHandler> handlers;
    private final ThreadPoolExecutor executor;
    private final Counter dropped;

    @Inject
    public SecurityEventDispatcher(TelemetryConfig config, MeterRegistry meterRegistry) {
        this(config.securityEvents() ? discoverHandlers(meterRegistry) : List.of(),
                config.eventQueueSize(),
                meterRegistry);
        if (!config.securityEvents()) {
            LOG.debug("Security events are disabled, dispatcher inactive");
        }
    }

    SecurityEventDispatcher(List<SecurityEventHandler> handlers, int queueSize, MeterRegistry meterRegistry) {
        this.handlers = handlers.stream()
                .filter(SecurityEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(SecurityEventHandler::priority).reversed())
                .toList();
        this.dropped = Counter.builder("floodgate.security.events.dropped")
                .description("Security events dropped because the dispatch queue was full")
                .register(meterRegistry);

        if (this.handlers.isEmpty()) {
            this.executor = null;
            return;
        }
        LOG.infov("Dispatching security events to {0}", this.handlers.stream()
                .map(h -> h.name() + "(priority=" + h.priority() + ")")
                .toList());
        this.executor = new ThreadPoolExecutor(
                1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueSize)),
                r -> {
                    final var thread = new Thread(r, "floodgate-security-events");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    private static List<SecurityEventHandler> discoverHandlers(MeterRegistry meterRegistry) {
        final var loaded = ServiceLoader.load(SecurityEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
        for (final var handler : loaded) {
            if (handler instanceof MetricsSecurityEventHandler metricsHandler) {
                metricsHandler.setMeterRegistry(meterRegistry);
            }
        }
        if (loaded.isEmpty()) {
            LOG.warn("No security event handlers registered, events will be dropped");
        }
        return loaded;
    }

    @Override
    public void publish(SecurityEvent event) {
        if (executor == null) {
            return;
        }
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            dropped.increment();
            LOG.debugv("Dropped {0}: dispatch queue full", event.getClass().getSimpleName());
        }
    }

    private void deliver(SecurityEvent event) {
        for (final var handler : handlers) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                LOG.warnv("Handler {0} failed on {1}: {2}",
                        handler.name(), event.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    /**
     * Lets queued events drain briefly, then closes the handlers.
     */
    @PreDestroy
    void shutdown() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                LOG.warnv("Discarding {0} undelivered security event(s)", executor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        for (final var handler : handlers) {
            try {
                handler.close();
            } catch (RuntimeException e) {
                LOG.warnv("Error closing handler {0}: {1}", handler.name(), e.getMessage());
            }
        }
    }

    List<SecurityEventHandler> handlers() {
        return handlers;
    }
}
