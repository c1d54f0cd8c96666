package floodgate.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import floodgate.core.model.monitor.ExportFormat;
import floodgate.core.model.monitor.HourlyBucket;
import floodgate.core.model.monitor.SecuritySummary;
import floodgate.core.model.monitor.TimeRange;
import floodgate.core.model.monitor.UsageSummary;
import floodgate.core.model.monitor.ViolationSummary;
import floodgate.core.port.in.RateLimitMonitoring;

/**
 * REST resource for rate limit analytics.
 *
 * <p>Ranges are written {@code 15m}, {@code 1h}, {@code 24h} or {@code 7d}
 * and default to one hour.
 */
@Path("/admin/monitoring")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class MonitoringResource {

    private static final String TEXT_CSV = "text/csv";

    private final RateLimitMonitoring monitoring;

    @Inject
    public MonitoringResource(RateLimitMonitoring monitoring) {
        this.monitoring = monitoring;
    }

    @GET
    @Path("/summary")
    public Uni<SecuritySummary> summary(@QueryParam("range") String range) {
        return monitoring.getSecuritySummary(TimeRange.parse(range));
    }

    @GET
    @Path("/violations")
    public Uni<ViolationSummary> violations(@QueryParam("range") String range) {
        return monitoring.violationSummary(TimeRange.parse(range));
    }

    @GET
    @Path("/usage")
    public Uni<UsageSummary> usage(@QueryParam("range") String range) {
        return monitoring.apiUsageSummary(TimeRange.parse(range));
    }

    @GET
    @Path("/hourly")
    public Uni<List<HourlyBucket>> hourly(@QueryParam("days") @DefaultValue("7") int days) {
        return monitoring.hourlyPattern(days);
    }

    /**
     * Export every buffered event.
     *
     * @param format {@code json} (default) or {@code csv}
     */
    @GET
    @Path("/export")
    @Produces({MediaType.APPLICATION_JSON, TEXT_CSV})
    public Uni<Response> export(@QueryParam("format") String format) {
        final var exportFormat = ExportFormat.parse(format);
        final var mediaType = exportFormat == ExportFormat.CSV ? TEXT_CSV : MediaType.APPLICATION_JSON;
        return monitoring.export(exportFormat)
                .map(body -> Response.ok(body, mediaType).build());
    }
}
