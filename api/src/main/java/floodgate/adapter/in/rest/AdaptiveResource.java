package floodgate.adapter.in.rest;

import java.time.Clock;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import floodgate.adapter.in.dto.AdaptiveRuleDto;
import floodgate.adapter.in.dto.SystemMetricsDto;
import floodgate.adapter.in.problem.RateLimitProblem;
import floodgate.core.model.adaptive.AdjustmentRecord;
import floodgate.core.port.in.AdaptiveControl;

/**
 * REST resource for the adaptive controller.
 */
@Path("/admin/adaptive")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AdaptiveResource {

    private final AdaptiveControl adaptive;
    private final Clock clock;

    @Inject
    public AdaptiveResource(AdaptiveControl adaptive, Clock clock) {
        this.adaptive = adaptive;
        this.clock = clock;
    }

    /**
     * Push a system load sample.
     *
     * @return the adjustments it caused
     */
    @POST
    @Path("/metrics")
    public Uni<List<AdjustmentRecord>> updateMetrics(
            @NotNull(message = "request body is required") SystemMetricsDto request) {
        return adaptive.updateSystemMetrics(request.toModel(clock.instant()));
    }

    @GET
    @Path("/rules")
    public Uni<List<AdaptiveRuleDto>> listRules() {
        return adaptive.listAdaptiveRules()
                .map(rules -> rules.stream().map(AdaptiveRuleDto::fromModel).toList());
    }

    /**
     * Attach adaptive bounds to a registered rule.
     *
     * @return 201 Created, 400 if the rule is unknown or the bounds are invalid
     */
    @POST
    @Path("/rules")
    public Uni<Response> registerRule(@NotNull(message = "request body is required") @Valid AdaptiveRuleDto request) {
        return adaptive.registerAdaptiveRule(request.toModel())
                .map(rule -> Response.status(Response.Status.CREATED)
                        .entity(AdaptiveRuleDto.fromModel(rule))
                        .build());
    }

    @DELETE
    @Path("/rules/{scope}/{rule}")
    public Uni<Response> unregisterRule(@PathParam("scope") String scope, @PathParam("rule") String rule) {
        return adaptive.unregisterAdaptiveRule(scope, rule).map(removed -> {
            if (removed) {
                return Response.noContent().build();
            } else {
                throw RateLimitProblem.resourceNotFound("Adaptive rule", scope + "/" + rule);
            }
        });
    }

    @GET
    @Path("/history")
    public Uni<List<AdjustmentRecord>> history() {
        return adaptive.adjustmentHistory();
    }
}
