package floodgate.adapter.in.rest;

import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import floodgate.adapter.in.dto.PolicyAssignmentRequest;
import floodgate.adapter.in.dto.PolicyDto;
import floodgate.adapter.in.problem.RateLimitProblem;
import floodgate.core.model.monitor.TimeRange;
import floodgate.core.model.policy.PolicyEffectiveness;
import floodgate.core.port.in.PolicyManagement;

/**
 * REST resource for rate limit policy management.
 *
 * <p>Policies are named rule bundles; assigning an identifier to a policy adds
 * the policy's rules to every check of that identifier.
 */
@Path("/admin/policies")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PolicyResource {

    private final PolicyManagement policies;

    @Inject
    public PolicyResource(PolicyManagement policies) {
        this.policies = policies;
    }

    /**
     * Create a new policy.
     *
     * @return 201 Created with the policy, 409 if the name is taken
     */
    @POST
    public Uni<Response> create(@NotNull(message = "request body is required") @Valid PolicyDto request) {
        return policies.create(request.toModel(null))
                .map(policy -> Response.status(Response.Status.CREATED)
                        .entity(PolicyDto.fromModel(policy))
                        .build());
    }

    @GET
    public Uni<List<PolicyDto>> list(@QueryParam("enabledOnly") @DefaultValue("false") boolean enabledOnly) {
        return policies.list(enabledOnly)
                .map(all -> all.stream().map(PolicyDto::fromModel).toList());
    }

    /**
     * Export every policy as a bundle.
     *
     * @param format bundle format, {@code json} by default
     */
    @GET
    @Path("/export")
    public Uni<String> exportAll(@QueryParam("format") @DefaultValue("json") String format) {
        return policies.exportAll(format);
    }

    /**
     * Import a policy bundle. Malformed entries are skipped.
     *
     * @param overwrite replace policies that already exist
     * @return the number of imported policies
     */
    @POST
    @Path("/import")
    public Uni<Map<String, Integer>> importAll(
            String bundle, @QueryParam("overwrite") @DefaultValue("false") boolean overwrite) {
        return policies.importAll(bundle, overwrite).map(count -> Map.of("imported", count));
    }

    @GET
    @Path("/{name}")
    public Uni<PolicyDto> get(@PathParam("name") String name) {
        return policies.get(name).map(opt -> opt.map(PolicyDto::fromModel)
                .orElseThrow(() -> RateLimitProblem.resourceNotFound("Policy", name)));
    }

    /**
     * Replace a policy's content. Creation metadata is kept.
     *
     * @return the updated policy, 404 if unknown
     */
    @PUT
    @Path("/{name}")
    public Uni<PolicyDto> update(
            @PathParam("name") String name,
            @NotNull(message = "request body is required") @Valid PolicyDto request) {
        return policies.update(name, request.toModel(name)).map(PolicyDto::fromModel);
    }

    /**
     * Delete a policy and its assignments.
     *
     * @return 204 No Content, 404 if unknown
     */
    @DELETE
    @Path("/{name}")
    public Uni<Response> delete(@PathParam("name") String name) {
        return policies.delete(name).map(ignored -> Response.noContent().build());
    }

    @GET
    @Path("/{name}/effectiveness")
    public Uni<PolicyEffectiveness> effectiveness(@PathParam("name") String name, @QueryParam("range") String range) {
        return policies.analyzeEffectiveness(name, TimeRange.parse(range));
    }

    /**
     * Assign an identifier to a policy, replacing any previous assignment.
     *
     * @return 204 No Content, 404 if the policy is unknown
     */
    @PUT
    @Path("/assignments/{identifier}")
    public Uni<Response> assign(
            @PathParam("identifier") String identifier,
            @NotNull(message = "request body is required") @Valid PolicyAssignmentRequest request) {
        return policies.assignToIdentifier(identifier, request.policy())
                .map(ignored -> Response.noContent().build());
    }

    @GET
    @Path("/assignments/{identifier}")
    public Uni<Map<String, String>> assignment(@PathParam("identifier") String identifier) {
        return policies.getPolicyForIdentifier(identifier).map(policy -> Map.of(
                "identifier", identifier,
                "policy", policy.orElseThrow(() -> RateLimitProblem.resourceNotFound("Assignment", identifier))));
    }
}
