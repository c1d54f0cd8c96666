package floodgate.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * DTO for assigning an identifier to a policy.
 *
 * @param policy the policy name
 */
public record PolicyAssignmentRequest(@NotBlank(message = "policy is required") String policy) {}
