package floodgate.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * DTO for releasing a concurrency slot.
 *
 * @param identifier client identifier
 * @param rule       slot reference from {@code heldSlots}, or a bare rule name
 */
public record SlotReleaseRequest(
        @NotBlank(message = "identifier is required") String identifier,
        @NotBlank(message = "rule is required") String rule) {}
