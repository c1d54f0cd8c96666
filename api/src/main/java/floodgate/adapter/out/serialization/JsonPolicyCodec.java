package floodgate.adapter.out.serialization;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import floodgate.core.model.policy.InvalidImportDataException;
import floodgate.core.model.policy.PolicyImportEntry;
import floodgate.core.model.policy.RateLimitPolicy;
import floodgate.core.model.ratelimit.LimitType;
import floodgate.core.model.ratelimit.RateLimitRule;
import floodgate.core.model.ratelimit.RuleCategory;
import floodgate.core.model.ratelimit.RuleConfigurationException;
import floodgate.core.port.out.PolicyCodec;

/**
 * JSON policy bundle codec.
 *
 * <p>Bundle format:
 * <pre>{@code
 * {
 *   "version": 1,
 *   "exportedAt": "2024-01-01T00:00:00Z",
 *   "policies": [
 *     {"name": "premium", "enabled": true, "priority": 10,
 *      "rules": [{"name": "rpm", "limitType": "per-minute", "limit": 1000}]}
 *   ]
 * }
 * }</pre>
 *
 * <p>A bare array of policies is accepted on import as well. Each policy entry
 * is decoded on its own: one malformed or duplicated rule invalidates its
 * policy entry only.
 */
@ApplicationScoped
public class JsonPolicyCodec implements PolicyCodec {

    static final int BUNDLE_VERSION = 1;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Inject
    public JsonPolicyCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public String encode(List<RateLimitPolicy> policies) {
        final var root = objectMapper.createObjectNode();
        root.put("version", BUNDLE_VERSION);
        root.put("exportedAt", clock.instant().toString());
        final var array = root.putArray("policies");
        for (final var policy : policies) {
            array.add(encodePolicy(policy));
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize policy bundle", e);
        }
    }

    @Override
    public List<PolicyImportEntry> decode(String serialized) {
        if (serialized == null || serialized.isBlank()) {
            throw new InvalidImportDataException("Policy bundle is empty");
        }

        final JsonNode root;
        try {
            root = objectMapper.readTree(serialized);
        } catch (JsonProcessingException e) {
            throw new InvalidImportDataException("Policy bundle is not valid JSON: " + e.getOriginalMessage(), e);
        }

        final JsonNode policies;
        if (root.isArray()) {
            policies = root;
        } else if (root.isObject() && root.path("policies").isArray()) {
            final var version = root.path("version").asInt(BUNDLE_VERSION);
            if (version > BUNDLE_VERSION) {
                throw new InvalidImportDataException("Unsupported policy bundle version: " + version);
            }
            policies = root.get("policies");
        } else {
            throw new InvalidImportDataException("Policy bundle must be an array or contain a 'policies' array");
        }

        final var entries = new ArrayList<PolicyImportEntry>();
        for (final var node : policies) {
            entries.add(decodePolicy(node));
        }
        return entries;
    }

    private ObjectNode encodePolicy(RateLimitPolicy policy) {
        final var node = objectMapper.createObjectNode();
        node.put("name", policy.name());
        node.put("description", policy.description());
        node.put("enabled", policy.enabled());
        node.put("priority", policy.priority());
        node.put("createdAt", policy.createdAt().toString());
        node.put("updatedAt", policy.updatedAt().toString());
        node.put("createdBy", policy.createdBy());
        final ArrayNode rules = node.putArray("rules");
        for (final var rule : policy.rules()) {
            final var ruleNode = rules.addObject();
            ruleNode.put("name", rule.name());
            ruleNode.put("limitType", rule.limitType().wireName());
            ruleNode.put("limit", rule.limit());
            ruleNode.put("windowSeconds", rule.windowSeconds());
            ruleNode.put("burst", rule.burst());
            ruleNode.put("priority", rule.priority());
            ruleNode.put("category", rule.category().name());
            ruleNode.put("penaltySeconds", rule.penaltySeconds());
        }
        return node;
    }

    private PolicyImportEntry decodePolicy(JsonNode node) {
        final var name = node.path("name").asText("");
        if (!node.isObject() || name.isBlank()) {
            return PolicyImportEntry.invalid("<unnamed>", "Policy entry requires a name");
        }
        try {
            final var rules = new ArrayList<RateLimitRule>();
            final var rulesNode = node.path("rules");
            if (!rulesNode.isMissingNode() && !rulesNode.isArray()) {
                return PolicyImportEntry.invalid(name, "'rules' must be an array");
            }
            final var ruleNames = new HashSet<String>();
            for (final var ruleNode : rulesNode) {
                final var rule = decodeRule(ruleNode);
                if (!ruleNames.add(rule.name())) {
                    return PolicyImportEntry.invalid(name, "Duplicate rule " + rule.name());
                }
                rules.add(rule);
            }
            final var policy = RateLimitPolicy.builder(name)
                    .description(node.path("description").asText(""))
                    .enabled(node.path("enabled").asBoolean(true))
                    .priority(node.path("priority").asInt(0))
                    .rules(rules)
                    .createdAt(parseInstant(node.path("createdAt")))
                    .updatedAt(parseInstant(node.path("updatedAt")))
                    .createdBy(node.path("createdBy").asText(null))
                    .build();
            return PolicyImportEntry.valid(policy);
        } catch (RuleConfigurationException | IllegalArgumentException | DateTimeParseException e) {
            return PolicyImportEntry.invalid(name, e.getMessage());
        }
    }

    private RateLimitRule decodeRule(JsonNode node) {
        if (!node.isObject()) {
            throw new RuleConfigurationException("Rule entry must be an object");
        }
        final var name = node.path("name").asText("");
        final var limitNode = node.path("limit");
        if (!limitNode.canConvertToLong() || !limitNode.isIntegralNumber()) {
            throw new RuleConfigurationException("Rule " + name + " requires an integer limit");
        }
        final var builder = RateLimitRule.builder(name, LimitType.parse(node.path("limitType").asText(null)))
                .limit(limitNode.asLong())
                .burst(node.path("burst").asLong(0))
                .priority(node.path("priority").asInt(0))
                .penaltySeconds(node.path("penaltySeconds").asLong(0));
        if (node.hasNonNull("windowSeconds")) {
            builder.windowSeconds(node.get("windowSeconds").asLong());
        }
        if (node.hasNonNull("category")) {
            builder.category(RuleCategory.valueOf(node.get("category").asText().trim().toUpperCase(Locale.ROOT)));
        }
        return builder.build().validate();
    }

    private Instant parseInstant(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return Instant.parse(node.asText());
    }
}
