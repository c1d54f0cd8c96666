package floodgate.system.filter;

/**
 * Who a request is counted against.
 *
 * @param identifier counter identifier, e.g. {@code api_key:3f2a...}, {@code user:42}, {@code ip:10.0.0.1}
 * @param ruleType   identity scope that applies: {@code api_key}, {@code user} or {@code ip}
 */
public record ClientIdentity(String identifier, String ruleType) {}
