package floodgate.core.service.policy;

import java.util.List;

import floodgate.core.model.policy.RateLimitPolicy;
import floodgate.core.model.ratelimit.LimitType;
import floodgate.core.model.ratelimit.RateLimitRule;
import floodgate.core.model.ratelimit.RuleCategory;

/**
 * Built-in policies seeded at startup.
 *
 * <p>Limits follow the usual client tiers: anonymous callers get the free tier,
 * {@code standard} the basic tier, {@code premium} the pro tier and
 * {@code developer} the enterprise tier.
 */
public final class DefaultPolicies {

    public static final String CREATED_BY = "system";

    private DefaultPolicies() {}

    public static List<RateLimitPolicy> all() {
        return List.of(developer(), premium(), standard(), anonymous());
    }

    public static RateLimitPolicy developer() {
        return RateLimitPolicy.builder("developer")
                .description("Developer tier: generous limits for integration work")
                .priority(40)
                .createdBy(CREATED_BY)
                .rules(List.of(
                        RateLimitRule.builder("developer-per-minute", LimitType.PER_MINUTE)
                                .limit(10_000)
                                .burst(2_000)
                                .priority(40)
                                .build(),
                        RateLimitRule.builder("developer-concurrent", LimitType.CONCURRENT_REQUESTS)
                                .limit(200)
                                .priority(40)
                                .build()))
                .build();
    }

    public static RateLimitPolicy premium() {
        return RateLimitPolicy.builder("premium")
                .description("Premium tier")
                .priority(30)
                .createdBy(CREATED_BY)
                .rules(List.of(
                        RateLimitRule.builder("premium-per-minute", LimitType.PER_MINUTE)
                                .limit(2_000)
                                .burst(500)
                                .priority(30)
                                .build(),
                        RateLimitRule.builder("premium-per-day", LimitType.PER_DAY)
                                .limit(1_000_000)
                                .priority(30)
                                .build(),
                        RateLimitRule.builder("premium-concurrent", LimitType.CONCURRENT_REQUESTS)
                                .limit(50)
                                .priority(30)
                                .build()))
                .build();
    }

    public static RateLimitPolicy standard() {
        return RateLimitPolicy.builder("standard")
                .description("Standard tier")
                .priority(20)
                .createdBy(CREATED_BY)
                .rules(List.of(
                        RateLimitRule.builder("standard-per-minute", LimitType.PER_MINUTE)
                                .limit(500)
                                .burst(100)
                                .priority(20)
                                .build(),
                        RateLimitRule.builder("standard-per-hour", LimitType.PER_HOUR)
                                .limit(10_000)
                                .priority(20)
                                .build()))
                .build();
    }

    public static RateLimitPolicy anonymous() {
        return RateLimitPolicy.builder("anonymous")
                .description("Unauthenticated callers")
                .priority(10)
                .createdBy(CREATED_BY)
                .rules(List.of(
                        RateLimitRule.builder("anonymous-per-second", LimitType.PER_SECOND)
                                .limit(10)
                                .priority(10)
                                .category(RuleCategory.SECURITY)
                                .build(),
                        RateLimitRule.builder("anonymous-per-minute", LimitType.PER_MINUTE)
                                .limit(100)
                                .burst(20)
                                .priority(10)
                                .penaltySeconds(60)
                                .category(RuleCategory.SECURITY)
                                .build()))
                .build();
    }
}
