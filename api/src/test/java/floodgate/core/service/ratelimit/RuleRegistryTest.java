package floodgate.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import floodgate.core.model.ratelimit.LimitType;
import floodgate.core.model.ratelimit.RateLimitRule;
import floodgate.core.model.ratelimit.RateLimitScope;
import floodgate.core.model.ratelimit.RequestContext;
import floodgate.core.model.ratelimit.RuleConfigurationException;
import floodgate.core.model.ratelimit.ScopedRule;

@DisplayName("RuleRegistry")
class RuleRegistryTest {

    private RuleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RuleRegistry(new EndpointPatternMatcher());
    }

    private static RateLimitRule rule(String name, int priority) {
        return RateLimitRule.builder(name, LimitType.PER_MINUTE).limit(10).priority(priority).build();
    }

    private static List<String> names(List<ScopedRule> rules) {
        return rules.stream().map(ScopedRule::ruleName).toList();
    }

    @Nested
    @DisplayName("Resolution")
    class ResolutionTests {

        @Test
        @DisplayName("should always include global rules")
        void shouldAlwaysIncludeGlobalRules() {
            registry.register(RateLimitScope.global(), rule("global", 0));

            var rules = registry.resolveRules(RequestContext.of("ip:1.2.3.4", "ip"), Optional.empty());

            assertEquals(List.of("global"), names(rules));
        }

        @Test
        @DisplayName("should select identity scope by rule type")
        void shouldSelectIdentityScopeByRuleType() {
            registry.register(RateLimitScope.user(), rule("user", 0));
            registry.register(RateLimitScope.apiKey(), rule("key", 0));

            assertEquals(List.of("user"),
                    names(registry.resolveRules(RequestContext.of("u1", "user"), Optional.empty())));
            assertEquals(List.of("key"),
                    names(registry.resolveRules(RequestContext.of("k1", "api-key"), Optional.empty())));
        }

        @Test
        @DisplayName("should include provider and policy scopes when named")
        void shouldIncludeProviderAndPolicyScopes() {
            registry.register(RateLimitScope.provider("openai"), rule("openai", 0));
            registry.register(RateLimitScope.provider("stripe"), rule("stripe", 0));
            registry.replaceScope(RateLimitScope.policy("gold"), List.of(rule("gold", 0)));

            var rules = registry.resolveRules(
                    RequestContext.of("u1", "user", "/v1/chat", "openai"), Optional.of("gold"));

            assertEquals(List.of("openai", "gold"), names(rules));
        }

        @Test
        @DisplayName("should sort by priority descending, keeping registration order on ties")
        void shouldSortByPriority() {
            registry.register(RateLimitScope.global(), rule("low", 1));
            registry.register(RateLimitScope.global(), rule("first-high", 5));
            registry.register(RateLimitScope.user(), rule("second-high", 5));
            registry.register(RateLimitScope.user(), rule("top", 9));

            var rules = registry.resolveRules(RequestContext.of("u1", "user"), Optional.empty());

            assertEquals(List.of("top", "first-high", "second-high", "low"), names(rules));
        }
    }

    @Nested
    @DisplayName("Mutation")
    class MutationTests {

        @Test
        @DisplayName("should reject rules without a positive limit")
        void shouldRejectNonPositiveLimit() {
            var zero = RateLimitRule.of("zero", LimitType.PER_SECOND, 0);

            assertThrows(RuleConfigurationException.class, () -> registry.register(RateLimitScope.global(), zero));
            assertEquals(0, registry.snapshot().size());
        }

        @Test
        @DisplayName("should reject duplicate names in a replaced scope")
        void shouldRejectDuplicateNames() {
            var scope = RateLimitScope.policy("p");

            assertThrows(RuleConfigurationException.class,
                    () -> registry.replaceScope(scope, List.of(rule("a", 0), rule("a", 1))));
        }

        @Test
        @DisplayName("should replace a rule of the same name")
        void shouldReplaceRuleOfSameName() {
            registry.register(RateLimitScope.global(), rule("a", 0));
            registry.register(RateLimitScope.global(), rule("a", 7));

            assertEquals(1, registry.snapshot().size());
            assertEquals(7, registry.find(RateLimitScope.global(), "a").orElseThrow().priority());
        }

        @Test
        @DisplayName("should clear a scope with an empty list")
        void shouldClearScope() {
            registry.replaceScope(RateLimitScope.policy("p"), List.of(rule("a", 0)));
            registry.replaceScope(RateLimitScope.policy("p"), List.of());

            assertTrue(registry.snapshot().scopes().isEmpty());
        }

        @Test
        @DisplayName("should update a limit and return the previous rule")
        void shouldUpdateLimit() {
            registry.register(RateLimitScope.global(), rule("a", 0));

            var previous = registry.updateLimit(RateLimitScope.global(), "a", 25);

            assertEquals(10, previous.orElseThrow().limit());
            assertEquals(25, registry.find(RateLimitScope.global(), "a").orElseThrow().limit());
            assertTrue(registry.updateLimit(RateLimitScope.global(), "missing", 25).isEmpty());
        }

        @Test
        @DisplayName("should report whether a rule was removed")
        void shouldRemoveRule() {
            registry.register(RateLimitScope.global(), rule("a", 0));

            assertTrue(registry.remove(RateLimitScope.global(), "a"));
            assertFalse(registry.remove(RateLimitScope.global(), "a"));
        }

        @Test
        @DisplayName("readers should always see a complete rule set while limits change")
        void readersShouldSeeCompleteRuleSets() throws InterruptedException {
            registry.register(RateLimitScope.global(), rule("a", 0));
            registry.register(RateLimitScope.global(), rule("b", 0));
            var executor = Executors.newFixedThreadPool(4);
            var stop = new AtomicBoolean();
            var failures = new ArrayList<String>();
            var done = new CountDownLatch(3);

            for (int r = 0; r < 3; r++) {
                executor.submit(() -> {
                    try {
                        while (!stop.get()) {
                            var rules = registry.resolveRules(RequestContext.of("u", "user"), Optional.empty());
                            if (rules.size() != 2) {
                                synchronized (failures) {
                                    failures.add("saw " + rules.size() + " rules");
                                }
                            }
                        }
                    } finally {
                        done.countDown();
                    }
                });
            }
            for (int i = 1; i <= 2000; i++) {
                registry.updateLimit(RateLimitScope.global(), i % 2 == 0 ? "a" : "b", i);
            }
            stop.set(true);
            assertTrue(done.await(5, TimeUnit.SECONDS));
            executor.shutdown();

            assertTrue(failures.isEmpty(), failures.toString());
        }
    }
}
