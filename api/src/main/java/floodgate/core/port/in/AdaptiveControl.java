package floodgate.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import floodgate.core.model.adaptive.AdaptiveRule;
import floodgate.core.model.adaptive.AdjustmentRecord;
import floodgate.core.model.adaptive.SystemMetrics;

/**
 * Port for the adaptive controller.
 */
public interface AdaptiveControl {

    /**
     * Ingest a metrics sample and evaluate every adaptive rule against it.
     *
     * @param metrics the sample
     * @return Uni with the adjustments applied by this sample
     */
    Uni<List<AdjustmentRecord>> updateSystemMetrics(SystemMetrics metrics);

    /**
     * Attach adaptive bounds to a registered rule.
     *
     * @param rule the bounds
     * @return Uni with the registered bounds
     * @throws floodgate.core.model.ratelimit.RuleConfigurationException if the rule is not registered
     */
    Uni<AdaptiveRule> registerAdaptiveRule(AdaptiveRule rule);

    /**
     * @param scope    scope key
     * @param ruleName rule name
     * @return Uni with true if bounds were removed
     */
    Uni<Boolean> unregisterAdaptiveRule(String scope, String ruleName);

    Uni<List<AdaptiveRule>> listAdaptiveRules();

    /**
     * @return Uni with applied adjustments, oldest first
     */
    Uni<List<AdjustmentRecord>> adjustmentHistory();
}
