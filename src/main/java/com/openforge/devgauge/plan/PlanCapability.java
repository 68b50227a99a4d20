package com.openforge.devgauge.plan;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Static capabilities of one subscription tier.
 *
 * @param memoryEligible  long-term memory is persisted
 * @param customIdentity  the agent name, personality and icon may be customised
 * @param customWeights   model-suggested category weights may override the defaults
 * @param memoryCap       maximum long-term memory items kept (0 when not eligible)
 * @param fallbackModel   model served once a limit is reached; null means hard block
 * @param limits          per-period limits; a missing entry means unlimited
 */
public record PlanCapability(
        String id,
        String name,
        boolean memoryEligible,
        boolean customIdentity,
        boolean customWeights,
        MetricsDetail metricsDetail,
        int memoryCap,
        String primaryModel,
        String fallbackModel,
        Map<UsageType, Integer> limits
) {

    public PlanCapability {
        limits = limits == null ? Map.of() : Map.copyOf(limits);
    }

    public OptionalInt limit(UsageType type) {
        Integer limit = limits.get(type);
        return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
    }

    public boolean hasFallback() {
        return fallbackModel != null && !fallbackModel.isBlank();
    }
}
