package com.openforge.devgauge.plan;

/**
 * Outcome of a usage check.
 *
 * @param model         model to call with; null when not allowed
 * @param usingFallback the plan's limit was reached and its fallback model is served instead
 * @param limit         the plan's cap for this usage type; null means unlimited
 */
public record UsageDecision(
        boolean allowed,
        String model,
        boolean usingFallback,
        int current,
        Integer limit,
        PlanCapability plan
) {}
