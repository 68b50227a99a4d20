package com.openforge.devgauge.plan;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lookup table of the subscription tiers. Unknown or missing ids resolve to free.
 */
@Component
public class PlanCatalog {

    public static final String FREE     = "free";
    public static final String STUDENT  = "student";
    public static final String PRO      = "pro";
    public static final String ULTIMATE = "ultimate";

    /** Absolute ceiling for long-term memory items, whatever the plan says. */
    public static final int MEMORY_MAX_ITEMS = 500;

    private final Map<String, PlanCapability> plans;

    public PlanCatalog() {
        this(defaultPlans());
    }

    public PlanCatalog(List<PlanCapability> plans) {
        Map<String, PlanCapability> byId = new LinkedHashMap<>();
        plans.forEach(plan -> byId.put(plan.id(), plan));
        if (!byId.containsKey(FREE)) {
            throw new IllegalArgumentException("Plan catalog must define the '" + FREE + "' plan");
        }
        this.plans = Map.copyOf(byId);
    }

    public PlanCapability get(String planId) {
        if (planId == null) return plans.get(FREE);
        return plans.getOrDefault(planId.toLowerCase(Locale.ROOT), plans.get(FREE));
    }

    /** Effective memory cap: the plan's own cap bounded by {@link #MEMORY_MAX_ITEMS}. */
    public int memoryCap(String planId) {
        PlanCapability plan = get(planId);
        return plan.memoryEligible() ? Math.min(plan.memoryCap(), MEMORY_MAX_ITEMS) : 0;
    }

    public static List<PlanCapability> defaultPlans() {
        return List.of(
                new PlanCapability(FREE, "Free", false, false, false, MetricsDetail.SUMMARY, 0,
                        "meta-llama/llama-4-scout", "meta-llama/llama-3.3-70b-instruct:free",
                        Map.of(UsageType.MESSAGES, 20, UsageType.REANALYZES, 3, UsageType.PROJECT_CHATS, 3)),
                new PlanCapability(STUDENT, "Student", true, false, false, MetricsDetail.FULL, 75,
                        "meta-llama/llama-4-scout", null,
                        Map.of(UsageType.MESSAGES, 50, UsageType.REANALYZES, 15, UsageType.PROJECT_CHATS, 15)),
                new PlanCapability(PRO, "Pro", true, true, true, MetricsDetail.FULL, 200,
                        "meta-llama/llama-4-maverick", null,
                        Map.of(UsageType.MESSAGES, 200, UsageType.REANALYZES, 50)),
                new PlanCapability(ULTIMATE, "Ultimate", true, true, true, MetricsDetail.FULL, 500,
                        "google/gemini-3.1-pro-preview", null,
                        Map.of())
        );
    }
}
