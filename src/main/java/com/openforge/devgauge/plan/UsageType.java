package com.openforge.devgauge.plan;

/**
 * Metered AI call types, each with its own per-period counter.
 */
public enum UsageType {
    MESSAGES,
    REANALYZES,
    PROJECT_CHATS
}
