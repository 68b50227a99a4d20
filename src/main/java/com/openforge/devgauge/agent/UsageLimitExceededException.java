package com.openforge.devgauge.agent;

import com.openforge.devgauge.plan.UsageType;

import java.util.Locale;

/** A paid plan reached its limit for the period and has no fallback model. */
public class UsageLimitExceededException extends RuntimeException {

    private final UsageType type;
    private final int       limit;

    public UsageLimitExceededException(UsageType type, int limit) {
        super("Usage limit reached for " + type.name().toLowerCase(Locale.ROOT) + " (" + limit + " per period)");
        this.type  = type;
        this.limit = limit;
    }

    public UsageType type() {
        return type;
    }

    public int limit() {
        return limit;
    }
}
