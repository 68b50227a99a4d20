package com.openforge.devgauge.analysis;

import java.util.Locale;

/**
 * Roast intensity chosen by the user. BALANCED adds nothing to the prompt.
 */
public enum ToneDirective {

    MILD("Use a diplomatic, encouraging tone throughout. Lead with strengths before mentioning "
            + "weaknesses. Frame every gap as an area of opportunity rather than a failure. "
            + "Avoid blunt or harsh language."),
    BALANCED(""),
    BRUTAL("Be brutally blunt. Do not sugarcoat weaknesses. Call out every gap, missed opportunity "
            + "and red flag directly, while remaining factually accurate. Hold nothing back.");

    private final String instruction;

    ToneDirective(String instruction) {
        this.instruction = instruction;
    }

    public String instruction() {
        return instruction;
    }

    /** Lenient parse; null or unknown values mean BALANCED. */
    public static ToneDirective parse(String value) {
        if (value == null || value.isBlank()) return BALANCED;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return BALANCED;
        }
    }
}
