package com.openforge.devgauge.memory;

import java.util.Arrays;
import java.util.Optional;

/**
 * Agent personalities selectable on plans with custom identity.
 * {@code custom} is not a preset: the user's own instruction is used instead.
 */
public enum PersonalityPreset {

    COACH("coach", "Adopt the tone of a disciplined coach. Break advice into clear steps, set milestones "
            + "and hold the user accountable. Celebrate wins but always point to the next target."),
    MENTOR("mentor", "Speak like a seasoned mentor. Prioritise understanding over speed. Explain the "
            + "reasoning behind each recommendation so the user learns, not just follows."),
    DRILL_SERGEANT("drill-sergeant", "Channel a drill sergeant. Be relentless and demanding. No excuses "
            + "are acceptable. Push the user hard, always with their growth in mind. Short, punchy sentences."),
    HYPE_MAN("hype-man", "Be an energetic hype man. Lead with excitement, amplify every positive signal "
            + "and frame challenges as opportunities. Keep the energy high while staying actionable."),
    STRATEGIST("strategist", "Think like a strategist. Be precise and data-focused. Reference metrics "
            + "directly and present recommendations as calculated moves in a bigger plan."),
    FRIEND("friend", "Talk like a friendly senior developer. Keep it casual and conversational. Be honest "
            + "but approachable, like grabbing coffee and talking career.");

    public static final String CUSTOM_ID = "custom";

    private final String id;
    private final String instruction;

    PersonalityPreset(String id, String instruction) {
        this.id          = id;
        this.instruction = instruction;
    }

    public String id() {
        return id;
    }

    public String instruction() {
        return instruction;
    }

    public static Optional<PersonalityPreset> byId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values()).filter(p -> p.id.equalsIgnoreCase(id.trim())).findFirst();
    }
}
