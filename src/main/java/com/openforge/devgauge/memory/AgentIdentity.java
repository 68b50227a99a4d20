package com.openforge.devgauge.memory;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Custom agent persona. Lengths are clamped on construction.
 *
 * @param personality       a {@link PersonalityPreset} id or {@link PersonalityPreset#CUSTOM_ID}
 * @param customPersonality the user's own instruction when personality is "custom"
 * @param icon              base64 data URI
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentIdentity(
        String name,
        String personality,
        String customPersonality,
        String icon
) {

    public static final String DEFAULT_NAME             = "DevGauge Agent";
    public static final int    NAME_MAX_LENGTH          = 24;
    public static final int    CUSTOM_PERSONALITY_MAX   = 300;
    public static final int    ICON_MAX_LENGTH          = 256 * 1024;

    public AgentIdentity {
        name              = clamp(name, NAME_MAX_LENGTH);
        customPersonality = clamp(customPersonality, CUSTOM_PERSONALITY_MAX);
        if (icon != null && icon.length() > ICON_MAX_LENGTH) icon = null;
    }

    public static AgentIdentity defaults() {
        return new AgentIdentity(DEFAULT_NAME, null, null, null);
    }

    public String displayName() {
        return name == null || name.isBlank() ? DEFAULT_NAME : name;
    }

    /** Prompt instruction for the chosen personality; empty when none applies. */
    public String personalityInstruction() {
        if (PersonalityPreset.CUSTOM_ID.equalsIgnoreCase(personality)) {
            return customPersonality == null ? "" : customPersonality;
        }
        return PersonalityPreset.byId(personality).map(PersonalityPreset::instruction).orElse("");
    }

    /**
     * The persona section of a chat system prompt. {@code identity} may be null
     * (default persona); {@code userName} is the user's nickname, if known.
     * Empty when there is nothing to add.
     */
    public static String promptBlock(AgentIdentity identity, String userName) {
        StringBuilder sb = new StringBuilder();
        if (identity != null) {
            sb.append("# AGENT IDENTITY\nYour name is \"").append(identity.displayName()).append("\".");
            String personality = identity.personalityInstruction();
            if (!personality.isBlank()) sb.append('\n').append(personality);
        }
        if (userName != null && !userName.isBlank()) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append("# USER\nThe user's name is ").append(userName.trim())
                    .append(". Address them by name occasionally.");
        }
        return sb.toString();
    }

    private static String clamp(String value, int max) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.length() > max ? trimmed.substring(0, max) : trimmed;
    }
}
