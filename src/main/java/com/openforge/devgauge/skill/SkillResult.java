package com.openforge.devgauge.skill;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a skill call. Only {@link Status#OK} carries a value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SkillResult(
        Status status,
        String skill,
        Object value,
        String message,
        String suggestion
) {

    public enum Status { OK, NOT_FOUND, NO_BASELINE }

    public static SkillResult ok(String skill, Object value) {
        return new SkillResult(Status.OK, skill, value, null, null);
    }

    public static SkillResult notFound(String skill) {
        return new SkillResult(Status.NOT_FOUND, skill, null, "Skill '" + skill + "' not found", null);
    }

    public static SkillResult noBaseline(String skill) {
        return new SkillResult(Status.NO_BASELINE, skill, null,
                "No previous analysis available for comparison",
                "This is your first analysis. Complete some projects and return for a progress check!");
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * The value as {@code type}.
     *
     * @throws IllegalStateException when the result is not OK or holds another type
     */
    public <T> T valueAs(Class<T> type) {
        if (!isOk() || !type.isInstance(value)) {
            throw new IllegalStateException("Skill '" + skill + "' has no " + type.getSimpleName() + " value (" + status + ")");
        }
        return type.cast(value);
    }
}
