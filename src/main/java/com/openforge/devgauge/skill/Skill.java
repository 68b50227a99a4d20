package com.openforge.devgauge.skill;

/**
 * A named analysis capability. Implementations are stateless Spring beans and
 * are discovered by {@link SkillRegistry}.
 */
public interface Skill {

    /** Registry key, e.g. "recommendProjects". */
    String name();

    String description();

    /**
     * Runs the capability. Transport failures and unparseable responses
     * propagate as exceptions; expected non-results come back as a
     * {@link SkillResult} status.
     */
    SkillResult execute(SkillContext context);
}
