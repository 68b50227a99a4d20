package com.openforge.devgauge.skill;

import com.openforge.devgauge.analysis.AnalysisException;
import com.openforge.devgauge.analysis.ScoringPhase;

/**
 * A skill's response could not be turned into its result type.
 */
public class SkillFailedException extends AnalysisException {

    private final String skill;

    public SkillFailedException(String skill, String message) {
        super(ScoringPhase.FAILED, message);
        this.skill = skill;
    }

    public String skill() {
        return skill;
    }
}
