package com.openforge.devgauge.analysis;

/**
 * Phase 1 produced no parseable scores, even after the missing-category retry.
 */
public class ScoringFailedException extends AnalysisException {

    public ScoringFailedException(String message) {
        super(ScoringPhase.SCORING, message);
    }
}
