package com.openforge.devgauge.analysis;

/**
 * Phase 2 produced no parseable narrative. Carries the Phase 1 result so the
 * caller can retry {@link ScoringOrchestrator#synthesize} alone.
 */
public class SynthesisFailedException extends AnalysisException {

    private final transient ScoredCategories scored;

    public SynthesisFailedException(String message, ScoredCategories scored) {
        super(ScoringPhase.SYNTHESIS, message);
        this.scored = scored;
    }

    public ScoredCategories scored() {
        return scored;
    }
}
