package com.openforge.devgauge.analysis;

/**
 * No usable JSON could be recovered from the model. Distinct from transport
 * failures, which surface as {@code LlmClient.LlmException}.
 */
public class AnalysisException extends RuntimeException {

    private final ScoringPhase phase;

    public AnalysisException(ScoringPhase phase, String message) {
        super(message);
        this.phase = phase;
    }

    /** The phase whose response could not be parsed. */
    public ScoringPhase phase() {
        return phase;
    }

    /** Whether repeating the call can reasonably succeed. */
    public boolean retryable() {
        return true;
    }
}
