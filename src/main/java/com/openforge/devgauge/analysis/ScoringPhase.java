package com.openforge.devgauge.analysis;

/**
 * States of one orchestrator run: SCORING, optionally RETRY, then SYNTHESIS and DONE.
 * FAILED is terminal.
 */
public enum ScoringPhase {
    SCORING,
    RETRY,
    SYNTHESIS,
    DONE,
    FAILED
}
