package com.openforge.devgauge.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.devgauge.llm.LlmClient;
import com.openforge.devgauge.llm.ModelGateway;
import com.openforge.devgauge.llm.ResponseExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Two-phase analysis: score, then synthesize.
 *
 * <pre>
 *   SCORING ──(categories missing)──▶ RETRY ──▶ normalize ──▶ SYNTHESIS ──▶ DONE
 *      │                                │                          │
 *      └──────(nothing parseable)───────┴──────▶ FAILED ◀──────────┘
 * </pre>
 *
 * The level is fixed by {@link NormalizationEngine} before Phase 2 starts and is
 * handed to the model as authoritative. At most one retry is made, and only for
 * the categories Phase 1 left out; anything still missing afterwards is filled by
 * the engine's mean-of-present rule. Transport failures propagate unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringOrchestrator {

    private final ModelGateway        gateway;
    private final ResponseExtractor   extractor;
    private final NormalizationEngine engine;

    /**
     * Runs both phases. Narrative tokens are forwarded to {@code sink} when it is
     * non-null; the result is the same either way.
     *
     * @throws ScoringFailedException   no scores could be parsed after the retry
     * @throws SynthesisFailedException the narrative could not be parsed; carries the scores
     */
    public AnalysisResult analyze(ScoringRequest request, Consumer<String> sink) {
        ScoredCategories scored = score(request);
        return synthesize(request, scored, sink);
    }

    /**
     * Phase 1. Returns the complete, normalized category set with its level.
     */
    public ScoredCategories score(ScoringRequest request) {
        String metrics = request.formattedMetrics();
        log.debug("[Scoring:{}] requesting category scores, prompt-length={}", ScoringPhase.SCORING, metrics.length());

        String firstText = gateway.complete(AnalysisInstructions.SCORING, scoringPrompt(request, metrics), request.model());
        JsonNode firstJson = extractor.extract(firstText);
        ScoringPayload payload = ScoringPayload.from(firstJson);

        List<CategoryKey> missing = engine.missingCategories(payload.categories());
        if (!missing.isEmpty()) {
            log.warn("[Scoring:{}] missing categories {} after first pass, retrying once", ScoringPhase.RETRY, missing);
            boolean havePartial = missing.size() < CategoryKey.values().length;
            ScoringPayload retry = retryMissing(request, metrics, missing, havePartial);
            if (retry != null) {
                payload = payload.mergedWith(retry);
            }
            if (engine.missingCategories(payload.categories()).size() == CategoryKey.values().length) {
                log.warn("[Scoring:{}] no usable scores after retry", ScoringPhase.FAILED);
                throw new ScoringFailedException("Could not parse category scores from the model response");
            }
        }

        Map<String, Double> weights = request.customWeights() ? payload.weights() : null;
        ScoredCategories scored = engine.normalize(payload.categories(), weights);
        log.info("[Scoring:{}] locked level={} ({})", ScoringPhase.SCORING, scored.level(), scored.levelName());
        return scored;
    }

    /**
     * Phase 2 over an already-locked score set. Public so a caller holding the
     * scores from a {@link SynthesisFailedException} can retry this phase alone.
     */
    public AnalysisResult synthesize(ScoringRequest request, ScoredCategories scored, Consumer<String> sink) {
        String system = AnalysisInstructions.chat(
                request.metricsDetail(), request.tone(), null, AnalysisMode.SYNTHESIS);
        PromptContext prompt = PromptContext.builder()
                .profileAndMetrics(request.formattedMetrics())
                .precomputedLevel(MetricsFormatter.lockedLevel(scored))
                .previousAnalysis(request.previous() == null ? null : MetricsFormatter.previousAnalysis(request.previous()))
                .instruction("Write the summary, recommendations and insights for the scores above. "
                        + "The level name \"" + scored.levelName().label() + "\" is authoritative.")
                .build();

        String text = gateway.stream(system, prompt.render(), request.model(), sink);
        SynthesisPayload narrative = SynthesisPayload.from(extractor.extract(text))
                .orElseThrow(() -> {
                    log.warn("[Scoring:{}] synthesis response not parseable, length={}", ScoringPhase.FAILED,
                            text == null ? 0 : text.length());
                    return new SynthesisFailedException("Could not parse the analysis narrative", scored);
                });

        ScoredCategories confirmed = engine.renormalize(scored);
        if (confirmed.level() != scored.level()) {
            // renormalize is deterministic; this only fires if the engine was misconfigured
            log.error("[Scoring] level drifted on re-normalization: {} -> {}", scored.level(), confirmed.level());
        }
        log.debug("[Scoring:{}] level={} recommendations={}", ScoringPhase.DONE,
                confirmed.level(), narrative.recommendations().size());
        return AnalysisResult.of(confirmed, narrative);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static String scoringPrompt(ScoringRequest request, String metrics) {
        return PromptContext.builder()
                .instruction("Analyze this developer profile. Score all four categories (0-100) "
                        + "using the calibration anchors in your instructions.")
                .profileAndMetrics(metrics)
                .previousAnalysis(request.previous() == null ? null
                        : MetricsFormatter.previousAnalysis(request.previous()))
                .build()
                .render();
    }

    /**
     * The single targeted retry. Returns null when the retry gave nothing usable.
     * A transport failure here is only tolerated when the first pass already
     * produced at least one usable category score.
     */
    private ScoringPayload retryMissing(ScoringRequest request, String metrics,
                                        List<CategoryKey> missing, boolean havePartial) {
        String prompt = AnalysisInstructions.missingCategoriesRequest(missing) + "\n\n" + metrics;
        String text;
        try {
            text = gateway.complete(AnalysisInstructions.SCORING, prompt, request.model());
        } catch (LlmClient.LlmException e) {
            if (!havePartial) throw e;
            log.warn("[Scoring:{}] retry failed, normalizing with fallback: {}", ScoringPhase.RETRY, e.getMessage());
            return null;
        }
        JsonNode json = extractor.extract(text);
        return json == null ? null : ScoringPayload.from(json);
    }
}
