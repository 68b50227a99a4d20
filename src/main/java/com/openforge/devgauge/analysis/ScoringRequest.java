package com.openforge.devgauge.analysis;

import com.openforge.devgauge.plan.MetricsDetail;
import lombok.Builder;

import java.util.Map;

/**
 * Inputs of one analysis run.
 *
 * @param previous      earlier result; adds a comparison section when present
 * @param model         model override; blank means the gateway default
 * @param customWeights accept per-category weights suggested by the model
 */
@Builder(toBuilder = true)
public record ScoringRequest(
        Map<String, Object> metrics,
        DeveloperProfile profile,
        MetricsDetail metricsDetail,
        AnalysisResult previous,
        String model,
        boolean customWeights,
        ToneDirective tone
) {

    public ScoringRequest {
        metrics       = metrics == null ? Map.of() : metrics;
        profile       = profile == null ? DeveloperProfile.empty() : profile;
        metricsDetail = metricsDetail == null ? MetricsDetail.FULL : metricsDetail;
        tone          = tone == null ? ToneDirective.BALANCED : tone;
    }

    public String formattedMetrics() {
        return MetricsFormatter.format(metrics, profile, metricsDetail);
    }
}
