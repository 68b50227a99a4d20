package com.openforge.devgauge.skill;

import com.openforge.devgauge.analysis.AnalysisResult;
import com.openforge.devgauge.analysis.DeveloperProfile;
import com.openforge.devgauge.analysis.ScoringRequest;
import com.openforge.devgauge.analysis.ToneDirective;
import com.openforge.devgauge.plan.MetricsDetail;
import lombok.Builder;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Inputs shared by every skill.
 *
 * @param previous earlier analysis, if any
 * @param model    model override for this call; blank means the gateway default
 * @param sink     receives streamed tokens of the narrative call; may be null
 */
@Builder(toBuilder = true)
public record SkillContext(
        Map<String, Object> metrics,
        DeveloperProfile profile,
        AnalysisResult previous,
        MetricsDetail metricsDetail,
        ToneDirective tone,
        String model,
        boolean customWeights,
        Consumer<String> sink
) {

    public SkillContext {
        metrics       = metrics == null ? Map.of() : metrics;
        profile       = profile == null ? DeveloperProfile.empty() : profile;
        metricsDetail = metricsDetail == null ? MetricsDetail.FULL : metricsDetail;
        tone          = tone == null ? ToneDirective.BALANCED : tone;
    }

    public ScoringRequest toScoringRequest() {
        return ScoringRequest.builder()
                .metrics(metrics)
                .profile(profile)
                .metricsDetail(metricsDetail)
                .previous(previous)
                .model(model)
                .customWeights(customWeights)
                .tone(tone)
                .build();
    }

    public String formattedMetrics() {
        return toScoringRequest().formattedMetrics();
    }
}
