package com.openforge.devgauge.chat;

import com.openforge.devgauge.analysis.AnalysisResult;
import com.openforge.devgauge.analysis.DeveloperProfile;

import java.util.Map;

/**
 * What a conversation was started with: the metrics record, the profile and
 * the analysis shown at the time. Any part may be absent.
 */
public record ChatContext(
        Map<String, Object> metrics,
        DeveloperProfile profile,
        AnalysisResult analysis
) {

    public boolean isEmpty() {
        return (metrics == null || metrics.isEmpty()) && profile == null && analysis == null;
    }
}
