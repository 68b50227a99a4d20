package com.openforge.devgauge.agent;

import com.openforge.devgauge.analysis.AnalysisResult;
import com.openforge.devgauge.analysis.DeveloperProfile;
import com.openforge.devgauge.analysis.ToneDirective;
import lombok.Builder;

import java.util.Map;

/**
 * Arguments of {@link AnalysisAgent#initialize}.
 *
 * @param priorResult     the analysis the user is looking at; also the baseline for progress checks
 * @param conversationRef id of a stored chat to resume
 * @param displayName     the user's nickname, used in the persona block
 */
@Builder
public record SessionSetup(
        Map<String, Object> metrics,
        DeveloperProfile profile,
        AnalysisResult priorResult,
        String conversationRef,
        ToneDirective tone,
        String displayName
) {}
