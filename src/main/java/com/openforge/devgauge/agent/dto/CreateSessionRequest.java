package com.openforge.devgauge.agent.dto;

import com.openforge.devgauge.agent.SessionSetup;
import com.openforge.devgauge.analysis.AnalysisResult;
import com.openforge.devgauge.analysis.DeveloperProfile;
import com.openforge.devgauge.analysis.ToneDirective;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Request body for POST /api/agent/sessions. Every field is optional.
 *
 * @param conversationRef id of a stored chat to resume
 * @param tone            MILD, BALANCED or BRUTAL; anything else means BALANCED
 * @param displayName     the user's nickname, used by the persona block
 */
public record CreateSessionRequest(
        Map<String, Object> metrics,
        DeveloperProfile    profile,
        AnalysisResult      priorResult,
        @Size(max = 64)  String conversationRef,
        @Size(max = 16)  String tone,
        @Size(max = 50)  String displayName
) {

    public SessionSetup toSetup() {
        return SessionSetup.builder()
                .metrics(metrics)
                .profile(profile)
                .priorResult(priorResult)
                .conversationRef(conversationRef)
                .tone(ToneDirective.parse(tone))
                .displayName(displayName)
                .build();
    }
}
