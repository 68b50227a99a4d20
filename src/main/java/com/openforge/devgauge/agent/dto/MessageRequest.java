package com.openforge.devgauge.agent.dto;

import com.openforge.devgauge.analysis.AnalysisMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * One chat turn. {@code mode} defaults to QUICK_CHAT; {@code model} overrides
 * the plan's model when set.
 */
public record MessageRequest(
        @NotBlank @Size(max = 4000) String message,
        AnalysisMode mode,
        @Size(max = 128) String model
) {}
