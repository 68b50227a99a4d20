package com.openforge.devgauge.agent.dto;

import com.openforge.devgauge.skill.ProjectIdea;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ProjectMessageRequest(
        @NotBlank @Size(max = 4000) String message,
        @NotNull ProjectIdea project,
        @Size(max = 128) String model
) {}
