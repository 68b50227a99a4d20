package com.openforge.devgauge.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Error body for every API failure.
 *
 * @param retryable set for failures where repeating the same request can succeed
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
        int     status,
        String  message,
        Boolean retryable
) {}
