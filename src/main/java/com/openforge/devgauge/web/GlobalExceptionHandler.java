package com.openforge.devgauge.web;

import com.openforge.devgauge.agent.AgentNotInitializedException;
import com.openforge.devgauge.agent.UsageLimitExceededException;
import com.openforge.devgauge.analysis.AnalysisException;
import com.openforge.devgauge.chat.ChatNotFoundException;
import com.openforge.devgauge.llm.LlmClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.stream.Collectors;

/**
 * Maps exceptions from the controllers to {@link ApiErrorResponse} bodies.
 *
 *   LlmRateLimitException        429
 *   LlmException (incl. circuit)  502
 *   AnalysisException             502, retryable
 *   UsageLimitExceededException   429
 *   session or chat not found     404
 *   bad input                     400
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LlmClient.LlmRateLimitException.class)
    public ResponseEntity<ApiErrorResponse> handleRateLimit(LlmClient.LlmRateLimitException ex) {
        log.warn("[API] Provider rate limit: {}", ex.getMessage());
        return respond(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(), true);
    }

    @ExceptionHandler(LlmClient.LlmException.class)
    public ResponseEntity<ApiErrorResponse> handleLlm(LlmClient.LlmException ex) {
        log.warn("[API] Provider failure: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage(), null);
    }

    @ExceptionHandler(AnalysisException.class)
    public ResponseEntity<ApiErrorResponse> handleAnalysis(AnalysisException ex) {
        log.warn("[API] Unparseable model output in {}: {}", ex.phase(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex.retryable());
    }

    @ExceptionHandler(UsageLimitExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleUsageLimit(UsageLimitExceededException ex) {
        log.info("[API] {}", ex.getMessage());
        return respond(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(), false);
    }

    @ExceptionHandler({AgentNotInitializedException.class, ChatNotFoundException.class})
    public ResponseEntity<ApiErrorResponse> handleNotFound(RuntimeException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiErrorResponse> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("[API] Invalid request: {}", message);
        return respond(HttpStatus.BAD_REQUEST, message, null);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request: " + ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiErrorResponse> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private static ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String message, Boolean retryable) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .retryable(retryable)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
