package com.openforge.devgauge.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a JSON value from model free text.
 *
 * The text is first reduced to its JSON-looking span (fenced block contents,
 * then the outermost {...} or [...]); the span is then parsed through a fixed
 * sequence of repair passes. Each pass rewrites the output of the previous one,
 * so fixes accumulate:
 *
 *   1. as-is
 *   2. trailing commas before ] or } removed
 *   3. raw control characters removed, except \n \r \t
 *   4. backslashes that do not start a valid JSON escape doubled
 *
 * The first pass that parses wins. If none does the result is {@code null};
 * callers turn that into their own typed failure.
 */
@Slf4j
@Component
public class ResponseExtractor {

    private static final Pattern JSON_BLOCK     = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);
    private static final Pattern OBJECT_SPAN    = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final Pattern ARRAY_SPAN     = Pattern.compile("\\[[\\s\\S]*\\]");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([\\]}])");
    private static final Pattern CONTROL_CHARS  = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern STRAY_BACKSLASH = Pattern.compile("\\\\(?![\"\\\\bfnrtu/])");

    private static final List<UnaryOperator<String>> REPAIRS = List.of(
            s -> TRAILING_COMMA.matcher(s).replaceAll("$1"),
            s -> CONTROL_CHARS.matcher(s).replaceAll(""),
            s -> STRAY_BACKSLASH.matcher(s).replaceAll(Matcher.quoteReplacement("\\\\"))
    );

    private final ObjectMapper objectMapper;

    public ResponseExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Extracts a JSON object (or any JSON value when no {...} span exists). */
    @Nullable
    public JsonNode extract(@Nullable String text) {
        return repairAndParse(isolate(text, OBJECT_SPAN));
    }

    /** Extracts a JSON array, for capabilities that answer with a list. */
    @Nullable
    public JsonNode extractArray(@Nullable String text) {
        JsonNode node = repairAndParse(isolate(text, ARRAY_SPAN));
        return node != null && node.isArray() ? node : null;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    @Nullable
    private JsonNode repairAndParse(@Nullable String candidate) {
        if (candidate == null || candidate.isBlank()) return null;

        String current = candidate;
        JsonNode parsed = tryParse(current);
        if (parsed != null) return parsed;

        for (int pass = 0; pass < REPAIRS.size(); pass++) {
            current = REPAIRS.get(pass).apply(current);
            parsed = tryParse(current);
            if (parsed != null) {
                log.debug("[ResponseExtractor] Recovered JSON on repair pass {}", pass + 2);
                return parsed;
            }
        }
        log.debug("[ResponseExtractor] No JSON recoverable from text of length {}", candidate.length());
        return null;
    }

    @Nullable
    private JsonNode tryParse(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    @Nullable
    private static String isolate(@Nullable String text, Pattern span) {
        if (text == null) return null;
        String body = text;
        Matcher fenced = JSON_BLOCK.matcher(body);
        if (fenced.find()) body = fenced.group(1);
        Matcher m = span.matcher(body);
        return m.find() ? m.group() : body.trim();
    }
}
