package com.openforge.devgauge.memory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One long-term memory entry.
 *
 * @param content trimmed, at most {@link #MAX_CONTENT_LENGTH} characters
 * @param meta    free-form attributes, e.g. {"status": "done"} for an ACTION
 */
public record MemoryItem(
        MemoryType type,
        String content,
        Map<String, Object> meta,
        Instant createdAt
) {

    public static final int MAX_CONTENT_LENGTH = 500;

    public MemoryItem {
        content = sanitize(content);
        meta    = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    public static MemoryItem of(MemoryType type, String content, Instant createdAt) {
        return new MemoryItem(type, content, Map.of(), createdAt);
    }

    /** Same item with a fresh timestamp, as stored on write. */
    public MemoryItem stampedAt(Instant now) {
        return new MemoryItem(type, content, meta, now);
    }

    private static String sanitize(String content) {
        if (content == null) return "";
        String trimmed = content.trim();
        return trimmed.length() > MAX_CONTENT_LENGTH ? trimmed.substring(0, MAX_CONTENT_LENGTH) : trimmed;
    }
}
