package com.openforge.devgauge.agent.dto;

import com.openforge.devgauge.memory.MemoryItem;
import com.openforge.devgauge.memory.MemoryType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record AddMemoryRequest(
        @NotNull MemoryType type,
        @NotBlank @Size(max = MemoryItem.MAX_CONTENT_LENGTH) String content,
        Map<String, Object> meta
) {

    /** The timestamp is assigned by the store. */
    public MemoryItem toItem() {
        return new MemoryItem(type, content, meta, null);
    }
}
