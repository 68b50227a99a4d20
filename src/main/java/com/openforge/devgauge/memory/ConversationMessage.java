package com.openforge.devgauge.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Locale;

/**
 * One turn of a conversation.
 */
public record ConversationMessage(
        Role role,
        String content,
        Instant timestamp
) {

    public enum Role {
        USER,
        ASSISTANT;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Role fromWire(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public static ConversationMessage user(String content, Instant at) {
        return new ConversationMessage(Role.USER, content, at);
    }

    public static ConversationMessage assistant(String content, Instant at) {
        return new ConversationMessage(Role.ASSISTANT, content, at);
    }
}
