package com.openforge.devgauge.chat;

import com.openforge.devgauge.memory.ConversationMessage;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A stored conversation as read back from {@link ChatService}.
 */
public record ChatDocument(
        String chatId,
        String title,
        ChatContext context,
        List<ConversationMessage> messages,
        LocalDateTime createTime,
        LocalDateTime updateTime
) {

    public ChatDocument {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
