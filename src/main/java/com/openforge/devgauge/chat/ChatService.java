package com.openforge.devgauge.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.devgauge.domain.ChatRecord;
import com.openforge.devgauge.memory.ConversationMessage;
import com.openforge.devgauge.repository.ChatRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Stored conversations, one {@link ChatRecord} per chat. The full message
 * history is kept here; sessions only hold the recent window.
 */
@Slf4j
@Service
public class ChatService {

    static final int TITLE_LENGTH = 50;

    private static final TypeReference<List<ConversationMessage>> MESSAGE_LIST = new TypeReference<>() {};

    private final ChatRepository repository;
    private final ObjectMapper   objectMapper;
    private final Clock          clock;

    public ChatService(ChatRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    /** Creates a chat holding {@code firstMessage} and returns its id. */
    public String create(String userId, String firstMessage, ChatContext context) {
        String chatId = UUID.randomUUID().toString();
        List<ConversationMessage> messages = List.of(ConversationMessage.user(firstMessage, clock.instant()));
        ChatRecord record = ChatRecord.builder()
                .chatId(chatId)
                .userId(userId)
                .title(title(firstMessage))
                .contextJson(context == null ? null : write(context))
                .messagesJson(write(messages))
                .build();
        repository.save(record);
        log.info("[Chat:{}] created for user={}", chatId, userId);
        return chatId;
    }

    /** The chat, or empty when it does not exist or belongs to someone else. */
    public Optional<ChatDocument> get(String userId, String chatId) {
        return repository.findByUserIdAndChatId(userId, chatId).map(this::toDocument);
    }

    /**
     * Appends messages in order.
     *
     * @throws ChatNotFoundException when the chat does not exist for this user
     */
    public void addMessages(String userId, String chatId, List<ConversationMessage> messages) {
        ChatRecord record = repository.findByUserIdAndChatId(userId, chatId)
                .orElseThrow(() -> new ChatNotFoundException(chatId));
        List<ConversationMessage> all = new ArrayList<>(readMessages(record.getMessagesJson()));
        all.addAll(messages);
        record.setMessagesJson(write(all));
        repository.save(record);
        log.debug("[Chat:{}] +{} messages, {} total", chatId, messages.size(), all.size());
    }

    /** The user's chats, most recently updated first. */
    public List<ChatDocument> list(String userId) {
        return repository.findByUserIdOrderByUpdateTimeDesc(userId).stream()
                .map(this::toDocument)
                .toList();
    }

    /** The first 50 characters, with "..." appended when cut. */
    static String title(String firstMessage) {
        String text = firstMessage == null ? "" : firstMessage;
        return text.length() > TITLE_LENGTH ? text.substring(0, TITLE_LENGTH) + "..." : text;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ChatDocument toDocument(ChatRecord record) {
        return new ChatDocument(
                record.getChatId(),
                record.getTitle(),
                readContext(record.getContextJson()),
                readMessages(record.getMessagesJson()),
                record.getCreateTime(),
                record.getUpdateTime());
    }

    private List<ConversationMessage> readMessages(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            List<ConversationMessage> messages = objectMapper.readValue(json, MESSAGE_LIST);
            return messages == null ? List.of() : messages;
        } catch (JsonProcessingException e) {
            log.warn("[Chat] Stored messages are not readable: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private ChatContext readContext(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, ChatContext.class);
        } catch (JsonProcessingException e) {
            log.warn("[Chat] Stored context is not readable: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize chat", e);
        }
    }
}
