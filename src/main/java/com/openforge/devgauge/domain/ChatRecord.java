package com.openforge.devgauge.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * One stored conversation (logical path users/{id}/chats/{chatId}).
 *
 *  contextJson : the metrics/profile/analysis the chat was started with
 *  messagesJson: serialized List<ConversationMessage>, full history in order
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "chats",
    uniqueConstraints = @UniqueConstraint(name = "uq_chat_id", columnNames = "chat_id")
)
public class ChatRecord extends BaseEntity {

    @Column(name = "chat_id", nullable = false, length = 64)
    private String chatId;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "title", nullable = false, length = 64)
    private String title;

    @Column(name = "context_json", columnDefinition = "LONGTEXT")
    private String contextJson;

    @Column(name = "messages_json", columnDefinition = "LONGTEXT")
    private String messagesJson;
}
