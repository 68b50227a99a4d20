package com.openforge.devgauge.chat;

import com.openforge.devgauge.auth.CurrentUser;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Read access to stored conversations. Chats are written by agent sessions;
 * a chat id from here can be passed as {@code conversation_ref} to resume it.
 */
@RestController
@RequestMapping("/api/chats")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chats;
    private final CurrentUser currentUser;

    @GetMapping
    public ResponseEntity<List<ChatDocument>> list() {
        return ResponseEntity.ok(chats.list(requireUser()));
    }

    @GetMapping("/{chatId}")
    public ResponseEntity<ChatDocument> get(@PathVariable String chatId) {
        return ResponseEntity.ok(chats.get(requireUser(), chatId)
                .orElseThrow(() -> new ChatNotFoundException(chatId)));
    }

    private String requireUser() {
        return currentUser.id().orElseThrow(
                () -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Not authenticated"));
    }
}
