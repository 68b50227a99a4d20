package com.openforge.devgauge.repository;

import com.openforge.devgauge.domain.ChatRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ChatRepository extends JpaRepository<ChatRecord, Long> {

    Optional<ChatRecord> findByUserIdAndChatId(String userId, String chatId);

    List<ChatRecord> findByUserIdOrderByUpdateTimeDesc(String userId);
}
