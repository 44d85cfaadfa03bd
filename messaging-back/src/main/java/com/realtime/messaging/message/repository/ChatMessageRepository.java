package com.realtime.messaging.message.repository;

import com.realtime.messaging.message.entity.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    Optional<ChatMessage> findByMessageId(String messageId);

    // 정렬은 호출 측 Pageable (created_at desc, id desc)
    List<ChatMessage> findByGroupKeyAndDeletedFalse(String groupKey, Pageable pageable);

    long countByGroupKeyAndDeletedFalse(String groupKey);

    List<ChatMessage> findByGroupKeyAndDeletedFalseAndContentContainingIgnoreCase(
            String groupKey, String query, Pageable pageable);

    List<ChatMessage> findByGroupKeyAndKindAndDeletedFalse(
            String groupKey, ChatMessage.Kind kind, Pageable pageable);

    long countByGroupKeyAndKindAndDeletedFalse(String groupKey, ChatMessage.Kind kind);

    List<ChatMessage> findByGroupKeyAndKindAndDeletedFalseAndFileMetadataFileType(
            String groupKey, ChatMessage.Kind kind, String fileType, Pageable pageable);

    long countByGroupKeyAndKindAndDeletedFalseAndFileMetadataFileType(
            String groupKey, ChatMessage.Kind kind, String fileType);

    /** 아직 내가 읽지 않은 메시지 */
    @Query("""
           select m
           from ChatMessage m
           where m.groupKey = :groupKey
             and m.deleted = false
             and not exists (
                 select 1 from MessageRead r
                 where r.message = m and r.userId = :userId
             )
           order by m.id asc
           """)
    List<ChatMessage> findUnreadBy(@Param("groupKey") String groupKey, @Param("userId") UUID userId);
}
