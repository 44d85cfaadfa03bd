package com.realtime.messaging.message.repository;

import com.realtime.messaging.message.entity.MessageReaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface MessageReactionRepository extends JpaRepository<MessageReaction, Long> {

    boolean existsByMessage_IdAndEmojiAndUserId(Long messagePk, String emoji, UUID userId);

    List<MessageReaction> findByMessage_IdInOrderByIdAsc(Collection<Long> messagePks);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           delete from MessageReaction r
           where r.message.id = :messagePk and r.emoji = :emoji and r.userId = :userId
           """)
    int deleteOne(@Param("messagePk") Long messagePk,
                  @Param("emoji") String emoji,
                  @Param("userId") UUID userId);
}
