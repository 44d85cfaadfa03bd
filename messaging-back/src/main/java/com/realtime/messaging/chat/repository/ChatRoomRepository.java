package com.realtime.messaging.chat.repository;

import com.realtime.messaging.chat.entity.ChatRoom;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ChatRoomRepository extends JpaRepository<ChatRoom, String> {

    Optional<ChatRoom> findByExternalIdentifier(String externalIdentifier);

    /** 내가 참여 중인 활성 방, 최근 활동 순 */
    @Query("""
           select distinct r
           from ChatRoom r join r.participantIds p
           where p = :userId and r.active = true
           order by r.updatedAt desc
           """)
    List<ChatRoom> findActiveByParticipant(@Param("userId") UUID userId);

    /** 메시지 저장 시 방 최근 활동 갱신 */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ChatRoom r set r.updatedAt = :at where r.id = :roomId")
    int touch(@Param("roomId") String roomId, @Param("at") Instant at);
}
