package com.realtime.messaging.notify.repository;

import com.realtime.messaging.notify.entity.ChatNotification;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

public interface ChatNotificationRepository extends JpaRepository<ChatNotification, Long> {

    boolean existsByUserIdAndMessageId(UUID userId, String messageId);

    List<ChatNotification> findByUserIdOrderByCreatedAtDescIdDesc(UUID userId, Pageable pageable);

    List<ChatNotification> findByUserIdAndReadFalseOrderByCreatedAtDescIdDesc(UUID userId, Pageable pageable);

    long countByUserIdAndReadFalse(UUID userId);

    /** 읽음 처리. 이미 읽은 알림이면 0이지만 호출 측에서는 성공으로 취급 */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ChatNotification n set n.read = true where n.id = :id and n.read = false")
    int markRead(@Param("id") Long id);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ChatNotification n set n.read = true where n.userId = :userId and n.read = false")
    int markAllRead(@Param("userId") UUID userId);
}
