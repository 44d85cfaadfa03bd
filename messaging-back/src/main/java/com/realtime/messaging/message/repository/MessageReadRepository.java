package com.realtime.messaging.message.repository;

import com.realtime.messaging.message.entity.MessageRead;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface MessageReadRepository extends JpaRepository<MessageRead, Long> {

    boolean existsByMessage_IdAndUserId(Long messagePk, UUID userId);

    List<MessageRead> findByMessage_IdIn(Collection<Long> messagePks);
}
