package com.realtime.messaging.notify.service;

import com.realtime.messaging.channel.entity.Channel;
import com.realtime.messaging.channel.repository.ChannelRepository;
import com.realtime.messaging.chat.entity.ChatRoom;
import com.realtime.messaging.chat.repository.ChatRoomRepository;
import com.realtime.messaging.common.ChatException;
import com.realtime.messaging.message.dto.MessageDto;
import com.realtime.messaging.notify.entity.ChatNotification;
import com.realtime.messaging.notify.repository.ChatNotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private static final int LIST_LIMIT = 50;

    private final ChatNotificationRepository notificationRepo;
    private final ChatRoomRepository roomRepo;
    private final ChannelRepository channelRepo;

    /**
     * 발신자를 제외한 방/채널 참여자마다 안읽음 알림 1건.
     * 수신자 단위로 실패를 격리한다(로그 후 다음 수신자).
     *
     * @return 새로 만든 알림 수
     */
    public int onMessagePosted(MessageDto message) {
        Set<UUID> recipients = recipientsOf(message);
        UUID sender = parseUuid(message.getSenderId());
        String kind = message.isBroadcast() ? ChatNotification.CHANNEL_BROADCAST : ChatNotification.NEW_MESSAGE;

        int created = 0;
        for (UUID uid : recipients) {
            if (uid == null || uid.equals(sender)) continue;
            try {
                // 브로커 재전달(at-least-once) 대비
                if (notificationRepo.existsByUserIdAndMessageId(uid, message.getMessageId())) continue;

                notificationRepo.save(ChatNotification.builder()
                        .userId(uid)
                        .roomId(message.getRoomId())
                        .channelId(message.getChannelId())
                        .messageId(message.getMessageId())
                        .kind(kind)
                        .read(false)
                        .build());
                created++;
            } catch (DataIntegrityViolationException e) {
                log.debug("notification already exists: userId={}, messageId={}", uid, message.getMessageId());
            } catch (DataAccessException e) {
                log.warn("notification create failed: userId={}, messageId={}, cause={}",
                        uid, message.getMessageId(), e.getMessage());
            }
        }
        log.debug("fan-out done: messageId={}, created={}", message.getMessageId(), created);
        return created;
    }

    /** 이미 읽은 알림이어도 성공. 없거나 남의 알림이면 NotFound */
    public void markRead(Long notificationId, UUID userId) {
        ChatNotification n = notificationRepo.findById(notificationId)
                .filter(x -> x.getUserId().equals(userId))
                .orElseThrow(() -> ChatException.notFound("notification not found"));
        if (!n.isRead()) {
            notificationRepo.markRead(n.getId());
        }
    }

    /** @return 이번에 읽음으로 바뀐 건수 */
    public int markAllRead(UUID userId) {
        return notificationRepo.markAllRead(userId);
    }

    public List<ChatNotification> list(UUID userId, boolean unreadOnly) {
        var page = PageRequest.of(0, LIST_LIMIT);
        return unreadOnly
                ? notificationRepo.findByUserIdAndReadFalseOrderByCreatedAtDescIdDesc(userId, page)
                : notificationRepo.findByUserIdOrderByCreatedAtDescIdDesc(userId, page);
    }

    public long unreadCount(UUID userId) {
        return notificationRepo.countByUserIdAndReadFalse(userId);
    }

    private Set<UUID> recipientsOf(MessageDto m) {
        if (m.getRoomId() != null) {
            return roomRepo.findById(m.getRoomId())
                    .map(ChatRoom::getParticipantIds)
                    .orElseGet(() -> {
                        log.warn("fan-out skipped: room {} not found", m.getRoomId());
                        return Collections.emptySet();
                    });
        }
        if (m.getChannelId() != null) {
            return channelRepo.findById(m.getChannelId())
                    .map(Channel::audience)
                    .orElseGet(() -> {
                        log.warn("fan-out skipped: channel {} not found", m.getChannelId());
                        return Collections.emptySet();
                    });
        }
        log.warn("fan-out dropped: no room/channel on message {}", m.getMessageId());
        return Collections.emptySet();
    }

    private static UUID parseUuid(String s) {
        try { return s == null ? null : UUID.fromString(s); }
        catch (IllegalArgumentException e) { return null; }
    }
}
