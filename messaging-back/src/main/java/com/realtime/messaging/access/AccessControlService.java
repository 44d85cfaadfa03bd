package com.realtime.messaging.access;

import com.realtime.messaging.channel.entity.Channel;
import com.realtime.messaging.channel.repository.ChannelRepository;
import com.realtime.messaging.chat.entity.ChatRoom;
import com.realtime.messaging.chat.repository.ChatRoomRepository;
import com.realtime.messaging.common.ChatException;
import com.realtime.messaging.common.GroupRef;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * 그룹(방/채널/presence)에 대한 join / post / moderate 권한 판정.
 * 비활성(soft-deleted) 방·채널은 모든 권한 거부.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AccessControlService {

    private final ChatRoomRepository roomRepo;
    private final ChannelRepository channelRepo;

    public boolean canJoin(UUID userId, GroupRef group) {
        if (userId == null) return false;
        return switch (group.type()) {
            case PRESENCE -> true;
            case ROOM -> activeRoom(group.id()).map(r -> r.hasParticipant(userId)).orElse(false);
            // 공개 채널은 항상 통과, 비공개는 멤버 ∪ 관리자
            case CHANNEL -> activeChannel(group.id())
                    .map(c -> c.isPublicChannel() || c.isMember(userId) || c.isAdmin(userId))
                    .orElse(false);
        };
    }

    public boolean canPost(UUID userId, GroupRef group) {
        if (userId == null) return false;
        return switch (group.type()) {
            case PRESENCE -> false;
            case ROOM -> activeRoom(group.id()).map(r -> r.hasParticipant(userId)).orElse(false);
            case CHANNEL -> activeChannel(group.id()).map(c -> canPost(userId, c)).orElse(false);
        };
    }

    public boolean canModerate(UUID userId, GroupRef group) {
        if (userId == null) return false;
        return switch (group.type()) {
            case PRESENCE -> false;
            case ROOM -> activeRoom(group.id()).map(r -> userId.equals(r.getCreatorId())).orElse(false);
            case CHANNEL -> activeChannel(group.id())
                    .map(c -> c.isAdmin(userId) || userId.equals(c.getCreatorId()))
                    .orElse(false);
        };
    }

    /** 관리자는 allow_member_posts와 무관하게 게시 가능 */
    public static boolean canPost(UUID userId, Channel c) {
        return c.isAdmin(userId) || (c.isMember(userId) && c.getSettings().isAllowMemberPosts());
    }

    public void requireJoin(UUID userId, GroupRef group) {
        requireExists(group);
        if (!canJoin(userId, group)) {
            throw ChatException.forbidden("no access to " + group);
        }
    }

    public void requirePost(UUID userId, GroupRef group) {
        requireExists(group);
        if (!canPost(userId, group)) {
            throw ChatException.forbidden("not allowed to post in " + group);
        }
    }

    public void requireModerate(UUID userId, GroupRef group) {
        requireExists(group);
        if (!canModerate(userId, group)) {
            throw ChatException.forbidden("not a moderator of " + group);
        }
    }

    private void requireExists(GroupRef group) {
        boolean exists = switch (group.type()) {
            case PRESENCE -> true;
            case ROOM -> activeRoom(group.id()).isPresent();
            case CHANNEL -> activeChannel(group.id()).isPresent();
        };
        if (!exists) {
            throw ChatException.notFound(group.type().name().toLowerCase() + " not found");
        }
    }

    private Optional<ChatRoom> activeRoom(String roomId) {
        return roomRepo.findById(roomId).filter(ChatRoom::isActive);
    }

    private Optional<Channel> activeChannel(String channelId) {
        return channelRepo.findById(channelId).filter(Channel::isActive);
    }
}
