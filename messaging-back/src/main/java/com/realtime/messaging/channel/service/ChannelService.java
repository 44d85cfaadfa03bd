package com.realtime.messaging.channel.service;

import com.realtime.messaging.access.AccessControlService;
import com.realtime.messaging.channel.dto.ChannelDto;
import com.realtime.messaging.channel.dto.CreateChannelRequest;
import com.realtime.messaging.channel.dto.UpdateChannelRequest;
import com.realtime.messaging.channel.entity.Channel;
import com.realtime.messaging.channel.entity.ChannelSettings;
import com.realtime.messaging.channel.repository.ChannelRepository;
import com.realtime.messaging.common.AfterCommit;
import com.realtime.messaging.common.ChatException;
import com.realtime.messaging.common.GroupRef;
import com.realtime.messaging.gateway.ChatGateway;
import com.realtime.messaging.gateway.frame.OutboundEvent;
import com.realtime.messaging.message.dto.MessageDto;
import com.realtime.messaging.message.dto.PostMessageCommand;
import com.realtime.messaging.message.entity.ChatMessage;
import com.realtime.messaging.message.service.MessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ChannelService {

    private final ChannelRepository channelRepo;
    private final AccessControlService accessControl;
    private final MessageService messageService;
    private final ChatGateway gateway;

    /** 생성자는 항상 관리자 */
    @Transactional
    public ChannelDto create(UUID creatorId, CreateChannelRequest req) {
        if (req.name() == null || req.name().isBlank()) {
            throw ChatException.badRequest("channel name is required");
        }
        Set<UUID> admins = new LinkedHashSet<>();
        admins.add(creatorId);
        if (req.adminIds() != null) req.adminIds().stream().filter(Objects::nonNull).forEach(admins::add);

        Set<UUID> members = new LinkedHashSet<>();
        if (req.memberIds() != null) req.memberIds().stream().filter(Objects::nonNull).forEach(members::add);

        ChannelSettings settings = ChannelSettings.builder()
                .allowMemberPosts(req.allowMemberPosts() == null || req.allowMemberPosts())
                .allowReactions(req.allowReactions() == null || req.allowReactions())
                .allowReplies(req.allowReplies() == null || req.allowReplies())
                .build();

        Instant now = Instant.now();
        Channel c = Channel.builder()
                .id(UUID.randomUUID().toString())
                .name(req.name().trim())
                .kind(parseKind(req.kind()))
                .description(req.description())
                .creatorId(creatorId)
                .adminIds(admins)
                .memberIds(members)
                .publicChannel(req.isPublic() == null || req.isPublic())
                .settings(settings)
                .createdAt(now)
                .updatedAt(now)
                .build();
        c = channelRepo.save(c);
        log.info("channel created: id={}, kind={}, public={}", c.getId(), c.getKind(), c.isPublicChannel());
        return ChannelDto.from(c);
    }

    @Transactional(readOnly = true)
    public ChannelDto get(UUID requesterId, String channelId) {
        accessControl.requireJoin(requesterId, GroupRef.channel(channelId));
        return ChannelDto.from(load(channelId));
    }

    /** 공개 채널 + 내가 멤버/관리자인 비공개 채널 */
    @Transactional(readOnly = true)
    public List<ChannelDto> listFor(UUID userId) {
        return channelRepo.findVisibleTo(userId).stream().map(ChannelDto::from).toList();
    }

    @Transactional(readOnly = true)
    public List<ChannelDto> listByKind(UUID userId, String kind) {
        Channel.Kind k = parseKind(kind);
        return channelRepo.findByKindAndActiveTrueOrderByNameAsc(k).stream()
                .filter(c -> accessControl.canJoin(userId, GroupRef.channel(c.getId())))
                .map(ChannelDto::from)
                .toList();
    }

    @Transactional
    public ChannelDto update(UUID requesterId, String channelId, UpdateChannelRequest req) {
        Channel c = moderated(requesterId, channelId);
        boolean detailsChanged = false;
        boolean settingsChanged = false;

        if (req.name() != null && !req.name().isBlank()) {
            c.setName(req.name().trim());
            detailsChanged = true;
        }
        if (req.description() != null) {
            c.setDescription(req.description());
            detailsChanged = true;
        }
        if (req.isPublic() != null) {
            c.setPublicChannel(req.isPublic());
            settingsChanged = true;
        }
        ChannelSettings s = c.getSettings();
        if (req.allowMemberPosts() != null) {
            s.setAllowMemberPosts(req.allowMemberPosts());
            settingsChanged = true;
        }
        if (req.allowReactions() != null) {
            s.setAllowReactions(req.allowReactions());
            settingsChanged = true;
        }
        if (req.allowReplies() != null) {
            s.setAllowReplies(req.allowReplies());
            settingsChanged = true;
        }
        c.setUpdatedAt(Instant.now());

        ChannelDto dto = ChannelDto.from(c);
        GroupRef ref = GroupRef.channel(channelId);
        if (detailsChanged || settingsChanged) {
            String updateType = settingsChanged ? "settings" : "details";
            AfterCommit.run(() -> gateway.publish(ref, new OutboundEvent.ChannelUpdateEvent(updateType, dto)));
        }
        if (Boolean.FALSE.equals(req.isPublic())) {
            AfterCommit.run(() -> gateway.revokeAccess(ref));
        }
        return dto;
    }

    /** 이미 멤버면 no-op */
    @Transactional
    public ChannelDto join(UUID userId, String channelId) {
        GroupRef ref = GroupRef.channel(channelId);
        accessControl.requireJoin(userId, ref);
        Channel c = load(channelId);
        if (c.getMemberIds().add(userId)) {
            c.setUpdatedAt(Instant.now());
        }
        return ChannelDto.from(c);
    }

    /** 관리자는 멤버에서만 빠지고 관리자 권한은 유지 */
    @Transactional
    public ChannelDto leave(UUID userId, String channelId) {
        Channel c = load(channelId);
        if (c.getMemberIds().remove(userId)) {
            c.setUpdatedAt(Instant.now());
            AfterCommit.run(() -> gateway.revokeAccess(GroupRef.channel(channelId)));
        }
        return ChannelDto.from(c);
    }

    @Transactional
    public ChannelDto addMember(UUID requesterId, String channelId, UUID userId) {
        Channel c = moderated(requesterId, channelId);
        if (c.getMemberIds().add(userId)) c.setUpdatedAt(Instant.now());
        return ChannelDto.from(c);
    }

    @Transactional
    public ChannelDto removeMember(UUID requesterId, String channelId, UUID userId) {
        Channel c = moderated(requesterId, channelId);
        if (c.getMemberIds().remove(userId)) {
            c.setUpdatedAt(Instant.now());
            AfterCommit.run(() -> gateway.revokeAccess(GroupRef.channel(channelId)));
        }
        return ChannelDto.from(c);
    }

    /** 관리자 추가 시 멤버에도 넣는다 */
    @Transactional
    public ChannelDto addAdmin(UUID requesterId, String channelId, UUID userId) {
        Channel c = moderated(requesterId, channelId);
        boolean changed = c.getAdminIds().add(userId);
        changed |= c.getMemberIds().add(userId);
        if (changed) c.setUpdatedAt(Instant.now());
        return ChannelDto.from(c);
    }

    /** soft delete */
    @Transactional
    public void delete(UUID requesterId, String channelId) {
        Channel c = moderated(requesterId, channelId);
        c.setActive(false);
        c.setUpdatedAt(Instant.now());
        log.info("channel deactivated: id={}, by={}", channelId, requesterId);
        GroupRef ref = GroupRef.channel(channelId);
        ChannelDto dto = ChannelDto.from(c);
        // 삭제 알림을 먼저 보내고 남은 커넥션을 끊는다
        AfterCommit.run(() -> {
            gateway.publish(ref, new OutboundEvent.ChannelUpdateEvent("deleted", dto));
            gateway.revokeAccess(ref);
        });
    }

    /**
     * 채널 공지: 메시지로 저장한 뒤 채널 그룹에 broadcast 이벤트를 보낸다.
     * 게시 권한은 메시지 저장 단계에서 확인한다.
     */
    public MessageDto broadcast(String channelId, UUID senderId, String senderName,
                                String content, ChatMessage.Kind kind) {
        GroupRef ref = GroupRef.channel(channelId);
        MessageDto saved = messageService.post(new PostMessageCommand(
                ref, senderId, senderName, content, kind == null ? ChatMessage.Kind.TEXT : kind, null, null));
        gateway.publish(ref, new OutboundEvent.BroadcastEvent(
                saved, saved.getSenderId(), saved.getSenderName(), saved.getCreatedAt()));
        return saved;
    }

    // ─────────────────────────────────────────────────────────────

    private Channel load(String channelId) {
        return channelRepo.findById(channelId)
                .filter(Channel::isActive)
                .orElseThrow(() -> ChatException.notFound("channel not found"));
    }

    private Channel moderated(UUID requesterId, String channelId) {
        accessControl.requireModerate(requesterId, GroupRef.channel(channelId));
        return load(channelId);
    }

    static Channel.Kind parseKind(String raw) {
        if (raw == null || raw.isBlank()) return Channel.Kind.DEPARTMENT;
        try {
            return Channel.Kind.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw ChatException.badRequest("unknown channel kind: " + raw);
        }
    }
}
