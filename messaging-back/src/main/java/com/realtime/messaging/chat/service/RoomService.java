package com.realtime.messaging.chat.service;

import com.realtime.messaging.access.AccessControlService;
import com.realtime.messaging.chat.dto.CreateRoomRequest;
import com.realtime.messaging.chat.dto.RoomDto;
import com.realtime.messaging.chat.dto.UpdateRoomRequest;
import com.realtime.messaging.chat.entity.ChatRoom;
import com.realtime.messaging.chat.repository.ChatRoomRepository;
import com.realtime.messaging.common.AfterCommit;
import com.realtime.messaging.common.ChatException;
import com.realtime.messaging.common.GroupRef;
import com.realtime.messaging.gateway.ChatGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;

@Service
@RequiredArgsConstructor
@Slf4j
public class RoomService {

    private final ChatRoomRepository roomRepo;
    private final AccessControlService accessControl;
    private final ChatGateway gateway;

    /**
     * 방 생성. 생성자는 항상 참여자에 포함된다.
     * direct 방은 참여자가 정확히 2명이어야 하고, 같은 두 사람의 방이 이미 있으면 그 방을 돌려준다.
     *
     * <p>중복 생성 경합은 external_identifier 유니크 제약으로 막고, 위반 시 기존 방을 다시 읽는다.
     * 그래서 이 메서드 자체는 트랜잭션으로 감싸지 않는다.
     */
    public RoomDto create(UUID creatorId, CreateRoomRequest req) {
        String name = requireName(req.name());
        ChatRoom.Kind kind = parseKind(req.kind());

        LinkedHashSet<UUID> participants = new LinkedHashSet<>();
        participants.add(creatorId);
        if (req.participantIds() != null) {
            req.participantIds().stream().filter(Objects::nonNull).forEach(participants::add);
        }
        if (kind == ChatRoom.Kind.DIRECT && participants.size() != 2) {
            throw ChatException.badRequest("direct rooms need exactly two participants");
        }
        if (participants.size() < 2) {
            throw ChatException.badRequest("a room needs at least two participants");
        }

        String identifier = identifierFor(kind, participants, req.identifier());
        Optional<ChatRoom> existing = roomRepo.findByExternalIdentifier(identifier);
        if (existing.isPresent()) {
            return reuse(existing.get(), creatorId);
        }

        Instant now = Instant.now();
        ChatRoom room = ChatRoom.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .kind(kind)
                .participantIds(participants)
                .creatorId(creatorId)
                .externalIdentifier(identifier)
                .description(req.description())
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            room = roomRepo.saveAndFlush(room);
        } catch (DataIntegrityViolationException e) {
            // 동시에 같은 식별자로 생성됨
            log.debug("room identifier race: identifier={}", identifier);
            return roomRepo.findByExternalIdentifier(identifier)
                    .map(r -> reuse(r, creatorId))
                    .orElseThrow(() -> e);
        }
        log.info("room created: id={}, kind={}, participants={}", room.getId(), kind, participants.size());
        return RoomDto.from(room);
    }

    /** 1:1 방 열기 (없으면 생성) */
    public RoomDto openDirect(UUID meId, UUID otherId, String name) {
        if (meId.equals(otherId)) throw ChatException.badRequest("cannot open a direct room with yourself");
        return create(meId, new CreateRoomRequest(name, "direct", List.of(meId, otherId), null, null));
    }

    @Transactional(readOnly = true)
    public RoomDto get(UUID requesterId, String roomId) {
        if (roomId == null || roomId.isBlank()) throw ChatException.badRequest("roomId is required");
        accessControl.requireJoin(requesterId, GroupRef.room(roomId));
        return RoomDto.from(roomRepo.findById(roomId).orElseThrow(() -> ChatException.notFound("room not found")));
    }

    @Transactional(readOnly = true)
    public List<RoomDto> listFor(UUID userId) {
        return roomRepo.findActiveByParticipant(userId).stream().map(RoomDto::from).toList();
    }

    /** 이름/설명 변경. moderator만 */
    @Transactional
    public RoomDto update(UUID requesterId, String roomId, UpdateRoomRequest req) {
        ChatRoom room = moderated(requesterId, roomId);
        boolean changed = false;
        if (req.name() != null) {
            room.setName(requireName(req.name()));
            changed = true;
        }
        if (req.description() != null) {
            room.setDescription(req.description());
            changed = true;
        }
        if (changed) {
            room.setUpdatedAt(Instant.now());
        }
        return RoomDto.from(room);
    }

    @Transactional
    public RoomDto addParticipant(UUID requesterId, String roomId, UUID userId) {
        ChatRoom room = moderated(requesterId, roomId);
        if (room.getKind() == ChatRoom.Kind.DIRECT) {
            throw ChatException.badRequest("direct rooms have fixed participants");
        }
        if (room.getParticipantIds().add(userId)) {
            room.setUpdatedAt(Instant.now());
        }
        return RoomDto.from(room);
    }

    @Transactional
    public RoomDto removeParticipant(UUID requesterId, String roomId, UUID userId) {
        ChatRoom room = moderated(requesterId, roomId);
        if (room.getKind() == ChatRoom.Kind.DIRECT) {
            throw ChatException.badRequest("direct rooms have fixed participants");
        }
        if (userId.equals(room.getCreatorId())) {
            throw ChatException.badRequest("the creator cannot be removed");
        }
        if (room.getParticipantIds().remove(userId)) {
            room.setUpdatedAt(Instant.now());
            // 이미 붙어 있는 커넥션도 끊는다
            AfterCommit.run(() -> gateway.revokeAccess(GroupRef.room(roomId)));
        }
        return RoomDto.from(room);
    }

    /** soft delete */
    @Transactional
    public void delete(UUID requesterId, String roomId) {
        ChatRoom room = moderated(requesterId, roomId);
        room.setActive(false);
        room.setUpdatedAt(Instant.now());
        log.info("room deactivated: id={}, by={}", roomId, requesterId);
        AfterCommit.run(() -> gateway.revokeAccess(GroupRef.room(roomId)));
    }

    // ─────────────────────────────────────────────────────────────

    private ChatRoom moderated(UUID requesterId, String roomId) {
        accessControl.requireModerate(requesterId, GroupRef.room(roomId));
        return roomRepo.findById(roomId).orElseThrow(() -> ChatException.notFound("room not found"));
    }

    private RoomDto reuse(ChatRoom room, UUID requesterId) {
        if (!room.isActive() || !room.hasParticipant(requesterId)) {
            throw ChatException.badRequest("room identifier already in use");
        }
        return RoomDto.from(room);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) throw ChatException.badRequest("room name is required");
        return name.trim();
    }

    static String identifierFor(ChatRoom.Kind kind, Set<UUID> participants, String requested) {
        if (kind == ChatRoom.Kind.DIRECT) {
            List<String> ids = participants.stream().map(UUID::toString).sorted().toList();
            return "direct_" + ids.get(0) + "_" + ids.get(1);
        }
        if (requested != null && !requested.isBlank()) return requested.trim();
        String hex = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return kind.name().toLowerCase() + "_" + hex;
    }

    static ChatRoom.Kind parseKind(String raw) {
        if (raw == null || raw.isBlank()) throw ChatException.badRequest("room kind is required");
        try {
            return ChatRoom.Kind.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw ChatException.badRequest("unknown room kind: " + raw);
        }
    }
}
