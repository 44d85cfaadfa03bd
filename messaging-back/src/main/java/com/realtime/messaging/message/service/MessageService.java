package com.realtime.messaging.message.service;

import com.realtime.messaging.access.AccessControlService;
import com.realtime.messaging.channel.entity.Channel;
import com.realtime.messaging.channel.repository.ChannelRepository;
import com.realtime.messaging.chat.repository.ChatRoomRepository;
import com.realtime.messaging.common.AfterCommit;
import com.realtime.messaging.common.ChatException;
import com.realtime.messaging.common.GroupRef;
import com.realtime.messaging.common.OffsetPageRequest;
import com.realtime.messaging.config.MessagingProps;
import com.realtime.messaging.message.dto.FileMetadataDto;
import com.realtime.messaging.message.dto.MessageDto;
import com.realtime.messaging.message.dto.MessagePage;
import com.realtime.messaging.message.dto.PostMessageCommand;
import com.realtime.messaging.message.entity.ChatMessage;
import com.realtime.messaging.message.entity.MessageReaction;
import com.realtime.messaging.message.entity.MessageRead;
import com.realtime.messaging.message.repository.ChatMessageRepository;
import com.realtime.messaging.message.repository.MessageReactionRepository;
import com.realtime.messaging.message.repository.MessageReadRepository;
import com.realtime.messaging.notify.service.ChatFanoutService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 메시지 저장/수정/삭제, 읽음·리액션 집합 관리, 목록·검색.
 *
 * <p>read_by, reactions는 (message, user[, emoji]) 유니크 행으로 저장한다. 추가는 "없으면 insert",
 * 동시 중복 insert는 유니크 제약 위반을 no-op으로 취급하므로 여러 번 호출해도 결과 집합이 같다.
 * 이 두 연산은 바깥 트랜잭션 없이 repository 호출 단위로 커밋된다(제약 위반이 다른 작업을 롤백시키지 않도록).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageService {

    private static final Sort NEWEST_FIRST =
            Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "id"));

    private final ChatMessageRepository messageRepo;
    private final MessageReadRepository readRepo;
    private final MessageReactionRepository reactionRepo;
    private final ChatRoomRepository roomRepo;
    private final ChannelRepository channelRepo;
    private final AccessControlService accessControl;
    private final ChatFanoutService chatFanoutService;
    private final MessagingProps props;

    // ─────────────────────────────────────────────────────────────
    //  저장 / 수정 / 삭제
    // ─────────────────────────────────────────────────────────────

    @Transactional
    public MessageDto post(PostMessageCommand cmd) {
        GroupRef group = cmd.group();
        if (group == null || group.isPresence()) {
            throw ChatException.badRequest("room or channel is required");
        }
        ChatMessage.Kind kind = cmd.kind() == null ? ChatMessage.Kind.TEXT : cmd.kind();
        String content = cmd.content() == null ? "" : cmd.content().trim();
        if (kind == ChatMessage.Kind.TEXT && content.isEmpty()) {
            throw ChatException.badRequest("content is required");
        }
        requireContentLength(content);
        if (kind == ChatMessage.Kind.FILE && (cmd.fileMetadata() == null || cmd.fileMetadata().fileUrl() == null)) {
            throw ChatException.badRequest("file metadata is required for file messages");
        }

        accessControl.requirePost(cmd.senderId(), group);

        if (cmd.parentMessageId() != null) {
            if (group.isChannel() && !channelOf(group).getSettings().isAllowReplies()) {
                throw ChatException.forbidden("replies are disabled in this channel");
            }
            ChatMessage parent = find(cmd.parentMessageId());
            if (!parent.getGroupKey().equals(group.key())) {
                throw ChatException.notFound("parent message not found");
            }
        }

        Instant now = Instant.now();
        ChatMessage m = ChatMessage.builder()
                .messageId(UUID.randomUUID().toString())
                .roomId(group.isRoom() ? group.id() : null)
                .channelId(group.isChannel() ? group.id() : null)
                .groupKey(group.key())
                .senderId(cmd.senderId())
                .senderName(cmd.senderName())
                .content(content)
                .kind(kind)
                .parentMessageId(cmd.parentMessageId())
                .fileMetadata(kind == ChatMessage.Kind.FILE ? cmd.fileMetadata().toEntity() : null)
                .broadcast(group.isChannel())
                .createdAt(now)
                .updatedAt(now)
                .build();
        m = messageRepo.save(m);

        // 보낸 사람은 읽은 것으로
        readRepo.save(MessageRead.builder().message(m).userId(cmd.senderId()).readAt(now).build());

        if (group.isRoom()) {
            roomRepo.touch(group.id(), now);
        }

        MessageDto dto = toDto(m, List.of(cmd.senderId()), List.of());
        // 알림 fan-out은 커밋 후 비동기로
        AfterCommit.run(() -> chatFanoutService.publishToBrokerAsync(dto));
        return dto;
    }

    /** 첨부 업로드 후 호출. 파일 바이트는 외부 스토리지, 여기선 참조만 */
    public MessageDto postFile(GroupRef group, UUID senderId, String senderName,
                               @Nullable String caption, FileMetadataDto file) {
        return post(new PostMessageCommand(group, senderId, senderName, caption,
                ChatMessage.Kind.FILE, null, file));
    }

    @Transactional
    public MessageDto edit(String messageId, UUID editorId, String newContent) {
        ChatMessage m = find(messageId);
        if (m.isDeleted()) throw ChatException.notFound("message not found");
        if (!m.getSenderId().equals(editorId)) {
            throw ChatException.forbidden("only the sender can edit this message");
        }
        String content = newContent == null ? "" : newContent.trim();
        if (content.isEmpty() && m.getKind() == ChatMessage.Kind.TEXT) {
            throw ChatException.badRequest("content is required");
        }
        requireContentLength(content);
        m.setContent(content);
        m.setEdited(true);
        m.setUpdatedAt(Instant.now());
        return withSets(m);
    }

    /** soft delete. 보낸 사람 또는 그룹 moderator만 */
    @Transactional
    public MessageDto delete(String messageId, UUID requesterId) {
        ChatMessage m = find(messageId);
        boolean allowed = m.getSenderId().equals(requesterId) || accessControl.canModerate(requesterId, m.group());
        if (!allowed) {
            throw ChatException.forbidden("only the sender or a moderator can delete this message");
        }
        if (!m.isDeleted()) {
            m.setDeleted(true);
            m.setUpdatedAt(Instant.now());
        }
        return withSets(m);
    }

    // ─────────────────────────────────────────────────────────────
    //  읽음 / 리액션 (멱등 집합 연산)
    // ─────────────────────────────────────────────────────────────

    /** @return 이번 호출로 read_by가 바뀌었으면 true. 이미 읽었으면 false(성공) */
    public boolean markRead(String messageId, UUID userId) {
        ChatMessage m = find(messageId);
        return addRead(m, userId);
    }

    /** 방의 안읽은 메시지를 모두 읽음으로. @return 새로 읽음 처리된 건수 */
    public int markRoomRead(String roomId, UUID userId) {
        GroupRef room = GroupRef.room(roomId);
        accessControl.requireJoin(userId, room);
        int changed = 0;
        for (ChatMessage m : messageRepo.findUnreadBy(room.key(), userId)) {
            if (addRead(m, userId)) changed++;
        }
        return changed;
    }

    public boolean addReaction(String messageId, UUID userId, String emoji) {
        String e = requireEmoji(emoji);
        ChatMessage m = find(messageId);
        if (m.isDeleted()) throw ChatException.notFound("message not found");
        if (m.getChannelId() != null && !channelOf(m.group()).getSettings().isAllowReactions()) {
            throw ChatException.forbidden("reactions are disabled in this channel");
        }
        if (reactionRepo.existsByMessage_IdAndEmojiAndUserId(m.getId(), e, userId)) return false;
        try {
            reactionRepo.save(MessageReaction.builder()
                    .message(m).emoji(e).userId(userId).createdAt(Instant.now()).build());
            return true;
        } catch (DataIntegrityViolationException ex) {
            // 동시에 같은 리액션이 들어온 경우
            log.debug("reaction already present: messageId={}, userId={}, emoji={}", messageId, userId, e);
            return false;
        }
    }

    public boolean removeReaction(String messageId, UUID userId, String emoji) {
        String e = requireEmoji(emoji);
        ChatMessage m = find(messageId);
        return reactionRepo.deleteOne(m.getId(), e, userId) > 0;
    }

    // ─────────────────────────────────────────────────────────────
    //  조회
    // ─────────────────────────────────────────────────────────────

    /** 최신순, 삭제 제외. 같은 시각이면 id 역순 */
    @Transactional(readOnly = true)
    public List<MessageDto> list(UUID requesterId, GroupRef group, int limit, int offset) {
        accessControl.requireJoin(requesterId, group);
        var page = OffsetPageRequest.of(Math.max(0, offset), clampLimit(limit), NEWEST_FIRST);
        return toDtos(messageRepo.findByGroupKeyAndDeletedFalse(group.key(), page));
    }

    /** 대소문자 무시 부분 일치, 삭제 제외, 최대 search.max-results 건 */
    @Transactional(readOnly = true)
    public List<MessageDto> search(UUID requesterId, GroupRef group, String query) {
        accessControl.requireJoin(requesterId, group);
        if (query == null || query.isBlank()) return List.of();
        var page = OffsetPageRequest.of(0, Math.max(1, props.getSearch().getMaxResults()), NEWEST_FIRST);
        return toDtos(messageRepo.findByGroupKeyAndDeletedFalseAndContentContainingIgnoreCase(
                group.key(), query.trim(), page));
    }

    /** id 직접 조회. soft-deleted 메시지도 반환(감사용) */
    @Transactional(readOnly = true)
    public MessageDto get(String messageId) {
        return withSets(find(messageId));
    }

    @Transactional(readOnly = true)
    public MessagePage listFiles(UUID requesterId, GroupRef group, @Nullable String fileType, int limit, int offset) {
        accessControl.requireJoin(requesterId, group);
        int capped = clampLimit(limit);
        var page = OffsetPageRequest.of(Math.max(0, offset), capped, NEWEST_FIRST);
        List<ChatMessage> rows;
        long total;
        if (fileType == null || fileType.isBlank()) {
            rows = messageRepo.findByGroupKeyAndKindAndDeletedFalse(group.key(), ChatMessage.Kind.FILE, page);
            total = messageRepo.countByGroupKeyAndKindAndDeletedFalse(group.key(), ChatMessage.Kind.FILE);
        } else {
            rows = messageRepo.findByGroupKeyAndKindAndDeletedFalseAndFileMetadataFileType(
                    group.key(), ChatMessage.Kind.FILE, fileType, page);
            total = messageRepo.countByGroupKeyAndKindAndDeletedFalseAndFileMetadataFileType(
                    group.key(), ChatMessage.Kind.FILE, fileType);
        }
        return new MessagePage(toDtos(rows), total, capped, page.getOffset());
    }

    // ─────────────────────────────────────────────────────────────

    private boolean addRead(ChatMessage m, UUID userId) {
        if (readRepo.existsByMessage_IdAndUserId(m.getId(), userId)) return false;
        try {
            readRepo.save(MessageRead.builder().message(m).userId(userId).readAt(Instant.now()).build());
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("read already recorded: messageId={}, userId={}", m.getMessageId(), userId);
            return false;
        }
    }

    private ChatMessage find(String messageId) {
        if (messageId == null || messageId.isBlank()) throw ChatException.notFound("message not found");
        return messageRepo.findByMessageId(messageId)
                .orElseThrow(() -> ChatException.notFound("message not found"));
    }

    private Channel channelOf(GroupRef group) {
        return channelRepo.findById(group.id())
                .orElseThrow(() -> ChatException.notFound("channel not found"));
    }

    private int clampLimit(int limit) {
        int max = props.getHistory().getMaxLimit();
        int requested = limit <= 0 ? props.getHistory().getDefaultLimit() : limit;
        return Math.min(max, Math.max(1, requested));
    }

    private void requireContentLength(String content) {
        int max = Math.min(props.getMessage().getMaxContentChars(), ChatMessage.MAX_CONTENT_CHARS);
        if (content.length() > max) {
            throw ChatException.badRequest("content exceeds " + max + " characters");
        }
    }

    private static String requireEmoji(String emoji) {
        if (emoji == null || emoji.isBlank()) throw ChatException.badRequest("emoji is required");
        return emoji.trim();
    }

    private MessageDto withSets(ChatMessage m) {
        return toDtos(List.of(m)).get(0);
    }

    private List<MessageDto> toDtos(List<ChatMessage> rows) {
        if (rows.isEmpty()) return List.of();
        List<Long> pks = rows.stream().map(ChatMessage::getId).toList();

        Map<Long, List<UUID>> reads = readRepo.findByMessage_IdIn(pks).stream()
                .collect(Collectors.groupingBy(r -> r.getMessage().getId(),
                        Collectors.mapping(MessageRead::getUserId, Collectors.toList())));
        Map<Long, List<MessageReaction>> reactions = reactionRepo.findByMessage_IdInOrderByIdAsc(pks).stream()
                .collect(Collectors.groupingBy(r -> r.getMessage().getId()));

        return rows.stream()
                .map(m -> toDto(m, reads.getOrDefault(m.getId(), List.of()),
                        reactions.getOrDefault(m.getId(), List.of())))
                .toList();
    }

    private static MessageDto toDto(ChatMessage m, Collection<UUID> readBy, List<MessageReaction> reactions) {
        Map<String, List<String>> byEmoji = new LinkedHashMap<>();
        for (MessageReaction r : reactions) {
            byEmoji.computeIfAbsent(r.getEmoji(), k -> new ArrayList<>()).add(r.getUserId().toString());
        }
        return MessageDto.builder()
                .id(m.getId())
                .messageId(m.getMessageId())
                .roomId(m.getRoomId())
                .channelId(m.getChannelId())
                .senderId(m.getSenderId().toString())
                .senderName(m.getSenderName())
                .content(m.getContent())
                .messageType(m.getKind().name().toLowerCase())
                .parentMessageId(m.getParentMessageId())
                .fileMetadata(FileMetadataDto.from(m.getFileMetadata()))
                .broadcast(m.isBroadcast())
                .edited(m.isEdited())
                .deleted(m.isDeleted())
                .readBy(readBy.stream().map(UUID::toString).distinct().toList())
                .reactions(byEmoji)
                .createdAt(m.getCreatedAt())
                .updatedAt(m.getUpdatedAt())
                .build();
    }
}
