package com.realtime.messaging.gateway;

import com.realtime.messaging.access.AccessControlService;
import com.realtime.messaging.common.ChatErrorCode;
import com.realtime.messaging.common.ChatException;
import com.realtime.messaging.common.GroupRef;
import com.realtime.messaging.config.MessagingProps;
import com.realtime.messaging.gateway.frame.*;
import com.realtime.messaging.gateway.frame.OutboundEvent.*;
import com.realtime.messaging.identity.Identity;
import com.realtime.messaging.identity.IdentityResolver;
import com.realtime.messaging.message.dto.MessageDto;
import com.realtime.messaging.message.dto.PostMessageCommand;
import com.realtime.messaging.message.service.MessageService;
import com.realtime.messaging.presence.PresenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 커넥션 수명 관리: 접속(인증/권한/그룹 등록/presence), 프레임 수신/디스패치, 종료 정리.
 *
 * <p>한 그룹에 대한 처리와 브로드캐스트는 모두 {@link GroupSequencer}를 거치므로
 * 같은 그룹 안에서는 게이트웨이가 받은 순서대로 이벤트가 나간다.
 */
@Component
@Slf4j
public class ChatGateway {

    private final IdentityResolver identityResolver;
    private final AccessControlService accessControl;
    private final PresenceService presenceService;
    private final MessageService messageService;
    private final GroupRegistry registry;
    private final GroupSequencer sequencer;
    private final FrameCodec frameCodec;
    private final MessagingProps props;

    // connectionId → session (JOINED 이후만)
    private final Map<String, GatewaySession> sessions = new ConcurrentHashMap<>();

    public ChatGateway(IdentityResolver identityResolver,
                       AccessControlService accessControl,
                       PresenceService presenceService,
                       MessageService messageService,
                       GroupRegistry registry,
                       GroupSequencer sequencer,
                       FrameCodec frameCodec,
                       MessagingProps props) {
        this.identityResolver = identityResolver;
        this.accessControl = accessControl;
        this.presenceService = presenceService;
        this.messageService = messageService;
        this.registry = registry;
        this.sequencer = sequencer;
        this.frameCodec = frameCodec;
        this.props = props;
        // 전송 실패로 끊긴 커넥션도 정상 종료와 같은 정리를 거친다
        registry.onDeliveryFailure(this::disconnect);
    }

    // ─────────────────────────────────────────────────────────────
    //  Connect
    // ─────────────────────────────────────────────────────────────

    /**
     * @param credential bearer 토큰 (없으면 null)
     * @return JOINED까지 갔으면 세션, 거부되어 커넥션을 닫았으면 empty
     */
    public Optional<GatewaySession> connect(ClientConnection conn, @Nullable String credential, GroupRef target) {
        GatewaySession session = new GatewaySession(conn);

        Identity identity = resolve(credential);
        if (identity == null) {
            reject(session, ChatErrorCode.UNAUTHENTICATED, "authentication required");
            return Optional.empty();
        }
        session.authenticated(identity);

        try {
            accessControl.requireJoin(identity.userId(), target);
        } catch (ChatException e) {
            reject(session, e.getCode(), e.getMessage());
            return Optional.empty();
        } catch (DataAccessException e) {
            log.warn("access check failed on connect: userId={}, group={}, cause={}",
                    identity.userId(), target, e.getMessage());
            reject(session, ChatErrorCode.PERSISTENCE_UNAVAILABLE, "temporarily unavailable");
            return Optional.empty();
        }

        sessions.put(conn.id(), session);
        registry.join(target.key(), conn);
        session.joined(target);

        boolean firstConnection = presenceService.connectionOpened(identity.userId());
        log.info("ws connected: connectionId={}, userId={}, group={}, first={}",
                conn.id(), identity.userId(), target, firstConnection);

        if (target.isPresence()) {
            send(session, new OnlineUsersEvent(presenceService.getOnlineUsers()));
        } else {
            if (target.isChannel()) {
                send(session, new ConnectedEvent(target.id(), "Connected to channel " + target.id()));
            }
            UserJoinedEvent joined = UserJoinedEvent.of(identity);
            sequencer.submit(target.key(), () -> registry.broadcast(target.key(), joined, conn.id()));
        }
        if (firstConnection) {
            publishPresence(identity, true);
        }
        return Optional.of(session);
    }

    // ─────────────────────────────────────────────────────────────
    //  Receive
    // ─────────────────────────────────────────────────────────────

    public void receive(ClientConnection conn, String text) {
        GatewaySession session = sessions.get(conn.id());
        if (session == null || session.isDisconnected()) {
            log.debug("frame from unknown or closed connection ignored: connectionId={}", conn.id());
            return;
        }

        if (text == null || text.length() > props.getWs().getMaxFrameChars()) {
            send(session, ErrorEvent.of(ChatErrorCode.INVALID_FRAME, "frame too large"));
            conn.close(ClientConnection.CloseReason.TOO_BIG);
            return;
        }

        InboundFrame frame;
        try {
            frame = frameCodec.decode(text);
        } catch (ChatException e) {
            log.debug("invalid frame: connectionId={}, reason={}", conn.id(), e.getMessage());
            send(session, ErrorEvent.of(e.getCode(), e.getMessage()));
            return;
        }

        GroupRef group = session.getGroup();
        sequencer.submit(group.key(), () -> dispatch(session, frame));
    }

    private void dispatch(GatewaySession session, InboundFrame frame) {
        // 이미 끊긴 커넥션의 프레임도 저장까지는 마친다
        boolean receiving = session.beginReceive();
        try {
            handle(session, frame);
        } catch (ChatException e) {
            send(session, ErrorEvent.of(e.getCode(), e.getMessage()));
        } catch (DataAccessException e) {
            log.warn("store unavailable: connectionId={}, frame={}, cause={}",
                    session.connectionId(), frame.getClass().getSimpleName(), e.getMessage());
            send(session, ErrorEvent.of(ChatErrorCode.PERSISTENCE_UNAVAILABLE, "message store unavailable"));
        } finally {
            if (receiving) session.endReceive();
        }
    }

    private void handle(GatewaySession session, InboundFrame frame) {
        GroupRef group = session.getGroup();
        Identity me = session.getIdentity();
        if (group.isPresence()) {
            throw ChatException.forbidden("presence connections are receive-only");
        }

        if (frame instanceof MessageFrame m) {
            onMessage(session, m);
        } else if (frame instanceof TypingStartFrame) {
            onTyping(session, true);
        } else if (frame instanceof TypingStopFrame) {
            onTyping(session, false);
        } else if (frame instanceof ReadReceiptFrame r) {
            MessageDto msg = messageInGroup(me, group, r.messageId());
            if (messageService.markRead(msg.getMessageId(), me.userId())) {
                registry.broadcast(group.key(), new ReadReceiptEvent(
                        msg.getMessageId(), me.userId().toString(), me.label(), Instant.now()));
            }
        } else if (frame instanceof ReactionFrame r) {
            MessageDto msg = messageInGroup(me, group, r.messageId());
            boolean changed = r.isRemove()
                    ? messageService.removeReaction(msg.getMessageId(), me.userId(), r.emoji())
                    : messageService.addReaction(msg.getMessageId(), me.userId(), r.emoji());
            if (changed) {
                registry.broadcast(group.key(), new ReactionEvent(
                        msg.getMessageId(), me.userId().toString(), me.label(), r.emoji().trim(),
                        r.isRemove() ? ReactionFrame.REMOVE : ReactionFrame.ADD, Instant.now()));
            }
        } else {
            throw ChatException.invalidFrame("unsupported frame");
        }
    }

    private void onMessage(GatewaySession session, MessageFrame m) {
        GroupRef group = session.getGroup();
        Identity me = session.getIdentity();
        MessageDto saved = messageService.post(new PostMessageCommand(
                group, me.userId(), me.label(), m.content(), m.kind(), m.parentMessageId(), m.fileMetadata()));

        // 채널은 공지형이라 broadcast 이벤트로 내보낸다
        OutboundEvent event = group.isChannel()
                ? new BroadcastEvent(saved, saved.getSenderId(), saved.getSenderName(), saved.getCreatedAt())
                : new MessageEvent(saved);
        registry.broadcast(group.key(), event);
    }

    private void onTyping(GatewaySession session, boolean typing) {
        GroupRef group = session.getGroup();
        if (!group.isRoom()) {
            throw ChatException.forbidden("typing indicators are only supported in rooms");
        }
        registry.broadcast(group.key(), TypingEvent.of(session.getIdentity(), typing), session.connectionId());
    }

    /** 읽음/리액션 대상은 이 커넥션의 그룹에 속한, 삭제되지 않은 메시지여야 한다 */
    private MessageDto messageInGroup(Identity me, GroupRef group, String messageId) {
        accessControl.requireJoin(me.userId(), group);
        MessageDto msg = messageService.get(messageId);
        String owner = group.isRoom() ? msg.getRoomId() : msg.getChannelId();
        if (msg.isDeleted() || !group.id().equals(owner)) {
            throw ChatException.notFound("message not found");
        }
        return msg;
    }

    // ─────────────────────────────────────────────────────────────
    //  Disconnect
    // ─────────────────────────────────────────────────────────────

    /**
     * 전송 계층의 close 콜백(정상 종료, 전송 오류 모두)에서 호출. 여러 번 불려도 정리는 한 번만 한다.
     */
    public void disconnect(ClientConnection conn) {
        GatewaySession session = sessions.remove(conn.id());
        if (session == null || !session.disconnected()) {
            return;
        }
        registry.leaveAll(conn);

        Identity who = session.getIdentity();
        GroupRef group = session.getGroup();
        boolean lastConnection = presenceService.connectionClosed(who.userId());
        log.info("ws disconnected: connectionId={}, userId={}, group={}, last={}",
                conn.id(), who.userId(), group, lastConnection);

        if (group != null && !group.isPresence()) {
            UserLeftEvent left = UserLeftEvent.of(who);
            sequencer.submit(group.key(), () -> registry.broadcast(group.key(), left));
        }
        if (lastConnection) {
            publishPresence(who, false);
        }
    }

    // ─────────────────────────────────────────────────────────────
    //  외부(채널 공지 등)에서 그룹으로 이벤트 발행
    // ─────────────────────────────────────────────────────────────

    public CompletableFuture<Void> publish(GroupRef group, OutboundEvent event) {
        return sequencer.submit(group.key(), () -> registry.broadcast(group.key(), event));
    }

    /**
     * 멤버십 변경(참여자 제거, 방/채널 삭제, 비공개 전환)이 커밋된 뒤 호출.
     * 그룹에 붙어 있는 커넥션 중 더 이상 join 권한이 없는 것은 forbidden 에러 프레임 후 닫고 정리한다.
     * 그룹의 다른 이벤트와 같은 순서 안에서 실행된다.
     */
    public CompletableFuture<Void> revokeAccess(GroupRef group) {
        return sequencer.submit(group.key(), () -> evictUnauthorized(group));
    }

    public int activeSessions() {
        return sessions.size();
    }

    // ─────────────────────────────────────────────────────────────

    private void publishPresence(Identity who, boolean online) {
        GroupRef presence = GroupRef.presence();
        StatusChangeEvent event = StatusChangeEvent.of(who, online);
        sequencer.submit(presence.key(), () -> registry.broadcast(presence.key(), event));
    }

    private void evictUnauthorized(GroupRef group) {
        for (String connectionId : registry.members(group.key())) {
            GatewaySession session = sessions.get(connectionId);
            if (session == null || session.isDisconnected() || !group.equals(session.getGroup())) continue;

            UUID userId = session.getIdentity().userId();
            boolean allowed;
            try {
                allowed = accessControl.canJoin(userId, group);
            } catch (DataAccessException e) {
                // 판정 불가. 다음 멤버십 변경이나 재접속 때 다시 확인된다
                log.warn("access re-check failed: connectionId={}, userId={}, group={}, cause={}",
                        connectionId, userId, group, e.getMessage());
                continue;
            }
            if (allowed) continue;

            log.info("ws access revoked: connectionId={}, userId={}, group={}", connectionId, userId, group);
            ClientConnection conn = session.getConnection();
            send(session, ErrorEvent.of(ChatErrorCode.FORBIDDEN, "access to " + group + " was revoked"));
            conn.close(ClientConnection.CloseReason.POLICY_VIOLATION);
            disconnect(conn);
        }
    }

    @Nullable
    private Identity resolve(@Nullable String credential) {
        if (credential == null || credential.isBlank()) return null;
        return identityResolver.resolve(credential)
                .filter(Identity::authenticated)
                .orElse(null);
    }

    private void reject(GatewaySession session, ChatErrorCode code, String message) {
        ClientConnection conn = session.getConnection();
        log.info("ws rejected: connectionId={}, code={}, reason={}", conn.id(), code.wireCode(), message);
        send(session, ErrorEvent.of(code, message));
        session.disconnected();
        conn.close(code == ChatErrorCode.PERSISTENCE_UNAVAILABLE
                ? ClientConnection.CloseReason.SERVER_ERROR
                : ClientConnection.CloseReason.POLICY_VIOLATION);
    }

    /** 본인 커넥션에 직접 전송. 실패하면 끊고 정리한다 */
    private void send(GatewaySession session, OutboundEvent event) {
        ClientConnection conn = session.getConnection();
        if (!conn.isOpen()) return;
        try {
            conn.send(frameCodec.encode(event));
        } catch (IOException | IllegalStateException e) {
            log.warn("direct send failed: connectionId={}, cause={}", conn.id(), e.toString());
            conn.close(ClientConnection.CloseReason.SERVER_ERROR);
            disconnect(conn);
        }
    }
}
