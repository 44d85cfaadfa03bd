package com.realtime.messaging.gateway;

import com.realtime.messaging.access.AccessControlService;
import com.realtime.messaging.common.ChatException;
import com.realtime.messaging.common.GroupRef;
import com.realtime.messaging.config.MessagingProps;
import com.realtime.messaging.gateway.frame.FrameCodec;
import com.realtime.messaging.identity.Identity;
import com.realtime.messaging.identity.IdentityResolver;
import com.realtime.messaging.message.dto.MessageDto;
import com.realtime.messaging.message.dto.PostMessageCommand;
import com.realtime.messaging.message.service.MessageService;
import com.realtime.messaging.presence.InMemoryPresenceStore;
import com.realtime.messaging.presence.PresenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("ChatGateway")
class ChatGatewayTest {

    private static final GroupRef ROOM = GroupRef.room("r1");

    private final UUID aliceId = UUID.randomUUID();
    private final UUID bobId = UUID.randomUUID();
    private final UUID carolId = UUID.randomUUID();

    private IdentityResolver identityResolver;
    private AccessControlService accessControl;
    private MessageService messageService;
    private PresenceService presenceService;
    private GroupRegistry registry;
    private MessagingProps props;
    private ChatGateway gateway;

    @BeforeEach
    void setUp() {
        identityResolver = mock(IdentityResolver.class);
        accessControl = mock(AccessControlService.class);
        messageService = mock(MessageService.class);
        presenceService = new PresenceService(new InMemoryPresenceStore());
        FrameCodec codec = new FrameCodec(TestMappers.objectMapper());
        registry = new GroupRegistry(codec);
        props = new MessagingProps();
        gateway = new ChatGateway(identityResolver, accessControl, presenceService, messageService,
                registry, new GroupSequencer(Runnable::run), codec, props);

        when(identityResolver.resolve("tok-alice")).thenReturn(Optional.of(Identity.of(aliceId, "alice")));
        when(identityResolver.resolve("tok-bob")).thenReturn(Optional.of(Identity.of(bobId, "bob")));
        when(identityResolver.resolve("tok-carol")).thenReturn(Optional.of(Identity.of(carolId, "carol")));
    }

    private RecordingConnection connect(String id, String token, GroupRef group) {
        RecordingConnection c = new RecordingConnection(id);
        gateway.connect(c, token, group);
        return c;
    }

    private MessageDto stored(String messageId, String content) {
        return MessageDto.builder()
                .id(1L).messageId(messageId).roomId("r1")
                .senderId(aliceId.toString()).senderName("alice")
                .content(content).messageType("text")
                .readBy(List.of(aliceId.toString())).reactions(Map.of())
                .createdAt(Instant.now()).updatedAt(Instant.now())
                .build();
    }

    @Nested
    @DisplayName("connect")
    class Connect {

        @Test
        @DisplayName("missing credential is rejected and the connection closed")
        void unauthenticated() {
            RecordingConnection c = connect("c1", null, ROOM);

            assertTrue(c.received("\"code\":\"unauthenticated\""));
            assertEquals(ClientConnection.CloseReason.POLICY_VIOLATION, c.closeReason());
            assertEquals(0, registry.size(ROOM.key()));
            assertEquals(0, gateway.activeSessions());
        }

        @Test
        @DisplayName("invalid credential is rejected")
        void invalidCredential() {
            RecordingConnection c = connect("c1", "garbage", ROOM);

            assertTrue(c.received("unauthenticated"));
            assertFalse(c.isOpen());
        }

        @Test
        @DisplayName("no access to the group closes with forbidden")
        void forbidden() {
            doThrow(ChatException.forbidden("no access to room:r1"))
                    .when(accessControl).requireJoin(bobId, ROOM);

            RecordingConnection c = connect("c1", "tok-bob", ROOM);

            assertTrue(c.received("\"code\":\"forbidden\""));
            assertEquals(ClientConnection.CloseReason.POLICY_VIOLATION, c.closeReason());
            assertFalse(presenceService.isOnline(bobId));
        }

        @Test
        @DisplayName("user_joined reaches others but not the joining connection")
        void userJoined() {
            RecordingConnection alice = connect("a", "tok-alice", ROOM);
            RecordingConnection bob = connect("b", "tok-bob", ROOM);

            assertTrue(alice.received("\"type\":\"user_joined\""));
            assertTrue(alice.received(bobId.toString()));
            assertFalse(bob.received("user_joined"));
            assertTrue(presenceService.isOnline(aliceId));
            assertTrue(presenceService.isOnline(bobId));
        }

        @Test
        @DisplayName("presence connection gets a snapshot and later status changes")
        void presenceSnapshot() {
            connect("a", "tok-alice", ROOM);
            RecordingConnection watcher = connect("w", "tok-carol", GroupRef.presence());

            assertTrue(watcher.received("\"type\":\"online_users\""));
            assertTrue(watcher.received(aliceId.toString()));

            watcher.clear();
            connect("b", "tok-bob", ROOM);
            assertTrue(watcher.received("\"type\":\"status_change\""));
            assertTrue(watcher.received("\"is_online\":true"));
        }

        @Test
        @DisplayName("channel connection receives a connected confirmation")
        void channelConnected() {
            RecordingConnection c = connect("c", "tok-alice", GroupRef.channel("ch1"));
            assertTrue(c.received("\"type\":\"connected\""));
            assertTrue(c.received("\"channel_id\":\"ch1\""));
        }
    }

    @Nested
    @DisplayName("receive")
    class Receive {

        private RecordingConnection alice;
        private RecordingConnection bob;

        @BeforeEach
        void joinBoth() {
            alice = connect("a", "tok-alice", ROOM);
            bob = connect("b", "tok-bob", ROOM);
            alice.clear();
            bob.clear();
        }

        @Test
        @DisplayName("posted message is stored and delivered to the whole room")
        void postMessage() {
            when(messageService.post(any())).thenReturn(stored("m1", "hello"));

            gateway.receive(alice, "{\"type\":\"message\",\"content\":\"hello\"}");

            ArgumentCaptor<PostMessageCommand> cmd = ArgumentCaptor.forClass(PostMessageCommand.class);
            verify(messageService).post(cmd.capture());
            assertEquals(ROOM, cmd.getValue().group());
            assertEquals(aliceId, cmd.getValue().senderId());
            assertEquals("hello", cmd.getValue().content());

            assertTrue(bob.received("\"type\":\"message\""));
            assertTrue(bob.received("\"content\":\"hello\""));
            assertTrue(alice.received("\"type\":\"message\""));
        }

        @Test
        @DisplayName("typing indicator is not echoed to its sender")
        void typing() {
            gateway.receive(alice, "{\"type\":\"typing_start\"}");

            assertTrue(bob.received("\"type\":\"typing\""));
            assertTrue(bob.received("\"is_typing\":true"));
            assertTrue(alice.sent().isEmpty());
        }

        @Test
        @DisplayName("malformed frame yields an error frame and keeps the connection")
        void malformed() {
            gateway.receive(alice, "{oops");

            assertTrue(alice.received("\"code\":\"invalid_frame\""));
            assertTrue(alice.isOpen());
            assertTrue(bob.sent().isEmpty());
        }

        @Test
        @DisplayName("oversized frame is fatal")
        void oversized() {
            props.getWs().setMaxFrameChars(10);

            gateway.receive(alice, "{\"type\":\"message\",\"content\":\"far too long\"}");

            assertTrue(alice.received("invalid_frame"));
            assertEquals(ClientConnection.CloseReason.TOO_BIG, alice.closeReason());
            verifyNoInteractions(messageService);
        }

        @Test
        @DisplayName("forbidden post is reported to the sender only")
        void forbiddenPost() {
            when(messageService.post(any())).thenThrow(ChatException.forbidden("not allowed to post in room:r1"));

            gateway.receive(alice, "{\"type\":\"message\",\"content\":\"hi\"}");

            assertTrue(alice.received("\"code\":\"forbidden\""));
            assertTrue(alice.isOpen());
            assertTrue(bob.sent().isEmpty());
        }

        @Test
        @DisplayName("store failure on post is reported as persistence_unavailable")
        void storeDown() {
            when(messageService.post(any())).thenThrow(new DataAccessResourceFailureException("db down"));

            gateway.receive(alice, "{\"type\":\"message\",\"content\":\"hi\"}");

            assertTrue(alice.received("\"code\":\"persistence_unavailable\""));
            assertTrue(bob.sent().isEmpty());
        }

        @Test
        @DisplayName("read receipt is stored and broadcast once")
        void readReceipt() {
            when(messageService.get("m1")).thenReturn(stored("m1", "hello"));
            when(messageService.markRead("m1", bobId)).thenReturn(true, false);

            gateway.receive(bob, "{\"type\":\"read_receipt\",\"message_id\":\"m1\"}");
            gateway.receive(bob, "{\"type\":\"read_receipt\",\"message_id\":\"m1\"}");

            assertEquals(1, alice.sent().size());
            assertTrue(alice.received("\"type\":\"read_receipt\""));
            assertTrue(alice.received(bobId.toString()));
        }

        @Test
        @DisplayName("read receipt for a message of another room is not_found")
        void readReceiptOtherRoom() {
            MessageDto elsewhere = stored("m9", "x");
            elsewhere.setRoomId("r2");
            when(messageService.get("m9")).thenReturn(elsewhere);

            gateway.receive(bob, "{\"type\":\"read_receipt\",\"message_id\":\"m9\"}");

            assertTrue(bob.received("\"code\":\"not_found\""));
            verify(messageService, never()).markRead(anyString(), any());
        }

        @Test
        @DisplayName("reaction remove is forwarded with its action")
        void reactionRemove() {
            when(messageService.get("m1")).thenReturn(stored("m1", "hello"));
            when(messageService.removeReaction("m1", bobId, "👍")).thenReturn(true);

            gateway.receive(bob, "{\"type\":\"reaction\",\"message_id\":\"m1\",\"emoji\":\"👍\",\"action\":\"remove\"}");

            verify(messageService).removeReaction("m1", bobId, "👍");
            assertTrue(alice.received("\"type\":\"reaction\""));
            assertTrue(alice.received("\"action\":\"remove\""));
        }

        @Test
        @DisplayName("a recipient whose delivery fails is cleaned up")
        void failedRecipientIsDisconnected() {
            when(messageService.post(any())).thenReturn(stored("m1", "hello"));
            bob.failSends();

            gateway.receive(alice, "{\"type\":\"message\",\"content\":\"hello\"}");

            assertTrue(alice.received("\"type\":\"message\""));
            assertFalse(registry.members(ROOM.key()).contains("b"));
            assertFalse(presenceService.isOnline(bobId));
            assertTrue(alice.received("\"type\":\"user_left\""));
        }
    }

    @Test
    @DisplayName("presence connections are receive-only")
    void presenceConnectionCannotSend() {
        RecordingConnection watcher = connect("w", "tok-carol", GroupRef.presence());
        watcher.clear();

        gateway.receive(watcher, "{\"type\":\"message\",\"content\":\"hi\"}");

        assertTrue(watcher.received("\"code\":\"forbidden\""));
        verifyNoInteractions(messageService);
    }

    @Nested
    @DisplayName("revokeAccess")
    class RevokeAccess {

        @Test
        @DisplayName("a connection that lost access is closed and receives nothing further")
        void revokedConnectionStopsReceiving() {
            RecordingConnection alice = connect("a", "tok-alice", ROOM);
            RecordingConnection bob = connect("b", "tok-bob", ROOM);
            alice.clear();
            bob.clear();
            when(accessControl.canJoin(aliceId, ROOM)).thenReturn(true);
            when(accessControl.canJoin(bobId, ROOM)).thenReturn(false);

            gateway.revokeAccess(ROOM).join();

            assertTrue(bob.received("\"code\":\"forbidden\""));
            assertEquals(ClientConnection.CloseReason.POLICY_VIOLATION, bob.closeReason());
            assertEquals(List.of("a"), List.copyOf(registry.members(ROOM.key())));
            assertTrue(alice.received("\"type\":\"user_left\""));
            assertNull(alice.closeReason());

            bob.clear();
            when(messageService.post(any())).thenReturn(stored("m1", "after removal"));
            gateway.receive(alice, "{\"type\":\"message\",\"content\":\"after removal\"}");

            assertTrue(alice.received("after removal"));
            assertFalse(bob.received("after removal"));
            assertTrue(bob.sent().isEmpty());
        }

        @Test
        @DisplayName("members that still have access are left alone")
        void allowedStay() {
            RecordingConnection alice = connect("a", "tok-alice", ROOM);
            alice.clear();
            when(accessControl.canJoin(aliceId, ROOM)).thenReturn(true);

            gateway.revokeAccess(ROOM).join();

            assertTrue(alice.sent().isEmpty());
            assertTrue(alice.isOpen());
            assertEquals(1, gateway.activeSessions());
        }

        @Test
        @DisplayName("a store failure during the re-check keeps the connection")
        void storeDownKeeps() {
            RecordingConnection bob = connect("b", "tok-bob", ROOM);
            when(accessControl.canJoin(bobId, ROOM)).thenThrow(new DataAccessResourceFailureException("db down"));

            gateway.revokeAccess(ROOM).join();

            assertTrue(bob.isOpen());
            assertEquals(List.of("b"), List.copyOf(registry.members(ROOM.key())));
        }
    }

    @Nested
    @DisplayName("disconnect")
    class Disconnect {

        @Test
        @DisplayName("last connection going away marks the user offline and notifies the presence group")
        void lastConnection() {
            RecordingConnection watcher = connect("w", "tok-carol", GroupRef.presence());
            RecordingConnection alice = connect("a", "tok-alice", ROOM);
            RecordingConnection bob = connect("b", "tok-bob", ROOM);
            watcher.clear();
            bob.clear();

            gateway.disconnect(alice);

            assertFalse(presenceService.isOnline(aliceId));
            assertTrue(watcher.received("\"type\":\"status_change\""));
            assertTrue(watcher.received("\"is_online\":false"));
            assertTrue(bob.received("\"type\":\"user_left\""));
            assertEquals(List.of("b"), List.copyOf(registry.members(ROOM.key())));
        }

        @Test
        @DisplayName("is idempotent")
        void idempotent() {
            RecordingConnection watcher = connect("w", "tok-carol", GroupRef.presence());
            RecordingConnection alice = connect("a", "tok-alice", ROOM);
            watcher.clear();

            gateway.disconnect(alice);
            gateway.disconnect(alice);

            assertEquals(1, watcher.sent().size());
            assertEquals(0, presenceService.connectionCount(aliceId));
        }

        @Test
        @DisplayName("another open tab keeps the user online")
        void otherTabStaysOnline() {
            RecordingConnection watcher = connect("w", "tok-carol", GroupRef.presence());
            RecordingConnection tab1 = connect("a1", "tok-alice", ROOM);
            connect("a2", "tok-alice", GroupRef.channel("ch1"));
            watcher.clear();

            gateway.disconnect(tab1);

            assertTrue(presenceService.isOnline(aliceId));
            assertTrue(watcher.sent().isEmpty());
        }

        @Test
        @DisplayName("frames after disconnect are ignored")
        void framesAfterDisconnect() {
            RecordingConnection alice = connect("a", "tok-alice", ROOM);
            gateway.disconnect(alice);

            gateway.receive(alice, "{\"type\":\"message\",\"content\":\"late\"}");

            verifyNoInteractions(messageService);
        }
    }
}
