package com.realtime.messaging.access;

import com.realtime.messaging.channel.entity.Channel;
import com.realtime.messaging.channel.entity.ChannelSettings;
import com.realtime.messaging.channel.repository.ChannelRepository;
import com.realtime.messaging.chat.entity.ChatRoom;
import com.realtime.messaging.chat.repository.ChatRoomRepository;
import com.realtime.messaging.common.ChatErrorCode;
import com.realtime.messaging.common.ChatException;
import com.realtime.messaging.common.GroupRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("AccessControlService")
class AccessControlServiceTest {

    private final UUID admin = UUID.randomUUID();
    private final UUID member = UUID.randomUUID();
    private final UUID outsider = UUID.randomUUID();

    private ChatRoomRepository roomRepo;
    private ChannelRepository channelRepo;
    private AccessControlService access;

    @BeforeEach
    void setUp() {
        roomRepo = mock(ChatRoomRepository.class);
        channelRepo = mock(ChannelRepository.class);
        when(roomRepo.findById(anyString())).thenReturn(Optional.empty());
        when(channelRepo.findById(anyString())).thenReturn(Optional.empty());
        access = new AccessControlService(roomRepo, channelRepo);
    }

    private Channel channel(String id, boolean isPublic, boolean allowMemberPosts) {
        Channel c = Channel.builder()
                .id(id).name(id).kind(Channel.Kind.PROJECT).creatorId(admin)
                .adminIds(Set.of(admin)).memberIds(Set.of(member))
                .publicChannel(isPublic)
                .settings(ChannelSettings.builder().allowMemberPosts(allowMemberPosts).build())
                .build();
        when(channelRepo.findById(id)).thenReturn(Optional.of(c));
        return c;
    }

    @Nested
    @DisplayName("rooms")
    class Rooms {

        @BeforeEach
        void room() {
            ChatRoom r = ChatRoom.builder()
                    .id("r1").name("r1").kind(ChatRoom.Kind.GROUP).creatorId(admin)
                    .participantIds(Set.of(admin, member))
                    .build();
            when(roomRepo.findById("r1")).thenReturn(Optional.of(r));
        }

        @Test
        @DisplayName("participants may join and post, others may not")
        void participantsOnly() {
            GroupRef room = GroupRef.room("r1");
            assertTrue(access.canJoin(member, room));
            assertTrue(access.canPost(member, room));
            assertFalse(access.canJoin(outsider, room));
            assertFalse(access.canPost(outsider, room));
        }

        @Test
        @DisplayName("only the creator moderates")
        void creatorModerates() {
            assertTrue(access.canModerate(admin, GroupRef.room("r1")));
            assertFalse(access.canModerate(member, GroupRef.room("r1")));
        }

        @Test
        @DisplayName("inactive room denies everything")
        void inactiveRoom() {
            roomRepo.findById("r1").orElseThrow().setActive(false);
            assertFalse(access.canJoin(member, GroupRef.room("r1")));
            ChatException e = assertThrows(ChatException.class,
                    () -> access.requireJoin(member, GroupRef.room("r1")));
            assertEquals(ChatErrorCode.NOT_FOUND, e.getCode());
        }
    }

    @Nested
    @DisplayName("channels")
    class Channels {

        @Test
        @DisplayName("public channel is joinable by anyone")
        void publicChannel() {
            channel("c1", true, true);
            assertTrue(access.canJoin(outsider, GroupRef.channel("c1")));
            assertFalse(access.canPost(outsider, GroupRef.channel("c1")));
        }

        @Test
        @DisplayName("private channel rejects non-members with forbidden")
        void privateChannel() {
            channel("c2", false, true);
            assertTrue(access.canJoin(member, GroupRef.channel("c2")));
            assertTrue(access.canJoin(admin, GroupRef.channel("c2")));
            assertFalse(access.canJoin(outsider, GroupRef.channel("c2")));

            ChatException e = assertThrows(ChatException.class,
                    () -> access.requireJoin(outsider, GroupRef.channel("c2")));
            assertEquals(ChatErrorCode.FORBIDDEN, e.getCode());
        }

        @Test
        @DisplayName("members post only when member posts are allowed; admins always")
        void memberPosts() {
            channel("c3", true, false);
            assertFalse(access.canPost(member, GroupRef.channel("c3")));
            assertTrue(access.canPost(admin, GroupRef.channel("c3")));
        }

        @Test
        @DisplayName("admins moderate")
        void adminsModerate() {
            channel("c4", true, true);
            assertTrue(access.canModerate(admin, GroupRef.channel("c4")));
            assertFalse(access.canModerate(member, GroupRef.channel("c4")));
        }

        @Test
        @DisplayName("unknown channel is not_found")
        void unknown() {
            ChatException e = assertThrows(ChatException.class,
                    () -> access.requirePost(member, GroupRef.channel("nope")));
            assertEquals(ChatErrorCode.NOT_FOUND, e.getCode());
        }
    }

    @Test
    @DisplayName("presence group: joinable, never postable")
    void presenceGroup() {
        assertTrue(access.canJoin(outsider, GroupRef.presence()));
        assertFalse(access.canPost(outsider, GroupRef.presence()));
        assertFalse(access.canJoin(null, GroupRef.presence()));
    }
}
