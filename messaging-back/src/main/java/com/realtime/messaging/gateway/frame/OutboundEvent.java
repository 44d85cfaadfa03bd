package com.realtime.messaging.gateway.frame;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realtime.messaging.channel.dto.ChannelDto;
import com.realtime.messaging.common.ChatErrorCode;
import com.realtime.messaging.identity.Identity;
import com.realtime.messaging.message.dto.MessageDto;
import com.realtime.messaging.presence.PresenceRecord;

import java.time.Instant;
import java.util.List;

/**
 * 서버 → 클라이언트 이벤트. 직렬화 시 type 필드가 붙는다.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = OutboundEvent.MessageEvent.class, name = "message"),
        @JsonSubTypes.Type(value = OutboundEvent.TypingEvent.class, name = "typing"),
        @JsonSubTypes.Type(value = OutboundEvent.UserJoinedEvent.class, name = "user_joined"),
        @JsonSubTypes.Type(value = OutboundEvent.UserLeftEvent.class, name = "user_left"),
        @JsonSubTypes.Type(value = OutboundEvent.ReadReceiptEvent.class, name = "read_receipt"),
        @JsonSubTypes.Type(value = OutboundEvent.ReactionEvent.class, name = "reaction"),
        @JsonSubTypes.Type(value = OutboundEvent.StatusChangeEvent.class, name = "status_change"),
        @JsonSubTypes.Type(value = OutboundEvent.OnlineUsersEvent.class, name = "online_users"),
        @JsonSubTypes.Type(value = OutboundEvent.ConnectedEvent.class, name = "connected"),
        @JsonSubTypes.Type(value = OutboundEvent.BroadcastEvent.class, name = "broadcast"),
        @JsonSubTypes.Type(value = OutboundEvent.ChannelUpdateEvent.class, name = "channel_update"),
        @JsonSubTypes.Type(value = OutboundEvent.ErrorEvent.class, name = "error")
})
public interface OutboundEvent {

    record MessageEvent(MessageDto data) implements OutboundEvent {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record TypingEvent(String userId, String username, @JsonProperty("is_typing") boolean typing)
            implements OutboundEvent {

        public static TypingEvent of(Identity who, boolean typing) {
            return new TypingEvent(who.userId().toString(), who.label(), typing);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record UserJoinedEvent(String userId, String username, Instant timestamp) implements OutboundEvent {

        public static UserJoinedEvent of(Identity who) {
            return new UserJoinedEvent(who.userId().toString(), who.label(), Instant.now());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record UserLeftEvent(String userId, String username, Instant timestamp) implements OutboundEvent {

        public static UserLeftEvent of(Identity who) {
            return new UserLeftEvent(who.userId().toString(), who.label(), Instant.now());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record ReadReceiptEvent(String messageId, String userId, String username, Instant timestamp)
            implements OutboundEvent {}

    /** action: add | remove */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record ReactionEvent(String messageId, String userId, String username, String emoji, String action,
                         Instant timestamp) implements OutboundEvent {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record StatusChangeEvent(String userId, String username, @JsonProperty("is_online") boolean online)
            implements OutboundEvent {

        public static StatusChangeEvent of(Identity who, boolean online) {
            return new StatusChangeEvent(who.userId().toString(), who.label(), online);
        }
    }

    /** /ws/online 접속 직후 스냅샷 */
    record OnlineUsersEvent(List<PresenceRecord> users) implements OutboundEvent {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record ConnectedEvent(String channelId, String message) implements OutboundEvent {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record BroadcastEvent(MessageDto data, String senderId, String senderName, Instant timestamp)
            implements OutboundEvent {}

    /** update_type: details | settings | deleted */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record ChannelUpdateEvent(String updateType, ChannelDto data) implements OutboundEvent {}

    record ErrorEvent(String code, String message) implements OutboundEvent {

        public static ErrorEvent of(ChatErrorCode code, String message) {
            return new ErrorEvent(code.wireCode(), message);
        }
    }
}
