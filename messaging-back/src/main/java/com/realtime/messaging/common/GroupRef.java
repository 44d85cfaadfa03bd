package com.realtime.messaging.common;

import java.util.Objects;

/**
 * 커넥션이 구독할 수 있는 그룹(방 / 채널 / 전역 presence).
 * key()는 GroupRegistry의 키로 쓰인다.
 */
public record GroupRef(Type type, String id) {

    public enum Type { ROOM, CHANNEL, PRESENCE }

    public static final String PRESENCE_ID = "online_users";

    private static final GroupRef PRESENCE_GROUP = new GroupRef(Type.PRESENCE, PRESENCE_ID);

    public GroupRef {
        Objects.requireNonNull(type, "type");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("group id is required");
        }
    }

    public static GroupRef room(String roomId) {
        return new GroupRef(Type.ROOM, roomId);
    }

    public static GroupRef channel(String channelId) {
        return new GroupRef(Type.CHANNEL, channelId);
    }

    public static GroupRef presence() {
        return PRESENCE_GROUP;
    }

    public boolean isRoom() {
        return type == Type.ROOM;
    }

    public boolean isChannel() {
        return type == Type.CHANNEL;
    }

    public boolean isPresence() {
        return type == Type.PRESENCE;
    }

    /** room:{id} / channel:{id} / presence:online_users */
    public String key() {
        return type.name().toLowerCase() + ":" + id;
    }

    @Override
    public String toString() {
        return key();
    }
}
