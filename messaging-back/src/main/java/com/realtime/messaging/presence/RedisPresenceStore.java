package com.realtime.messaging.presence;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * presence:online      = 온라인 사용자 SET
 * presence:last-seen   = userId -> epoch millis HASH
 */
@Component
@ConditionalOnProperty(name = "app.messaging.presence.store", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedisPresenceStore implements PresenceStore {

    static final String ONLINE_KEY = "presence:online";
    static final String LAST_SEEN_KEY = "presence:last-seen";

    private final StringRedisTemplate redis;

    @Override
    public void upsert(UUID userId, boolean online, Instant lastSeen) {
        String id = userId.toString();
        if (online) {
            redis.opsForSet().add(ONLINE_KEY, id);
        } else {
            redis.opsForSet().remove(ONLINE_KEY, id);
        }
        redis.opsForHash().put(LAST_SEEN_KEY, id, String.valueOf(lastSeen.toEpochMilli()));
    }

    @Override
    public Optional<PresenceRecord> find(UUID userId) {
        String id = userId.toString();
        Object seen = redis.opsForHash().get(LAST_SEEN_KEY, id);
        if (seen == null) return Optional.empty();
        boolean online = Boolean.TRUE.equals(redis.opsForSet().isMember(ONLINE_KEY, id));
        return Optional.of(new PresenceRecord(userId, online, toInstant(seen)));
    }

    @Override
    public List<PresenceRecord> findOnline(Collection<UUID> userIds) {
        Set<String> members = redis.opsForSet().members(ONLINE_KEY);
        if (members == null || members.isEmpty()) return List.of();

        List<Object> ids = new ArrayList<>();
        for (String m : members) {
            if (userIds == null || userIds.contains(UUID.fromString(m))) ids.add(m);
        }
        if (ids.isEmpty()) return List.of();

        List<Object> seen = redis.opsForHash().multiGet(LAST_SEEN_KEY, ids);
        List<PresenceRecord> out = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            Object s = (seen != null && i < seen.size()) ? seen.get(i) : null;
            out.add(new PresenceRecord(UUID.fromString((String) ids.get(i)), true, s == null ? null : toInstant(s)));
        }
        return out;
    }

    private static Instant toInstant(Object epochMillis) {
        return Instant.ofEpochMilli(Long.parseLong(epochMillis.toString()));
    }
}
