package com.realtime.messaging.presence;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** 단일 노드/로컬 개발용. app.messaging.presence.store=memory */
@Component
@ConditionalOnProperty(name = "app.messaging.presence.store", havingValue = "memory")
public class InMemoryPresenceStore implements PresenceStore {

    private final Map<UUID, PresenceRecord> records = new ConcurrentHashMap<>();

    @Override
    public void upsert(UUID userId, boolean online, Instant lastSeen) {
        records.put(userId, new PresenceRecord(userId, online, lastSeen));
    }

    @Override
    public Optional<PresenceRecord> find(UUID userId) {
        return Optional.ofNullable(records.get(userId));
    }

    @Override
    public List<PresenceRecord> findOnline(Collection<UUID> userIds) {
        return records.values().stream()
                .filter(PresenceRecord::online)
                .filter(r -> userIds == null || userIds.contains(r.userId()))
                .toList();
    }
}
