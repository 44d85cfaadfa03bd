package com.realtime.messaging.presence;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 사용자별 presence 레코드 저장소. 사용자당 레코드 하나, upsert / last-write-wins.
 */
public interface PresenceStore {

    void upsert(UUID userId, boolean online, Instant lastSeen);

    Optional<PresenceRecord> find(UUID userId);

    /** userIds가 null이면 온라인 전체 */
    List<PresenceRecord> findOnline(Collection<UUID> userIds);
}
