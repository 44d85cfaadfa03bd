package com.realtime.messaging.presence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 온라인/오프라인 상태 관리.
 *
 * <p>한 사용자가 여러 커넥션(브라우저 탭 여러 개)을 가질 수 있으므로 게이트웨이는
 * {@link #connectionOpened}/{@link #connectionClosed}만 호출하고, 오프라인 전환은
 * 마지막 커넥션이 닫힐 때만 일어난다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PresenceService {

    private final PresenceStore store;

    // 이 노드의 사용자별 살아있는 커넥션 수
    private final Map<UUID, Integer> connections = new ConcurrentHashMap<>();

    public void setOnline(UUID userId) {
        store.upsert(userId, true, Instant.now());
    }

    public void setOffline(UUID userId) {
        store.upsert(userId, false, Instant.now());
    }

    /** @return 이 사용자의 첫 커넥션이면 true (온라인 전환) */
    public boolean connectionOpened(UUID userId) {
        int count = connections.merge(userId, 1, Integer::sum);
        if (count == 1) {
            write(userId, true);
            return true;
        }
        return false;
    }

    /** @return 마지막 커넥션이 닫혔으면 true (오프라인 전환) */
    public boolean connectionClosed(UUID userId) {
        boolean[] last = {false};
        connections.computeIfPresent(userId, (k, v) -> {
            if (v <= 1) {
                last[0] = true;
                return null;
            }
            return v - 1;
        });
        if (last[0]) {
            write(userId, false);
        }
        return last[0];
    }

    public int connectionCount(UUID userId) {
        return connections.getOrDefault(userId, 0);
    }

    public List<PresenceRecord> getOnlineUsers(Collection<UUID> userIds) {
        return store.findOnline(userIds);
    }

    public List<PresenceRecord> getOnlineUsers() {
        return store.findOnline(null);
    }

    public Optional<PresenceRecord> getStatus(UUID userId) {
        return store.find(userId);
    }

    public boolean isOnline(UUID userId) {
        return store.find(userId).map(PresenceRecord::online).orElse(false);
    }

    // 저장소 쓰기는 락 밖에서. open/close가 경합해 순서가 뒤집히면 현재 카운트 기준으로 한 번 더 맞춘다
    private void write(UUID userId, boolean online) {
        try {
            store.upsert(userId, online, Instant.now());
            boolean actual = connectionCount(userId) > 0;
            if (actual != online) {
                store.upsert(userId, actual, Instant.now());
            }
        } catch (DataAccessException e) {
            log.warn("presence write failed: userId={}, online={}, cause={}", userId, online, e.getMessage());
        }
    }
}
