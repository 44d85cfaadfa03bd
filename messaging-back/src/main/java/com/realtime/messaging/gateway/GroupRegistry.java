package com.realtime.messaging.gateway;

import com.realtime.messaging.gateway.frame.FrameCodec;
import com.realtime.messaging.gateway.frame.OutboundEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 그룹 키 → 살아있는 커넥션 집합.
 *
 * <p>broadcast는 그룹 단위 락 안에서 수신자마다 따로 전송하고 결과를 모은다.
 * 한 수신자의 실패는 그 커넥션을 끊고 실패 리스너(게이트웨이의 disconnect 정리)를 부를 뿐,
 * 다른 수신자 전송이나 호출자에게 영향을 주지 않는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GroupRegistry {

    private final FrameCodec frameCodec;

    private final Map<String, Group> groups = new ConcurrentHashMap<>();
    private final List<Consumer<ClientConnection>> failureListeners = new CopyOnWriteArrayList<>();

    public void onDeliveryFailure(Consumer<ClientConnection> listener) {
        failureListeners.add(listener);
    }

    /** @return 새로 들어갔으면 true, 이미 있었으면 false */
    public boolean join(String groupKey, ClientConnection connection) {
        boolean[] added = {false};
        // leave가 빈 그룹을 지우는 것과 경합하지 않도록 compute 안에서 추가
        groups.compute(groupKey, (k, g) -> {
            Group target = g == null ? new Group() : g;
            added[0] = target.members.putIfAbsent(connection.id(), connection) == null;
            return target;
        });
        return added[0];
    }

    public boolean leave(String groupKey, ClientConnection connection) {
        boolean[] removed = {false};
        groups.computeIfPresent(groupKey, (k, g) -> {
            removed[0] = g.members.remove(connection.id()) != null;
            return g.members.isEmpty() ? null : g;
        });
        return removed[0];
    }

    /** @return 빠져나온 그룹 키 */
    public Set<String> leaveAll(ClientConnection connection) {
        Set<String> left = new HashSet<>();
        for (String key : List.copyOf(groups.keySet())) {
            if (leave(key, connection)) left.add(key);
        }
        return left;
    }

    public BroadcastResult broadcast(String groupKey, OutboundEvent event) {
        return broadcast(groupKey, event, null);
    }

    /**
     * @param excludeConnectionId 이 커넥션에는 보내지 않는다(타이핑 표시 등 본인 에코 방지)
     */
    public BroadcastResult broadcast(String groupKey, OutboundEvent event, @Nullable String excludeConnectionId) {
        Group group = groups.get(groupKey);
        if (group == null) return BroadcastResult.empty(groupKey);

        String payload = frameCodec.encode(event);
        List<String> delivered = new ArrayList<>();
        List<ClientConnection> failed = new ArrayList<>();

        synchronized (group) {
            for (ClientConnection c : List.copyOf(group.members.values())) {
                if (c.id().equals(excludeConnectionId)) continue;
                try {
                    if (!c.isOpen()) throw new IllegalStateException("connection closed");
                    c.send(payload);
                    delivered.add(c.id());
                } catch (Exception e) {
                    log.warn("broadcast delivery failed: group={}, connectionId={}, cause={}",
                            groupKey, c.id(), e.toString());
                    failed.add(c);
                }
            }
        }

        // 락 밖에서 정리 (정리 과정이 다시 broadcast를 부를 수 있음)
        for (ClientConnection c : failed) {
            abort(c);
        }
        return new BroadcastResult(groupKey, delivered, failed.stream().map(ClientConnection::id).toList());
    }

    public Set<String> members(String groupKey) {
        Group g = groups.get(groupKey);
        return g == null ? Set.of() : Set.copyOf(g.members.keySet());
    }

    public int size(String groupKey) {
        Group g = groups.get(groupKey);
        return g == null ? 0 : g.members.size();
    }

    private void abort(ClientConnection c) {
        try {
            c.close(ClientConnection.CloseReason.SERVER_ERROR);
        } catch (RuntimeException e) {
            log.debug("close after failed delivery threw: connectionId={}, cause={}", c.id(), e.toString());
        }
        for (Consumer<ClientConnection> l : failureListeners) {
            try {
                l.accept(c);
            } catch (RuntimeException e) {
                log.error("delivery failure listener failed: connectionId={}", c.id(), e);
            }
        }
    }

    private static final class Group {
        private final Map<String, ClientConnection> members = new ConcurrentHashMap<>();
    }
}
