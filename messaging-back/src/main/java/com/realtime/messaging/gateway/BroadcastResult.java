package com.realtime.messaging.gateway;

import java.util.List;

/**
 * 브로드캐스트 1회의 수신자별 결과. failed에는 전송 실패로 끊긴 커넥션 id.
 */
public record BroadcastResult(String groupKey, List<String> delivered, List<String> failed) {

    public static BroadcastResult empty(String groupKey) {
        return new BroadcastResult(groupKey, List.of(), List.of());
    }

    public int deliveredCount() {
        return delivered.size();
    }

    public boolean allDelivered() {
        return failed.isEmpty();
    }
}
