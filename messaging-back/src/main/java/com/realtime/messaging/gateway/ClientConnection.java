package com.realtime.messaging.gateway;

import java.io.IOException;

/**
 * 게이트웨이가 보는 클라이언트 커넥션. 전송 계층(WebSocket 등)이 구현한다.
 *
 * <p>send는 여러 스레드에서 동시에 호출될 수 있다. close는 여러 번 불려도 되고,
 * 전송 계층의 close 콜백을 통해 {@link ChatGateway#disconnect}로 이어져야 한다.
 */
public interface ClientConnection {

    String id();

    void send(String payload) throws IOException;

    boolean isOpen();

    void close(CloseReason reason);

    enum CloseReason {
        NORMAL,
        /** 인증 실패, 권한 없음 */
        POLICY_VIOLATION,
        /** 최대 프레임 크기 초과 */
        TOO_BIG,
        /** 전송 실패 등 서버 측 사유 */
        SERVER_ERROR
    }
}
