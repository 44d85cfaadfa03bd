package com.realtime.messaging.gateway.ws;

import com.realtime.messaging.gateway.ClientConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * WebSocketSession 어댑터. 동시 전송은 ConcurrentWebSocketSessionDecorator가 직렬화하고,
 * 시간/버퍼 한도를 넘는 느린 클라이언트는 decorator가 끊는다.
 */
@Slf4j
public class WsClientConnection implements ClientConnection {

    private final WebSocketSession session;

    public WsClientConnection(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close(CloseReason reason) {
        if (!session.isOpen()) return;
        try {
            session.close(toStatus(reason));
        } catch (IOException e) {
            log.debug("ws close failed: sessionId={}, cause={}", session.getId(), e.getMessage());
        }
    }

    static CloseStatus toStatus(CloseReason reason) {
        return switch (reason) {
            case NORMAL -> CloseStatus.NORMAL;
            case POLICY_VIOLATION -> CloseStatus.POLICY_VIOLATION;
            case TOO_BIG -> CloseStatus.TOO_BIG_TO_PROCESS;
            case SERVER_ERROR -> CloseStatus.SERVER_ERROR;
        };
    }
}
