package com.realtime.messaging.gateway.ws;

import com.realtime.messaging.common.GroupRef;
import com.realtime.messaging.config.MessagingProps;
import com.realtime.messaging.gateway.ChatGateway;
import com.realtime.messaging.gateway.ClientConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket 콜백 → ChatGateway. afterConnectionClosed는 정상/비정상 종료 모두에서 불리므로
 * 정리는 항상 여기서 시작된다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private static final String ATTR_CONNECTION = "ws.connection";

    private final ChatGateway gateway;
    private final MessagingProps props;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ClientConnection conn = new WsClientConnection(session,
                props.getWs().getSendTimeLimitMs(), props.getWs().getSendBufferBytes());
        session.getAttributes().put(ATTR_CONNECTION, conn);

        GroupRef group = (GroupRef) session.getAttributes().get(AuthHandshakeInterceptor.ATTR_GROUP);
        String credential = (String) session.getAttributes().get(AuthHandshakeInterceptor.ATTR_CREDENTIAL);
        if (group == null) {
            conn.close(ClientConnection.CloseReason.POLICY_VIOLATION);
            return;
        }
        gateway.connect(conn, credential, group);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection conn = connectionOf(session);
        if (conn != null) {
            gateway.receive(conn, message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("ws transport error: sessionId={}, cause={}", session.getId(), exception.toString());
        ClientConnection conn = connectionOf(session);
        if (conn != null) {
            conn.close(ClientConnection.CloseReason.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection conn = connectionOf(session);
        if (conn != null) {
            gateway.disconnect(conn);
        }
    }

    private static ClientConnection connectionOf(WebSocketSession session) {
        return (ClientConnection) session.getAttributes().get(ATTR_CONNECTION);
    }
}
