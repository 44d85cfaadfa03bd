package com.realtime.messaging.gateway.ws;

import com.realtime.messaging.common.GroupRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * 핸드셰이크에서 토큰과 대상 그룹만 꺼내 세션 속성에 담는다.
 * 토큰 검증/권한 판정은 게이트웨이에서 한다(에러 프레임을 보내고 닫기 위해).
 *
 * <ul>
 *   <li>/ws/chat/{roomId}</li>
 *   <li>/ws/channel/{channelId}</li>
 *   <li>/ws/online</li>
 * </ul>
 * 토큰: ?token=... 또는 Authorization: Bearer ...
 */
@Component
@Slf4j
public class AuthHandshakeInterceptor implements HandshakeInterceptor {

    public static final String ATTR_CREDENTIAL = "ws.credential";
    public static final String ATTR_GROUP = "ws.group";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        GroupRef group = groupFromPath(request.getURI().getPath());
        if (group == null) {
            log.debug("ws handshake refused, unknown path: {}", request.getURI().getPath());
            response.setStatusCode(HttpStatus.NOT_FOUND);
            return false;
        }
        attributes.put(ATTR_GROUP, group);

        String token = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst("token");
        if (token == null || token.isBlank()) {
            String auth = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
            if (auth != null && auth.startsWith("Bearer ")) token = auth.substring(7);
        }
        if (token != null && !token.isBlank()) {
            attributes.put(ATTR_CREDENTIAL, token.trim());
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("ws handshake failed: uri={}, cause={}", request.getURI(), exception.getMessage());
        }
    }

    static GroupRef groupFromPath(String path) {
        if (path == null) return null;
        String p = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        if (p.equals("/ws/online")) return GroupRef.presence();

        String[] parts = p.split("/");
        // ["", "ws", "chat", "{id}"]
        if (parts.length != 4 || !"ws".equals(parts[1]) || parts[3].isBlank()) return null;
        return switch (parts[2]) {
            case "chat" -> GroupRef.room(parts[3]);
            case "channel" -> GroupRef.channel(parts[3]);
            default -> null;
        };
    }
}
