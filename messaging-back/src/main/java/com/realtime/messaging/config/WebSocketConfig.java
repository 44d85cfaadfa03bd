package com.realtime.messaging.config;

import com.realtime.messaging.gateway.ws.AuthHandshakeInterceptor;
import com.realtime.messaging.gateway.ws.ChatWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatWebSocketHandler chatWebSocketHandler;
    private final AuthHandshakeInterceptor authHandshakeInterceptor;
    private final MessagingProps props;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatWebSocketHandler, "/ws/chat/*", "/ws/channel/*", "/ws/online")
                .addInterceptors(authHandshakeInterceptor)
                .setAllowedOrigins(props.getWs().getAllowedOrigins().toArray(String[]::new)); // React 클라이언트
    }

    // 컨테이너 버퍼는 넉넉히. 크기 초과 판정은 게이트웨이가 에러 프레임과 함께 한다
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        int buffer = Math.max(8192, props.getWs().getMaxFrameChars() * 4);
        container.setMaxTextMessageBufferSize(buffer);
        return container;
    }
}
