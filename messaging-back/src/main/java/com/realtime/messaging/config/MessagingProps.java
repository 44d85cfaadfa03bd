package com.realtime.messaging.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "app.messaging")
@Data
public class MessagingProps {

    private Ws ws = new Ws();
    private Message message = new Message();
    private History history = new History();
    private Search search = new Search();
    private Fanout fanout = new Fanout();
    private Presence presence = new Presence();

    @Data
    public static class Ws {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
        /** 이 길이를 넘는 프레임은 에러 프레임 후 커넥션 종료 */
        private int maxFrameChars = 16_000;
        /** 느린 클라이언트 송신 한도. 넘으면 해당 커넥션만 끊는다 */
        private int sendTimeLimitMs = 10_000;
        private int sendBufferBytes = 512 * 1024;
    }

    @Data
    public static class Message {
        /** 본문 최대 길이. 저장 컬럼(ChatMessage.MAX_CONTENT_CHARS)보다 클 수 없다 */
        private int maxContentChars = 4000;
    }

    @Data
    public static class History {
        private int defaultLimit = 50;
        private int maxLimit = 200;
    }

    @Data
    public static class Search {
        private int maxResults = 50;
    }

    @Data
    public static class Fanout {
        /** false면 브로커 발행 생략(알림 레코드 미생성) */
        private boolean enabled = true;
    }

    @Data
    public static class Presence {
        /** redis | memory */
        private String store = "redis";
    }
}
