package com.realtime.messaging.notify.service;

import com.realtime.messaging.config.MessagingProps;
import com.realtime.messaging.config.RabbitConfig;
import com.realtime.messaging.message.dto.MessageDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * 저장된 메시지를 브로커로 발행. 알림 생성은 NotificationBridge가 큐에서 받아 처리한다.
 * 발신자 응답을 막지 않도록 비동기.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatFanoutService {

    private final RabbitTemplate rabbitTemplate;
    private final MessagingProps props;

    @Async("chatExecutor")
    public void publishToBrokerAsync(MessageDto msg) {
        if (!props.getFanout().isEnabled()) return;

        String routingKey = routingKey(msg);
        try {
            rabbitTemplate.convertAndSend(RabbitConfig.CHAT_EXCHANGE, routingKey, msg);
        } catch (AmqpException e) {
            // 발신자의 저장은 이미 성공. 알림만 누락되고 재시도하지 않는다
            log.warn("fan-out publish failed: rk={}, messageId={}, cause={}",
                    routingKey, msg.getMessageId(), e.getMessage());
        }
    }

    static String routingKey(MessageDto msg) {
        return msg.getRoomId() != null
                ? RabbitConfig.ROOM_ROUTING_PREFIX + msg.getRoomId()
                : RabbitConfig.CHANNEL_ROUTING_PREFIX + msg.getChannelId();
    }
}
