package com.realtime.messaging.notify;

import com.realtime.messaging.config.RabbitConfig;
import com.realtime.messaging.message.dto.MessageDto;
import com.realtime.messaging.notify.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.support.AmqpHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationBridge {

    private final NotificationService notificationService;

    @RabbitListener(queues = RabbitConfig.NOTIFY_FANOUT_QUEUE)
    public void onMessage(
            MessageDto message,
            @Header(name = AmqpHeaders.RECEIVED_ROUTING_KEY, required = false) String routingKey
    ) {
        if (message.getMessageId() == null || (message.getRoomId() == null && message.getChannelId() == null)) {
            log.warn("notify bridge dropped: incomplete payload. rk={}", routingKey);
            return;
        }
        notificationService.onMessagePosted(message);
    }
}
