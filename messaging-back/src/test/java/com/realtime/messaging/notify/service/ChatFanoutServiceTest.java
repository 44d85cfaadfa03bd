package com.realtime.messaging.notify.service;

import com.realtime.messaging.config.MessagingProps;
import com.realtime.messaging.config.RabbitConfig;
import com.realtime.messaging.message.dto.MessageDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChatFanoutService")
class ChatFanoutServiceTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    private MessagingProps props;
    private ChatFanoutService service;

    @BeforeEach
    void setUp() {
        props = new MessagingProps();
        service = new ChatFanoutService(rabbitTemplate, props);
    }

    @Test
    @DisplayName("routes room and channel messages by group")
    void routingKeys() {
        assertEquals("chat.message.room.r1", ChatFanoutService.routingKey(MessageDto.builder().roomId("r1").build()));
        assertEquals("chat.message.channel.c1", ChatFanoutService.routingKey(MessageDto.builder().channelId("c1").build()));
    }

    @Test
    @DisplayName("publishes to the chat exchange")
    void publishes() {
        MessageDto m = MessageDto.builder().messageId("m1").roomId("r1").build();

        service.publishToBrokerAsync(m);

        verify(rabbitTemplate).convertAndSend(RabbitConfig.CHAT_EXCHANGE, "chat.message.room.r1", m);
    }

    @Test
    @DisplayName("does nothing when fan-out is disabled")
    void disabled() {
        props.getFanout().setEnabled(false);

        service.publishToBrokerAsync(MessageDto.builder().messageId("m1").roomId("r1").build());

        verifyNoInteractions(rabbitTemplate);
    }

    @Test
    @DisplayName("a broker outage does not reach the caller")
    void brokerDown() {
        doThrow(new AmqpConnectException(new ConnectException("refused")))
                .when(rabbitTemplate).convertAndSend(anyString(), anyString(), any(Object.class));

        assertDoesNotThrow(() -> service.publishToBrokerAsync(MessageDto.builder().messageId("m1").channelId("c1").build()));
        verify(rabbitTemplate).convertAndSend(eq(RabbitConfig.CHAT_EXCHANGE), eq("chat.message.channel.c1"), any(Object.class));
    }
}
