package com.realtime.messaging.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 메시지 저장 후 알림 fan-out 경로.
 * chatExchange(topic) → chat.message.room.{id} / chat.message.channel.{id} → chat.notify-fanout
 */
@Configuration
@EnableRabbit
public class RabbitConfig {

    public static final String CHAT_EXCHANGE = "chatExchange";
    public static final String NOTIFY_FANOUT_QUEUE = "chat.notify-fanout";

    public static final String ROOM_ROUTING_PREFIX = "chat.message.room.";
    public static final String CHANNEL_ROUTING_PREFIX = "chat.message.channel.";

    @Bean
    public TopicExchange chatExchange() {
        return ExchangeBuilder.topicExchange(CHAT_EXCHANGE).durable(true).build();
    }

    @Bean
    public Queue notifyFanoutQueue() {
        return QueueBuilder.durable(NOTIFY_FANOUT_QUEUE).build();
    }

    @Bean
    public Declarables notifyFanoutBindings(Queue notifyFanoutQueue, TopicExchange chatExchange) {
        return new Declarables(
                BindingBuilder.bind(notifyFanoutQueue).to(chatExchange).with(ROOM_ROUTING_PREFIX + "*"),
                BindingBuilder.bind(notifyFanoutQueue).to(chatExchange).with(CHANNEL_ROUTING_PREFIX + "*"));
    }

    @Bean
    public Jackson2JsonMessageConverter chatMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, Jackson2JsonMessageConverter chatMessageConverter) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setExchange(CHAT_EXCHANGE);
        template.setMessageConverter(chatMessageConverter);
        return template;
    }

    @Bean
    public SimpleRabbitListenerContainerFactory rabbitListenerContainerFactory(
            ConnectionFactory connectionFactory, Jackson2JsonMessageConverter chatMessageConverter) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        factory.setConnectionFactory(connectionFactory);
        factory.setMessageConverter(chatMessageConverter);
        // 수신자별 실패는 NotificationService가 처리. 메시지 단위 재큐잉 없음
        factory.setDefaultRequeueRejected(false);
        return factory;
    }
}
