package com.chaski.deliveryservice.config;

import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitMQConfig {

    public static final String EXCHANGE_NAME = "package-exchange";

    /**
     * Bid and package events go to a topic exchange; the notification dispatcher
     * binds its own queues with {@code bid.#} / {@code package.#} patterns.
     */
    @Bean
    public TopicExchange packageExchange() {
        return new TopicExchange(EXCHANGE_NAME, true, false);
    }

    /**
     * This bean tells the RabbitTemplate (the "sender")
     * to ALWAYS send messages as JSON, not serialized Java objects.
     */
    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }
}
