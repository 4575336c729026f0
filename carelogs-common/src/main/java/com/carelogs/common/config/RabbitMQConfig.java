package com.carelogs.common.config;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Queues carrying object-storage upload events to the two pipelines.
 * Messages are delivered as raw event JSON and parsed by the listener.
 */
@Configuration
@EnableRabbit
public class RabbitMQConfig {

    // Queue names
    public static final String CLASSIFY_QUEUE = "carelogs.visits.classify";
    public static final String SUMMARISE_QUEUE = "carelogs.visits.summarise";

    // Exchange names
    public static final String CARELOGS_EXCHANGE = "carelogs.exchange";
    public static final String DEAD_LETTER_EXCHANGE = "carelogs.dlx";

    // Routing keys
    public static final String CLASSIFY_KEY = "visits.classify";
    public static final String SUMMARISE_KEY = "visits.summarise";

    /**
     * Main exchange for routing upload events
     */
    @Bean
    public DirectExchange careLogsExchange() {
        return new DirectExchange(CARELOGS_EXCHANGE, true, false);
    }

    /**
     * Queue for per-visit urgency classification
     */
    @Bean
    public Queue classifyQueue() {
        return QueueBuilder.durable(CLASSIFY_QUEUE)
                .withArgument("x-dead-letter-exchange", DEAD_LETTER_EXCHANGE)
                .build();
    }

    /**
     * Queue for per-client visit summarisation
     */
    @Bean
    public Queue summariseQueue() {
        return QueueBuilder.durable(SUMMARISE_QUEUE)
                .withArgument("x-dead-letter-exchange", DEAD_LETTER_EXCHANGE)
                .build();
    }

    @Bean
    public Binding classifyBinding() {
        return BindingBuilder
                .bind(classifyQueue())
                .to(careLogsExchange())
                .with(CLASSIFY_KEY);
    }

    @Bean
    public Binding summariseBinding() {
        return BindingBuilder
                .bind(summariseQueue())
                .to(careLogsExchange())
                .with(SUMMARISE_KEY);
    }
}
