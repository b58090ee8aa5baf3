package com.rxgate.fulfillmentservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.*;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AmqpConfig {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";
    public static final String DLQ_ROUTING_KEY = "dlq";
    public static final String PRESCRIPTION_EXCHANGE = "prescription_events_exchange";

    // consumed by the email/SMS notification service
    public static final String Q_PRESCRIPTION_NOTIFY = "q.notification.prescription";

    public static final String ROUTING_KEY_VERIFIED = "prescription.verified";
    public static final String ROUTING_KEY_REJECTED = "prescription.rejected";

    @Bean
    public TopicExchange deadLetterExchange() {
        return new TopicExchange(DLX_NAME);
    }

    @Bean
    public Queue deadLetterQueue() {
        return new Queue(DLQ_NAME);
    }

    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange()).with("#");
    }

    @Bean
    public TopicExchange prescriptionEventsExchange() {
        return new TopicExchange(PRESCRIPTION_EXCHANGE);
    }

    @Bean
    public Queue prescriptionNotificationQueue() {
        return QueueBuilder.durable(Q_PRESCRIPTION_NOTIFY)
                .withArgument("x-dead-letter-exchange", DLX_NAME)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }

    @Bean
    public Binding prescriptionNotificationBinding(Queue prescriptionNotificationQueue,
            TopicExchange prescriptionEventsExchange) {
        return BindingBuilder.bind(prescriptionNotificationQueue)
                .to(prescriptionEventsExchange)
                .with("prescription.*");
    }

    // shared mapper, so decidedAt goes out as an ISO-8601 string
    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }
}
