package com.rxgate.fulfillmentservice.notification;

import com.rxgate.common.contracts.PrescriptionDecisionContract;
import com.rxgate.fulfillmentservice.config.AmqpConfig;
import com.rxgate.fulfillmentservice.model.PrescriptionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes decisions to the prescription events exchange; the notification
 * service renders and sends the actual messages.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AmqpNotificationDispatcher implements NotificationDispatcher {

    private final RabbitTemplate rabbitTemplate;

    @Override
    public void notify(PrescriptionDecisionContract contract) {
        String routingKey = PrescriptionStatus.VERIFIED.name().equals(contract.getPrescriptionStatus())
                ? AmqpConfig.ROUTING_KEY_VERIFIED
                : AmqpConfig.ROUTING_KEY_REJECTED;

        try {
            rabbitTemplate.convertAndSend(AmqpConfig.PRESCRIPTION_EXCHANGE, routingKey, contract);
            log.info("'{}' event sent: prescriptionId={}, orderId={}",
                    routingKey, contract.getPrescriptionId(), contract.getOrderId());
        } catch (AmqpException e) {
            throw new NotificationException("Failed to publish " + routingKey
                    + " for order " + contract.getOrderId(), e);
        }
    }
}
