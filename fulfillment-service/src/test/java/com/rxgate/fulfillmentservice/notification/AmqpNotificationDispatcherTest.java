package com.rxgate.fulfillmentservice.notification;

import com.rxgate.common.contracts.PrescriptionDecisionContract;
import com.rxgate.fulfillmentservice.config.AmqpConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AmqpNotificationDispatcher Unit Tests")
class AmqpNotificationDispatcherTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    @InjectMocks
    private AmqpNotificationDispatcher dispatcher;

    private static PrescriptionDecisionContract contract(String status) {
        return PrescriptionDecisionContract.builder()
                .prescriptionId(1L)
                .orderId(5L)
                .prescriptionStatus(status)
                .build();
    }

    @Test
    @DisplayName("should route verified decisions to the verified key")
    void shouldRouteVerified() {
        PrescriptionDecisionContract contract = contract("VERIFIED");

        dispatcher.notify(contract);

        verify(rabbitTemplate).convertAndSend(AmqpConfig.PRESCRIPTION_EXCHANGE, AmqpConfig.ROUTING_KEY_VERIFIED, contract);
    }

    @Test
    @DisplayName("should route rejected decisions to the rejected key")
    void shouldRouteRejected() {
        PrescriptionDecisionContract contract = contract("REJECTED");

        dispatcher.notify(contract);

        verify(rabbitTemplate).convertAndSend(AmqpConfig.PRESCRIPTION_EXCHANGE, AmqpConfig.ROUTING_KEY_REJECTED, contract);
    }

    @Test
    @DisplayName("should wrap broker errors in NotificationException")
    void shouldWrapBrokerErrors() {
        doThrow(new AmqpConnectException(new ConnectException("refused")))
                .when(rabbitTemplate).convertAndSend(anyString(), anyString(), any(Object.class));

        assertThatThrownBy(() -> dispatcher.notify(contract("VERIFIED")))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("order 5");
    }
}
