package com.rxgate.fulfillmentservice.notification;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationFailure {
    private Long orderId;
    private String reason;
}
