package com.rxgate.fulfillmentservice.dto;

import com.rxgate.fulfillmentservice.model.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AffectedOrder {
    private Long orderId;
    private OrderStatus status;
}
