package com.rxgate.fulfillmentservice.dto;

import com.rxgate.fulfillmentservice.model.OrderStatus;
import com.rxgate.fulfillmentservice.model.PrescriptionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Where each item of the patient's current prescription can be obtained.
 * {@code items} is empty until the prescription is verified.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FulfillmentOptionsResponse {
    private Long prescriptionId;
    private PrescriptionStatus status;
    private boolean verified;
    private String fileUrl;
    private Instant createdAt;
    private List<LineItemOptions> items;

    // most recent order linked to the prescription
    private Long orderId;
    private OrderStatus orderStatus;
}
