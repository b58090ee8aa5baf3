package com.rxgate.fulfillmentservice.dto;

import com.rxgate.fulfillmentservice.model.PrescriptionStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DecisionRequest {
    // VERIFIED or REJECTED
    @NotNull(message = "Decision cannot be null")
    private PrescriptionStatus decision;

    private String rejectionReason;
}
