package com.rxgate.fulfillmentservice.dto;

import com.rxgate.fulfillmentservice.model.PrescriptionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionResponse {
    private Long id;
    private String patientIdentifier;
    private String email;
    private String phone;
    private String fileUrl;
    private PrescriptionStatus status;
    private boolean verified;
    private String rejectionReason;
    private List<LineItemResponse> lineItems;
    private Instant createdAt;
    private Instant updatedAt;
}
