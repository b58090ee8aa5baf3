package com.rxgate.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Published once per affected order after a prescription decision commits.
 *
 * Consumers (email/SMS senders) use the contact fields to reach the patient.
 * Either contact field may be null when the patient was identified by an
 * opaque identifier only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionDecisionContract {
    private Long prescriptionId;
    private String patientIdentifier;
    private String email; // nullable
    private String phone; // nullable, normalized international form
    private String prescriptionStatus;
    private String rejectionReason; // only for REJECTED
    private Long orderId;
    private String orderStatus;
    private Instant decidedAt;
}
