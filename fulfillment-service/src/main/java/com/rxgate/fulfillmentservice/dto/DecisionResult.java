package com.rxgate.fulfillmentservice.dto;

import com.rxgate.fulfillmentservice.model.PrescriptionStatus;
import com.rxgate.fulfillmentservice.notification.NotificationFailure;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a committed prescription decision. Notification failures are
 * reported here and never undo the decision.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionResult {
    private Long prescriptionId;
    private PrescriptionStatus status;
    private String rejectionReason;
    private Instant decidedAt;

    @Builder.Default
    private List<AffectedOrder> affectedOrders = new ArrayList<>();

    @Builder.Default
    private List<NotificationFailure> notificationFailures = new ArrayList<>();
}
