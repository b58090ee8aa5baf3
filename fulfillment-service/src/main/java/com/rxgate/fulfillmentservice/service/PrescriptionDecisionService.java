package com.rxgate.fulfillmentservice.service;

import com.rxgate.common.contracts.PrescriptionDecisionContract;
import com.rxgate.common.exception.InvalidInputException;
import com.rxgate.common.exception.ResourceNotFoundException;
import com.rxgate.fulfillmentservice.config.FulfillmentProperties;
import com.rxgate.fulfillmentservice.config.RejectionPolicy;
import com.rxgate.fulfillmentservice.dto.AffectedOrder;
import com.rxgate.fulfillmentservice.dto.DecisionResult;
import com.rxgate.fulfillmentservice.exception.PrescriptionAlreadyProcessedException;
import com.rxgate.fulfillmentservice.exception.RejectionReasonRequiredException;
import com.rxgate.fulfillmentservice.model.Order;
import com.rxgate.fulfillmentservice.model.OrderStatus;
import com.rxgate.fulfillmentservice.model.Prescription;
import com.rxgate.fulfillmentservice.model.PrescriptionStatus;
import com.rxgate.fulfillmentservice.notification.NotificationFailure;
import com.rxgate.fulfillmentservice.notification.NotificationFanout;
import com.rxgate.fulfillmentservice.repository.OrderRepository;
import com.rxgate.fulfillmentservice.repository.PrescriptionRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies a reviewer's decision to a prescription and every order waiting on it.
 *
 * The status change, order updates and stock releases commit together or not
 * at all. Notifications go out only after the commit and cannot undo it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PrescriptionDecisionService {

    static final String REJECTION_REASON_PREFIX = "Prescription rejected: ";

    private final PrescriptionRepository prescriptionRepository;
    private final OrderRepository orderRepository;
    private final InventoryReleaseService inventoryReleaseService;
    private final NotificationFanout notificationFanout;
    private final FulfillmentProperties properties;

    @Autowired
    @Lazy
    private PrescriptionDecisionService self;

    /**
     * Decides a PENDING prescription.
     *
     * 1. Transaction (through the {@code self} proxy): compare-and-swap the
     *    status, move linked orders, release stock.
     * 2. After commit: notify per affected order, collecting failures.
     *
     * @throws ResourceNotFoundException if the prescription does not exist
     * @throws PrescriptionAlreadyProcessedException if it is no longer PENDING,
     *         including when a concurrent decision won the race
     * @throws RejectionReasonRequiredException if rejecting without a reason
     */
    public DecisionResult decide(Long prescriptionId, PrescriptionStatus decision, String rejectionReason) {
        log.info("Prescription decision requested: prescriptionId={}, decision={}", prescriptionId, decision);

        AppliedDecision applied = self.applyDecision(prescriptionId, decision, rejectionReason);

        List<NotificationFailure> failures = notificationFanout.dispatchAll(applied.getNotifications());
        if (!failures.isEmpty()) {
            log.warn("Decision committed but {} notification(s) failed: prescriptionId={}",
                    failures.size(), prescriptionId);
        }

        DecisionResult result = applied.getResult();
        result.setNotificationFailures(failures);
        return result;
    }

    @Transactional
    public AppliedDecision applyDecision(Long prescriptionId, PrescriptionStatus decision, String rejectionReason) {
        if (decision != PrescriptionStatus.VERIFIED && decision != PrescriptionStatus.REJECTED) {
            throw new InvalidInputException("Decision must be VERIFIED or REJECTED, got: " + decision);
        }

        Prescription prescription = prescriptionRepository.findById(prescriptionId)
                .orElseThrow(() -> {
                    log.warn("Prescription not found: prescriptionId={}", prescriptionId);
                    return new ResourceNotFoundException("Prescription not found with id: " + prescriptionId);
                });

        if (prescription.getStatus() != PrescriptionStatus.PENDING) {
            log.warn("Prescription already processed: prescriptionId={}, status={}",
                    prescriptionId, prescription.getStatus());
            throw new PrescriptionAlreadyProcessedException(
                    "Prescription " + prescriptionId + " is already " + prescription.getStatus());
        }

        String reason = null;
        if (decision == PrescriptionStatus.REJECTED) {
            if (rejectionReason == null || rejectionReason.isBlank()) {
                log.warn("Rejection without reason: prescriptionId={}", prescriptionId);
                throw new RejectionReasonRequiredException("A reason is required to reject a prescription");
            }
            reason = rejectionReason.trim();
        }

        Instant now = Instant.now();
        int updated = prescriptionRepository.transitionStatus(prescriptionId, PrescriptionStatus.PENDING,
                decision, decision == PrescriptionStatus.VERIFIED, reason, now);
        if (updated == 0) {
            // lost the race against another reviewer (or the status changed after our read)
            log.warn("Concurrent decision detected: prescriptionId={}", prescriptionId);
            throw new PrescriptionAlreadyProcessedException(
                    "Prescription " + prescriptionId + " was processed concurrently");
        }

        List<Order> orders = orderRepository.findByPrescriptionIdAndStatusNotIn(
                prescriptionId, OrderStatus.terminalStatuses());
        List<AffectedOrder> affected = new ArrayList<>();
        for (Order order : orders) {
            applyToOrder(order, decision, reason, now);
            affected.add(new AffectedOrder(order.getId(), order.getStatus()));
        }
        orderRepository.saveAll(orders);

        log.info("Prescription decided: prescriptionId={}, status={}, affectedOrders={}",
                prescriptionId, decision, affected.size());

        DecisionResult result = DecisionResult.builder()
                .prescriptionId(prescriptionId)
                .status(decision)
                .rejectionReason(reason)
                .decidedAt(now)
                .affectedOrders(affected)
                .build();

        return new AppliedDecision(result, buildNotifications(prescription, decision, reason, affected, now));
    }

    private void applyToOrder(Order order, PrescriptionStatus decision, String reason, Instant now) {
        OrderStatus previous = order.getStatus();

        if (decision == PrescriptionStatus.VERIFIED) {
            order.setStatus(OrderStatus.PENDING);
        } else {
            RejectionPolicy policy = properties.getPrescription().getRejectionPolicy();
            if (policy == RejectionPolicy.CANCEL) {
                order.setStatus(OrderStatus.CANCELLED);
                order.setCancelReason(REJECTION_REASON_PREFIX + reason);
                order.setCancelledAt(now);
            } else {
                order.setStatus(OrderStatus.PENDING_PRESCRIPTION);
            }
            int released = inventoryReleaseService.releaseReservations(order);
            log.info("Reservations released for rejected prescription: orderId={}, units={}, policy={}",
                    order.getId(), released, policy);
        }

        log.info("Order status updated by prescription decision: orderId={}, {} -> {}",
                order.getId(), previous, order.getStatus());
    }

    // one per affected order
    private List<PrescriptionDecisionContract> buildNotifications(Prescription prescription,
            PrescriptionStatus decision, String reason, List<AffectedOrder> affected, Instant now) {
        List<PrescriptionDecisionContract> contracts = new ArrayList<>();
        for (AffectedOrder order : affected) {
            contracts.add(contract(prescription, decision, reason, order, now));
        }
        return contracts;
    }

    private PrescriptionDecisionContract contract(Prescription prescription, PrescriptionStatus decision,
            String reason, AffectedOrder order, Instant now) {
        return PrescriptionDecisionContract.builder()
                .prescriptionId(prescription.getId())
                .patientIdentifier(prescription.getPatientIdentifier())
                .email(prescription.getEmail())
                .phone(prescription.getPhone())
                .prescriptionStatus(decision.name())
                .rejectionReason(reason)
                .orderId(order.getOrderId())
                .orderStatus(order.getStatus().name())
                .decidedAt(now)
                .build();
    }

    /**
     * What the decision transaction committed, plus the notifications to send for it.
     */
    @Getter
    @AllArgsConstructor
    public static class AppliedDecision {
        private final DecisionResult result;
        private final List<PrescriptionDecisionContract> notifications;
    }
}
