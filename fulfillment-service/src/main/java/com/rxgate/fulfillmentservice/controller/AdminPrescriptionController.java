package com.rxgate.fulfillmentservice.controller;

import com.rxgate.common.exception.AccessDeniedException;
import com.rxgate.fulfillmentservice.config.ClientRoles;
import com.rxgate.fulfillmentservice.dto.DecisionRequest;
import com.rxgate.fulfillmentservice.dto.DecisionResult;
import com.rxgate.fulfillmentservice.service.PrescriptionDecisionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/v1/admin/prescriptions")
@RequiredArgsConstructor
public class AdminPrescriptionController {

    private final PrescriptionDecisionService decisionService;
    private final ClientRoles clientRoles;

    @PostMapping("/{prescriptionId}/decision")
    public ResponseEntity<DecisionResult> decide(
            @PathVariable Long prescriptionId,
            @Valid @RequestBody DecisionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        if (!clientRoles.hasRole(jwt, ClientRoles.PRESCRIPTION_REVIEWER)) {
            log.warn("Access denied: user {} attempted to decide prescription {} without {} role",
                    jwt.getSubject(), prescriptionId, ClientRoles.PRESCRIPTION_REVIEWER);
            throw new AccessDeniedException("Access Denied: Only prescription reviewers can decide prescriptions");
        }

        DecisionResult result = decisionService.decide(prescriptionId, request.getDecision(), request.getRejectionReason());
        return ResponseEntity.ok(result);
    }
}
