package com.rxgate.fulfillmentservice.service;

import com.rxgate.fulfillmentservice.model.CoverageStatus;
import com.rxgate.fulfillmentservice.model.Prescription;
import com.rxgate.fulfillmentservice.model.PrescriptionStatus;
import com.rxgate.fulfillmentservice.repository.PrescriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tells a client, per catalog item, whether the patient's current prescription covers it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PrescriptionStatusProjectionService {

    private static final Set<PrescriptionStatus> ACTIVE = EnumSet.of(PrescriptionStatus.PENDING, PrescriptionStatus.VERIFIED);

    private final PrescriptionRepository prescriptionRepository;

    /**
     * Keys are the requested ids as given, in request order. Ids that are not
     * numeric, or not on the active prescription, map to NONE.
     */
    @Transactional(readOnly = true)
    public Map<String, CoverageStatus> statusesFor(String patientIdentifier, List<String> catalogItemIds) {
        Map<String, CoverageStatus> statuses = new LinkedHashMap<>();
        if (catalogItemIds == null || catalogItemIds.isEmpty()) {
            return statuses;
        }
        catalogItemIds.forEach(id -> statuses.put(id, CoverageStatus.NONE));

        Optional<Prescription> active = prescriptionRepository
                .findFirstByPatientIdentifierAndStatusInOrderByCreatedAtDescIdDesc(patientIdentifier, ACTIVE);
        if (active.isEmpty()) {
            log.debug("No active prescription: patientIdentifier={}", patientIdentifier);
            return statuses;
        }

        Prescription prescription = active.get();
        CoverageStatus status = CoverageStatus.of(prescription.getStatus());

        for (String rawId : catalogItemIds) {
            Long id = parseId(rawId);
            if (id != null && prescription.covers(id)) {
                statuses.put(rawId, status);
            }
        }
        return statuses;
    }

    private Long parseId(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Long.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            log.debug("Skipping non-numeric catalog item id: {}", raw);
            return null;
        }
    }
}
