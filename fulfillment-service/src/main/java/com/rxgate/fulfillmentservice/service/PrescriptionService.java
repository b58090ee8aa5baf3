package com.rxgate.fulfillmentservice.service;

import com.rxgate.fulfillmentservice.dto.LineItemRequest;
import com.rxgate.fulfillmentservice.dto.PrescriptionResponse;
import com.rxgate.fulfillmentservice.dto.UploadPrescriptionRequest;

import java.util.List;

public interface PrescriptionService {

    /**
     * Records an uploaded prescription as PENDING.
     * With an order id, the order is linked and moved to PENDING_PRESCRIPTION
     * in the same transaction.
     */
    PrescriptionResponse upload(UploadPrescriptionRequest request);

    /**
     * Adds prescribed items to a PENDING prescription. All items are inserted or none.
     */
    PrescriptionResponse addLineItems(Long prescriptionId, List<LineItemRequest> items);

    PrescriptionResponse getPrescription(Long prescriptionId);

    List<PrescriptionResponse> getPrescriptionsForPatient(String patientIdentifier);
}
