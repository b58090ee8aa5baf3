package com.rxgate.fulfillmentservice.controller;

import com.rxgate.fulfillmentservice.dto.AddLineItemsRequest;
import com.rxgate.fulfillmentservice.dto.FulfillmentOptionsResponse;
import com.rxgate.fulfillmentservice.dto.PrescriptionResponse;
import com.rxgate.fulfillmentservice.dto.UploadPrescriptionRequest;
import com.rxgate.fulfillmentservice.model.CoverageStatus;
import com.rxgate.fulfillmentservice.service.GeoFilter;
import com.rxgate.fulfillmentservice.service.OfferRanking;
import com.rxgate.fulfillmentservice.service.PrescriptionFulfillmentService;
import com.rxgate.fulfillmentservice.service.PrescriptionService;
import com.rxgate.fulfillmentservice.service.PrescriptionStatusProjectionService;
import com.rxgate.fulfillmentservice.service.RegionFilter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/prescriptions")
@RequiredArgsConstructor
public class PrescriptionController {

    private final PrescriptionService prescriptionService;
    private final PrescriptionStatusProjectionService statusProjectionService;
    private final PrescriptionFulfillmentService fulfillmentService;

    @PostMapping
    public ResponseEntity<PrescriptionResponse> upload(@Valid @RequestBody UploadPrescriptionRequest request) {
        PrescriptionResponse response = prescriptionService.upload(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/{prescriptionId}/items")
    public ResponseEntity<PrescriptionResponse> addLineItems(
            @PathVariable Long prescriptionId,
            @Valid @RequestBody AddLineItemsRequest request) {
        PrescriptionResponse response = prescriptionService.addLineItems(prescriptionId, request.getItems());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{prescriptionId}")
    public ResponseEntity<PrescriptionResponse> getPrescription(@PathVariable Long prescriptionId) {
        return ResponseEntity.ok(prescriptionService.getPrescription(prescriptionId));
    }

    @GetMapping
    public ResponseEntity<List<PrescriptionResponse>> getPrescriptionsForPatient(
            @RequestParam String patientIdentifier) {
        return ResponseEntity.ok(prescriptionService.getPrescriptionsForPatient(patientIdentifier));
    }

    // polled by the cart to show which items are covered
    @GetMapping("/statuses")
    public ResponseEntity<Map<String, CoverageStatus>> getStatuses(
            @RequestParam String patientIdentifier,
            @RequestParam List<String> catalogItemIds) {
        return ResponseEntity.ok(statusProjectionService.statusesFor(patientIdentifier, catalogItemIds));
    }

    @GetMapping("/fulfillment-options")
    public ResponseEntity<FulfillmentOptionsResponse> getFulfillmentOptions(
            @RequestParam String patientIdentifier,
            @RequestParam(required = false) Double lat,
            @RequestParam(required = false) Double lng,
            @RequestParam(required = false) Double radius,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String lga,
            @RequestParam(required = false) String ward,
            @RequestParam(required = false) String sortBy) {
        GeoFilter geo = GeoFilter.of(lat, lng, radius).orElse(null);
        RegionFilter region = RegionFilter.of(state, lga, ward).orElse(null);
        OfferRanking ranking = OfferRanking.fromParam(sortBy);

        return ResponseEntity.ok(fulfillmentService.fulfillmentOptions(patientIdentifier, geo, region, ranking));
    }
}
