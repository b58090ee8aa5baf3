package com.rxgate.fulfillmentservice.service;

import com.rxgate.common.exception.ResourceNotFoundException;
import com.rxgate.fulfillmentservice.dto.FulfillmentOptionsResponse;
import com.rxgate.fulfillmentservice.dto.LineItemOptions;
import com.rxgate.fulfillmentservice.dto.ProviderOfferView;
import com.rxgate.fulfillmentservice.model.Order;
import com.rxgate.fulfillmentservice.model.Prescription;
import com.rxgate.fulfillmentservice.model.PrescriptionLineItem;
import com.rxgate.fulfillmentservice.model.PrescriptionStatus;
import com.rxgate.fulfillmentservice.repository.OrderRepository;
import com.rxgate.fulfillmentservice.repository.PrescriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Builds the "where can I get my prescription filled" view for a patient.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PrescriptionFulfillmentService {

    private final PrescriptionRepository prescriptionRepository;
    private final OrderRepository orderRepository;
    private final AvailabilityIndex availabilityIndex;

    /**
     * Geo and region filters are validated by the caller (see {@link GeoFilter#of})
     * before this runs, so bad coordinates never reach a query.
     */
    @Transactional(readOnly = true)
    public FulfillmentOptionsResponse fulfillmentOptions(String patientIdentifier, GeoFilter geo,
            RegionFilter region, OfferRanking ranking) {
        Prescription prescription = prescriptionRepository
                .findFirstByPatientIdentifierAndStatusInOrderByCreatedAtDescIdDesc(patientIdentifier,
                        EnumSet.of(PrescriptionStatus.PENDING, PrescriptionStatus.VERIFIED))
                .orElseThrow(() -> {
                    log.warn("No active prescription: patientIdentifier={}", patientIdentifier);
                    return new ResourceNotFoundException("No pending or verified prescription found");
                });

        FulfillmentOptionsResponse.FulfillmentOptionsResponseBuilder response = FulfillmentOptionsResponse.builder()
                .prescriptionId(prescription.getId())
                .status(prescription.getStatus())
                .verified(prescription.isVerified())
                .fileUrl(prescription.getFileUrl())
                .createdAt(prescription.getCreatedAt());

        if (prescription.getStatus() == PrescriptionStatus.PENDING) {
            return response.items(List.of()).build();
        }

        List<LineItemOptions> items = new ArrayList<>();
        for (PrescriptionLineItem lineItem : prescription.getLineItems()) {
            AvailabilityQuery query = AvailabilityQuery.builder()
                    .catalogItemId(lineItem.getCatalogItem().getId())
                    .requiredQuantity(lineItem.getQuantity())
                    .geo(geo)
                    .region(region)
                    .build();
            List<ProviderOfferView> offers = availabilityIndex.findAvailability(query, ranking);

            items.add(LineItemOptions.builder()
                    .catalogItemId(lineItem.getCatalogItem().getId())
                    .catalogItemName(lineItem.getCatalogItem().getName())
                    .quantity(lineItem.getQuantity())
                    .instructions(lineItem.getInstructions())
                    .offers(offers)
                    .build());
        }

        Optional<Order> latestOrder = orderRepository.findFirstByPrescriptionIdOrderByCreatedAtDescIdDesc(prescription.getId());
        latestOrder.ifPresent(order -> response.orderId(order.getId()).orderStatus(order.getStatus()));

        log.info("Fulfillment options built: prescriptionId={}, lineItems={}, ranking={}",
                prescription.getId(), items.size(), ranking);
        return response.items(items).build();
    }
}
