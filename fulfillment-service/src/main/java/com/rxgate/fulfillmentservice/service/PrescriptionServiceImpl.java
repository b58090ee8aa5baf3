package com.rxgate.fulfillmentservice.service;

import com.rxgate.common.exception.InvalidInputException;
import com.rxgate.common.exception.ResourceNotFoundException;
import com.rxgate.fulfillmentservice.dto.LineItemRequest;
import com.rxgate.fulfillmentservice.dto.PrescriptionResponse;
import com.rxgate.fulfillmentservice.dto.UploadPrescriptionRequest;
import com.rxgate.fulfillmentservice.exception.NoEligibleItemsException;
import com.rxgate.fulfillmentservice.exception.PrescriptionAlreadyProcessedException;
import com.rxgate.fulfillmentservice.mapper.PrescriptionMapper;
import com.rxgate.fulfillmentservice.model.CatalogItem;
import com.rxgate.fulfillmentservice.model.Order;
import com.rxgate.fulfillmentservice.model.OrderStatus;
import com.rxgate.fulfillmentservice.model.Prescription;
import com.rxgate.fulfillmentservice.model.PrescriptionLineItem;
import com.rxgate.fulfillmentservice.model.PrescriptionStatus;
import com.rxgate.fulfillmentservice.repository.OrderRepository;
import com.rxgate.fulfillmentservice.repository.PrescriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PrescriptionServiceImpl implements PrescriptionService {

    private final PrescriptionRepository prescriptionRepository;
    private final OrderRepository orderRepository;
    private final CatalogService catalogService;
    private final ContactNormalizer contactNormalizer;
    private final PrescriptionMapper prescriptionMapper;

    @Override
    @Transactional
    public PrescriptionResponse upload(UploadPrescriptionRequest request) {
        log.info("Prescription upload started: patientIdentifier={}, orderId={}",
                request.getPatientIdentifier(), request.getOrderId());

        ContactDetails contact = contactNormalizer.normalize(request.getPhone(), request.getEmail());
        List<LineItemRequest> items = request.getItems() == null ? List.of() : request.getItems();
        validateQuantities(items);

        Order order = null;
        if (request.getOrderId() != null) {
            order = loadEligibleOrder(request.getOrderId(), request.getPatientIdentifier());
        }

        Map<Long, CatalogItem> catalogItems = items.isEmpty()
                ? Map.of()
                : catalogService.resolveAll(items.stream().map(LineItemRequest::getCatalogItemId).toList());

        Prescription prescription = Prescription.builder()
                .patientIdentifier(request.getPatientIdentifier())
                .phone(contact.getPhone())
                .email(contact.getEmail())
                .fileUrl(request.getFileUrl())
                .status(PrescriptionStatus.PENDING)
                .verified(false)
                .build();
        items.forEach(item -> prescription.addLineItem(toLineItem(item, catalogItems)));

        Prescription saved = prescriptionRepository.save(prescription);

        if (order != null) {
            order.setPrescription(saved);
            order.setStatus(OrderStatus.PENDING_PRESCRIPTION);
            orderRepository.save(order);
            log.info("Order linked to prescription: orderId={}, prescriptionId={}, status={}",
                    order.getId(), saved.getId(), order.getStatus());
        }

        log.info("Prescription uploaded: prescriptionId={}, lineItems={}", saved.getId(), items.size());
        return prescriptionMapper.toPrescriptionResponse(saved);
    }

    @Override
    @Transactional
    public PrescriptionResponse addLineItems(Long prescriptionId, List<LineItemRequest> items) {
        Prescription prescription = prescriptionRepository.findByIdForUpdate(prescriptionId)
                .orElseThrow(() -> {
                    log.warn("Prescription not found: prescriptionId={}", prescriptionId);
                    return new ResourceNotFoundException("Prescription not found with id: " + prescriptionId);
                });

        if (prescription.getStatus() != PrescriptionStatus.PENDING) {
            log.warn("Line items rejected, prescription already processed: prescriptionId={}, status={}",
                    prescriptionId, prescription.getStatus());
            throw new PrescriptionAlreadyProcessedException(
                    "Prescription " + prescriptionId + " is already " + prescription.getStatus());
        }

        if (items == null || items.isEmpty()) {
            throw new InvalidInputException("At least one line item is required");
        }
        validateQuantities(items);

        Map<Long, CatalogItem> catalogItems = catalogService.resolveAll(
                items.stream().map(LineItemRequest::getCatalogItemId).toList());

        items.forEach(item -> prescription.addLineItem(toLineItem(item, catalogItems)));
        Prescription saved = prescriptionRepository.save(prescription);

        log.info("Line items added: prescriptionId={}, added={}, total={}",
                prescriptionId, items.size(), saved.getLineItems().size());
        return prescriptionMapper.toPrescriptionResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public PrescriptionResponse getPrescription(Long prescriptionId) {
        Prescription prescription = prescriptionRepository.findWithLineItemsById(prescriptionId)
                .orElseThrow(() -> {
                    log.warn("Prescription not found: prescriptionId={}", prescriptionId);
                    return new ResourceNotFoundException("Prescription not found with id: " + prescriptionId);
                });
        return prescriptionMapper.toPrescriptionResponse(prescription);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PrescriptionResponse> getPrescriptionsForPatient(String patientIdentifier) {
        return prescriptionRepository.findByPatientIdentifierOrderByCreatedAtDescIdDesc(patientIdentifier)
                .stream()
                .map(prescriptionMapper::toPrescriptionResponse)
                .collect(Collectors.toList());
    }

    private Order loadEligibleOrder(Long orderId, String patientIdentifier) {
        Order order = orderRepository.findByIdAndPatientIdentifier(orderId, patientIdentifier)
                .orElseThrow(() -> {
                    log.warn("Order not found for patient: orderId={}, patientIdentifier={}",
                            orderId, patientIdentifier);
                    return new ResourceNotFoundException("Order not found");
                });

        if (order.getStatus().isTerminal()) {
            log.warn("Cannot attach prescription to finished order: orderId={}, status={}",
                    orderId, order.getStatus());
            throw new InvalidInputException("Order " + orderId + " is already " + order.getStatus());
        }

        if (!order.requiresPrescription()) {
            log.warn("Order has no prescription-only items: orderId={}", orderId);
            throw new NoEligibleItemsException("Order " + orderId + " has no items that require a prescription");
        }
        return order;
    }

    private void validateQuantities(List<LineItemRequest> items) {
        for (LineItemRequest item : items) {
            if (item.getCatalogItemId() == null) {
                throw new InvalidInputException("Catalog item ID cannot be null");
            }
            if (item.getQuantity() == null || item.getQuantity() < 1) {
                throw new InvalidInputException("Quantity must be at least 1 for catalog item "
                        + item.getCatalogItemId());
            }
        }
    }

    private PrescriptionLineItem toLineItem(LineItemRequest item, Map<Long, CatalogItem> catalogItems) {
        return PrescriptionLineItem.builder()
                .catalogItem(catalogItems.get(item.getCatalogItemId()))
                .quantity(item.getQuantity())
                .instructions(item.getInstructions())
                .build();
    }
}
