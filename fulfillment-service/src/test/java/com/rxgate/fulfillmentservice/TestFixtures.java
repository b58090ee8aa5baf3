package com.rxgate.fulfillmentservice;

import com.rxgate.fulfillmentservice.model.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Entity builders shared by unit tests. Ids are assigned by hand since nothing is persisted.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    public static CatalogItem medication(Long id, boolean prescriptionRequired) {
        return CatalogItem.builder()
                .id(id)
                .name("Amoxicillin 500mg #" + id)
                .kind(CatalogItemKind.MEDICATION)
                .prescriptionRequired(prescriptionRequired)
                .build();
    }

    public static CatalogItem labService(Long id) {
        return CatalogItem.builder()
                .id(id)
                .name("Full Blood Count #" + id)
                .kind(CatalogItemKind.SERVICE)
                .prescriptionRequired(true)
                .testType("HEMATOLOGY")
                .build();
    }

    public static Provider provider(Long id, Double latitude, Double longitude) {
        return Provider.builder()
                .id(id)
                .name("Provider " + id)
                .status(ProviderStatus.VERIFIED)
                .isActive(true)
                .state("Lagos")
                .lga("Ikeja")
                .latitude(latitude)
                .longitude(longitude)
                .build();
    }

    public static ProviderOffer offer(Provider provider, CatalogItem item, Integer stock, String price) {
        return ProviderOffer.builder()
                .id(new ProviderOfferId(provider.getId(), item.getId()))
                .provider(provider)
                .catalogItem(item)
                .stock(stock)
                .available(true)
                .price(new BigDecimal(price))
                .build();
    }

    public static Prescription prescription(Long id, String patient, PrescriptionStatus status) {
        return Prescription.builder()
                .id(id)
                .patientIdentifier(patient)
                .email("patient@example.com")
                .phone("+2348031234567")
                .fileUrl("https://files.example.com/rx/" + id + ".jpg")
                .status(status)
                .verified(status == PrescriptionStatus.VERIFIED)
                .createdAt(Instant.now())
                .build();
    }

    public static PrescriptionLineItem lineItem(CatalogItem item, int quantity) {
        return PrescriptionLineItem.builder()
                .catalogItem(item)
                .quantity(quantity)
                .build();
    }

    public static Order order(Long id, String patient, OrderStatus status) {
        Order order = new Order();
        order.setId(id);
        order.setPatientIdentifier(patient);
        order.setStatus(status);
        order.setTotalPrice(BigDecimal.ZERO);
        order.setCreatedAt(Instant.now());
        return order;
    }

    public static OrderItem orderItem(Order order, ProviderOffer offer, int quantity, boolean reserved) {
        OrderItem item = new OrderItem();
        item.setOrder(order);
        item.setOffer(offer);
        item.setQuantity(quantity);
        item.setPrice(offer.getPrice());
        item.setReserved(reserved);
        order.getItems().add(item);
        return item;
    }
}
