package com.rxgate.fulfillmentservice.dto;

import com.rxgate.fulfillmentservice.model.CatalogItemKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One provider able to fulfill a catalog item, as returned by availability search.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderOfferView {
    private Long providerId;
    private String providerName;
    private String address;
    private String phone;
    private String state;
    private String lga;
    private String ward;
    private String operatingHours;
    private Boolean homeCollectionAvailable;
    private Double latitude;
    private Double longitude;

    private Long catalogItemId;
    private String catalogItemName;
    private CatalogItemKind kind;
    private BigDecimal price;
    private Integer stock;
    private Boolean available;
    private LocalDate expiryDate;

    // null when the search had no geo filter
    private Double distanceKm;
}
