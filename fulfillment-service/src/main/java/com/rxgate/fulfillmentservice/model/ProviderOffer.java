package com.rxgate.fulfillmentservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A provider's stock (or availability) and price for one catalog item.
 */
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "provider_offers")
public class ProviderOffer {

    @EmbeddedId
    @ToString.Include
    private ProviderOfferId id;

    @MapsId("providerId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "provider_id")
    private Provider provider;

    @MapsId("catalogItemId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "catalog_item_id")
    private CatalogItem catalogItem;

    // null for scheduled services
    @ToString.Include
    private Integer stock;

    @Builder.Default
    @Column(nullable = false)
    private Boolean available = true;

    @Column(nullable = false)
    private BigDecimal price;

    @Column(name = "received_date")
    private LocalDate receivedDate;

    @Column(name = "expiry_date")
    private LocalDate expiryDate;
}
