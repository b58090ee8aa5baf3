package com.rxgate.fulfillmentservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A pharmacy, lab or clinic able to fulfill catalog items.
 */
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "providers", indexes = {
        @Index(name = "idx_providers_lat_lng", columnList = "latitude, longitude")
})
public class Provider {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    @Column(nullable = false)
    @ToString.Include
    private String name;

    private String address;

    private String phone;

    @Column(name = "license_number")
    private String licenseNumber;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProviderStatus status = ProviderStatus.PENDING;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    // administrative region
    private String state;
    private String lga;
    private String ward;

    @Column(name = "operating_hours")
    private String operatingHours;

    private Double latitude;

    private Double longitude;

    @Builder.Default
    @Column(name = "home_collection_available", nullable = false)
    private Boolean homeCollectionAvailable = false;
}
