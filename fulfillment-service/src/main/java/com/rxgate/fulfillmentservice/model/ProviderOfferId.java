package com.rxgate.fulfillmentservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.io.Serializable;

@Embeddable
@Getter
@Setter
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class ProviderOfferId implements Serializable {

    @Column(name = "provider_id", nullable = false)
    private Long providerId;

    @Column(name = "catalog_item_id", nullable = false)
    private Long catalogItemId;
}
