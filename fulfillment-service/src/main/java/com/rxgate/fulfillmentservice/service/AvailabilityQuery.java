package com.rxgate.fulfillmentservice.service;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class AvailabilityQuery {

    private final Long catalogItemId;

    @Builder.Default
    private final int requiredQuantity = 1;

    private final GeoFilter geo;

    private final RegionFilter region;

    // lab services: only providers offering sample collection at home
    private final boolean homeCollectionOnly;
}
