package com.rxgate.fulfillmentservice.controller;

import com.rxgate.fulfillmentservice.dto.ProviderOfferView;
import com.rxgate.fulfillmentservice.service.AvailabilityIndex;
import com.rxgate.fulfillmentservice.service.AvailabilityQuery;
import com.rxgate.fulfillmentservice.service.GeoFilter;
import com.rxgate.fulfillmentservice.service.OfferRanking;
import com.rxgate.fulfillmentservice.service.RegionFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final AvailabilityIndex availabilityIndex;

    @GetMapping
    public ResponseEntity<List<ProviderOfferView>> search(
            @RequestParam Long catalogItemId,
            @RequestParam(defaultValue = "1") int quantity,
            @RequestParam(required = false) Double lat,
            @RequestParam(required = false) Double lng,
            @RequestParam(required = false) Double radius,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String lga,
            @RequestParam(required = false) String ward,
            @RequestParam(defaultValue = "false") boolean homeCollection,
            @RequestParam(required = false) String sortBy) {
        AvailabilityQuery query = AvailabilityQuery.builder()
                .catalogItemId(catalogItemId)
                .requiredQuantity(quantity)
                .geo(GeoFilter.of(lat, lng, radius).orElse(null))
                .region(RegionFilter.of(state, lga, ward).orElse(null))
                .homeCollectionOnly(homeCollection)
                .build();

        return ResponseEntity.ok(availabilityIndex.findAvailability(query, OfferRanking.fromParam(sortBy)));
    }
}
