package com.rxgate.fulfillmentservice.mapper;

import com.rxgate.fulfillmentservice.dto.ProviderOfferView;
import com.rxgate.fulfillmentservice.model.ProviderOffer;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ProviderOfferMapper {

    // distanceKm is filled in by the caller, it depends on the search point
    @Mapping(source = "provider.id", target = "providerId")
    @Mapping(source = "provider.name", target = "providerName")
    @Mapping(source = "provider.address", target = "address")
    @Mapping(source = "provider.phone", target = "phone")
    @Mapping(source = "provider.state", target = "state")
    @Mapping(source = "provider.lga", target = "lga")
    @Mapping(source = "provider.ward", target = "ward")
    @Mapping(source = "provider.operatingHours", target = "operatingHours")
    @Mapping(source = "provider.homeCollectionAvailable", target = "homeCollectionAvailable")
    @Mapping(source = "provider.latitude", target = "latitude")
    @Mapping(source = "provider.longitude", target = "longitude")
    @Mapping(source = "catalogItem.id", target = "catalogItemId")
    @Mapping(source = "catalogItem.name", target = "catalogItemName")
    @Mapping(source = "catalogItem.kind", target = "kind")
    @Mapping(target = "distanceKm", ignore = true)
    ProviderOfferView toView(ProviderOffer offer);
}
