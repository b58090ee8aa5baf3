package com.rxgate.fulfillmentservice.mapper;

import com.rxgate.fulfillmentservice.dto.LineItemResponse;
import com.rxgate.fulfillmentservice.dto.PrescriptionResponse;
import com.rxgate.fulfillmentservice.model.Prescription;
import com.rxgate.fulfillmentservice.model.PrescriptionLineItem;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface PrescriptionMapper {

    @Mapping(source = "lineItems", target = "lineItems")
    PrescriptionResponse toPrescriptionResponse(Prescription prescription);

    @Mapping(source = "catalogItem.id", target = "catalogItemId")
    @Mapping(source = "catalogItem.name", target = "catalogItemName")
    @Mapping(source = "catalogItem.kind", target = "kind")
    LineItemResponse toLineItemResponse(PrescriptionLineItem lineItem);
}
