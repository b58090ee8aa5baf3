package com.rxgate.fulfillmentservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItemOptions {
    private Long catalogItemId;
    private String catalogItemName;
    private Integer quantity;
    private String instructions;
    private List<ProviderOfferView> offers;
}
