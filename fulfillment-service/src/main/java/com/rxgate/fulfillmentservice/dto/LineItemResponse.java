package com.rxgate.fulfillmentservice.dto;

import com.rxgate.fulfillmentservice.model.CatalogItemKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItemResponse {
    private Long id;
    private Long catalogItemId;
    private String catalogItemName;
    private CatalogItemKind kind;
    private Integer quantity;
    private String instructions;
}
