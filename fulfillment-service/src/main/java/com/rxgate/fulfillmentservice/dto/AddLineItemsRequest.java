package com.rxgate.fulfillmentservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddLineItemsRequest {
    @NotEmpty(message = "At least one line item is required")
    @Valid
    private List<LineItemRequest> items;
}
