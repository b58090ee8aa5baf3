package com.rxgate.fulfillmentservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class UploadPrescriptionRequest {
    @NotBlank(message = "Patient identifier cannot be blank")
    private String patientIdentifier;

    private String phone;

    private String email;

    // reference returned by the file storage service
    @NotBlank(message = "File URL cannot be blank")
    private String fileUrl;

    // order waiting on this prescription, if any
    private Long orderId;

    @Valid
    private List<LineItemRequest> items = new ArrayList<>();
}
