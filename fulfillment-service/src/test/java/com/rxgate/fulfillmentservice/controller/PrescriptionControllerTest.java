package com.rxgate.fulfillmentservice.controller;

import com.rxgate.fulfillmentservice.config.ClientRoles;
import com.rxgate.fulfillmentservice.config.FulfillmentProperties;
import com.rxgate.fulfillmentservice.config.SecurityConfig;
import com.rxgate.fulfillmentservice.dto.PrescriptionResponse;
import com.rxgate.fulfillmentservice.dto.UploadPrescriptionRequest;
import com.rxgate.fulfillmentservice.model.CoverageStatus;
import com.rxgate.fulfillmentservice.model.PrescriptionStatus;
import com.rxgate.fulfillmentservice.service.AvailabilityIndex;
import com.rxgate.fulfillmentservice.service.OfferRanking;
import com.rxgate.fulfillmentservice.service.PrescriptionFulfillmentService;
import com.rxgate.fulfillmentservice.service.PrescriptionService;
import com.rxgate.fulfillmentservice.service.PrescriptionStatusProjectionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({PrescriptionController.class, AvailabilityController.class})
@Import({SecurityConfig.class, ClientRoles.class})
@EnableConfigurationProperties(FulfillmentProperties.class)
@DisplayName("Patient-facing controller Web Tests")
class PrescriptionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PrescriptionService prescriptionService;

    @MockBean
    private PrescriptionStatusProjectionService statusProjectionService;

    @MockBean
    private PrescriptionFulfillmentService fulfillmentService;

    @MockBean
    private AvailabilityIndex availabilityIndex;

    @MockBean
    private JwtDecoder jwtDecoder;

    @Test
    @DisplayName("should answer 201 with the stored prescription on upload")
    void shouldUpload() throws Exception {
        PrescriptionResponse response = PrescriptionResponse.builder()
                .id(1L)
                .status(PrescriptionStatus.PENDING)
                .build();
        when(prescriptionService.upload(any(UploadPrescriptionRequest.class))).thenReturn(response);

        mockMvc.perform(post("/api/v1/prescriptions")
                        .with(jwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patientIdentifier\":\"P1\",\"phone\":\"08031234567\","
                                + "\"fileUrl\":\"https://files.example.com/rx/1.jpg\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("should reject an upload without a file reference")
    void shouldValidateUpload() throws Exception {
        mockMvc.perform(post("/api/v1/prescriptions")
                        .with(jwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patientIdentifier\":\"P1\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(prescriptionService);
    }

    @Test
    @DisplayName("should return 400 INVALID_INPUT for a truncated upload body")
    void shouldRejectMalformedUpload() throws Exception {
        mockMvc.perform(post("/api/v1/prescriptions")
                        .with(jwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patientIdentifier\":\"P1\","))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_INPUT"));

        verifyNoInteractions(prescriptionService);
    }

    @Test
    @DisplayName("should return coverage in request order")
    void shouldReturnStatuses() throws Exception {
        Map<String, CoverageStatus> statuses = new LinkedHashMap<>();
        statuses.put("10", CoverageStatus.VERIFIED);
        statuses.put("99", CoverageStatus.NONE);
        when(statusProjectionService.statusesFor("P1", List.of("10", "99"))).thenReturn(statuses);

        mockMvc.perform(get("/api/v1/prescriptions/statuses")
                        .with(jwt())
                        .param("patientIdentifier", "P1")
                        .param("catalogItemIds", "10", "99"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['10']").value("VERIFIED"))
                .andExpect(jsonPath("$['99']").value("NONE"));
    }

    @Test
    @DisplayName("should return 400 INVALID_COORDINATES before any lookup")
    void shouldRejectInvalidCoordinates() throws Exception {
        mockMvc.perform(get("/api/v1/prescriptions/fulfillment-options")
                        .with(jwt())
                        .param("patientIdentifier", "P1")
                        .param("lat", "100")
                        .param("lng", "200")
                        .param("radius", "5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_COORDINATES"));

        verifyNoInteractions(fulfillmentService);
    }

    @Test
    @DisplayName("should return 400 for an unknown sort order on availability search")
    void shouldRejectUnknownSort() throws Exception {
        mockMvc.perform(get("/api/v1/availability")
                        .with(jwt())
                        .param("catalogItemId", "10")
                        .param("sortBy", "fastest"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_INPUT"));

        verifyNoInteractions(availabilityIndex);
    }

    @Test
    @DisplayName("should search availability with the requested ranking")
    void shouldSearchAvailability() throws Exception {
        when(availabilityIndex.findAvailability(any(), eq(OfferRanking.CLOSEST))).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/availability")
                        .with(jwt())
                        .param("catalogItemId", "10")
                        .param("lat", "6.45")
                        .param("lng", "3.39")
                        .param("radius", "10")
                        .param("sortBy", "closest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    @DisplayName("should require authentication")
    void shouldRejectAnonymous() throws Exception {
        mockMvc.perform(get("/api/v1/prescriptions").param("patientIdentifier", "P1"))
                .andExpect(status().isUnauthorized());
    }
}
