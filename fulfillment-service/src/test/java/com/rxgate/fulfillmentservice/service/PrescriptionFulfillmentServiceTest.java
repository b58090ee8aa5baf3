package com.rxgate.fulfillmentservice.service;

import com.rxgate.common.exception.ResourceNotFoundException;
import com.rxgate.fulfillmentservice.dto.FulfillmentOptionsResponse;
import com.rxgate.fulfillmentservice.dto.LineItemOptions;
import com.rxgate.fulfillmentservice.dto.ProviderOfferView;
import com.rxgate.fulfillmentservice.model.Order;
import com.rxgate.fulfillmentservice.model.OrderStatus;
import com.rxgate.fulfillmentservice.model.Prescription;
import com.rxgate.fulfillmentservice.model.PrescriptionStatus;
import com.rxgate.fulfillmentservice.repository.OrderRepository;
import com.rxgate.fulfillmentservice.repository.PrescriptionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static com.rxgate.fulfillmentservice.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PrescriptionFulfillmentService Unit Tests")
class PrescriptionFulfillmentServiceTest {

    @Mock
    private PrescriptionRepository prescriptionRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private AvailabilityIndex availabilityIndex;

    @InjectMocks
    private PrescriptionFulfillmentService service;

    @Test
    @DisplayName("should return no items while the prescription is pending")
    void shouldReturnEmptyItemsWhilePending() {
        Prescription pending = prescription(1L, "P1", PrescriptionStatus.PENDING);
        pending.addLineItem(lineItem(medication(10L, true), 2));
        when(prescriptionRepository.findFirstByPatientIdentifierAndStatusInOrderByCreatedAtDescIdDesc(eq("P1"), any()))
                .thenReturn(Optional.of(pending));

        FulfillmentOptionsResponse response = service.fulfillmentOptions("P1", null, null, OfferRanking.CHEAPEST);

        assertThat(response.getStatus()).isEqualTo(PrescriptionStatus.PENDING);
        assertThat(response.isVerified()).isFalse();
        assertThat(response.getItems()).isEmpty();
        verifyNoInteractions(availabilityIndex, orderRepository);
    }

    @Test
    @DisplayName("should list ranked offers per line item with the prescribed quantity")
    void shouldListOffersWhenVerified() {
        Prescription verified = prescription(1L, "P1", PrescriptionStatus.VERIFIED);
        verified.addLineItem(lineItem(medication(10L, true), 3));
        when(prescriptionRepository.findFirstByPatientIdentifierAndStatusInOrderByCreatedAtDescIdDesc(eq("P1"), any()))
                .thenReturn(Optional.of(verified));

        ProviderOfferView view = ProviderOfferView.builder()
                .providerId(1L)
                .catalogItemId(10L)
                .price(new BigDecimal("1500.00"))
                .stock(5)
                .build();
        when(availabilityIndex.findAvailability(any(AvailabilityQuery.class), eq(OfferRanking.CLOSEST)))
                .thenReturn(List.of(view));

        Order order = order(7L, "P1", OrderStatus.PENDING);
        when(orderRepository.findFirstByPrescriptionIdOrderByCreatedAtDescIdDesc(1L)).thenReturn(Optional.of(order));

        GeoFilter geo = GeoFilter.of(6.5244, 3.3792, 10.0).orElseThrow();
        FulfillmentOptionsResponse response = service.fulfillmentOptions("P1", geo, null, OfferRanking.CLOSEST);

        assertThat(response.isVerified()).isTrue();
        assertThat(response.getOrderId()).isEqualTo(7L);
        assertThat(response.getOrderStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(response.getItems()).hasSize(1);

        LineItemOptions options = response.getItems().get(0);
        assertThat(options.getCatalogItemId()).isEqualTo(10L);
        assertThat(options.getQuantity()).isEqualTo(3);
        assertThat(options.getOffers()).containsExactly(view);

        ArgumentCaptor<AvailabilityQuery> captor = ArgumentCaptor.forClass(AvailabilityQuery.class);
        verify(availabilityIndex).findAvailability(captor.capture(), eq(OfferRanking.CLOSEST));
        assertThat(captor.getValue().getRequiredQuantity()).isEqualTo(3);
        assertThat(captor.getValue().getGeo()).isSameAs(geo);
    }

    @Test
    @DisplayName("should throw when the patient has no active prescription")
    void shouldThrowWithoutActivePrescription() {
        when(prescriptionRepository.findFirstByPatientIdentifierAndStatusInOrderByCreatedAtDescIdDesc(eq("P9"), any()))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.fulfillmentOptions("P9", null, null, OfferRanking.CHEAPEST))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
