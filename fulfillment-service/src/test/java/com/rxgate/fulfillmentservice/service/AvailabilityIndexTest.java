package com.rxgate.fulfillmentservice.service;

import com.rxgate.common.exception.InvalidInputException;
import com.rxgate.common.exception.ResourceNotFoundException;
import com.rxgate.fulfillmentservice.dto.ProviderOfferView;
import com.rxgate.fulfillmentservice.mapper.ProviderOfferMapper;
import com.rxgate.fulfillmentservice.mapper.ProviderOfferMapperImpl;
import com.rxgate.fulfillmentservice.model.CatalogItem;
import com.rxgate.fulfillmentservice.model.Provider;
import com.rxgate.fulfillmentservice.model.ProviderOffer;
import com.rxgate.fulfillmentservice.model.ProviderStatus;
import com.rxgate.fulfillmentservice.repository.ProviderOfferRepository;
import com.rxgate.fulfillmentservice.repository.ProviderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;

import static com.rxgate.fulfillmentservice.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AvailabilityIndex Unit Tests")
class AvailabilityIndexTest {

    @Mock
    private ProviderOfferRepository providerOfferRepository;

    @Mock
    private ProviderRepository providerRepository;

    @Mock
    private CatalogService catalogService;

    @Spy
    private GeoDistanceCalculator geoDistanceCalculator = new GeoDistanceCalculator();

    @Spy
    private ProviderOfferMapper providerOfferMapper = new ProviderOfferMapperImpl();

    @InjectMocks
    private AvailabilityIndex availabilityIndex;

    private CatalogItem amoxicillin;
    private Provider nearby;
    private Provider faraway;

    @BeforeEach
    void setUp() {
        amoxicillin = medication(10L, true);
        // Ikeja, and Ibadan (~110 km away)
        nearby = provider(1L, 6.6018, 3.3515);
        faraway = provider(2L, 7.3775, 3.9470);
    }

    private static Specification<ProviderOffer> anySpec() {
        return any();
    }

    @Nested
    @DisplayName("without geo filter")
    class WithoutGeoFilterTests {

        @Test
        @DisplayName("should return offers ordered by provider id with null distance")
        void shouldReturnOffersWithoutDistance() {
            when(catalogService.resolveCatalogItem(10L)).thenReturn(amoxicillin);
            when(providerOfferRepository.findAll(anySpec())).thenReturn(List.of(
                    offer(faraway, amoxicillin, 30, "1200.00"),
                    offer(nearby, amoxicillin, 5, "1500.00")));

            List<ProviderOfferView> result = availabilityIndex.findAvailability(
                    AvailabilityQuery.builder().catalogItemId(10L).requiredQuantity(2).build());

            assertThat(result).extracting(ProviderOfferView::getProviderId).containsExactly(1L, 2L);
            assertThat(result).allSatisfy(view -> assertThat(view.getDistanceKm()).isNull());
            assertThat(result.get(0).getProviderName()).isEqualTo("Provider 1");
            assertThat(result.get(0).getCatalogItemId()).isEqualTo(10L);
            verifyNoInteractions(providerRepository);
        }

        @Test
        @DisplayName("should rank by price when asked for cheapest")
        void shouldRankCheapest() {
            when(catalogService.resolveCatalogItem(10L)).thenReturn(amoxicillin);
            when(providerOfferRepository.findAll(anySpec())).thenReturn(List.of(
                    offer(nearby, amoxicillin, 5, "1500.00"),
                    offer(faraway, amoxicillin, 30, "1200.00")));

            List<ProviderOfferView> result = availabilityIndex.findAvailability(
                    AvailabilityQuery.builder().catalogItemId(10L).build(), OfferRanking.CHEAPEST);

            assertThat(result).extracting(ProviderOfferView::getProviderId).containsExactly(2L, 1L);
        }
    }

    @Nested
    @DisplayName("with geo filter")
    class WithGeoFilterTests {

        @Test
        @DisplayName("should keep only providers inside the radius and attach distance")
        void shouldFilterByRadius() {
            GeoFilter geo = GeoFilter.of(6.6000, 3.3500, 10.0).orElseThrow();
            when(catalogService.resolveCatalogItem(10L)).thenReturn(amoxicillin);
            when(providerRepository.findInBoundingBox(eq(ProviderStatus.VERIFIED),
                    anyDouble(), anyDouble(), anyDouble(), anyDouble()))
                    .thenReturn(List.of(nearby, faraway));
            when(providerOfferRepository.findAll(anySpec()))
                    .thenReturn(List.of(offer(nearby, amoxicillin, 5, "1500.00")));

            List<ProviderOfferView> result = availabilityIndex.findAvailability(
                    AvailabilityQuery.builder().catalogItemId(10L).geo(geo).build());

            assertThat(result).hasSize(1);
            assertThat(result.get(0).getDistanceKm()).isNotNull().isLessThanOrEqualTo(10.0);
        }

        @Test
        @DisplayName("should still run the offer query when no provider is in range")
        void shouldQueryWhenNoCandidates() {
            GeoFilter geo = GeoFilter.of(9.0765, 7.3986, 5.0).orElseThrow();
            when(catalogService.resolveCatalogItem(10L)).thenReturn(amoxicillin);
            when(providerRepository.findInBoundingBox(eq(ProviderStatus.VERIFIED),
                    anyDouble(), anyDouble(), anyDouble(), anyDouble()))
                    .thenReturn(List.of());
            when(providerOfferRepository.findAll(anySpec())).thenReturn(List.of());

            List<ProviderOfferView> result = availabilityIndex.findAvailability(
                    AvailabilityQuery.builder().catalogItemId(10L).geo(geo).build());

            assertThat(result).isEmpty();
            verify(providerOfferRepository).findAll(anySpec());
        }
    }

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("should fail for unknown catalog item before querying offers")
        void shouldFailForUnknownItem() {
            when(catalogService.resolveCatalogItem(99L))
                    .thenThrow(new ResourceNotFoundException("Catalog item not found with id: 99"));

            assertThatThrownBy(() -> availabilityIndex.findAvailability(
                    AvailabilityQuery.builder().catalogItemId(99L).build()))
                    .isInstanceOf(ResourceNotFoundException.class);

            verifyNoInteractions(providerOfferRepository, providerRepository);
        }

        @Test
        @DisplayName("should reject quantity below one")
        void shouldRejectZeroQuantity() {
            assertThatThrownBy(() -> availabilityIndex.findAvailability(
                    AvailabilityQuery.builder().catalogItemId(10L).requiredQuantity(0).build()))
                    .isInstanceOf(InvalidInputException.class);

            verify(catalogService, never()).resolveCatalogItem(any());
        }
    }
}
