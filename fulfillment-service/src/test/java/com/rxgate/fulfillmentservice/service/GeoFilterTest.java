package com.rxgate.fulfillmentservice.service;

import com.rxgate.common.exception.InvalidInputException;
import com.rxgate.fulfillmentservice.exception.InvalidCoordinatesException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GeoFilter / RegionFilter Unit Tests")
class GeoFilterTest {

    @Test
    @DisplayName("should skip geo filter when any value is missing")
    void shouldSkipWhenIncomplete() {
        assertThat(GeoFilter.of(6.5, null, 10.0)).isEmpty();
        assertThat(GeoFilter.of(null, 3.4, 10.0)).isEmpty();
        assertThat(GeoFilter.of(6.5, 3.4, null)).isEmpty();
    }

    @Test
    @DisplayName("should reject out of range coordinates")
    void shouldRejectOutOfRange() {
        assertThatThrownBy(() -> GeoFilter.of(100.0, 200.0, 5.0))
                .isInstanceOf(InvalidCoordinatesException.class);
        assertThatThrownBy(() -> GeoFilter.of(-91.0, 0.0, 5.0))
                .isInstanceOf(InvalidCoordinatesException.class);
    }

    @Test
    @DisplayName("should reject non-positive radius")
    void shouldRejectNonPositiveRadius() {
        assertThatThrownBy(() -> GeoFilter.of(6.5, 3.4, 0.0))
                .isInstanceOf(InvalidInputException.class)
                .isNotInstanceOf(InvalidCoordinatesException.class);
    }

    @Test
    @DisplayName("should accept boundary coordinates")
    void shouldAcceptBoundaries() {
        assertThat(GeoFilter.of(90.0, -180.0, 1.0)).isPresent();
    }

    @Test
    @DisplayName("region filter should be empty when all fields are blank")
    void regionShouldBeEmptyWhenBlank() {
        assertThat(RegionFilter.of(" ", null, "")).isEmpty();
        assertThat(RegionFilter.of(" Lagos ", null, null))
                .get()
                .extracting(RegionFilter::getState)
                .isEqualTo("Lagos");
    }
}
