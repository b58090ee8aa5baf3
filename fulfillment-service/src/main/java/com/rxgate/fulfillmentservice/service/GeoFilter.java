package com.rxgate.fulfillmentservice.service;

import com.rxgate.common.exception.InvalidInputException;
import com.rxgate.fulfillmentservice.exception.InvalidCoordinatesException;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * A point and a radius restricting availability search.
 */
@Getter
@ToString
public class GeoFilter {

    private final double latitude;
    private final double longitude;
    private final double radiusKm;

    private GeoFilter(double latitude, double longitude, double radiusKm) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.radiusKm = radiusKm;
    }

    /**
     * Returns empty when any of the three values is missing; the search then
     * runs without a geo filter.
     *
     * @throws InvalidCoordinatesException when the point is outside the valid range
     * @throws InvalidInputException when the radius is not positive
     */
    public static Optional<GeoFilter> of(Double latitude, Double longitude, Double radiusKm) {
        if (latitude == null || longitude == null || radiusKm == null) {
            return Optional.empty();
        }
        if (latitude.isNaN() || longitude.isNaN()
                || latitude < -90 || latitude > 90 || longitude < -180 || longitude > 180) {
            throw new InvalidCoordinatesException("Invalid coordinates: lat=" + latitude + ", lng=" + longitude);
        }
        if (radiusKm.isNaN() || radiusKm <= 0) {
            throw new InvalidInputException("Radius must be greater than 0 km");
        }
        return Optional.of(new GeoFilter(latitude, longitude, radiusKm));
    }
}
