package com.rxgate.fulfillmentservice.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Great-circle distances (Haversine) and the lat/lng box enclosing a search radius.
 */
@Component
public class GeoDistanceCalculator {

    private static final double EARTH_RADIUS_KM = 6371;
    private static final double KM_PER_DEGREE = Math.PI * EARTH_RADIUS_KM / 180;
    // widens the box slightly so points right on the radius are never cut off
    private static final double BOX_PADDING = 1.01;

    /**
     * @return distance in kilometers
     */
    public double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                        * Math.sin(dLon / 2) * Math.sin(dLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }

    // truncates, a rounded distance never exceeds the radius it was checked against
    public double round(double distanceKm) {
        return BigDecimal.valueOf(distanceKm).setScale(2, RoundingMode.DOWN).doubleValue();
    }

    /**
     * Box guaranteed to contain every point within {@code radiusKm} of the filter
     * point. Falls back to the full longitude range near the poles and across the
     * antimeridian.
     */
    public BoundingBox boundingBox(GeoFilter filter) {
        double paddedRadius = filter.getRadiusKm() * BOX_PADDING;
        double latDelta = paddedRadius / KM_PER_DEGREE;
        double minLat = Math.max(-90, filter.getLatitude() - latDelta);
        double maxLat = Math.min(90, filter.getLatitude() + latDelta);

        double cosLat = Math.min(Math.cos(Math.toRadians(minLat)), Math.cos(Math.toRadians(maxLat)));
        double minLng = -180;
        double maxLng = 180;
        if (cosLat > 1e-6) {
            double lngDelta = paddedRadius / (KM_PER_DEGREE * cosLat);
            if (filter.getLongitude() - lngDelta >= -180 && filter.getLongitude() + lngDelta <= 180) {
                minLng = filter.getLongitude() - lngDelta;
                maxLng = filter.getLongitude() + lngDelta;
            }
        }
        return new BoundingBox(minLat, maxLat, minLng, maxLng);
    }

    public static class BoundingBox {
        public final double minLat;
        public final double maxLat;
        public final double minLng;
        public final double maxLng;

        BoundingBox(double minLat, double maxLat, double minLng, double maxLng) {
            this.minLat = minLat;
            this.maxLat = maxLat;
            this.minLng = minLng;
            this.maxLng = maxLng;
        }
    }
}
