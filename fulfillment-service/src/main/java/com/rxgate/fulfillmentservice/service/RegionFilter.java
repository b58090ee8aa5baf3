package com.rxgate.fulfillmentservice.service;

import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Administrative region match (state, LGA, ward). Only supplied fields are applied.
 */
@Getter
@ToString
public class RegionFilter {

    private final String state;
    private final String lga;
    private final String ward;

    private RegionFilter(String state, String lga, String ward) {
        this.state = state;
        this.lga = lga;
        this.ward = ward;
    }

    public static Optional<RegionFilter> of(String state, String lga, String ward) {
        String s = trimToNull(state);
        String l = trimToNull(lga);
        String w = trimToNull(ward);
        if (s == null && l == null && w == null) {
            return Optional.empty();
        }
        return Optional.of(new RegionFilter(s, l, w));
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
