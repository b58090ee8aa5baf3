package com.rxgate.fulfillmentservice.service;

import com.rxgate.common.exception.InvalidInputException;
import com.rxgate.fulfillmentservice.dto.ProviderOfferView;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Orderings a caller can ask for. Ties fall back to provider id so results are stable.
 */
public enum OfferRanking {

    CHEAPEST(Comparator.comparing(ProviderOfferView::getPrice,
            Comparator.nullsLast(Comparator.naturalOrder()))),

    // offers without a distance (no geo filter, or provider without coordinates) go last
    CLOSEST(Comparator.comparing(ProviderOfferView::getDistanceKm,
            Comparator.nullsLast(Comparator.naturalOrder())));

    private final Comparator<ProviderOfferView> comparator;

    OfferRanking(Comparator<ProviderOfferView> primary) {
        this.comparator = primary.thenComparing(ProviderOfferView::getProviderId,
                Comparator.nullsLast(Comparator.naturalOrder()));
    }

    public List<ProviderOfferView> rank(List<ProviderOfferView> offers) {
        return offers.stream().sorted(comparator).collect(Collectors.toList());
    }

    /**
     * Parses the {@code sortBy} request parameter; blank means CHEAPEST.
     */
    public static OfferRanking fromParam(String sortBy) {
        if (sortBy == null || sortBy.isBlank()) {
            return CHEAPEST;
        }
        try {
            return OfferRanking.valueOf(sortBy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("sortBy must be 'cheapest' or 'closest', got: " + sortBy, e);
        }
    }
}
