package com.rxgate.fulfillmentservice.service;

import com.rxgate.common.exception.InvalidInputException;
import com.rxgate.fulfillmentservice.dto.ProviderOfferView;
import com.rxgate.fulfillmentservice.mapper.ProviderOfferMapper;
import com.rxgate.fulfillmentservice.model.Provider;
import com.rxgate.fulfillmentservice.model.ProviderOffer;
import com.rxgate.fulfillmentservice.model.ProviderStatus;
import com.rxgate.fulfillmentservice.repository.ProviderOfferRepository;
import com.rxgate.fulfillmentservice.repository.ProviderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.rxgate.fulfillmentservice.service.ProviderOfferSpecifications.*;

/**
 * Finds the provider offers able to fulfill a catalog item in a given quantity,
 * optionally restricted to a radius around a point and to a region.
 *
 * Geo search runs in two steps: a bounding-box query over verified, active
 * providers, then exact Haversine distance against the radius. When no provider
 * is in range the offer query still runs, restricted to provider id -1, so an
 * empty geo result can never widen into an unfiltered search.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AvailabilityIndex {

    private static final Set<Long> NO_PROVIDER = Set.of(-1L);

    private final ProviderOfferRepository providerOfferRepository;
    private final ProviderRepository providerRepository;
    private final CatalogService catalogService;
    private final GeoDistanceCalculator geoDistanceCalculator;
    private final ProviderOfferMapper providerOfferMapper;

    /**
     * @return eligible offers ordered by provider id; rank them with {@link OfferRanking}
     */
    public List<ProviderOfferView> findAvailability(AvailabilityQuery query) {
        if (query.getRequiredQuantity() < 1) {
            throw new InvalidInputException("Required quantity must be at least 1");
        }
        catalogService.resolveCatalogItem(query.getCatalogItemId());

        Specification<ProviderOffer> spec = Specification.where(forCatalogItem(query.getCatalogItemId()))
                .and(providerVerifiedAndActive())
                .and(canFulfill(query.getRequiredQuantity()));

        if (query.isHomeCollectionOnly()) {
            spec = spec.and(homeCollectionAvailable());
        }
        if (query.getRegion() != null) {
            spec = spec.and(inRegion(query.getRegion()));
        }

        Map<Long, Double> distances = null;
        if (query.getGeo() != null) {
            distances = providersWithinRadius(query.getGeo());
            spec = spec.and(providerIdIn(distances.isEmpty() ? NO_PROVIDER : distances.keySet()));
        }

        List<ProviderOffer> offers = providerOfferRepository.findAll(spec);

        Map<Long, Double> distanceByProvider = distances;
        List<ProviderOfferView> views = offers.stream()
                .map(offer -> {
                    ProviderOfferView view = providerOfferMapper.toView(offer);
                    if (distanceByProvider != null) {
                        view.setDistanceKm(distanceByProvider.get(view.getProviderId()));
                    }
                    return view;
                })
                .sorted(Comparator.comparing(ProviderOfferView::getProviderId))
                .collect(Collectors.toList());

        log.debug("Availability lookup: catalogItemId={}, quantity={}, geo={}, region={}, results={}",
                query.getCatalogItemId(), query.getRequiredQuantity(), query.getGeo(), query.getRegion(),
                views.size());
        return views;
    }

    public List<ProviderOfferView> findAvailability(AvailabilityQuery query, OfferRanking ranking) {
        return ranking.rank(findAvailability(query));
    }

    // providerId -> distance (km, 2 decimals) for verified, active providers inside the radius
    private Map<Long, Double> providersWithinRadius(GeoFilter geo) {
        GeoDistanceCalculator.BoundingBox box = geoDistanceCalculator.boundingBox(geo);
        List<Provider> candidates = providerRepository.findInBoundingBox(
                ProviderStatus.VERIFIED, box.minLat, box.maxLat, box.minLng, box.maxLng);

        Map<Long, Double> inRange = new HashMap<>();
        for (Provider provider : candidates) {
            double distance = geoDistanceCalculator.distanceKm(
                    geo.getLatitude(), geo.getLongitude(),
                    provider.getLatitude(), provider.getLongitude());
            if (distance <= geo.getRadiusKm()) {
                inRange.put(provider.getId(), geoDistanceCalculator.round(distance));
            }
        }

        log.debug("Geo filter: {} candidates in bounding box, {} within {} km",
                candidates.size(), inRange.size(), geo.getRadiusKm());
        return inRange;
    }
}
