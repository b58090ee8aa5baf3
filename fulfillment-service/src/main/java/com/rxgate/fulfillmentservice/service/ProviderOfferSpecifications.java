package com.rxgate.fulfillmentservice.service;

import com.rxgate.fulfillmentservice.model.CatalogItem;
import com.rxgate.fulfillmentservice.model.CatalogItemKind;
import com.rxgate.fulfillmentservice.model.Provider;
import com.rxgate.fulfillmentservice.model.ProviderOffer;
import com.rxgate.fulfillmentservice.model.ProviderStatus;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class ProviderOfferSpecifications {

    private ProviderOfferSpecifications() {
    }

    public static Specification<ProviderOffer> forCatalogItem(Long catalogItemId) {
        return (root, query, cb) -> cb.equal(root.get("id").get("catalogItemId"), catalogItemId);
    }

    public static Specification<ProviderOffer> providerVerifiedAndActive() {
        return (root, query, cb) -> {
            Join<ProviderOffer, Provider> provider = root.join("provider");
            return cb.and(
                    cb.equal(provider.get("status"), ProviderStatus.VERIFIED),
                    cb.isTrue(provider.get("isActive")));
        };
    }

    // stock for medications, the availability flag for services
    public static Specification<ProviderOffer> canFulfill(int requiredQuantity) {
        return (root, query, cb) -> {
            Join<ProviderOffer, CatalogItem> item = root.join("catalogItem");
            return cb.or(
                    cb.and(cb.equal(item.get("kind"), CatalogItemKind.MEDICATION),
                            cb.greaterThanOrEqualTo(root.get("stock"), requiredQuantity)),
                    cb.and(cb.equal(item.get("kind"), CatalogItemKind.SERVICE),
                            cb.isTrue(root.get("available"))));
        };
    }

    public static Specification<ProviderOffer> inRegion(RegionFilter region) {
        return (root, query, cb) -> {
            Join<ProviderOffer, Provider> provider = root.join("provider");
            List<Predicate> predicates = new ArrayList<>();
            if (region.getState() != null) {
                predicates.add(cb.equal(cb.lower(provider.get("state")), region.getState().toLowerCase()));
            }
            if (region.getLga() != null) {
                predicates.add(cb.equal(cb.lower(provider.get("lga")), region.getLga().toLowerCase()));
            }
            if (region.getWard() != null) {
                predicates.add(cb.equal(cb.lower(provider.get("ward")), region.getWard().toLowerCase()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    public static Specification<ProviderOffer> providerIdIn(Collection<Long> providerIds) {
        return (root, query, cb) -> root.get("id").get("providerId").in(providerIds);
    }

    public static Specification<ProviderOffer> homeCollectionAvailable() {
        return (root, query, cb) -> cb.isTrue(root.join("provider").get("homeCollectionAvailable"));
    }
}
