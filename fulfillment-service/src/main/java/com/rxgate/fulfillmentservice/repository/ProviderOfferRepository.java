package com.rxgate.fulfillmentservice.repository;

import com.rxgate.fulfillmentservice.model.ProviderOffer;
import com.rxgate.fulfillmentservice.model.ProviderOfferId;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProviderOfferRepository extends JpaRepository<ProviderOffer, ProviderOfferId>,
        JpaSpecificationExecutor<ProviderOffer> {

    @Override
    @EntityGraph(attributePaths = {"provider", "catalogItem"})
    List<ProviderOffer> findAll(Specification<ProviderOffer> spec);

    @Modifying
    @Query("UPDATE ProviderOffer o SET o.stock = o.stock + :quantity " +
            "WHERE o.id.providerId = :providerId AND o.id.catalogItemId = :catalogItemId " +
            "AND o.stock IS NOT NULL")
    int increaseStock(@Param("providerId") Long providerId,
                      @Param("catalogItemId") Long catalogItemId,
                      @Param("quantity") int quantity);
}
