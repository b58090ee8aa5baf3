package com.rxgate.fulfillmentservice.repository;

import com.rxgate.fulfillmentservice.model.Provider;
import com.rxgate.fulfillmentservice.model.ProviderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProviderRepository extends JpaRepository<Provider, Long> {

    // bounding-box prefilter, exact distance is computed afterwards
    @Query("SELECT p FROM Provider p WHERE p.status = :status AND p.isActive = true " +
            "AND p.latitude BETWEEN :minLat AND :maxLat " +
            "AND p.longitude BETWEEN :minLng AND :maxLng")
    List<Provider> findInBoundingBox(@Param("status") ProviderStatus status,
                                     @Param("minLat") double minLat,
                                     @Param("maxLat") double maxLat,
                                     @Param("minLng") double minLng,
                                     @Param("maxLng") double maxLng);
}
