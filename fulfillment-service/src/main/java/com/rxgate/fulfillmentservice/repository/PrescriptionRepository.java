package com.rxgate.fulfillmentservice.repository;

import com.rxgate.fulfillmentservice.model.Prescription;
import com.rxgate.fulfillmentservice.model.PrescriptionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PrescriptionRepository extends JpaRepository<Prescription, Long> {

    @EntityGraph(attributePaths = {"lineItems", "lineItems.catalogItem"})
    Optional<Prescription> findWithLineItemsById(Long id);

    // "active" prescription for a patient: newest first, id breaks createdAt ties
    @EntityGraph(attributePaths = {"lineItems", "lineItems.catalogItem"})
    Optional<Prescription> findFirstByPatientIdentifierAndStatusInOrderByCreatedAtDescIdDesc(
            String patientIdentifier, Collection<PrescriptionStatus> statuses);

    @EntityGraph(attributePaths = {"lineItems", "lineItems.catalogItem"})
    List<Prescription> findByPatientIdentifierOrderByCreatedAtDescIdDesc(String patientIdentifier);

    // serializes line-item additions against a concurrent decision on the same row
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Prescription p WHERE p.id = :id")
    Optional<Prescription> findByIdForUpdate(@Param("id") Long id);

    /**
     * Compare-and-swap on the stored status. Returns 0 when the prescription is
     * no longer PENDING, so at most one concurrent decision can succeed.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Prescription p SET p.status = :status, p.verified = :verified, " +
            "p.rejectionReason = :reason, p.updatedAt = :now, p.version = p.version + 1 " +
            "WHERE p.id = :id AND p.status = :expected")
    int transitionStatus(@Param("id") Long id,
                         @Param("expected") PrescriptionStatus expected,
                         @Param("status") PrescriptionStatus status,
                         @Param("verified") boolean verified,
                         @Param("reason") String reason,
                         @Param("now") Instant now);
}
