package com.rxgate.fulfillmentservice.repository;

import com.rxgate.fulfillmentservice.model.Order;
import com.rxgate.fulfillmentservice.model.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {

    Optional<Order> findByIdAndPatientIdentifier(Long id, String patientIdentifier);

    List<Order> findByPrescriptionIdAndStatusNotIn(Long prescriptionId, Collection<OrderStatus> statuses);

    Optional<Order> findFirstByPrescriptionIdOrderByCreatedAtDescIdDesc(Long prescriptionId);

    // stale orders blocked on prescription review
    List<Order> findByStatusAndCreatedAtBefore(OrderStatus status, Instant cutoff);
}
