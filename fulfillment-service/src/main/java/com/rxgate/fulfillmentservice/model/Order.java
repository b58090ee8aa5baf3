package com.rxgate.fulfillmentservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Orders are created by checkout; the fulfillment engine only moves their
 * status and cancellation fields.
 */
@Entity
@Table(name = "orders")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    @Column(name = "patient_identifier", nullable = false)
    private String patientIdentifier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private OrderStatus status;

    // set once the patient uploads a prescription for this order
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "prescription_id")
    private Prescription prescription;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<OrderItem> items = new ArrayList<>();

    @Column(name = "total_price")
    private BigDecimal totalPrice;

    @Column(name = "cancel_reason")
    private String cancelReason;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // Optimistic locking against concurrent status updates from checkout
    @Version
    @Column(name = "version")
    private Long version;

    public boolean requiresPrescription() {
        return items.stream().anyMatch(item -> item.getOffer().getCatalogItem().isPrescriptionRequired());
    }
}
