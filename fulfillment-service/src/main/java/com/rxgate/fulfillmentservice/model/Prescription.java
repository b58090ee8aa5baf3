package com.rxgate.fulfillmentservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "prescriptions", indexes = {
        @Index(name = "idx_prescriptions_patient_status", columnList = "patient_identifier, status")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Prescription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    // opaque, supplied by the caller (session id, user id, phone...)
    @Column(name = "patient_identifier", nullable = false)
    @ToString.Include
    private String patientIdentifier;

    private String email;

    private String phone;

    @Column(name = "file_url", nullable = false)
    private String fileUrl;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private PrescriptionStatus status = PrescriptionStatus.PENDING;

    // denormalized: true iff status == VERIFIED
    @Builder.Default
    @Column(nullable = false)
    private boolean verified = false;

    @Column(name = "rejection_reason")
    private String rejectionReason;

    @Builder.Default
    @OrderBy("id ASC")
    @OneToMany(mappedBy = "prescription", cascade = CascadeType.ALL)
    private List<PrescriptionLineItem> lineItems = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public void addLineItem(PrescriptionLineItem lineItem) {
        lineItem.setPrescription(this);
        lineItems.add(lineItem);
    }

    public boolean covers(Long catalogItemId) {
        return lineItems.stream()
                .anyMatch(item -> item.getCatalogItem().getId().equals(catalogItemId));
    }
}
