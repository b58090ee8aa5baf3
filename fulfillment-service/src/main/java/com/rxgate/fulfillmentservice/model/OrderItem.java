package com.rxgate.fulfillmentservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "order_items")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    private Order order;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumns({
            @JoinColumn(name = "provider_id", referencedColumnName = "provider_id", nullable = false),
            @JoinColumn(name = "catalog_item_id", referencedColumnName = "catalog_item_id", nullable = false)
    })
    private ProviderOffer offer;

    @Column(nullable = false)
    @ToString.Include
    private Integer quantity;

    @Column(nullable = false)
    private BigDecimal price;

    // true while quantity is held against the offer's stock
    @Column(nullable = false)
    @ToString.Include
    private boolean reserved;
}
