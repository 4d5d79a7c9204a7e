package com.ludora.paymentcore.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;

/**
 * Read-only view of a purchasable product. Maintained by the product subsystem; the
 * payment core only reads prices and availability from it.
 */
@Entity
@Table(
        name = "catalog_items",
        uniqueConstraints = @UniqueConstraint(name = "uq_catalog_entity", columnNames = {"entity_type", "entity_id"})
)
@Getter
@Setter
public class CatalogItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_type", nullable = false, length = 32)
    private String entityType;

    @Column(name = "entity_id", nullable = false, length = 64)
    private String entityId;

    @Column(length = 255)
    private String title;

    @Column(nullable = false)
    private Long priceMinor;

    @Column(nullable = false)
    private boolean active = true;
}
