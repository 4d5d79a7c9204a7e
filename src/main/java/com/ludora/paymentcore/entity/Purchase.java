package com.ludora.paymentcore.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

/**
 * Access grant created when a transaction completes.
 *
 * Features:
 *  - One row per purchase intent per transaction, enforced by (transaction_id, entity_type, entity_id).
 *  - Carries the resolution metadata of the transaction that produced it.
 */
@Entity
@Table(
        name = "purchases",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_purchase_txn_entity",
                columnNames = {"transaction_id", "entity_type", "entity_id"}
        ),
        indexes = @Index(name = "idx_purchase_buyer_entity", columnList = "buyer_user_id, entity_type, entity_id")
)
@Getter
@Setter
public class Purchase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "buyer_user_id", nullable = false, length = 64)
    private String buyerUserId;

    @Column(name = "entity_type", nullable = false, length = 32)
    private String entityType;

    @Column(name = "entity_id", nullable = false, length = 64)
    private String entityId;

    @Column(nullable = false)
    private Long amountMinor;

    @Column(name = "transaction_id", nullable = false)
    private Long transactionId;

    @Column(nullable = false)
    private Long paymentSessionId;

    /** Polling attempts the owning transaction had used when the purchase was activated. */
    @Column(nullable = false)
    private int pollingAttempts;

    private OffsetDateTime lastPolledAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ResolutionMethod resolutionMethod;

    @Column(nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
