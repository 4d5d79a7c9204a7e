package com.ludora.paymentcore.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

/**
 * Subscription record as far as payment resolution is concerned: it waits in PENDING
 * until its first checkout completes.
 */
@Entity
@Table(name = "subscriptions", indexes = @Index(name = "idx_subscription_user", columnList = "user_id"))
@Getter
@Setter
public class Subscription {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(nullable = false, length = 64)
    private String planId;

    @Column(nullable = false)
    private Long priceMinor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SubscriptionStatus status = SubscriptionStatus.PENDING;

    private OffsetDateTime activatedAt;

    /** Transaction that last changed this subscription's payment state. */
    private Long lastTransactionId;

    @Column(nullable = false)
    private int failedPaymentCount;

    private OffsetDateTime lastPaymentFailedAt;

    @Column(nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    @PreUpdate
    public void onUpdate() {
        this.updatedAt = OffsetDateTime.now();
    }
}
