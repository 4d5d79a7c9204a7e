package com.ludora.paymentcore.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

/**
 * Entity representing one payment attempt against the provider.
 *
 * The row is the single point of mutual exclusion between the webhook path and the
 * polling path: every non-pending status write happens while holding a row lock on it
 * (see ResolutionArbiter). Polling bookkeeping lives here as well so the counter is
 * incremented under the same lock.
 */
@Entity
@Table(
        name = "payment_transactions",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_txn_page_request_uid",
                        columnNames = {"page_request_uid"}
                )
        },
        indexes = {
                @Index(name = "idx_txn_status", columnList = "status"),
                @Index(name = "idx_txn_next_poll_at", columnList = "next_poll_at"),
                @Index(name = "idx_txn_session", columnList = "payment_session_id")
        }
)
@Getter
@Setter
public class PaymentTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Amount in minor units (agorot / cents). */
    @Column(nullable = false)
    private Long amountMinor;

    /** ISO 4217 currency code. */
    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false, length = 32)
    private String paymentMethod = "payplus";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionStatus status = TransactionStatus.PENDING;

    /** Provider correlation key issued at checkout creation. */
    @Column(name = "page_request_uid", length = 64)
    private String pageRequestUid;

    /** Provider-side transaction id, known once the user actually paid. */
    @Column(length = 64)
    private String providerTransactionUid;

    /** Raw provider payload that produced the final status (webhook body or status lookup). */
    @Lob
    private String providerResponse;

    @Column(length = 512)
    private String failureReason;

    /** production / staging */
    @Column(nullable = false, length = 16)
    private String environment;

    @Column(name = "payment_session_id", nullable = false)
    private Long paymentSessionId;

    /** Set exactly once, by the arbiter, when the transaction leaves PENDING. */
    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private ResolutionMethod resolutionMethod;

    @Column(nullable = false)
    private int pollingAttempts;

    private OffsetDateTime lastPolledAt;

    @Column(name = "next_poll_at")
    private OffsetDateTime nextPollAt;

    private OffsetDateTime webhookReceivedAt;

    private OffsetDateTime completedAt;

    private OffsetDateTime failedAt;

    @Column(nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    @PreUpdate
    public void onUpdate() {
        this.updatedAt = OffsetDateTime.now();
    }
}
