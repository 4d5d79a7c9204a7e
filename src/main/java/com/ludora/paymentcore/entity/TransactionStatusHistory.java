package com.ludora.paymentcore.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

/**
 * Append-only audit row written for every resolution attempt, including the ones that
 * lost a race or were rejected.
 */
@Entity
@Table(
        name = "transaction_status_history",
        indexes = @Index(name = "idx_status_history_txn", columnList = "transaction_id")
)
@Getter
@Setter
public class TransactionStatusHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_id", nullable = false)
    private Long transactionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private TransactionStatus reportedStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ResolutionMethod source;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ResolutionOutcome outcome;

    @Column(length = 512)
    private String detail;

    @Column(nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
