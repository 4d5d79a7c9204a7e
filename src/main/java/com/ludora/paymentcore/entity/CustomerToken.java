package com.ludora.paymentcore.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

/**
 * Tokenized payment method kept for recurring billing.
 *
 * The provider token is encrypted with AES-GCM before persistence; only the masked card
 * is ever logged. At most one active default token per user.
 */
@Entity
@Table(
        name = "customer_tokens",
        indexes = @Index(name = "idx_customer_token_user", columnList = "user_id"),
        uniqueConstraints = @UniqueConstraint(
                name = "uq_customer_token_user_fingerprint",
                columnNames = {"user_id", "token_fingerprint"}
        )
)
@Getter
@Setter
public class CustomerToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(length = 64)
    private String providerCustomerUid;

    /** SHA-256 hex of the plain token; finds an already stored token without decrypting. */
    @Column(name = "token_fingerprint", nullable = false, length = 64)
    private String tokenFingerprint;

    /** AES-GCM encrypted provider token. */
    @Lob
    @Column(nullable = false)
    private byte[] encToken;

    @Column(nullable = false, length = 16)
    private byte[] iv;

    @Column(nullable = false, length = 16)
    private byte[] tag;

    /** Data encryption key ID (used for key rotation). */
    @Column(nullable = false, length = 64)
    private String dekKid;

    /** Masked card number (e.g., "************1234"). */
    @Column(length = 32)
    private String cardMask;

    @Column(length = 32)
    private String cardBrand;

    private Integer expiryMonth;

    private Integer expiryYear;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "is_default", nullable = false)
    private boolean defaultToken;

    private OffsetDateTime lastUsedAt;

    @Column(nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
