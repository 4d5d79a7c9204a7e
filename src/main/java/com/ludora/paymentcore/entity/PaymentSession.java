package com.ludora.paymentcore.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Checkout unit shown to the user.
 *
 * Groups one or more purchase intents plus coupon discounts into a single provider
 * payment page. Its status is a coarse projection of the underlying transaction
 * status and its own expiry.
 */
@Entity
@Table(
        name = "payment_sessions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_session_ref", columnNames = {"session_ref"})
        },
        indexes = {
                @Index(name = "idx_session_user", columnList = "user_id"),
                @Index(name = "idx_session_status_expiry", columnList = "session_status, expires_at")
        }
)
@Getter
@Setter
public class PaymentSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Public identifier handed to the client (e.g. "ps_3f9a0c1d2e4b"). */
    @Column(name = "session_ref", nullable = false, length = 40)
    private String sessionRef;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "payment_session_intents", joinColumns = @JoinColumn(name = "payment_session_id"))
    @OrderColumn(name = "position")
    private List<PurchaseIntent> purchaseIntents = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "payment_session_coupons", joinColumns = @JoinColumn(name = "payment_session_id"))
    @OrderColumn(name = "position")
    private List<AppliedCoupon> appliedCoupons = new ArrayList<>();

    /** Amount charged, after coupon discounts. */
    @Column(nullable = false)
    private Long totalAmountMinor;

    /** Amount before coupon discounts. */
    @Column(nullable = false)
    private Long originalAmountMinor;

    @Column(nullable = false)
    private Long couponDiscountMinor = 0L;

    @Column(nullable = false, length = 3)
    private String currency;

    /** Set when this checkout pays for a subscription rather than one-off purchases. */
    @Column(length = 64)
    private String subscriptionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "session_status", nullable = false, length = 16)
    private SessionStatus sessionStatus = SessionStatus.CREATED;

    @Column(length = 64)
    private String pageRequestUid;

    @Column(length = 1024)
    private String paymentPageUrl;

    @Column(length = 1024)
    private String returnUrl;

    @Column(length = 1024)
    private String callbackUrl;

    @Column(nullable = false, length = 16)
    private String environment;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    private OffsetDateTime completedAt;

    private OffsetDateTime failedAt;

    @Column(length = 1024)
    private String errorMessage;

    @Column(nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    @PreUpdate
    public void onUpdate() {
        this.updatedAt = OffsetDateTime.now();
    }

    public boolean isSubscriptionCheckout() {
        return subscriptionId != null;
    }

    public boolean isExpiredAt(OffsetDateTime now) {
        return sessionStatus == SessionStatus.EXPIRED || (sessionStatus.isOpen() && expiresAt.isBefore(now));
    }
}
