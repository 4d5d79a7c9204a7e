package com.ludora.paymentcore.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.OffsetDateTime;

@Entity
@Table(name = "coupons", uniqueConstraints = @UniqueConstraint(name = "uq_coupon_code", columnNames = {"code"}))
@Getter
@Setter
public class Coupon {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DiscountType discountType;

    /** Percent (0-100) for PERCENTAGE, minor units for FIXED. */
    @Column(nullable = false)
    private Long discountValue;

    @Column(nullable = false)
    private boolean active = true;

    private OffsetDateTime validUntil;

    /** Null means unlimited. */
    private Integer usageLimit;

    @Column(nullable = false)
    private int usageCount;

    @Column(nullable = false)
    private boolean allowStacking;

    /** Minimum subtotal (minor units) for the coupon to apply. */
    private Long minimumAmountMinor;
}
