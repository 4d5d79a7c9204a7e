package com.ludora.paymentcore.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import javax.persistence.Column;
import javax.persistence.Embeddable;

/** Coupon code together with the discount it produced at checkout time. */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AppliedCoupon {

    @Column(name = "code", nullable = false, length = 64)
    private String code;

    @Column(name = "discount_minor", nullable = false)
    private Long discountMinor;
}
