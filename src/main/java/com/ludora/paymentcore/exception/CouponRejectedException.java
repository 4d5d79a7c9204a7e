package com.ludora.paymentcore.exception;

import java.util.List;

/**
 * Thrown when one or more coupon codes cannot be applied to a checkout.
 */
public class CouponRejectedException extends RuntimeException {

    private final List<String> codes;

    public CouponRejectedException(String message, List<String> codes) {
        super(message);
        this.codes = codes;
    }

    /** @return the codes that caused the rejection */
    public List<String> getCodes() {
        return codes;
    }
}
