package com.ludora.paymentcore.entity;

public enum DiscountType {
    PERCENTAGE,
    FIXED
}
