package com.ludora.paymentcore.entity;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import javax.persistence.Column;
import javax.persistence.Embeddable;

/**
 * One thing the user intends to buy in a checkout: an (entityType, entityId) pair plus
 * the price resolved for it when the session was created.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = {"entityType", "entityId"})
@ToString
public class PurchaseIntent {

    /** Entity type used for subscription checkouts; the entity id is the subscription id. */
    public static final String SUBSCRIPTION = "subscription";

    @Column(name = "entity_type", nullable = false, length = 32)
    private String entityType;

    @Column(name = "entity_id", nullable = false, length = 64)
    private String entityId;

    @Column(name = "amount_minor", nullable = false)
    private Long amountMinor;

    public boolean isSubscription() {
        return SUBSCRIPTION.equals(entityType);
    }
}
