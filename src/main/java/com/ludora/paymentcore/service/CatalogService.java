package com.ludora.paymentcore.service;

import com.ludora.paymentcore.entity.CatalogItem;
import com.ludora.paymentcore.entity.PurchaseIntent;
import com.ludora.paymentcore.entity.Subscription;
import com.ludora.paymentcore.repository.CatalogItemRepository;
import com.ludora.paymentcore.repository.PurchaseRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read-only price and ownership lookups for checkout.
 */
@Service
@RequiredArgsConstructor
public class CatalogService {

    private final CatalogItemRepository catalogRepo;
    private final PurchaseRepository purchaseRepo;
    private final SubscriptionService subscriptionService;

    /**
     * Current price of an entity for this user, or empty if it cannot be bought.
     */
    public Optional<Long> findPrice(String userId, String entityType, String entityId) {
        if (PurchaseIntent.SUBSCRIPTION.equals(entityType)) {
            return subscriptionService.findPayable(userId, entityId).map(Subscription::getPriceMinor);
        }
        return catalogRepo.findByEntityTypeAndEntityId(entityType, entityId)
                .filter(CatalogItem::isActive)
                .map(CatalogItem::getPriceMinor)
                .filter(price -> price > 0);
    }

    public boolean alreadyOwned(String userId, String entityType, String entityId) {
        if (PurchaseIntent.SUBSCRIPTION.equals(entityType)) {
            return false;
        }
        return purchaseRepo.existsByBuyerUserIdAndEntityTypeAndEntityId(userId, entityType, entityId);
    }
}
