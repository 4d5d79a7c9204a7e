package com.ludora.paymentcore.repository;

import com.ludora.paymentcore.entity.Purchase;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PurchaseRepository extends JpaRepository<Purchase, Long> {

    boolean existsByTransactionIdAndEntityTypeAndEntityId(Long transactionId, String entityType, String entityId);

    boolean existsByBuyerUserIdAndEntityTypeAndEntityId(String buyerUserId, String entityType, String entityId);

    List<Purchase> findByTransactionId(Long transactionId);
}
