package com.ludora.paymentcore.repository;

import com.ludora.paymentcore.entity.WebhookLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Webhook logs are append-only: callers create and update rows, never delete them.
 */
public interface WebhookLogRepository extends JpaRepository<WebhookLog, Long> {

    long countByPageRequestUidAndProviderTransactionUid(String pageRequestUid, String providerTransactionUid);

    long countByPageRequestUid(String pageRequestUid);

    List<WebhookLog> findByTransactionIdOrderByIdAsc(Long transactionId);
}
