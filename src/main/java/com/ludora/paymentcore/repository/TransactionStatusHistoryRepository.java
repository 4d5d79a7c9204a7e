package com.ludora.paymentcore.repository;

import com.ludora.paymentcore.entity.TransactionStatusHistory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TransactionStatusHistoryRepository extends JpaRepository<TransactionStatusHistory, Long> {

    List<TransactionStatusHistory> findByTransactionIdOrderByIdAsc(Long transactionId);
}
