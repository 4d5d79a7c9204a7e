package com.ludora.paymentcore.repository;

import com.ludora.paymentcore.entity.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubscriptionRepository extends JpaRepository<Subscription, String> {
}
