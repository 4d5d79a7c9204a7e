package com.ludora.paymentcore.repository;

import com.ludora.paymentcore.entity.CustomerToken;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CustomerTokenRepository extends JpaRepository<CustomerToken, Long> {

    Optional<CustomerToken> findByUserIdAndTokenFingerprint(String userId, String tokenFingerprint);

    boolean existsByUserIdAndDefaultTokenTrueAndActiveTrue(String userId);

    List<CustomerToken> findByUserId(String userId);
}
