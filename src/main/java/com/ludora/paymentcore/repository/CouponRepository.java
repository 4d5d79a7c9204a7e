package com.ludora.paymentcore.repository;

import com.ludora.paymentcore.entity.Coupon;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface CouponRepository extends JpaRepository<Coupon, Long> {

    List<Coupon> findByCodeIn(Collection<String> codes);

    @Modifying
    @Query("update Coupon c set c.usageCount = c.usageCount + 1 where c.code = :code")
    int incrementUsage(@Param("code") String code);
}
