package com.ludora.paymentcore.service;

import com.ludora.paymentcore.entity.AppliedCoupon;
import com.ludora.paymentcore.entity.Coupon;
import com.ludora.paymentcore.entity.DiscountType;
import com.ludora.paymentcore.exception.CouponRejectedException;
import com.ludora.paymentcore.repository.CouponRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Coupon validation and discount calculation at checkout.
 *
 * Rules:
 *  - Every code must exist, be active, not be past validUntil and have uses left.
 *  - The subtotal must reach the coupon's minimum amount.
 *  - More than one code is only allowed when every coupon allows stacking.
 *  - Discounts apply in the given order: a percentage of the remaining amount, or a fixed
 *    amount capped at the remaining amount.
 *  - The total must stay above zero.
 *
 * Usage counters are incremented when the payment completes, not here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CouponService {

    private final CouponRepository couponRepo;
    private final Clock clock;

    @Getter
    @AllArgsConstructor
    public static class CouponApplication {
        private final List<AppliedCoupon> applied;
        private final long discountMinor;
        private final long totalMinor;
    }

    public CouponApplication applyCoupons(List<String> codes, long subtotalMinor) {
        if (codes == null || codes.isEmpty()) {
            return new CouponApplication(List.of(), 0L, subtotalMinor);
        }

        Set<String> unique = new LinkedHashSet<>();
        for (String code : codes) {
            String trimmed = code == null ? "" : code.trim();
            if (trimmed.isEmpty() || !unique.add(trimmed)) {
                throw new CouponRejectedException("Coupon codes must be non-empty and distinct", codes);
            }
        }

        Map<String, Coupon> byCode = couponRepo.findByCodeIn(unique).stream()
                .collect(Collectors.toMap(Coupon::getCode, Function.identity()));

        List<String> unknown = unique.stream().filter(c -> !byCode.containsKey(c)).collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new CouponRejectedException("Unknown coupon code", unknown);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        for (String code : unique) {
            rejectIfUnusable(byCode.get(code), subtotalMinor, now);
        }

        if (unique.size() > 1) {
            List<String> exclusive = unique.stream()
                    .filter(c -> !byCode.get(c).isAllowStacking())
                    .collect(Collectors.toList());
            if (!exclusive.isEmpty()) {
                throw new CouponRejectedException("Coupon cannot be combined with other coupons", exclusive);
            }
        }

        long remaining = subtotalMinor;
        List<AppliedCoupon> applied = new ArrayList<>();
        for (String code : unique) {
            long discount = discountFor(byCode.get(code), remaining);
            remaining -= discount;
            applied.add(new AppliedCoupon(code, discount));
        }

        if (remaining <= 0) {
            throw new CouponRejectedException("Coupons would reduce the total to zero", new ArrayList<>(unique));
        }

        log.info("[SESSION] Coupons applied. codes={}, subtotalMinor={}, totalMinor={}", unique, subtotalMinor, remaining);
        return new CouponApplication(applied, subtotalMinor - remaining, remaining);
    }

    /**
     * Counts one use of each coupon. Called once per completed transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordUsage(List<AppliedCoupon> applied) {
        for (AppliedCoupon coupon : applied) {
            couponRepo.incrementUsage(coupon.getCode());
        }
    }

    private static void rejectIfUnusable(Coupon coupon, long subtotalMinor, OffsetDateTime now) {
        List<String> code = List.of(coupon.getCode());
        if (!coupon.isActive()) {
            throw new CouponRejectedException("Coupon is not active", code);
        }
        if (coupon.getValidUntil() != null && coupon.getValidUntil().isBefore(now)) {
            throw new CouponRejectedException("Coupon has expired", code);
        }
        if (coupon.getUsageLimit() != null && coupon.getUsageCount() >= coupon.getUsageLimit()) {
            throw new CouponRejectedException("Coupon usage limit reached", code);
        }
        if (coupon.getMinimumAmountMinor() != null && subtotalMinor < coupon.getMinimumAmountMinor()) {
            throw new CouponRejectedException("Order amount is below the coupon minimum", code);
        }
    }

    static long discountFor(Coupon coupon, long remaining) {
        if (coupon.getDiscountType() == DiscountType.PERCENTAGE) {
            long percent = Math.min(Math.max(coupon.getDiscountValue(), 0L), 100L);
            return remaining * percent / 100;
        }
        return Math.min(Math.max(coupon.getDiscountValue(), 0L), remaining);
    }
}
