package com.ludora.paymentcore.service;

import com.ludora.paymentcore.dto.ProviderPaymentData;
import com.ludora.paymentcore.entity.PaymentSession;
import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.Purchase;
import com.ludora.paymentcore.entity.PurchaseIntent;
import com.ludora.paymentcore.entity.TransactionStatus;
import com.ludora.paymentcore.exception.SideEffectException;
import com.ludora.paymentcore.repository.PurchaseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Business consequences of a resolved transaction.
 *
 * Only called by {@link ResolutionArbiter} while it holds the transaction row lock, and
 * in the same database transaction: if anything here fails, the status change is rolled
 * back with it. Purchases are checked before insert and also protected by the
 * (transaction_id, entity_type, entity_id) unique key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SideEffectApplier {

    private final PurchaseRepository purchaseRepo;
    private final SubscriptionService subscriptionService;
    private final CouponService couponService;
    private final CustomerTokenService customerTokenService;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void apply(PaymentTransaction txn, PaymentSession session, ProviderPaymentData paymentData) {
        try {
            switch (txn.getStatus()) {
                case COMPLETED:
                    grantAccess(txn, session);
                    break;
                case FAILED:
                    if (session.isSubscriptionCheckout()) {
                        subscriptionService.handlePaymentFailure(session.getSubscriptionId(), txn);
                    }
                    break;
                case CANCELLED:
                    if (session.isSubscriptionCheckout()) {
                        subscriptionService.handlePaymentCancelled(session.getSubscriptionId(), txn);
                    }
                    break;
                default:
                    log.info("[ARBITER] No side effects for status. transactionId={}, status={}",
                            txn.getId(), txn.getStatus());
                    return;
            }
        } catch (DataAccessException e) {
            throw new SideEffectException("Side effects failed for transaction " + txn.getId(), e);
        }

        if (txn.getStatus() == TransactionStatus.COMPLETED) {
            captureToken(session.getUserId(), txn, paymentData);
        }
    }

    private void grantAccess(PaymentTransaction txn, PaymentSession session) {
        int created = 0;
        for (PurchaseIntent intent : session.getPurchaseIntents()) {
            if (intent.isSubscription()) {
                subscriptionService.activate(intent.getEntityId(), txn);
                continue;
            }
            if (purchaseRepo.existsByTransactionIdAndEntityTypeAndEntityId(
                    txn.getId(), intent.getEntityType(), intent.getEntityId())) {
                log.warn("[ARBITER] Purchase already exists, skipped. transactionId={}, entity={}:{}",
                        txn.getId(), intent.getEntityType(), intent.getEntityId());
                continue;
            }
            purchaseRepo.save(toPurchase(txn, session, intent));
            created++;
        }

        couponService.recordUsage(session.getAppliedCoupons());

        log.info("[ARBITER] Access granted. transactionId={}, sessionRef={}, purchasesCreated={}, resolution={}",
                txn.getId(), session.getSessionRef(), created, txn.getResolutionMethod());
    }

    private Purchase toPurchase(PaymentTransaction txn, PaymentSession session, PurchaseIntent intent) {
        Purchase p = new Purchase();
        p.setBuyerUserId(session.getUserId());
        p.setEntityType(intent.getEntityType());
        p.setEntityId(intent.getEntityId());
        p.setAmountMinor(intent.getAmountMinor());
        p.setTransactionId(txn.getId());
        p.setPaymentSessionId(session.getId());
        p.setPollingAttempts(txn.getPollingAttempts());
        p.setLastPolledAt(txn.getLastPolledAt());
        p.setResolutionMethod(txn.getResolutionMethod());
        p.setCreatedAt(OffsetDateTime.now(clock));
        return p;
    }

    /**
     * Token capture runs in its own transaction; a failure is logged and does not undo the grant.
     */
    private void captureToken(String userId, PaymentTransaction txn, ProviderPaymentData paymentData) {
        if (paymentData == null || !paymentData.hasToken()) {
            return;
        }
        try {
            customerTokenService.saveFromProviderData(userId, paymentData);
        } catch (RuntimeException e) {
            log.error("[TOKEN] Token capture failed. userId={}, transactionId={}", userId, txn.getId(), e);
        }
    }
}
