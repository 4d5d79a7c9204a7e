package com.ludora.paymentcore.service;

import com.ludora.paymentcore.client.PaymentProviderClient;
import com.ludora.paymentcore.config.PaymentProperties;
import com.ludora.paymentcore.dto.CheckoutPage;
import com.ludora.paymentcore.dto.CheckoutPageRequest;
import com.ludora.paymentcore.dto.PaymentSessionResponse;
import com.ludora.paymentcore.dto.PurchaseIntentRequest;
import com.ludora.paymentcore.entity.PaymentSession;
import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.PurchaseIntent;
import com.ludora.paymentcore.entity.SessionStatus;
import com.ludora.paymentcore.entity.TransactionStatus;
import com.ludora.paymentcore.exception.InvalidPurchaseIntentException;
import com.ludora.paymentcore.exception.ProviderUnavailableException;
import com.ludora.paymentcore.exception.SessionNotFoundException;
import com.ludora.paymentcore.repository.PaymentSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Checkout sessions.
 *
 * Responsibilities:
 *  - Validates purchase intents and prices them from the catalog (never from the client).
 *  - Applies coupons.
 *  - Creates the hosted payment page at the provider.
 *  - Persists the session and its pending transaction together.
 *
 * Nothing is granted here; access follows only from a terminal transaction status.
 * The provider call happens outside any database transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentSessionManager {

    private final PaymentSessionRepository sessionRepo;
    private final TransactionStore store;
    private final CatalogService catalogService;
    private final CouponService couponService;
    private final PaymentProviderClient provider;
    private final PollingReconciler pollingReconciler;
    private final PaymentProperties props;
    private final Clock clock;

    public PaymentSessionResponse createSession(String userId, List<PurchaseIntentRequest> requested,
                                                List<String> couponCodes, String returnUrl) {
        log.info("[SESSION] Create. userId={}, intents={}, coupons={}",
                userId, requested == null ? 0 : requested.size(), couponCodes);

        List<PurchaseIntent> intents = priceIntents(userId, requested);
        long subtotal = intents.stream().mapToLong(PurchaseIntent::getAmountMinor).sum();
        CouponService.CouponApplication coupons = couponService.applyCoupons(couponCodes, subtotal);

        OffsetDateTime now = OffsetDateTime.now(clock);
        PaymentProperties.Provider providerProps = props.getProvider();

        PaymentSession session = new PaymentSession();
        session.setSessionRef("ps_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12));
        session.setUserId(userId);
        session.setPurchaseIntents(intents);
        session.setAppliedCoupons(new ArrayList<>(coupons.getApplied()));
        session.setOriginalAmountMinor(subtotal);
        session.setCouponDiscountMinor(coupons.getDiscountMinor());
        session.setTotalAmountMinor(coupons.getTotalMinor());
        session.setCurrency(props.getCurrency());
        session.setReturnUrl(returnUrl != null && !returnUrl.isBlank() ? returnUrl : providerProps.getReturnUrl());
        session.setCallbackUrl(providerProps.getCallbackUrl());
        session.setEnvironment(props.getEnvironment());
        session.setExpiresAt(now.plus(props.getSession().getTtl()));
        session.setCreatedAt(now);
        session.setUpdatedAt(now);
        if (intents.get(0).isSubscription()) {
            session.setSubscriptionId(intents.get(0).getEntityId());
        }

        CheckoutPage page;
        try {
            page = provider.createPaymentPage(checkoutRequest(session));
        } catch (ProviderUnavailableException e) {
            session.setSessionStatus(SessionStatus.FAILED);
            session.setFailedAt(now);
            session.setErrorMessage(e.getMessage());
            sessionRepo.save(session);
            log.error("[SESSION] Provider checkout creation failed. sessionRef={}, userId={}",
                    session.getSessionRef(), userId, e);
            throw e;
        }

        session.setPageRequestUid(page.getPageRequestUid());
        session.setPaymentPageUrl(page.getPaymentPageUrl());

        PaymentTransaction txn = new PaymentTransaction();
        txn.setAmountMinor(session.getTotalAmountMinor());
        txn.setCurrency(session.getCurrency());
        txn.setPaymentMethod(provider.name());
        txn.setStatus(TransactionStatus.PENDING);
        txn.setPageRequestUid(page.getPageRequestUid());
        txn.setEnvironment(props.getEnvironment());
        txn.setCreatedAt(now);
        txn.setUpdatedAt(now);

        PaymentTransaction created = store.openCheckout(session, txn);
        return PaymentSessionResponse.from(session, created);
    }

    public PaymentSessionResponse getSession(String userId, String sessionRef) {
        PaymentSession session = loadOwned(userId, sessionRef);
        return PaymentSessionResponse.from(session, store.findLatestForSession(session.getId()).orElse(null));
    }

    /**
     * User-triggered status check ("I paid, where is my purchase?"): one immediate poll
     * of the session's pending transaction, counted like any other attempt. A failing
     * check is logged and the session is returned as it stands.
     */
    public PaymentSessionResponse requestStatusCheck(String userId, String sessionRef) {
        PaymentSession session = loadOwned(userId, sessionRef);
        PaymentTransaction txn = store.findLatestForSession(session.getId()).orElse(null);

        if (txn != null && txn.getStatus() == TransactionStatus.PENDING
                && session.getSessionStatus() != SessionStatus.EXPIRED) {
            try {
                PollingReconciler.PollResult result = pollingReconciler.pollNow(txn.getId());
                log.info("[SESSION] Status check. sessionRef={}, transactionId={}, result={}",
                        sessionRef, txn.getId(), result);
            } catch (RuntimeException e) {
                log.error("[SESSION] Status check failed, returning current state. sessionRef={}, transactionId={}",
                        sessionRef, txn.getId(), e);
            }
            session = loadOwned(userId, sessionRef);
            txn = store.findById(txn.getId()).orElse(txn);
        }
        return PaymentSessionResponse.from(session, txn);
    }

    private PaymentSession loadOwned(String userId, String sessionRef) {
        return sessionRepo.findBySessionRef(sessionRef)
                .filter(s -> s.getUserId().equals(userId))
                .orElseThrow(() -> new SessionNotFoundException(sessionRef));
    }

    private List<PurchaseIntent> priceIntents(String userId, List<PurchaseIntentRequest> requested) {
        if (requested == null || requested.isEmpty()) {
            throw new InvalidPurchaseIntentException("At least one purchase intent is required");
        }

        Set<String> seen = new LinkedHashSet<>();
        boolean hasSubscription = false;
        for (PurchaseIntentRequest r : requested) {
            if (isBlank(r.getEntityType()) || isBlank(r.getEntityId())) {
                throw new InvalidPurchaseIntentException("Each purchase intent needs entityType and entityId");
            }
            if (!seen.add(key(r))) {
                throw new InvalidPurchaseIntentException("Duplicate purchase intent", List.of(key(r)));
            }
            hasSubscription |= PurchaseIntent.SUBSCRIPTION.equals(r.getEntityType());
        }
        if (hasSubscription && requested.size() > 1) {
            throw new InvalidPurchaseIntentException("A subscription must be purchased on its own", new ArrayList<>(seen));
        }

        List<String> unavailable = new ArrayList<>();
        List<String> owned = new ArrayList<>();
        List<PurchaseIntent> priced = new ArrayList<>();
        for (PurchaseIntentRequest r : requested) {
            Long price = catalogService.findPrice(userId, r.getEntityType(), r.getEntityId()).orElse(null);
            if (price == null) {
                unavailable.add(key(r));
            } else if (catalogService.alreadyOwned(userId, r.getEntityType(), r.getEntityId())) {
                owned.add(key(r));
            } else {
                priced.add(new PurchaseIntent(r.getEntityType(), r.getEntityId(), price));
            }
        }
        if (!unavailable.isEmpty()) {
            throw new InvalidPurchaseIntentException("Not available for purchase", unavailable);
        }
        if (!owned.isEmpty()) {
            throw new InvalidPurchaseIntentException("Already purchased", owned);
        }
        return priced;
    }

    private CheckoutPageRequest checkoutRequest(PaymentSession session) {
        String resultUrl = session.getReturnUrl() == null ? null
                : UriComponentsBuilder.fromUriString(session.getReturnUrl())
                .queryParam("session", session.getSessionRef())
                .build()
                .toUriString();

        return CheckoutPageRequest.builder()
                .sessionRef(session.getSessionRef())
                .userId(session.getUserId())
                .amountMinor(session.getTotalAmountMinor())
                .currency(session.getCurrency())
                .description(session.isSubscriptionCheckout() ? "subscription " + session.getSubscriptionId() : null)
                .callbackUrl(session.getCallbackUrl())
                .successUrl(resultUrl)
                .failureUrl(resultUrl)
                .cancelUrl(resultUrl)
                .build();
    }

    private static String key(PurchaseIntentRequest r) {
        return r.getEntityType() + ":" + r.getEntityId();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
