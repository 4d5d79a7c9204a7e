package com.ludora.paymentcore.service;

import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.Subscription;
import com.ludora.paymentcore.entity.SubscriptionStatus;
import com.ludora.paymentcore.exception.SideEffectException;
import com.ludora.paymentcore.repository.SubscriptionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubscriptionServiceTest {

    @Mock SubscriptionRepository subscriptionRepo;
    @Mock AlertNotifier alerts;

    private SubscriptionService service;
    private PaymentTransaction txn;

    @BeforeEach
    void setUp() {
        service = new SubscriptionService(subscriptionRepo, alerts,
                Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));
        txn = new PaymentTransaction();
        txn.setId(5L);
    }

    private Subscription stored(SubscriptionStatus status) {
        Subscription s = new Subscription();
        s.setId("sub-1");
        s.setUserId("user-1");
        s.setPlanId("plan-monthly");
        s.setPriceMinor(4900L);
        s.setStatus(status);
        when(subscriptionRepo.findById("sub-1")).thenReturn(Optional.of(s));
        return s;
    }

    @Test
    void findPayable_onlyForOwnerAndWaitingStatuses() {
        stored(SubscriptionStatus.PAYMENT_FAILED);
        assertThat(service.findPayable("user-1", "sub-1")).isPresent();
        assertThat(service.findPayable("user-2", "sub-1")).isEmpty();

        stored(SubscriptionStatus.ACTIVE);
        assertThat(service.findPayable("user-1", "sub-1")).isEmpty();
    }

    @Test
    void activate_pending_becomesActive() {
        Subscription s = stored(SubscriptionStatus.PENDING);

        service.activate("sub-1", txn);

        assertThat(s.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(s.getActivatedAt()).isNotNull();
        assertThat(s.getLastTransactionId()).isEqualTo(5L);
        verify(subscriptionRepo).save(s);
    }

    @Test
    void activate_alreadyActive_isNoOp() {
        stored(SubscriptionStatus.ACTIVE);

        service.activate("sub-1", txn);

        verify(subscriptionRepo, never()).save(any());
    }

    @Test
    void activate_cancelled_raisesAlert() {
        Subscription s = stored(SubscriptionStatus.CANCELLED);

        service.activate("sub-1", txn);

        assertThat(s.getStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
        verify(alerts).alert(eq(AlertNotifier.AlertType.SUBSCRIPTION_STATE_CONFLICT), anyString(), anyMap());
    }

    @Test
    void paymentFailure_countsAndMarksPending() {
        Subscription s = stored(SubscriptionStatus.PENDING);

        service.handlePaymentFailure("sub-1", txn);

        assertThat(s.getStatus()).isEqualTo(SubscriptionStatus.PAYMENT_FAILED);
        assertThat(s.getFailedPaymentCount()).isEqualTo(1);
        assertThat(s.getLastPaymentFailedAt()).isNotNull();
    }

    @Test
    void paymentCancelled_cancelsPending() {
        Subscription s = stored(SubscriptionStatus.PENDING);

        service.handlePaymentCancelled("sub-1", txn);

        assertThat(s.getStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
    }

    @Test
    void missingSubscription_throws() {
        when(subscriptionRepo.findById("sub-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.activate("sub-1", txn)).isInstanceOf(SideEffectException.class);
    }
}
