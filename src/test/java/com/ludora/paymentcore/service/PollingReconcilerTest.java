package com.ludora.paymentcore.service;

import com.ludora.paymentcore.client.PaymentProviderClient;
import com.ludora.paymentcore.config.PaymentProperties;
import com.ludora.paymentcore.dto.ProviderResolution;
import com.ludora.paymentcore.dto.ProviderStatusResult;
import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.ResolutionMethod;
import com.ludora.paymentcore.entity.ResolutionOutcome;
import com.ludora.paymentcore.entity.TransactionStatus;
import com.ludora.paymentcore.exception.ProviderUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PollingReconcilerTest {

    @Mock TransactionStore store;
    @Mock PaymentProviderClient provider;
    @Mock ResolutionArbiter arbiter;
    @Mock AlertNotifier alerts;

    private PaymentProperties props;
    private PollingReconciler reconciler;

    @BeforeEach
    void setUp() {
        props = new PaymentProperties();
        props.getPolling().setMaxAttempts(10);
        reconciler = new PollingReconciler(store, provider, arbiter, alerts, props,
                Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    private static PaymentTransaction txn(long id) {
        PaymentTransaction t = new PaymentTransaction();
        t.setId(id);
        t.setPaymentSessionId(100L + id);
        t.setPageRequestUid("uid-" + id);
        t.setAmountMinor(5000L);
        t.setStatus(TransactionStatus.PENDING);
        return t;
    }

    private static ProviderStatusResult lookup(TransactionStatus status) {
        return ProviderStatusResult.builder()
                .status(status)
                .statusCode(status == TransactionStatus.COMPLETED ? "000" : null)
                .rawResponse("{}")
                .build();
    }

    private void attempt(long id, int number) {
        when(store.findById(id)).thenReturn(Optional.of(txn(id)));
        when(store.recordPollAttempt(eq(id), any())).thenReturn(Optional.of(number));
    }

    // ============ pollNow ============

    @Test
    void pollNow_terminalAnswer_goesToArbiterAsPolling() {
        attempt(1L, 3);
        when(provider.lookupStatus("uid-1")).thenReturn(lookup(TransactionStatus.COMPLETED));
        when(arbiter.resolve(eq(1L), any(ProviderResolution.class), eq(ResolutionMethod.POLLING)))
                .thenReturn(ResolutionOutcome.APPLIED);

        assertThat(reconciler.pollNow(1L)).isEqualTo(PollingReconciler.PollResult.RESOLVED);
        verifyNoInteractions(alerts);
    }

    @Test
    void pollNow_stillPending_beforeLastAttempt() {
        attempt(1L, 4);
        when(provider.lookupStatus("uid-1")).thenReturn(lookup(TransactionStatus.PENDING));

        assertThat(reconciler.pollNow(1L)).isEqualTo(PollingReconciler.PollResult.STILL_PENDING);
        verifyNoInteractions(arbiter, alerts);
    }

    /**
     * The last allowed attempt without a terminal answer fails the transaction and alerts.
     */
    @Test
    void pollNow_lastAttemptStillPending_abandons() {
        attempt(1L, 10);
        when(provider.lookupStatus("uid-1")).thenReturn(lookup(TransactionStatus.PENDING));
        when(arbiter.resolve(eq(1L), any(ProviderResolution.class), eq(ResolutionMethod.ABANDONED_AFTER_POLLING)))
                .thenReturn(ResolutionOutcome.APPLIED);

        assertThat(reconciler.pollNow(1L)).isEqualTo(PollingReconciler.PollResult.ABANDONED);

        ArgumentCaptor<ProviderResolution> captor = ArgumentCaptor.forClass(ProviderResolution.class);
        verify(arbiter).resolve(eq(1L), captor.capture(), eq(ResolutionMethod.ABANDONED_AFTER_POLLING));
        assertThat(captor.getValue().getStatus()).isEqualTo(TransactionStatus.FAILED);
        assertThat(captor.getValue().getFailureReason()).isEqualTo("Abandoned after 10 polling attempts");
        verify(alerts).alert(eq(AlertNotifier.AlertType.POLLING_ABANDONED), anyString(), anyMap());
    }

    /**
     * A webhook that won the race while the last lookup was in flight: no alert.
     */
    @Test
    void pollNow_abandonLosesRace_noAlert() {
        attempt(1L, 10);
        when(provider.lookupStatus("uid-1")).thenReturn(lookup(TransactionStatus.PENDING));
        when(arbiter.resolve(eq(1L), any(ProviderResolution.class), eq(ResolutionMethod.ABANDONED_AFTER_POLLING)))
                .thenReturn(ResolutionOutcome.REJECTED);

        assertThat(reconciler.pollNow(1L)).isEqualTo(PollingReconciler.PollResult.ABANDONED);
        verifyNoInteractions(alerts);
    }

    @Test
    void pollNow_providerError_countsAttempt() {
        attempt(1L, 2);
        when(provider.lookupStatus("uid-1")).thenThrow(new ProviderUnavailableException("timeout"));

        assertThat(reconciler.pollNow(1L)).isEqualTo(PollingReconciler.PollResult.PROVIDER_ERROR);
        verifyNoInteractions(arbiter);
    }

    @Test
    void pollNow_providerErrorOnLastAttempt_abandons() {
        attempt(1L, 10);
        when(provider.lookupStatus("uid-1")).thenThrow(new ProviderUnavailableException("timeout"));
        when(arbiter.resolve(eq(1L), any(ProviderResolution.class), eq(ResolutionMethod.ABANDONED_AFTER_POLLING)))
                .thenReturn(ResolutionOutcome.APPLIED);

        assertThat(reconciler.pollNow(1L)).isEqualTo(PollingReconciler.PollResult.ABANDONED);
    }

    /**
     * A grant that rolls back on the last attempt gives the attempt back and alerts,
     * so a later pass can try again.
     */
    @Test
    void pollNow_resolutionThrowsOnLastAttempt_givesAttemptBackAndAlerts() {
        attempt(1L, 10);
        when(provider.lookupStatus("uid-1")).thenReturn(lookup(TransactionStatus.COMPLETED));
        when(arbiter.resolve(eq(1L), any(ProviderResolution.class), eq(ResolutionMethod.POLLING)))
                .thenThrow(new IllegalStateException("coupon usage write failed"));

        assertThat(reconciler.pollNow(1L)).isEqualTo(PollingReconciler.PollResult.RESOLUTION_FAILED);

        verify(store).releasePollAttempt(1L);
        verify(alerts).alert(eq(AlertNotifier.AlertType.RESOLUTION_FAILED), anyString(), anyMap());
        verify(arbiter, never()).resolve(eq(1L), any(ProviderResolution.class),
                eq(ResolutionMethod.ABANDONED_AFTER_POLLING));
    }

    @Test
    void pollNow_abandonThrows_givesAttemptBackAndAlerts() {
        attempt(1L, 10);
        when(provider.lookupStatus("uid-1")).thenReturn(lookup(TransactionStatus.PENDING));
        when(arbiter.resolve(eq(1L), any(ProviderResolution.class), eq(ResolutionMethod.ABANDONED_AFTER_POLLING)))
                .thenThrow(new IllegalStateException("subscription row locked"));

        assertThat(reconciler.pollNow(1L)).isEqualTo(PollingReconciler.PollResult.RESOLUTION_FAILED);

        verify(store).releasePollAttempt(1L);
        verify(alerts).alert(eq(AlertNotifier.AlertType.RESOLUTION_FAILED), anyString(), anyMap());
    }

    @Test
    void pollNow_notPendingAnyMore_skipsProvider() {
        when(store.findById(1L)).thenReturn(Optional.of(txn(1L)));
        when(store.recordPollAttempt(eq(1L), any())).thenReturn(Optional.empty());

        assertThat(reconciler.pollNow(1L)).isEqualTo(PollingReconciler.PollResult.SKIPPED);
        verifyNoInteractions(provider, arbiter);
    }

    // ============ reconcile ============

    /**
     * One broken transaction does not stop the pass.
     */
    @Test
    void reconcile_failureOnOneTransaction_continuesWithNext() {
        when(store.findPollCandidates(any())).thenReturn(List.of(txn(1L), txn(2L)));
        when(store.findById(1L)).thenThrow(new IllegalStateException("db hiccup"));
        when(store.findById(2L)).thenReturn(Optional.of(txn(2L)));
        when(store.recordPollAttempt(eq(2L), any())).thenReturn(Optional.of(1));
        when(provider.lookupStatus("uid-2")).thenReturn(lookup(TransactionStatus.PENDING));

        reconciler.reconcile();

        verify(provider).lookupStatus("uid-2");
        verify(provider, never()).lookupStatus("uid-1");
    }

    @Test
    void reconcile_disabled_doesNothing() {
        props.getPolling().setEnabled(false);

        reconciler.reconcile();

        verifyNoInteractions(store, provider, arbiter);
    }
}
