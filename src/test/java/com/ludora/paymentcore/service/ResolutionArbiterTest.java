package com.ludora.paymentcore.service;

import com.ludora.paymentcore.config.PaymentProperties;
import com.ludora.paymentcore.dto.ProviderPaymentData;
import com.ludora.paymentcore.dto.ProviderResolution;
import com.ludora.paymentcore.entity.PaymentSession;
import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.ResolutionMethod;
import com.ludora.paymentcore.entity.ResolutionOutcome;
import com.ludora.paymentcore.entity.SessionStatus;
import com.ludora.paymentcore.entity.TransactionStatus;
import com.ludora.paymentcore.entity.TransactionStatusHistory;
import com.ludora.paymentcore.exception.SideEffectException;
import com.ludora.paymentcore.repository.PaymentSessionRepository;
import com.ludora.paymentcore.repository.PaymentTransactionRepository;
import com.ludora.paymentcore.repository.TransactionStatusHistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ResolutionArbiter}.
 * Repositories and side effects are mocked; the real row lock is covered by
 * PaymentReconciliationIntegrationTest.
 */
@ExtendWith(MockitoExtension.class)
class ResolutionArbiterTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock PaymentTransactionRepository txnRepo;
    @Mock PaymentSessionRepository sessionRepo;
    @Mock TransactionStatusHistoryRepository historyRepo;
    @Mock SideEffectApplier sideEffects;
    @Mock AlertNotifier alerts;

    private PaymentProperties props;
    private ResolutionArbiter arbiter;

    @BeforeEach
    void setUp() {
        props = new PaymentProperties();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        arbiter = new ResolutionArbiter(txnRepo, sessionRepo, historyRepo, sideEffects, alerts, props, clock);
    }

    private static PaymentTransaction txn(TransactionStatus status) {
        PaymentTransaction t = new PaymentTransaction();
        t.setId(1L);
        t.setPaymentSessionId(10L);
        t.setPageRequestUid("uid-1");
        t.setAmountMinor(5000L);
        t.setCurrency("ILS");
        t.setEnvironment("staging");
        t.setStatus(status);
        return t;
    }

    private static PaymentSession session(OffsetDateTime expiresAt) {
        PaymentSession s = new PaymentSession();
        s.setId(10L);
        s.setSessionRef("ps_abc");
        s.setUserId("user-1");
        s.setSessionStatus(SessionStatus.PENDING);
        s.setExpiresAt(expiresAt);
        return s;
    }

    private static ProviderResolution report(TransactionStatus status) {
        return ProviderResolution.builder()
                .status(status)
                .providerTransactionUid("ptx-1")
                .rawResponse("{\"status\":\"" + status + "\"}")
                .failureReason(status == TransactionStatus.FAILED ? "Card declined" : null)
                .build();
    }

    private TransactionStatusHistory savedHistory() {
        ArgumentCaptor<TransactionStatusHistory> captor = ArgumentCaptor.forClass(TransactionStatusHistory.class);
        verify(historyRepo).save(captor.capture());
        return captor.getValue();
    }

    // ============ Applied ============

    /**
     * PENDING + COMPLETED webhook: status, method, timestamps, session projection,
     * side effects and history are all written.
     */
    @Test
    void resolve_pendingToCompleted_applies() {
        PaymentTransaction t = txn(TransactionStatus.PENDING);
        PaymentSession s = session(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusMinutes(10));
        ProviderPaymentData data = ProviderPaymentData.builder().token("tok").build();
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));
        when(sessionRepo.findById(10L)).thenReturn(Optional.of(s));

        ProviderResolution r = ProviderResolution.builder()
                .status(TransactionStatus.COMPLETED).providerTransactionUid("ptx-1").rawResponse("{}")
                .paymentData(data).build();
        ResolutionOutcome outcome = arbiter.resolve(1L, r, ResolutionMethod.WEBHOOK);

        assertThat(outcome).isEqualTo(ResolutionOutcome.APPLIED);
        assertThat(t.getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        assertThat(t.getResolutionMethod()).isEqualTo(ResolutionMethod.WEBHOOK);
        assertThat(t.getCompletedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(t.getWebhookReceivedAt()).isNotNull();
        assertThat(t.getProviderTransactionUid()).isEqualTo("ptx-1");
        assertThat(t.getNextPollAt()).isNull();
        assertThat(s.getSessionStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(s.getCompletedAt()).isNotNull();

        verify(sideEffects).apply(t, s, data);
        verify(txnRepo).save(t);
        verify(sessionRepo).save(s);
        TransactionStatusHistory h = savedHistory();
        assertThat(h.getOutcome()).isEqualTo(ResolutionOutcome.APPLIED);
        assertThat(h.getFromStatus()).isEqualTo(TransactionStatus.PENDING);
        assertThat(h.getSource()).isEqualTo(ResolutionMethod.WEBHOOK);
        verifyNoInteractions(alerts);
    }

    /**
     * FAILED report: failure reason lands on both transaction and session.
     */
    @Test
    void resolve_pendingToFailed_recordsReason() {
        PaymentTransaction t = txn(TransactionStatus.PENDING);
        PaymentSession s = session(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusMinutes(10));
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));
        when(sessionRepo.findById(10L)).thenReturn(Optional.of(s));

        ResolutionOutcome outcome = arbiter.resolve(1L, report(TransactionStatus.FAILED), ResolutionMethod.POLLING);

        assertThat(outcome).isEqualTo(ResolutionOutcome.APPLIED);
        assertThat(t.getFailureReason()).isEqualTo("Card declined");
        assertThat(t.getFailedAt()).isNotNull();
        assertThat(t.getWebhookReceivedAt()).isNull();
        assertThat(s.getSessionStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(s.getErrorMessage()).isEqualTo("Card declined");
    }

    /**
     * Default policy grants a completion that arrives after the session expired.
     */
    @Test
    void resolve_lateCompletion_grantPolicy_applies() {
        PaymentTransaction t = txn(TransactionStatus.PENDING);
        PaymentSession s = session(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minusMinutes(5));
        s.setSessionStatus(SessionStatus.EXPIRED);
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));
        when(sessionRepo.findById(10L)).thenReturn(Optional.of(s));

        ResolutionOutcome outcome = arbiter.resolve(1L, report(TransactionStatus.COMPLETED), ResolutionMethod.WEBHOOK);

        assertThat(outcome).isEqualTo(ResolutionOutcome.APPLIED);
        assertThat(s.getSessionStatus()).isEqualTo(SessionStatus.COMPLETED);
    }

    /**
     * Administrative refund of a completed payment keeps the original resolution method.
     */
    @Test
    void resolve_completedToRefunded_manual_applies() {
        PaymentTransaction t = txn(TransactionStatus.COMPLETED);
        t.setResolutionMethod(ResolutionMethod.WEBHOOK);
        PaymentSession s = session(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusMinutes(10));
        s.setSessionStatus(SessionStatus.COMPLETED);
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));
        when(sessionRepo.findById(10L)).thenReturn(Optional.of(s));

        ResolutionOutcome outcome = arbiter.resolve(1L, report(TransactionStatus.REFUNDED), ResolutionMethod.MANUAL);

        assertThat(outcome).isEqualTo(ResolutionOutcome.APPLIED);
        assertThat(t.getStatus()).isEqualTo(TransactionStatus.REFUNDED);
        assertThat(t.getResolutionMethod()).isEqualTo(ResolutionMethod.WEBHOOK);
        verify(sideEffects).apply(eq(t), eq(s), any());
    }

    // ============ Duplicate / Rejected ============

    /**
     * A second COMPLETED report after the first one won is a no-op DUPLICATE.
     */
    @Test
    void resolve_alreadyCompleted_sameStatus_duplicate() {
        PaymentTransaction t = txn(TransactionStatus.COMPLETED);
        t.setResolutionMethod(ResolutionMethod.POLLING);
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));

        ResolutionOutcome outcome = arbiter.resolve(1L, report(TransactionStatus.COMPLETED), ResolutionMethod.WEBHOOK);

        assertThat(outcome).isEqualTo(ResolutionOutcome.DUPLICATE);
        assertThat(t.getResolutionMethod()).isEqualTo(ResolutionMethod.POLLING);
        verifyNoInteractions(sideEffects, sessionRepo, alerts);
        verify(txnRepo, never()).save(any());
        TransactionStatusHistory h = savedHistory();
        assertThat(h.getOutcome()).isEqualTo(ResolutionOutcome.DUPLICATE);
        assertThat(h.getDetail()).isEqualTo("Already COMPLETED via POLLING");
    }

    /**
     * A contradicting report after a terminal status is rejected and raises an alert.
     */
    @Test
    void resolve_completedThenFailed_rejectedWithAlert() {
        PaymentTransaction t = txn(TransactionStatus.COMPLETED);
        t.setResolutionMethod(ResolutionMethod.WEBHOOK);
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));

        ResolutionOutcome outcome = arbiter.resolve(1L, report(TransactionStatus.FAILED), ResolutionMethod.POLLING);

        assertThat(outcome).isEqualTo(ResolutionOutcome.REJECTED);
        assertThat(t.getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        verify(alerts).alert(eq(AlertNotifier.AlertType.CONFLICTING_OUTCOME), anyString(), anyMap());
        verifyNoInteractions(sideEffects, sessionRepo);
        assertThat(savedHistory().getOutcome()).isEqualTo(ResolutionOutcome.REJECTED);
    }

    /**
     * A provider cannot refund through a webhook; only MANUAL may refund.
     */
    @Test
    void resolve_completedToRefunded_viaWebhook_rejected() {
        PaymentTransaction t = txn(TransactionStatus.COMPLETED);
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));

        ResolutionOutcome outcome = arbiter.resolve(1L, report(TransactionStatus.REFUNDED), ResolutionMethod.WEBHOOK);

        assertThat(outcome).isEqualTo(ResolutionOutcome.REJECTED);
        verify(alerts).alert(eq(AlertNotifier.AlertType.CONFLICTING_OUTCOME), anyString(), anyMap());
    }

    /**
     * PENDING -> REFUNDED is not an edge of the state machine.
     */
    @Test
    void resolve_pendingToRefunded_illegal() {
        PaymentTransaction t = txn(TransactionStatus.PENDING);
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));

        ResolutionOutcome outcome = arbiter.resolve(1L, report(TransactionStatus.REFUNDED), ResolutionMethod.MANUAL);

        assertThat(outcome).isEqualTo(ResolutionOutcome.REJECTED);
        assertThat(t.getStatus()).isEqualTo(TransactionStatus.PENDING);
        verify(alerts).alert(eq(AlertNotifier.AlertType.ILLEGAL_TRANSITION), anyString(), anyMap());
        verifyNoInteractions(sideEffects);
    }

    /**
     * REJECT policy: completion after expiry leaves the transaction pending and alerts.
     */
    @Test
    void resolve_lateCompletion_rejectPolicy_rejected() {
        props.getResolution().setExpiredSessionPolicy(PaymentProperties.ExpiredSessionPolicy.REJECT);
        PaymentTransaction t = txn(TransactionStatus.PENDING);
        PaymentSession s = session(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minusMinutes(1));
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));
        when(sessionRepo.findById(10L)).thenReturn(Optional.of(s));

        ResolutionOutcome outcome = arbiter.resolve(1L, report(TransactionStatus.COMPLETED), ResolutionMethod.WEBHOOK);

        assertThat(outcome).isEqualTo(ResolutionOutcome.REJECTED);
        assertThat(t.getStatus()).isEqualTo(TransactionStatus.PENDING);
        verify(alerts).alert(eq(AlertNotifier.AlertType.LATE_COMPLETION_REJECTED), anyString(), anyMap());
        verifyNoInteractions(sideEffects);
    }

    // ============ Failure ============

    /**
     * Side effect failure propagates so the surrounding database transaction rolls back.
     */
    @Test
    void resolve_sideEffectFailure_propagates() {
        PaymentTransaction t = txn(TransactionStatus.PENDING);
        PaymentSession s = session(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusMinutes(10));
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));
        when(sessionRepo.findById(10L)).thenReturn(Optional.of(s));
        doThrow(new SideEffectException("purchase insert failed")).when(sideEffects).apply(any(), any(), any());

        assertThatThrownBy(() -> arbiter.resolve(1L, report(TransactionStatus.COMPLETED), ResolutionMethod.WEBHOOK))
                .isInstanceOf(SideEffectException.class);
        verify(historyRepo, never()).save(any());
    }

    @Test
    void resolve_unknownTransaction_throws() {
        when(txnRepo.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> arbiter.resolve(99L, report(TransactionStatus.COMPLETED), ResolutionMethod.POLLING))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
