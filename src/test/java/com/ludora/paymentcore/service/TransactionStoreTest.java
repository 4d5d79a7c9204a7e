package com.ludora.paymentcore.service;

import com.ludora.paymentcore.config.PaymentProperties;
import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.TransactionStatus;
import com.ludora.paymentcore.repository.PaymentSessionRepository;
import com.ludora.paymentcore.repository.PaymentTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionStoreTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC);

    @Mock PaymentTransactionRepository txnRepo;
    @Mock PaymentSessionRepository sessionRepo;

    private TransactionStore store;

    @BeforeEach
    void setUp() {
        PaymentProperties props = new PaymentProperties();
        props.getPolling().setMaxAttempts(10);
        props.getPolling().setInitialBackoff(Duration.ofSeconds(15));
        props.getPolling().setMaxBackoff(Duration.ofMinutes(2));
        store = new TransactionStore(txnRepo, sessionRepo, props);
    }

    private static PaymentTransaction txn(TransactionStatus status, int attempts) {
        PaymentTransaction t = new PaymentTransaction();
        t.setId(1L);
        t.setStatus(status);
        t.setPollingAttempts(attempts);
        return t;
    }

    @Test
    void backoff_doublesUntilCap() {
        assertThat(store.backoff(1)).isEqualTo(Duration.ofSeconds(15));
        assertThat(store.backoff(2)).isEqualTo(Duration.ofSeconds(30));
        assertThat(store.backoff(3)).isEqualTo(Duration.ofSeconds(60));
        assertThat(store.backoff(4)).isEqualTo(Duration.ofMinutes(2));
        assertThat(store.backoff(10)).isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    void recordPollAttempt_incrementsAndSchedulesNext() {
        PaymentTransaction t = txn(TransactionStatus.PENDING, 1);
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));

        Optional<Integer> attempt = store.recordPollAttempt(1L, NOW);

        assertThat(attempt).contains(2);
        assertThat(t.getPollingAttempts()).isEqualTo(2);
        assertThat(t.getLastPolledAt()).isEqualTo(NOW);
        assertThat(t.getNextPollAt()).isEqualTo(NOW.plusSeconds(30));
    }

    @Test
    void recordPollAttempt_resolvedTransaction_notCounted() {
        PaymentTransaction t = txn(TransactionStatus.COMPLETED, 3);
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));

        assertThat(store.recordPollAttempt(1L, NOW)).isEmpty();
        assertThat(t.getPollingAttempts()).isEqualTo(3);
    }

    @Test
    void recordPollAttempt_outOfAttempts_notCounted() {
        PaymentTransaction t = txn(TransactionStatus.PENDING, 10);
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));

        assertThat(store.recordPollAttempt(1L, NOW)).isEmpty();
        assertThat(t.getPollingAttempts()).isEqualTo(10);
    }

    @Test
    void releasePollAttempt_pending_givesOneBack() {
        PaymentTransaction t = txn(TransactionStatus.PENDING, 10);
        t.setNextPollAt(NOW.plusMinutes(2));
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));

        store.releasePollAttempt(1L);

        assertThat(t.getPollingAttempts()).isEqualTo(9);
        assertThat(t.getNextPollAt()).isEqualTo(NOW.plusMinutes(2));
    }

    @Test
    void releasePollAttempt_resolvedMeanwhile_untouched() {
        PaymentTransaction t = txn(TransactionStatus.COMPLETED, 10);
        when(txnRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(t));

        store.releasePollAttempt(1L);

        assertThat(t.getPollingAttempts()).isEqualTo(10);
    }

    @Test
    void findByCorrelationKey_null_isEmpty() {
        assertThat(store.findByCorrelationKey(null)).isEmpty();
        verifyNoInteractions(txnRepo);
    }
}
