package com.ludora.paymentcore.repository;

import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.SessionStatus;
import com.ludora.paymentcore.entity.TransactionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import javax.persistence.LockModeType;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, Long> {

    Optional<PaymentTransaction> findByPageRequestUid(String pageRequestUid);

    Optional<PaymentTransaction> findFirstByPaymentSessionIdOrderByIdDesc(Long paymentSessionId);

    /**
     * Loads the transaction with an exclusive row lock (SELECT ... FOR UPDATE).
     * The lock is held until the surrounding database transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from PaymentTransaction t where t.id = :id")
    Optional<PaymentTransaction> findByIdForUpdate(@Param("id") Long id);

    /**
     * Pending transactions due for a status lookup.
     *
     * @param status        always PENDING; passed as parameter to keep JPQL enum-free
     * @param createdBefore grace-window cutoff
     * @param maxAttempts   attempts ceiling
     * @param now           due time for nextPollAt
     * @param excluded      session statuses that stop polling (EXPIRED)
     */
    @Query("select t from PaymentTransaction t, PaymentSession s "
            + "where s.id = t.paymentSessionId "
            + "and t.status = :status "
            + "and t.createdAt < :createdBefore "
            + "and t.pollingAttempts < :maxAttempts "
            + "and (t.nextPollAt is null or t.nextPollAt <= :now) "
            + "and s.sessionStatus not in :excluded "
            + "order by t.createdAt asc")
    List<PaymentTransaction> findPollCandidates(@Param("status") TransactionStatus status,
                                                @Param("createdBefore") OffsetDateTime createdBefore,
                                                @Param("maxAttempts") int maxAttempts,
                                                @Param("now") OffsetDateTime now,
                                                @Param("excluded") List<SessionStatus> excluded,
                                                Pageable page);

    /** First webhook delivery time; later deliveries leave it untouched. */
    @Modifying
    @Query("update PaymentTransaction t set t.webhookReceivedAt = :at, t.updatedAt = :at "
            + "where t.id = :id and t.webhookReceivedAt is null")
    int markWebhookReceived(@Param("id") Long id, @Param("at") OffsetDateTime at);
}
