package com.ludora.paymentcore.repository;

import com.ludora.paymentcore.entity.PaymentSession;
import com.ludora.paymentcore.entity.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Optional;

public interface PaymentSessionRepository extends JpaRepository<PaymentSession, Long> {

    Optional<PaymentSession> findBySessionRef(String sessionRef);

    /**
     * Moves every open session past its expiry to EXPIRED in one statement, so a
     * concurrent resolution that already closed the session is never overwritten.
     */
    @Modifying
    @Query("update PaymentSession s set s.sessionStatus = com.ludora.paymentcore.entity.SessionStatus.EXPIRED, "
            + "s.updatedAt = :now "
            + "where s.sessionStatus in :open and s.expiresAt < :now")
    int expireOpenSessions(@Param("open") Collection<SessionStatus> open, @Param("now") OffsetDateTime now);

    /** CREATED -> PENDING once the provider reports the user is on the payment page. */
    @Modifying
    @Query("update PaymentSession s set s.sessionStatus = com.ludora.paymentcore.entity.SessionStatus.PENDING, "
            + "s.updatedAt = :now "
            + "where s.id = :id and s.sessionStatus = com.ludora.paymentcore.entity.SessionStatus.CREATED")
    int markPending(@Param("id") Long id, @Param("now") OffsetDateTime now);
}
