package com.ludora.paymentcore.service;

import com.ludora.paymentcore.entity.SessionStatus;
import com.ludora.paymentcore.repository.PaymentSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;

/**
 * Marks open sessions past their expiry as EXPIRED. Their transactions stay PENDING but
 * are no longer polled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionExpirySweeper {

    private final PaymentSessionRepository sessionRepo;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${payments.session.sweep-interval:PT5M}")
    @SchedulerLock(name = "payment-session-expiry-sweep", lockAtMostFor = "PT2M")
    @Transactional
    public int sweep() {
        int expired = sessionRepo.expireOpenSessions(
                EnumSet.of(SessionStatus.CREATED, SessionStatus.PENDING), OffsetDateTime.now(clock));
        if (expired > 0) {
            log.info("[SESSION] Expired stale sessions. count={}", expired);
        }
        return expired;
    }
}
