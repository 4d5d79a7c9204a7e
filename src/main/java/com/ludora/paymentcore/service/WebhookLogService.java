package com.ludora.paymentcore.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ludora.paymentcore.dto.WebhookSenderInfo;
import com.ludora.paymentcore.entity.WebhookLog;
import com.ludora.paymentcore.repository.WebhookLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Writes webhook log rows, each in its own database transaction so the forensic record
 * survives whatever happens to the processing step.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookLogService {

    private final WebhookLogRepository logRepo;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Persists the delivery exactly as received, before anything else is done with it.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WebhookLog open(String provider, String rawPayload, WebhookSenderInfo sender) {
        OffsetDateTime now = OffsetDateTime.now(clock);

        WebhookLog row = new WebhookLog();
        row.setProvider(provider);
        row.setPayload(rawPayload);
        row.setHttpMethod(sender.getHttpMethod());
        row.setSenderIp(sender.getSenderIp());
        row.setUserAgent(truncate(sender.getUserAgent(), 255));
        row.setHeaders(toJson(sender));
        row.setCreatedAt(now);
        row.setUpdatedAt(now);
        row.addProcessLog(now, "Webhook received and logged");
        return logRepo.save(row);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WebhookLog update(WebhookLog row) {
        return logRepo.save(row);
    }

    /**
     * Deliveries already logged for the same correlation keys.
     */
    public long countEarlierDeliveries(String pageRequestUid, String providerTransactionUid) {
        if (pageRequestUid == null) {
            return 0;
        }
        if (providerTransactionUid == null) {
            return logRepo.countByPageRequestUid(pageRequestUid);
        }
        return logRepo.countByPageRequestUidAndProviderTransactionUid(pageRequestUid, providerTransactionUid);
    }

    private String toJson(WebhookSenderInfo sender) {
        if (sender.getHeaders() == null || sender.getHeaders().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(sender.getHeaders());
        } catch (JsonProcessingException e) {
            log.warn("[WEBHOOK] Could not serialize headers, stored as text. reason={}", e.getMessage());
            return sender.getHeaders().toString();
        }
    }

    static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
