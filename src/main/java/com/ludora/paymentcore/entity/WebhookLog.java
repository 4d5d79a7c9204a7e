package com.ludora.paymentcore.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Append-only forensic record of one inbound provider notification.
 *
 * The row is written before any state mutation is attempted, so every delivery
 * (duplicates and malformed payloads included) is durably recorded. Rows are never
 * deleted; they exist for replay and audit.
 */
@Entity
@Table(
        name = "webhook_logs",
        indexes = {
                @Index(name = "idx_webhook_log_page_request_uid", columnList = "page_request_uid"),
                @Index(name = "idx_webhook_log_transaction", columnList = "transaction_id"),
                @Index(name = "idx_webhook_log_status", columnList = "processing_status")
        }
)
@Getter
@Setter
public class WebhookLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String provider;

    @Column(length = 64)
    private String eventType;

    @Column(name = "page_request_uid", length = 64)
    private String pageRequestUid;

    @Column(length = 64)
    private String providerTransactionUid;

    @Column(length = 8)
    private String httpMethod;

    /** JSON object with a subset of request headers; credentials are redacted. */
    @Lob
    private String headers;

    @Column(length = 64)
    private String senderIp;

    @Column(length = 255)
    private String userAgent;

    /** Raw request body exactly as received. */
    @Lob
    private String payload;

    @Column(length = 16)
    private String providerStatusCode;

    @Column(length = 64)
    private String providerStatusName;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_status", nullable = false, length = 16)
    private WebhookProcessingStatus processingStatus = WebhookProcessingStatus.PENDING;

    /** One timestamped line per processing step. */
    @Lob
    private String processLog;

    @Column(length = 1024)
    private String errorMessage;

    @Lob
    private String errorStack;

    @Column(name = "transaction_id")
    private Long transactionId;

    private Long paymentSessionId;

    private Long processingDurationMs;

    /** Earlier deliveries seen for the same correlation keys. */
    @Column(nullable = false)
    private int retryCount;

    @Column(nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    private OffsetDateTime processedAt;

    @PreUpdate
    public void onUpdate() {
        this.updatedAt = OffsetDateTime.now();
    }

    /** Appends "[timestamp] message" to the processing trace. */
    public void addProcessLog(OffsetDateTime at, String message) {
        String entry = "[" + at + "] " + message;
        this.processLog = processLog == null ? entry : processLog + "\n" + entry;
    }

    public void finish(WebhookProcessingStatus status, OffsetDateTime at) {
        this.processingStatus = status;
        this.processedAt = at;
        this.processingDurationMs = Duration.between(createdAt, at).toMillis();
    }
}
