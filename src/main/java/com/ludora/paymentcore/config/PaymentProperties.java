package com.ludora.paymentcore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Payment core configuration: provider credentials, polling policy, session expiry,
 * webhook handling and resolution policy.
 */
@Configuration
@ConfigurationProperties(prefix = "payments")
@Data
public class PaymentProperties {

    /** Environment tag stored on sessions and transactions (production / staging). */
    private String environment = "production";

    /** Default ISO 4217 currency for checkouts. */
    private String currency = "ILS";

    private Provider provider = new Provider();
    private Polling polling = new Polling();
    private Session session = new Session();
    private Webhook webhook = new Webhook();
    private Resolution resolution = new Resolution();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Provider {
        /** Base URL of the provider REST API, ending with a slash. */
        private String baseUrl = "https://restapi.payplus.co.il/api/v1.0/";
        private String apiKey;
        private String secretKey;
        /** Payment page template configured at the provider. */
        private String paymentPageUid;
        /** Public URL the provider posts webhooks to. */
        private String callbackUrl;
        /** Default frontend URL the user returns to after paying. */
        private String returnUrl;
        /** Verify the HMAC signature on incoming webhooks. */
        private boolean enforceSignature = true;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Polling {
        private boolean enabled = true;
        /** Delay between reconciliation passes. */
        private Duration interval = Duration.ofSeconds(20);
        /** Minimum transaction age before the first poll; gives the webhook a chance. */
        private Duration gracePeriod = Duration.ofSeconds(30);
        private int maxAttempts = 10;
        /** Delay after the first attempt; doubles on each further attempt. */
        private Duration initialBackoff = Duration.ofSeconds(15);
        private Duration maxBackoff = Duration.ofMinutes(2);
        /** Transactions examined per pass. */
        private int batchSize = 50;
    }

    @Data
    public static class Session {
        private Duration ttl = Duration.ofMinutes(30);
        private Duration sweepInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Webhook {
        /** How long the endpoint waits for processing before acknowledging anyway. */
        private Duration processingTimeout = Duration.ofSeconds(5);
        private int workerThreads = 4;
        private int queueCapacity = 200;
    }

    @Data
    public static class Resolution {
        private ExpiredSessionPolicy expiredSessionPolicy = ExpiredSessionPolicy.GRANT;
    }

    @Data
    public static class Scheduling {
        /** Registers the polling reconciler and the session sweep with the scheduler. */
        private boolean enabled = true;
    }

    /** What to do with a completion that arrives after the session has expired. */
    public enum ExpiredSessionPolicy {
        /** Apply it; a late completion still grants access. */
        GRANT,
        /** Reject it and alert for manual reconciliation. */
        REJECT
    }
}
