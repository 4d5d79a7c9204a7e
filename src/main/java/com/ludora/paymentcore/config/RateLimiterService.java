package com.ludora.paymentcore.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Rate limiter service using Bucket4j.
 *
 * Two independent global buckets:
 * - checkout API: app.rate-limit.checkout-per-minute requests per minute.
 * - provider webhooks: app.rate-limit.webhook-per-five-minutes per 5 minutes.
 *
 * Notes:
 * - Limits are global for the instance. Checkout callers are already authenticated by
 *   API key, so a per-user limit belongs in the calling service.
 */
@Service
public class RateLimiterService {

    private final Bucket checkoutBucket;
    private final Bucket webhookBucket;

    public RateLimiterService(@Value("${app.rate-limit.checkout-per-minute:100}") long checkoutPerMinute,
                              @Value("${app.rate-limit.webhook-per-five-minutes:100}") long webhookPerFiveMinutes) {
        this.checkoutBucket = bucket(checkoutPerMinute, Duration.ofMinutes(1));
        this.webhookBucket = bucket(webhookPerFiveMinutes, Duration.ofMinutes(5));
    }

    private static Bucket bucket(long capacity, Duration period) {
        Bandwidth limit = Bandwidth.classic(capacity, Refill.greedy(capacity, period));
        return Bucket.builder().addLimit(limit).build();
    }

    /**
     * Try to consume one token from the checkout bucket.
     * @return true if the request is allowed, false if the limit has been reached.
     */
    public boolean tryConsumeCheckout() {
        return checkoutBucket.tryConsume(1);
    }

    /** Same as {@link #tryConsumeCheckout()} for provider webhook deliveries. */
    public boolean tryConsumeWebhook() {
        return webhookBucket.tryConsume(1);
    }
}
