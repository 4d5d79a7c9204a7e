package com.ludora.paymentcore.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Infrastructure beans shared by the payment services.
 */
@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * HTTP client for the payment provider, bounded by the configured timeouts.
     */
    @Bean
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder, PaymentProperties props) {
        return builder
                .setConnectTimeout(props.getProvider().getConnectTimeout())
                .setReadTimeout(props.getProvider().getReadTimeout())
                .build();
    }

    /**
     * Worker pool for webhook processing. The endpoint waits on it for a bounded time only.
     */
    @Bean
    public AsyncTaskExecutor webhookExecutor(PaymentProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getWebhook().getWorkerThreads());
        executor.setMaxPoolSize(props.getWebhook().getWorkerThreads());
        executor.setQueueCapacity(props.getWebhook().getQueueCapacity());
        executor.setThreadNamePrefix("webhook-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
