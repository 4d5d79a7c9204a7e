package com.ludora.paymentcore.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

/**
 * Redis configuration.
 *
 * Redis holds the ShedLock entries that keep the polling reconciler and the session
 * sweeper single-instance. Connections are opened lazily, so the application starts
 * without Redis when scheduling is disabled (test profile).
 */
@Configuration
public class RedisConfig {

    /**
     * Lettuce connection factory for the configured host and port.
     */
    @Bean
    public RedisConnectionFactory redisConnectionFactory(@Value("${spring.redis.host:localhost}") String host,
                                                         @Value("${spring.redis.port:6379}") int port) {
        return new LettuceConnectionFactory(new RedisStandaloneConfiguration(host, port));
    }
}
