package com.packsync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis configuration for cross-worker coordination.
 *
 * <p>All keys are prefixed with "packsync:" because the Redis server is shared with the
 * scraping fleet.
 *
 * <p>Key schema:
 * <pre>
 *   packsync:lock:performance:{performanceId} → owner token (TTL = packsync.lock.ttl-seconds)
 * </pre>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "packsync:";

    public static final String KEY_PREFIX_PERFORMANCE_LOCK = KEY_PREFIX + "lock:performance:";

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory redisConnectionFactory) {
        return new StringRedisTemplate(redisConnectionFactory);
    }
}
