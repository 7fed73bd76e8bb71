package com.dailyprojects.core.cache;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "dailyprojects.cache.provider", havingValue = "redis", matchIfMissing = true)
    public CacheStore redisCacheStore(StringRedisTemplate stringRedisTemplate) {
        return new RedisCacheStore(stringRedisTemplate);
    }

    /**
     * Local development and tests; counters and locks are not shared across
     * processes with this provider.
     */
    @Bean
    @ConditionalOnProperty(name = "dailyprojects.cache.provider", havingValue = "memory")
    public CacheStore inMemoryCacheStore(Clock clock) {
        return new InMemoryCacheStore(clock);
    }
}
