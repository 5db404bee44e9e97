package aforo.pricing.config;

import aforo.pricing.cache.CacheStore;
import aforo.pricing.cache.InMemoryCacheStore;
import aforo.pricing.cache.RedisCacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Selects the cache transport: Redis by default, in-process with
 * {@code aforo.pricing.cache.type=memory}.
 */
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "aforo.pricing.cache.type", havingValue = "redis", matchIfMissing = true)
    public CacheStore redisCacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        return new RedisCacheStore(redisTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "aforo.pricing.cache.type", havingValue = "memory")
    public CacheStore inMemoryCacheStore(ObjectMapper objectMapper, Clock clock) {
        return new InMemoryCacheStore(objectMapper, clock);
    }
}
