package aforo.pricing.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Redis-backed cache. Prefix deletes use {@code KEYS pattern}, which is fine for the
 * per-user key counts involved here.
 */
@Slf4j
public class RedisCacheStore extends JsonCacheStore {

    private final StringRedisTemplate redisTemplate;

    public RedisCacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        super(objectMapper);
        this.redisTemplate = redisTemplate;
        log.info("🗄️ Redis cache store initialized");
    }

    @Override
    protected String readRaw(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    protected void writeRaw(String key, String json, long ttlSeconds) {
        redisTemplate.opsForValue().set(key, json, Duration.ofSeconds(ttlSeconds));
    }

    @Override
    protected long deleteRaw(Collection<String> keys) {
        Long deleted = redisTemplate.delete(keys);
        return deleted != null ? deleted : 0;
    }

    @Override
    protected List<String> keys(String pattern) {
        String redisPattern = pattern.endsWith(".*") ? pattern.substring(0, pattern.length() - 1) + "*" : pattern;
        Set<String> keys = redisTemplate.keys(redisPattern);
        return keys != null ? new ArrayList<>(keys) : List.of();
    }
}
