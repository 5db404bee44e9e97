package aforo.pricing.cache;

import aforo.pricing.exception.CacheKeyCollisionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Base for stores that keep values as JSON text. Handles key normalisation, serialization
 * and the overwrite rule; subclasses only move strings.
 */
@Slf4j
public abstract class JsonCacheStore implements CacheStore {

    private final ObjectMapper objectMapper;

    protected JsonCacheStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected abstract String readRaw(String key);

    protected abstract void writeRaw(String key, String json, long ttlSeconds);

    protected abstract long deleteRaw(Collection<String> keys);

    /** Keys matching a lower-case glob pattern. */
    protected abstract List<String> keys(String pattern);

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return Optional.ofNullable(readRaw(normalize(key))).map(json -> read(key, json, type));
    }

    @Override
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return Optional.ofNullable(readRaw(normalize(key))).map(json -> read(key, json, type));
    }

    @Override
    public void set(String key, Object value, long ttlSeconds, boolean overwrite) {
        String normalized = normalize(key);
        String json = write(normalized, value);
        String previous = readRaw(normalized);
        if (previous != null && !previous.equals(json) && !overwrite) {
            throw new CacheKeyCollisionException(normalized);
        }
        writeRaw(normalized, json, ttlSeconds);
    }

    @Override
    public void del(String key) {
        delMany(List.of(key));
    }

    @Override
    public long delMany(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Set<String> toDelete = new LinkedHashSet<>();
        for (String key : keys) {
            String normalized = normalize(key);
            if (normalized.endsWith(".*")) {
                toDelete.addAll(keys(normalized));
            } else {
                toDelete.add(normalized);
            }
        }
        if (toDelete.isEmpty()) {
            return 0;
        }
        long deleted = deleteRaw(toDelete);
        log.debug("Deleted {} cache entries for {}", deleted, keys);
        return deleted;
    }

    @Override
    public List<String> match(String pattern) {
        return keys(normalize(pattern).replace("**", "*"));
    }

    protected static String normalize(String key) {
        return key.toLowerCase(Locale.ROOT);
    }

    private String write(String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize cache value for key " + key, e);
        }
    }

    private <T> T read(String key, String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt cache entry for key " + key, e);
        }
    }

    private <T> T read(String key, String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt cache entry for key " + key, e);
        }
    }
}
