package aforo.pricing.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Key/value side channel with TTLs. Keys are case-insensitive (stored lower-case).
 * A key ending in {@code .*} addresses every key starting with the part before the {@code *}.
 */
public interface CacheStore {

    <T> Optional<T> get(String key, Class<T> type);

    <T> Optional<T> get(String key, TypeReference<T> type);

    /**
     * Stores {@code value} for {@code ttlSeconds}.
     *
     * @throws aforo.pricing.exception.CacheKeyCollisionException when the key already holds a
     *         different value and {@code overwrite} is false
     */
    void set(String key, Object value, long ttlSeconds, boolean overwrite);

    /**
     * Deletes one key, or every key of a prefix when {@code key} ends in {@code .*}.
     */
    void del(String key);

    /**
     * Deletes every key of every given key or prefix.
     *
     * @return number of deleted entries
     */
    long delMany(Collection<String> keys);

    /**
     * Keys matching a glob pattern ({@code *} wildcard).
     */
    List<String> match(String pattern);
}
