package aforo.pricing.cache;

/**
 * A cache write requested by a pure computation and applied later by {@link CacheEffectApplier}.
 */
public record CacheEffect(Kind kind, String key, Object value, long ttlSeconds, boolean overwrite) {

    public enum Kind {
        SET,
        DELETE
    }

    public static CacheEffect set(String key, Object value, long ttlSeconds) {
        return new CacheEffect(Kind.SET, key, value, ttlSeconds, true);
    }

    /** Key may end in {@code .*} to delete a whole prefix. */
    public static CacheEffect delete(String key) {
        return new CacheEffect(Kind.DELETE, key, null, 0, false);
    }
}
