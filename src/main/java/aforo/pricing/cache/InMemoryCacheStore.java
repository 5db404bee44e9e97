package aforo.pricing.cache;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Process-local cache for single-node deployments and tests. Expired entries are dropped on read.
 */
public class InMemoryCacheStore extends JsonCacheStore {

    private record Entry(String json, Instant expiresAt) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheStore(ObjectMapper objectMapper, Clock clock) {
        super(objectMapper);
        this.clock = clock;
    }

    @Override
    protected String readRaw(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return null;
        }
        return entry.json();
    }

    @Override
    protected void writeRaw(String key, String json, long ttlSeconds) {
        entries.put(key, new Entry(json, clock.instant().plusSeconds(ttlSeconds)));
    }

    @Override
    protected long deleteRaw(Collection<String> keys) {
        long deleted = 0;
        for (String key : keys) {
            if (entries.remove(key) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    protected List<String> keys(String pattern) {
        String glob = pattern.endsWith(".*") ? pattern.substring(0, pattern.length() - 1) + "*" : pattern;
        Pattern regex = Pattern.compile(Pattern.quote(glob).replace("*", "\\E.*\\Q"));
        Instant now = clock.instant();
        return entries.entrySet().stream()
                .filter(e -> now.isBefore(e.getValue().expiresAt()))
                .map(Map.Entry::getKey)
                .filter(key -> regex.matcher(key).matches())
                .sorted()
                .collect(Collectors.toList());
    }
}
