package aforo.pricing.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Applies cache effects best-effort: a failing cache never fails the request that produced them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheEffectApplier {

    private final CacheStore cacheStore;

    public void apply(List<CacheEffect> effects) {
        for (CacheEffect effect : effects) {
            apply(effect);
        }
    }

    public void apply(CacheEffect effect) {
        try {
            switch (effect.kind()) {
                case SET -> cacheStore.set(effect.key(), effect.value(), effect.ttlSeconds(), effect.overwrite());
                case DELETE -> cacheStore.del(effect.key());
            }
        } catch (RuntimeException e) {
            log.warn("⚠️ Cache {} failed for key {}: {}", effect.kind(), effect.key(), e.getMessage());
        }
    }
}
