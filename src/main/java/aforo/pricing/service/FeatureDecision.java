package aforo.pricing.service;

import aforo.pricing.cache.CacheEffect;
import aforo.pricing.dto.FeatureEvaluationResult;

import java.util.List;
import java.util.Map;

/**
 * Result of evaluating one feature, plus what the caller has to persist for it.
 *
 * @param consumption usage limit → amount to record; empty when nothing is consumed
 * @param cacheEffects cache writes to apply once the consumption is persisted
 */
public record FeatureDecision(FeatureEvaluationResult result,
                              Map<String, Double> consumption,
                              List<CacheEffect> cacheEffects) {
}
