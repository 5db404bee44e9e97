package aforo.pricing.service;

import aforo.pricing.cache.CacheEffect;
import aforo.pricing.dto.FeatureEvaluationReport;

import java.util.List;

public record EvaluationOutcome(FeatureEvaluationReport report, List<CacheEffect> cacheEffects) {
}
