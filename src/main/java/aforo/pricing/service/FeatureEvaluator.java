package aforo.pricing.service;

import aforo.pricing.cache.CacheEffect;
import aforo.pricing.cache.CacheKeys;
import aforo.pricing.dto.FeatureEvaluationReport;
import aforo.pricing.dto.FeatureEvaluationResult;
import aforo.pricing.entity.Pricing;
import aforo.pricing.entity.UsageLimitDefinition;
import aforo.pricing.exception.ExpressionException;
import aforo.pricing.expression.ExpressionEvaluator;
import aforo.pricing.expression.VariableResolver;
import aforo.pricing.model.FeatureValue;
import aforo.pricing.service.context.ContextFlattener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates features against prepared contexts. Has no side effects: persistence of
 * consumption and cache writes are returned to the caller.
 *
 * <p>While evaluating feature {@code F} of service {@code S} an expression sees
 * {@code features.X}, {@code usageLimits.L} and {@code usage.L} for its own service, plus every
 * fully-qualified context key. Catalog entries without a configured value read as zero.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeatureEvaluator {

    private static final String FEATURES_PREFIX = "features.";
    private static final String USAGE_LIMITS_PREFIX = "usageLimits.";
    private static final String USAGE_PREFIX = "usage.";

    private final ExpressionEvaluator expressionEvaluator;

    /**
     * Evaluates every feature of every contracted service. Broken expressions are reported in
     * the feature's {@code error} instead of failing the other features.
     */
    public EvaluationOutcome evaluateAll(String userId, EvaluationContexts contexts, boolean details) {
        Map<String, FeatureEvaluationResult> results = new LinkedHashMap<>();
        contexts.pricings().forEach((service, pricing) -> {
            for (String feature : pricing.getFeatures().keySet()) {
                String featureId = ContextFlattener.featureId(service, feature);
                try {
                    results.put(featureId, evaluate(contexts, service, feature, Collections.emptyMap(), details).result());
                } catch (ExpressionException e) {
                    log.warn("Feature {} of user {} has a broken expression: {}", featureId, userId, e.getMessage());
                    results.put(featureId, FeatureEvaluationResult.builder()
                            .eval(false)
                            .error(new FeatureEvaluationResult.Error("EXPRESSION_ERROR", e.getMessage()))
                            .build());
                }
            }
        });
        FeatureEvaluationReport report = FeatureEvaluationReport.builder().features(results).build();
        return new EvaluationOutcome(report, List.of(
                CacheEffect.set(CacheKeys.featureEvaluations(userId), report, CacheKeys.EVALUATION_TTL_SECONDS)));
    }

    /**
     * Evaluates one feature with an optional consumption request.
     *
     * @param expected usage limit → increment, already resolved to limits of {@code service}
     * @throws ExpressionException when the feature's expression is broken
     */
    public FeatureDecision evaluateFeature(String userId, EvaluationContexts contexts, String service,
                                           String feature, Map<String, Double> expected, boolean details) {
        FeatureDecision decision = evaluate(contexts, service, feature, expected, details);
        // a traced result is never cached: plain reads of the key must not see the trace
        if (decision.result().isLimitReached() || details) {
            return decision;
        }
        String featureId = ContextFlattener.featureId(service, feature);
        List<CacheEffect> effects = List.of(CacheEffect.set(
                CacheKeys.featureEvaluation(userId, featureId), decision.result(), CacheKeys.EVALUATION_TTL_SECONDS));
        return new FeatureDecision(decision.result(), decision.consumption(), effects);
    }

    private FeatureDecision evaluate(EvaluationContexts contexts, String service, String feature,
                                     Map<String, Double> expected, boolean details) {
        Pricing pricing = contexts.pricings().get(service);
        String expression = contexts.evaluationContext().get(ContextFlattener.featureId(service, feature));
        List<String> linkedLimits = linkedUsageLimits(pricing, feature);

        Map<String, FeatureValue> seen = details ? new LinkedHashMap<>() : null;
        VariableResolver resolver = resolver(contexts, pricing, service, expected, seen);
        FeatureValue value = expressionEvaluator.evaluate(expression, resolver);

        String exceeded = null;
        for (Map.Entry<String, Double> entry : expected.entrySet()) {
            double projected = used(contexts, service, entry.getKey()) + entry.getValue();
            if (projected > limit(contexts, service, entry.getKey())) {
                exceeded = entry.getKey();
                break;
            }
        }

        String primary = exceeded != null ? exceeded : primaryLimit(linkedLimits, expected);
        boolean consume = exceeded == null && value.isTruthy() && !expected.isEmpty();

        FeatureEvaluationResult.FeatureEvaluationResultBuilder result = FeatureEvaluationResult.builder()
                .eval(exceeded == null && value.isTruthy())
                .limitReached(exceeded != null);
        if (primary != null) {
            double used = used(contexts, service, primary);
            if (consume) {
                used += expected.getOrDefault(primary, 0.0);
            }
            result.used(used).limit(limit(contexts, service, primary));
        }
        if (details) {
            result.trace(new FeatureEvaluationResult.Trace(expression, value, seen));
        }
        return new FeatureDecision(result.build(), consume ? new LinkedHashMap<>(expected) : Map.of(), List.of());
    }

    /**
     * Tracked usage limits linked to the feature, in catalog order.
     */
    public static List<String> linkedUsageLimits(Pricing pricing, String feature) {
        List<String> limits = new ArrayList<>();
        if (pricing.getUsageLimits() == null) {
            return limits;
        }
        for (UsageLimitDefinition limit : pricing.getUsageLimits().values()) {
            if (limit.isTracked() && limit.getLinkedFeatures() != null && limit.getLinkedFeatures().contains(feature)) {
                limits.add(limit.getName());
            }
        }
        return limits;
    }

    private static String primaryLimit(List<String> linkedLimits, Map<String, Double> expected) {
        if (!expected.isEmpty()) {
            return expected.keySet().iterator().next();
        }
        return linkedLimits.isEmpty() ? null : linkedLimits.get(0);
    }

    private static double used(EvaluationContexts contexts, String service, String usageLimit) {
        FeatureValue used = contexts.subscriptionContext().get(service + "." + usageLimit + "." + ContextFlattener.USED);
        return used != null && used.isNumeric() ? used.asNumber() : 0;
    }

    private static double limit(EvaluationContexts contexts, String service, String usageLimit) {
        FeatureValue limit = contexts.pricingContext().get(service + "." + ContextFlattener.USAGE_LIMITS + "." + usageLimit);
        return limit != null && limit.isNumeric() ? limit.asNumber() : 0;
    }

    private static VariableResolver resolver(EvaluationContexts contexts, Pricing pricing, String service,
                                             Map<String, Double> expected, Map<String, FeatureValue> seen) {
        return name -> {
            FeatureValue value = lookup(contexts, pricing, service, expected, name);
            if (seen != null && value != null) {
                seen.put(name, value);
            }
            return value;
        };
    }

    private static FeatureValue lookup(EvaluationContexts contexts, Pricing pricing, String service,
                                       Map<String, Double> expected, String name) {
        if (name.startsWith(FEATURES_PREFIX)) {
            String feature = name.substring(FEATURES_PREFIX.length());
            if (pricing.getFeatures().containsKey(feature)) {
                FeatureValue value = contexts.pricingContext().get(service + "." + ContextFlattener.FEATURES + "." + feature);
                return value != null ? value : FeatureValue.ZERO;
            }
        } else if (name.startsWith(USAGE_LIMITS_PREFIX)) {
            String limit = name.substring(USAGE_LIMITS_PREFIX.length());
            if (pricing.getUsageLimits() != null && pricing.getUsageLimits().containsKey(limit)) {
                FeatureValue value = contexts.pricingContext().get(service + "." + ContextFlattener.USAGE_LIMITS + "." + limit);
                return value != null ? value : FeatureValue.ZERO;
            }
        } else if (name.startsWith(USAGE_PREFIX)) {
            String limit = name.substring(USAGE_PREFIX.length());
            if (pricing.getUsageLimits() != null && pricing.getUsageLimits().containsKey(limit)) {
                return FeatureValue.of(used(contexts, service, limit) + expected.getOrDefault(limit, 0.0));
            }
        }
        FeatureValue qualified = contexts.pricingContext().get(name);
        return qualified != null ? qualified : contexts.subscriptionContext().get(name);
    }
}
