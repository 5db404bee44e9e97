package aforo.pricing.service;

import aforo.pricing.entity.Contract;
import aforo.pricing.entity.Pricing;
import aforo.pricing.model.FeatureValue;

import java.util.Map;

/**
 * Everything one evaluation request works on, built fresh per request and never persisted.
 *
 * @param pricings            contracted service → resolved pricing
 * @param subscriptionContext {@code <service>.<usageLimit>.used} → consumption
 * @param pricingContext      {@code <service>.features.<f>} / {@code <service>.usageLimits.<l>} → value
 * @param evaluationContext   {@code <service>-<feature>} → expression
 */
public record EvaluationContexts(Contract contract,
                                 Map<String, Pricing> pricings,
                                 Map<String, FeatureValue> subscriptionContext,
                                 Map<String, FeatureValue> pricingContext,
                                 Map<String, String> evaluationContext) {
}
