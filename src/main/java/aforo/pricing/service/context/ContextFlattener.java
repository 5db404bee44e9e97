package aforo.pricing.service.context;

import aforo.pricing.entity.AddOn;
import aforo.pricing.entity.Contract;
import aforo.pricing.entity.FeatureDefinition;
import aforo.pricing.entity.Plan;
import aforo.pricing.entity.Pricing;
import aforo.pricing.entity.UsageLevel;
import aforo.pricing.entity.UsageLimitDefinition;
import aforo.pricing.model.FeatureValue;
import aforo.pricing.model.ServiceConfiguration;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the flat, request-scoped maps the evaluator works on.
 *
 * <ul>
 *   <li>subscription context: {@code <service>.<usageLimit>.used} and {@code .resetTimeStamp}</li>
 *   <li>pricing context: {@code <service>.features.<feature>} and {@code <service>.usageLimits.<limit>}</li>
 *   <li>evaluation context: {@code <service>-<feature>} → expression</li>
 * </ul>
 */
@Slf4j
public final class ContextFlattener {

    public static final String FEATURES = "features";
    public static final String USAGE_LIMITS = "usageLimits";
    public static final String USED = "used";
    public static final String RESET_TIMESTAMP = "resetTimeStamp";

    private ContextFlattener() {
    }

    public static String featureId(String serviceName, String featureName) {
        return serviceName + "-" + featureName;
    }

    public static Map<String, FeatureValue> flattenUsageLevelsIntoSubscriptionContext(
            Map<String, Map<String, UsageLevel>> usageLevels) {
        Map<String, FeatureValue> context = new LinkedHashMap<>();
        if (usageLevels == null) {
            return context;
        }
        usageLevels.forEach((service, levels) -> {
            if (levels == null) {
                return;
            }
            levels.forEach((limit, level) -> {
                String prefix = service + "." + limit + ".";
                context.put(prefix + USED, FeatureValue.of(level.getConsumed()));
                if (level.getResetTimeStamp() != null) {
                    context.put(prefix + RESET_TIMESTAMP, FeatureValue.of(level.getResetTimeStamp().toEpochMilli()));
                }
            });
        });
        return context;
    }

    /**
     * Effective configuration per contracted service. Services whose subscription matches
     * neither a plan nor an add-on of their pricing are left out.
     */
    public static Map<String, ServiceConfiguration> mapSubscriptionsToConfigurationsByService(
            Contract contract, Map<String, Pricing> pricingsByService) {
        Map<String, ServiceConfiguration> configurations = new LinkedHashMap<>();
        pricingsByService.forEach((service, pricing) -> {
            String planName = contract.getSubscriptionPlans() != null ? contract.getSubscriptionPlans().get(service) : null;
            Map<String, Integer> addOns = contract.getSubscriptionAddOns() != null
                    ? contract.getSubscriptionAddOns().getOrDefault(service, Collections.emptyMap())
                    : Collections.emptyMap();
            ServiceConfiguration configuration = configure(service, pricing, planName, addOns);
            if (configuration != null) {
                configurations.put(service, configuration);
            }
        });
        return configurations;
    }

    /**
     * Catalog defaults, overridden by the plan, then add-ons with a positive quantity:
     * numeric values add {@code quantity × value}, other values replace.
     *
     * @return null when neither the plan nor any add-on exists in the pricing
     */
    public static ServiceConfiguration configure(String service, Pricing pricing, String planName,
                                                 Map<String, Integer> addOnQuantities) {
        Plan plan = planName != null && pricing.getPlans() != null ? pricing.getPlans().get(planName) : null;
        if (planName != null && plan == null) {
            log.warn("Plan {} not found in pricing {} of service {}", planName, pricing.getVersion(), service);
        }

        Map<String, AddOn> addOns = new LinkedHashMap<>();
        addOnQuantities.forEach((name, quantity) -> {
            AddOn addOn = pricing.getAddOns() != null ? pricing.getAddOns().get(name) : null;
            if (addOn == null) {
                log.warn("Add-on {} not found in pricing {} of service {}", name, pricing.getVersion(), service);
            } else if (quantity != null && quantity > 0) {
                addOns.put(name, addOn);
            }
        });

        if (plan == null && addOns.isEmpty()) {
            return null;
        }

        Map<String, FeatureValue> features = new LinkedHashMap<>();
        for (FeatureDefinition definition : pricing.getFeatures().values()) {
            features.put(definition.getName(), defaultOf(definition.getDefaultValue(), definition.getValueType()));
        }
        Map<String, FeatureValue> usageLimits = new LinkedHashMap<>();
        if (pricing.getUsageLimits() != null) {
            for (UsageLimitDefinition definition : pricing.getUsageLimits().values()) {
                usageLimits.put(definition.getName(), defaultOf(definition.getDefaultValue(), definition.getValueType()));
            }
        }

        if (plan != null) {
            if (plan.getFeatures() != null) {
                features.putAll(plan.getFeatures());
            }
            if (plan.getUsageLimits() != null) {
                usageLimits.putAll(plan.getUsageLimits());
            }
        }
        addOns.forEach((name, addOn) -> {
            int quantity = addOnQuantities.get(name);
            applyAddOnValues(features, addOn.getFeatures(), quantity);
            applyAddOnValues(usageLimits, addOn.getUsageLimits(), quantity);
        });

        return ServiceConfiguration.builder()
                .features(features)
                .usageLimits(usageLimits)
                .build();
    }

    public static Map<String, FeatureValue> flattenConfigurationsIntoPricingContext(
            Map<String, ServiceConfiguration> configurations) {
        Map<String, FeatureValue> context = new LinkedHashMap<>();
        configurations.forEach((service, configuration) -> {
            configuration.getFeatures().forEach((name, value) ->
                    context.put(service + "." + FEATURES + "." + name, value));
            configuration.getUsageLimits().forEach((name, value) ->
                    context.put(service + "." + USAGE_LIMITS + "." + name, value));
        });
        return context;
    }

    /**
     * Expression of every feature per service; {@code serverExpression} wins when
     * {@code server} is set and the feature has one. Features without an expression evaluate
     * their own value.
     */
    public static Map<String, Map<String, String>> getFeatureEvaluationExpressionsByService(
            Map<String, Pricing> pricingsByService, boolean server) {
        Map<String, Map<String, String>> expressions = new LinkedHashMap<>();
        pricingsByService.forEach((service, pricing) -> {
            Map<String, String> byFeature = new LinkedHashMap<>();
            for (FeatureDefinition feature : pricing.getFeatures().values()) {
                byFeature.put(feature.getName(), expressionOf(feature, server));
            }
            expressions.put(service, byFeature);
        });
        return expressions;
    }

    public static Map<String, String> flattenFeatureEvaluationsIntoEvaluationContext(
            Map<String, Map<String, String>> expressionsByService) {
        Map<String, String> context = new LinkedHashMap<>();
        expressionsByService.forEach((service, expressions) ->
                expressions.forEach((feature, expression) -> context.put(featureId(service, feature), expression)));
        return context;
    }

    static String expressionOf(FeatureDefinition feature, boolean server) {
        if (server && feature.getServerExpression() != null && !feature.getServerExpression().isBlank()) {
            return feature.getServerExpression();
        }
        if (feature.getExpression() != null && !feature.getExpression().isBlank()) {
            return feature.getExpression();
        }
        return FEATURES + "['" + feature.getName().replace("'", "''") + "']";
    }

    private static void applyAddOnValues(Map<String, FeatureValue> target, Map<String, FeatureValue> values, int quantity) {
        if (values == null) {
            return;
        }
        values.forEach((name, value) -> {
            FeatureValue base = target.get(name);
            if (value.isNumeric() && base != null && base.isNumeric()) {
                target.put(name, FeatureValue.of(base.asNumber() + quantity * value.asNumber()));
            } else if (value.isNumeric()) {
                target.put(name, FeatureValue.of(quantity * value.asNumber()));
            } else {
                target.put(name, value);
            }
        });
    }

    private static FeatureValue defaultOf(FeatureValue defaultValue, FeatureValue.Type type) {
        return defaultValue != null ? defaultValue : FeatureValue.emptyOf(type);
    }
}
