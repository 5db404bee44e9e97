package aforo.pricing.service.context;

import aforo.pricing.PricingFixtures;
import aforo.pricing.entity.Contract;
import aforo.pricing.entity.FeatureDefinition;
import aforo.pricing.entity.Pricing;
import aforo.pricing.entity.UsageLevel;
import aforo.pricing.model.FeatureValue;
import aforo.pricing.model.ServiceConfiguration;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextFlattenerTest {

    @Test
    void shouldFlattenUsageLevels() {
        Map<String, Map<String, UsageLevel>> levels = new LinkedHashMap<>();
        Map<String, UsageLevel> zoom = new LinkedHashMap<>();
        zoom.put("maxSeats", UsageLevel.builder().consumed(4).resetTimeStamp(Instant.ofEpochMilli(1000)).build());
        zoom.put("storageGb", UsageLevel.builder().consumed(2.5).build());
        levels.put("zoom", zoom);

        Map<String, FeatureValue> context = ContextFlattener.flattenUsageLevelsIntoSubscriptionContext(levels);

        assertEquals(FeatureValue.of(4), context.get("zoom.maxSeats.used"));
        assertEquals(FeatureValue.of(1000), context.get("zoom.maxSeats.resetTimeStamp"));
        assertEquals(FeatureValue.of(2.5), context.get("zoom.storageGb.used"));
        assertFalse(context.containsKey("zoom.storageGb.resetTimeStamp"));
    }

    @Test
    void shouldApplyDefaultsThenPlan() {
        ServiceConfiguration basic = ContextFlattener.configure("zoom", PricingFixtures.zoom("1.0"), "BASIC", Map.of());
        ServiceConfiguration pro = ContextFlattener.configure("zoom", PricingFixtures.zoom("1.0"), "PRO", Map.of());

        assertEquals(FeatureValue.of("SD"), basic.getFeatures().get("videoQuality"));
        assertEquals(FeatureValue.of(10), basic.getUsageLimits().get("maxSeats"));
        assertEquals(FeatureValue.of("HD"), pro.getFeatures().get("videoQuality"));
        assertEquals(FeatureValue.TRUE, pro.getFeatures().get("recording"));
        assertEquals(FeatureValue.of(50), pro.getUsageLimits().get("maxSeats"));
    }

    @Test
    void shouldAddNumericAddOnValuesTimesQuantity() {
        ServiceConfiguration configuration = ContextFlattener.configure(
                "zoom", PricingFixtures.zoom("1.0"), "PRO", Map.of("extraSeats", 3));

        assertEquals(FeatureValue.of(80), configuration.getUsageLimits().get("maxSeats"));
    }

    @Test
    void shouldIgnoreAddOnsWithZeroQuantity() {
        ServiceConfiguration configuration = ContextFlattener.configure(
                "zoom", PricingFixtures.zoom("1.0"), "PRO", Map.of("extraSeats", 0));

        assertEquals(FeatureValue.of(50), configuration.getUsageLimits().get("maxSeats"));
    }

    @Test
    void shouldOverrideNonNumericAddOnValues() {
        Pricing pricing = PricingFixtures.zoom("1.0");
        pricing.getAddOns().get("extraSeats").getFeatures().put("videoQuality", FeatureValue.of("4K"));

        ServiceConfiguration configuration = ContextFlattener.configure("zoom", pricing, "PRO", Map.of("extraSeats", 2));

        assertEquals(FeatureValue.of("4K"), configuration.getFeatures().get("videoQuality"));
    }

    @Test
    void shouldSkipServiceWithoutPlanOrAddOns() {
        assertNull(ContextFlattener.configure("zoom", PricingFixtures.zoom("1.0"), null, Map.of()));
        assertNull(ContextFlattener.configure("zoom", PricingFixtures.zoom("1.0"), "ENTERPRISE", Map.of("unknown", 1)));
    }

    @Test
    void shouldBuildPricingContextPerContractedService() {
        Contract contract = PricingFixtures.contract("1.0", "PRO");
        contract.getSubscriptionAddOns().get("zoom").put("extraSeats", 1);
        contract.getContractedServices().put("teams", "1_0");
        Map<String, Pricing> pricings = new LinkedHashMap<>();
        pricings.put("zoom", PricingFixtures.zoom("1.0"));
        pricings.put("teams", PricingFixtures.teams("1.0"));

        Map<String, FeatureValue> context = ContextFlattener.flattenConfigurationsIntoPricingContext(
                ContextFlattener.mapSubscriptionsToConfigurationsByService(contract, pricings));

        assertEquals(FeatureValue.of(60), context.get("zoom.usageLimits.maxSeats"));
        assertEquals(FeatureValue.TRUE, context.get("zoom.features.meetings"));
        assertFalse(context.keySet().stream().anyMatch(key -> key.startsWith("teams.")));
    }

    @Test
    void shouldSelectServerExpressionWhenRequested() {
        Map<String, Pricing> pricings = Map.of("zoom", PricingFixtures.zoom("1.0"));

        Map<String, String> client = ContextFlattener.flattenFeatureEvaluationsIntoEvaluationContext(
                ContextFlattener.getFeatureEvaluationExpressionsByService(pricings, false));
        Map<String, String> server = ContextFlattener.flattenFeatureEvaluationsIntoEvaluationContext(
                ContextFlattener.getFeatureEvaluationExpressionsByService(pricings, true));

        assertEquals("features.videoQuality == 'HD'", client.get("zoom-videoQuality"));
        assertEquals("features.videoQuality != 'SD'", server.get("zoom-videoQuality"));
        assertEquals(client.get("zoom-meetings"), server.get("zoom-meetings"));
    }

    @Test
    void shouldFallBackToFeatureValueWithoutExpression() {
        FeatureDefinition feature = FeatureDefinition.builder().name("it's").build();

        assertEquals("features['recording']", ContextFlattener.expressionOf(
                FeatureDefinition.builder().name("recording").build(), true));
        assertEquals("features['it''s']", ContextFlattener.expressionOf(feature, false));
    }
}
