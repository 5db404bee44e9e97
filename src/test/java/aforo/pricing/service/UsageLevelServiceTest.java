package aforo.pricing.service;

import aforo.pricing.PricingFixtures;
import aforo.pricing.entity.Contract;
import aforo.pricing.entity.Pricing;
import aforo.pricing.entity.UsageLevel;
import aforo.pricing.entity.UsageLimitDefinition;
import aforo.pricing.model.FeatureValue;
import aforo.pricing.model.UsageLevelKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UsageLevelServiceTest {

    private UsageLevelService usageLevelService;

    @BeforeEach
    void setUp() {
        usageLevelService = new UsageLevelService();
    }

    @Test
    void shouldGenerateLevelsForTrackedLimitsOnly() {
        Pricing pricing = PricingFixtures.zoom("1.0");
        pricing.getUsageLimits().put("storageGb", UsageLimitDefinition.builder()
                .name("storageGb").valueType(FeatureValue.Type.NUMERIC).trackable(false).build());
        pricing.getUsageLimits().put("apiCalls", UsageLimitDefinition.builder()
                .name("apiCalls").valueType(FeatureValue.Type.NUMERIC).trackable(true).build());

        Map<String, UsageLevel> levels = usageLevelService.generateUsageLevels(pricing, PricingFixtures.NOW);

        assertEquals(List.of("maxSeats", "apiCalls"), List.copyOf(levels.keySet()));
        assertEquals(Instant.parse("2024-06-10T12:00:00Z"), levels.get("maxSeats").getResetTimeStamp());
        assertNull(levels.get("apiCalls").getResetTimeStamp());
        assertEquals(0.0, levels.get("maxSeats").getConsumed());
    }

    @Test
    void shouldFindAndResetExpiredLevels() {
        Contract contract = PricingFixtures.contract("1.0", "BASIC");
        contract.getUsageLevels().get("zoom").get("maxSeats").setConsumed(7);
        Instant afterReset = Instant.parse("2024-06-11T00:00:00Z");

        assertTrue(usageLevelService.findExpiredUsageLevels(contract, PricingFixtures.NOW).isEmpty());
        List<UsageLevelKey> expired = usageLevelService.findExpiredUsageLevels(contract, afterReset);
        assertEquals(List.of(new UsageLevelKey("zoom", "maxSeats")), expired);

        Contract reset = usageLevelService.resetUsageLevels(contract, expired, afterReset);

        UsageLevel level = reset.getUsageLevels().get("zoom").get("maxSeats");
        assertEquals(0.0, level.getConsumed());
        assertEquals(Instant.parse("2024-07-11T00:00:00Z"), level.getResetTimeStamp());
        assertEquals(7.0, contract.getUsageLevels().get("zoom").get("maxSeats").getConsumed());
    }

    @Test
    void shouldFilterLevelsByUsageLimit() {
        Contract contract = PricingFixtures.contract("1.0", "BASIC");

        assertEquals(1, usageLevelService.findUsageLevels(contract, null).size());
        assertEquals(1, usageLevelService.findUsageLevels(contract, "maxSeats").size());
        assertTrue(usageLevelService.findUsageLevels(contract, "apiCalls").isEmpty());
    }

    @Test
    void shouldRecordConsumptionWithIncreasingSequence() {
        Contract contract = PricingFixtures.contract("1.0", "BASIC");

        Contract first = usageLevelService.recordConsumption(contract, "zoom", "meetings", Map.of("maxSeats", 2.0), PricingFixtures.NOW);
        Contract second = usageLevelService.recordConsumption(first, "zoom", "meetings", Map.of("maxSeats", 3.0), PricingFixtures.NOW);

        UsageLevel level = second.getUsageLevels().get("zoom").get("maxSeats");
        assertEquals(5.0, level.getConsumed());
        assertEquals(2, level.getConsumptions().size());
        assertEquals(1L, level.getConsumptions().get(0).getSequence());
        assertEquals(2L, level.getConsumptions().get(1).getSequence());
        assertEquals(0.0, contract.getUsageLevels().get("zoom").get("maxSeats").getConsumed());
    }

    @Test
    void shouldRevertLatestConsumptionOnly() {
        Contract contract = consumed(2.0, 3.0);

        Contract reverted = usageLevelService.revertConsumption(contract, "zoom", "meetings", true);

        UsageLevel level = reverted.getUsageLevels().get("zoom").get("maxSeats");
        assertEquals(2.0, level.getConsumed());
        assertEquals(1, level.getConsumptions().size());
    }

    @Test
    void shouldRevertAllConsumptionOfFeature() {
        Contract contract = consumed(2.0, 3.0);

        Contract reverted = usageLevelService.revertConsumption(contract, "zoom", "meetings", false);

        UsageLevel level = reverted.getUsageLevels().get("zoom").get("maxSeats");
        assertEquals(0.0, level.getConsumed());
        assertTrue(level.getConsumptions().isEmpty());
    }

    @Test
    void shouldNotGoBelowZeroWhenReverting() {
        Contract contract = consumed(4.0);
        contract.getUsageLevels().get("zoom").get("maxSeats").setConsumed(1);

        Contract reverted = usageLevelService.revertConsumption(contract, "zoom", "meetings", true);

        assertEquals(0.0, reverted.getUsageLevels().get("zoom").get("maxSeats").getConsumed());
    }

    @Test
    void shouldIgnoreRevertWithoutConsumption() {
        Contract contract = consumed(4.0);

        Contract reverted = usageLevelService.revertConsumption(contract, "zoom", "recording", true);

        assertEquals(4.0, reverted.getUsageLevels().get("zoom").get("maxSeats").getConsumed());
    }

    private Contract consumed(double... amounts) {
        Contract contract = PricingFixtures.contract("1.0", "BASIC");
        Instant at = PricingFixtures.NOW;
        for (double amount : amounts) {
            contract = usageLevelService.recordConsumption(contract, "zoom", "meetings", Map.of("maxSeats", amount), at);
            at = at.plus(Duration.ofMinutes(1));
        }
        return contract;
    }
}
