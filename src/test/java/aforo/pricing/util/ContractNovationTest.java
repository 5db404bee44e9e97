package aforo.pricing.util;

import aforo.pricing.PricingFixtures;
import aforo.pricing.dto.NewSubscription;
import aforo.pricing.entity.Contract;
import aforo.pricing.entity.ContractHistoryEntry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContractNovationTest {

    private static final Instant LATER = PricingFixtures.NOW.plus(Duration.ofDays(3));

    @Test
    void shouldReplaceSubscriptionAndRecordHistory() {
        Contract contract = PricingFixtures.contract("1.0", "BASIC");
        Map<String, String> services = new LinkedHashMap<>();
        services.put("Zoom", "2.0");
        Map<String, String> plans = new LinkedHashMap<>();
        plans.put("Zoom", "PRO");

        Contract novated = ContractNovation.performNovation(contract,
                NewSubscription.builder().contractedServices(services).subscriptionPlans(plans).build(), LATER);

        assertEquals("2_0", novated.getContractedServices().get("zoom"));
        assertEquals("PRO", novated.getSubscriptionPlans().get("zoom"));
        assertEquals(1, novated.getHistory().size());
        ContractHistoryEntry entry = novated.getHistory().get(0);
        assertEquals(PricingFixtures.NOW, entry.getStartDate());
        assertEquals(LATER, entry.getEndDate());
        assertEquals("1_0", entry.getContractedServices().get("zoom"));
        assertEquals("BASIC", entry.getSubscriptionPlans().get("zoom"));
        assertTrue(novated.getUsageLevels().containsKey("zoom"));
    }

    @Test
    void shouldOpenNewPeriodKeepingRenewalSettings() {
        Contract contract = PricingFixtures.contract("1.0", "BASIC");
        contract.getBillingPeriod().setRenewalDays(15);
        contract.getBillingPeriod().setAutoRenew(false);

        Contract novated = ContractNovation.performNovation(contract, subscriptionTo("1.0"), LATER);

        assertEquals(LATER, novated.getBillingPeriod().getStartDate());
        assertEquals(LATER.plus(Duration.ofDays(15)), novated.getBillingPeriod().getEndDate());
        assertFalse(novated.getBillingPeriod().isAutoRenew());
    }

    @Test
    void shouldPreferSuppliedRenewalSettings() {
        NewSubscription subscription = subscriptionTo("1.0");
        subscription.setRenewalDays(7);
        subscription.setAutoRenew(false);

        Contract novated = ContractNovation.performNovation(PricingFixtures.contract("1.0", "BASIC"), subscription, LATER);

        assertEquals(Integer.valueOf(7), novated.getBillingPeriod().getRenewalDays());
        assertEquals(LATER.plus(Duration.ofDays(7)), novated.getBillingPeriod().getEndDate());
        assertFalse(novated.getBillingPeriod().isAutoRenew());
    }

    @Test
    void shouldDefaultToThirtyDaysWithoutPreviousPeriod() {
        Contract contract = PricingFixtures.contract("1.0", "BASIC");
        contract.setBillingPeriod(null);

        Contract novated = ContractNovation.performNovation(contract, subscriptionTo("1.0"), LATER);

        assertEquals(LATER.plus(Duration.ofDays(30)), novated.getBillingPeriod().getEndDate());
        assertNull(novated.getHistory().get(0).getStartDate());
    }

    @Test
    void shouldDropUsageLevelsOfRemovedServices() {
        Contract novated = ContractNovation.performNovation(PricingFixtures.contract("1.0", "BASIC"),
                NewSubscription.builder().build(), LATER);

        assertTrue(novated.getContractedServices().isEmpty());
        assertTrue(novated.getUsageLevels().isEmpty());
    }

    @Test
    void shouldNotMutateInput() {
        Contract contract = PricingFixtures.contract("1.0", "BASIC");

        Contract novated = ContractNovation.performNovation(contract, subscriptionTo("2.0"), LATER);
        novated.getUsageLevels().get("zoom").get("maxSeats").setConsumed(5);

        assertEquals("1_0", contract.getContractedServices().get("zoom"));
        assertTrue(contract.getHistory().isEmpty());
        assertEquals(PricingFixtures.NOW, contract.getBillingPeriod().getStartDate());
        assertEquals(0.0, contract.getUsageLevels().get("zoom").get("maxSeats").getConsumed());
    }

    @Test
    void shouldRenewFromPreviousEndDate() {
        Contract contract = PricingFixtures.contract("1.0", "BASIC");
        Instant end = contract.getBillingPeriod().getEndDate();
        Instant now = end.plus(Duration.ofHours(2));

        Contract renewed = ContractNovation.renew(contract, now);

        assertEquals(now, renewed.getBillingPeriod().getStartDate());
        assertEquals(now.plus(Duration.ofDays(30)), renewed.getBillingPeriod().getEndDate());
        assertTrue(renewed.getBillingPeriod().isAutoRenew());
        assertEquals(end, renewed.getHistory().get(0).getEndDate());
        assertEquals("1_0", renewed.getContractedServices().get("zoom"));
    }

    private static NewSubscription subscriptionTo(String version) {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("zoom", version);
        Map<String, String> plans = new LinkedHashMap<>();
        plans.put("zoom", "BASIC");
        return NewSubscription.builder().contractedServices(services).subscriptionPlans(plans).build();
    }
}
