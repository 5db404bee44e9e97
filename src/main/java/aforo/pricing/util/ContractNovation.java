package aforo.pricing.util;

import aforo.pricing.dto.NewSubscription;
import aforo.pricing.entity.BillingPeriod;
import aforo.pricing.entity.Contract;
import aforo.pricing.entity.ContractHistoryEntry;
import aforo.pricing.entity.UsageLevel;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Pure contract transformations: creation, novation to a new subscription and billing renewal.
 * Inputs are never mutated.
 */
public final class ContractNovation {

    private ContractNovation() {
    }

    /**
     * Replaces the contract's subscription, records the previous one in the history and opens a
     * new billing period starting at {@code now}. Usage levels are carried over for services
     * that remain contracted; the caller regenerates them when the pricing changes.
     */
    public static Contract performNovation(Contract contract, NewSubscription subscription, Instant now) {
        Contract copy = copyOf(contract);
        copy.getHistory().add(historyEntry(contract, now));

        Map<String, String> contractedServices = VersionCodec.escapeContractedServices(subscription.getContractedServices());
        copy.setContractedServices(contractedServices);
        copy.setSubscriptionPlans(lowerCaseKeys(subscription.getSubscriptionPlans()));
        copy.setSubscriptionAddOns(copyAddOns(lowerCaseKeys(subscription.getSubscriptionAddOns())));
        copy.getUsageLevels().keySet().retainAll(contractedServices.keySet());
        copy.setBillingPeriod(billingPeriod(contract.getBillingPeriod(), subscription, now));
        return copy;
    }

    /**
     * A contract with no history and no usage levels, whose first billing period starts at
     * {@code now}. Auto-renewal is off unless the subscription asks for it.
     */
    public static Contract newContract(String userId, Long organizationId, NewSubscription subscription, Instant now) {
        return Contract.builder()
                .userId(userId)
                .organizationId(organizationId)
                .contractedServices(VersionCodec.escapeContractedServices(subscription.getContractedServices()))
                .subscriptionPlans(lowerCaseKeys(subscription.getSubscriptionPlans()))
                .subscriptionAddOns(copyAddOns(lowerCaseKeys(subscription.getSubscriptionAddOns())))
                .billingPeriod(billingPeriod(null, subscription, now))
                .build();
    }

    /**
     * The contract's current subscription with unescaped versions, ready to be edited and
     * passed to {@link #performNovation}.
     */
    public static NewSubscription subscriptionOf(Contract contract) {
        Map<String, String> services = new LinkedHashMap<>();
        nullSafe(contract.getContractedServices()).forEach((service, version) -> services.put(service, VersionCodec.unescape(version)));
        return NewSubscription.builder()
                .contractedServices(services)
                .subscriptionPlans(new LinkedHashMap<>(nullSafe(contract.getSubscriptionPlans())))
                .subscriptionAddOns(copyAddOns(contract.getSubscriptionAddOns()))
                .build();
    }

    /**
     * Starts the next billing period of an expired, auto-renewing contract.
     */
    public static Contract renew(Contract contract, Instant now) {
        Contract copy = copyOf(contract);
        copy.getHistory().add(historyEntry(contract, contract.getBillingPeriod().getEndDate()));
        BillingPeriod previous = contract.getBillingPeriod();
        int renewalDays = previous.getRenewalDays() != null ? previous.getRenewalDays() : BillingPeriod.DEFAULT_RENEWAL_DAYS;
        copy.setBillingPeriod(BillingPeriod.builder()
                .startDate(now)
                .endDate(now.plus(Duration.ofDays(renewalDays)))
                .autoRenew(previous.isAutoRenew())
                .renewalDays(renewalDays)
                .build());
        return copy;
    }

    /**
     * Deep copy of the mutable parts of a contract.
     */
    public static Contract copyOf(Contract contract) {
        Map<String, Map<String, UsageLevel>> usageLevels = new LinkedHashMap<>();
        if (contract.getUsageLevels() != null) {
            contract.getUsageLevels().forEach((service, levels) -> {
                Map<String, UsageLevel> copied = new LinkedHashMap<>();
                levels.forEach((limit, level) -> copied.put(limit, UsageLevel.builder()
                        .consumed(level.getConsumed())
                        .resetTimeStamp(level.getResetTimeStamp())
                        .period(level.getPeriod())
                        .consumptions(level.getConsumptions() != null ? new ArrayList<>(level.getConsumptions()) : new ArrayList<>())
                        .build()));
                usageLevels.put(service, copied);
            });
        }
        BillingPeriod period = contract.getBillingPeriod();
        return contract.toBuilder()
                .contractedServices(new LinkedHashMap<>(nullSafe(contract.getContractedServices())))
                .subscriptionPlans(new LinkedHashMap<>(nullSafe(contract.getSubscriptionPlans())))
                .subscriptionAddOns(copyAddOns(contract.getSubscriptionAddOns()))
                .usageLevels(usageLevels)
                .billingPeriod(period != null ? period.toBuilder().build() : null)
                .history(contract.getHistory() != null ? new ArrayList<>(contract.getHistory()) : new ArrayList<>())
                .build();
    }

    private static BillingPeriod billingPeriod(BillingPeriod previous, NewSubscription subscription, Instant now) {
        int renewalDays = subscription.getRenewalDays() != null
                ? subscription.getRenewalDays()
                : previous != null && previous.getRenewalDays() != null ? previous.getRenewalDays() : BillingPeriod.DEFAULT_RENEWAL_DAYS;
        boolean autoRenew = subscription.getAutoRenew() != null
                ? subscription.getAutoRenew()
                : previous != null && previous.isAutoRenew();
        return BillingPeriod.builder()
                .startDate(now)
                .endDate(now.plus(Duration.ofDays(renewalDays)))
                .autoRenew(autoRenew)
                .renewalDays(renewalDays)
                .build();
    }

    private static ContractHistoryEntry historyEntry(Contract contract, Instant endDate) {
        BillingPeriod period = contract.getBillingPeriod();
        return ContractHistoryEntry.builder()
                .startDate(period != null ? period.getStartDate() : null)
                .endDate(endDate)
                .contractedServices(new LinkedHashMap<>(nullSafe(contract.getContractedServices())))
                .subscriptionPlans(new LinkedHashMap<>(nullSafe(contract.getSubscriptionPlans())))
                .subscriptionAddOns(copyAddOns(contract.getSubscriptionAddOns()))
                .build();
    }

    private static Map<String, Map<String, Integer>> copyAddOns(Map<String, Map<String, Integer>> addOns) {
        Map<String, Map<String, Integer>> copy = new LinkedHashMap<>();
        if (addOns != null) {
            addOns.forEach((service, quantities) -> copy.put(service, new LinkedHashMap<>(quantities)));
        }
        return copy;
    }

    private static <V> Map<String, V> lowerCaseKeys(Map<String, V> map) {
        Map<String, V> result = new LinkedHashMap<>();
        if (map != null) {
            map.forEach((key, value) -> result.put(key.toLowerCase(Locale.ROOT), value));
        }
        return result;
    }

    private static <K, V> Map<K, V> nullSafe(Map<K, V> map) {
        return map != null ? map : Map.of();
    }
}
