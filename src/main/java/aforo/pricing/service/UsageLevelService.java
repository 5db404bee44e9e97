package aforo.pricing.service;

import aforo.pricing.entity.ConsumptionRecord;
import aforo.pricing.entity.Contract;
import aforo.pricing.entity.Pricing;
import aforo.pricing.entity.UsageLevel;
import aforo.pricing.entity.UsageLimitDefinition;
import aforo.pricing.model.UsageLevelKey;
import aforo.pricing.util.ContractNovation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle of usage levels: creation from a pricing, lazy reset once their period elapsed,
 * consumption and its revert. Operations on a contract return a modified copy.
 */
@Component
@Slf4j
public class UsageLevelService {

    /**
     * Fresh levels for every trackable numeric usage limit of the pricing.
     */
    public Map<String, UsageLevel> generateUsageLevels(Pricing pricing, Instant now) {
        Map<String, UsageLevel> levels = new LinkedHashMap<>();
        if (pricing.getUsageLimits() == null) {
            return levels;
        }
        for (UsageLimitDefinition limit : pricing.getUsageLimits().values()) {
            if (!limit.isTracked()) {
                continue;
            }
            levels.put(limit.getName(), UsageLevel.builder()
                    .consumed(0)
                    .period(limit.getPeriod())
                    .resetTimeStamp(limit.getPeriod() != null ? limit.getPeriod().nextResetFrom(now) : null)
                    .build());
        }
        return levels;
    }

    /**
     * Levels whose reset time has passed.
     */
    public List<UsageLevelKey> findExpiredUsageLevels(Contract contract, Instant now) {
        List<UsageLevelKey> expired = new ArrayList<>();
        if (contract.getUsageLevels() == null) {
            return expired;
        }
        contract.getUsageLevels().forEach((service, levels) -> levels.forEach((limit, level) -> {
            if (level.isExpiredAt(now)) {
                expired.add(new UsageLevelKey(service, limit));
            }
        }));
        return expired;
    }

    /**
     * Every level of the contract, optionally restricted to one usage limit name.
     */
    public List<UsageLevelKey> findUsageLevels(Contract contract, String usageLimit) {
        List<UsageLevelKey> keys = new ArrayList<>();
        if (contract.getUsageLevels() == null) {
            return keys;
        }
        contract.getUsageLevels().forEach((service, levels) -> levels.keySet().forEach(limit -> {
            if (usageLimit == null || usageLimit.equals(limit)) {
                keys.add(new UsageLevelKey(service, limit));
            }
        }));
        return keys;
    }

    /**
     * Resets the given levels: consumption back to zero and the next reset one period after
     * {@code now}.
     */
    public Contract resetUsageLevels(Contract contract, Collection<UsageLevelKey> keys, Instant now) {
        Contract copy = ContractNovation.copyOf(contract);
        for (UsageLevelKey key : keys) {
            Map<String, UsageLevel> levels = copy.getUsageLevels().get(key.service());
            UsageLevel level = levels != null ? levels.get(key.usageLimit()) : null;
            if (level == null) {
                log.warn("Usage level {} not found in contract of user {}", key, contract.getUserId());
                continue;
            }
            level.setConsumed(0);
            level.setConsumptions(new ArrayList<>());
            level.setResetTimeStamp(level.getPeriod() != null ? level.getPeriod().nextResetFrom(now) : null);
        }
        return copy;
    }

    /**
     * Adds accepted consumption of {@code feature} to usage limits of one service.
     * Limits are checked by the caller; this only records.
     */
    public Contract recordConsumption(Contract contract, String service, String feature,
                                      Map<String, Double> increments, Instant now) {
        Contract copy = ContractNovation.copyOf(contract);
        long sequence = lastSequence(copy) + 1;
        Map<String, UsageLevel> levels = copy.getUsageLevels().computeIfAbsent(service, s -> new LinkedHashMap<>());
        increments.forEach((limit, amount) -> {
            UsageLevel level = levels.computeIfAbsent(limit, l -> UsageLevel.builder().consumed(0).build());
            level.setConsumed(level.getConsumed() + amount);
            level.getConsumptions().add(ConsumptionRecord.builder()
                    .sequence(sequence)
                    .feature(feature)
                    .amount(amount)
                    .timestamp(now)
                    .build());
        });
        return copy;
    }

    /**
     * Undoes consumption of {@code feature} within one service: the most recent call when
     * {@code latest}, otherwise everything recorded since the last reset. Consumption never
     * drops below zero.
     */
    public Contract revertConsumption(Contract contract, String service, String feature, boolean latest) {
        Contract copy = ContractNovation.copyOf(contract);
        Map<String, UsageLevel> levels = copy.getUsageLevels().get(service);
        if (levels == null) {
            return copy;
        }
        long target = latest ? latestSequence(levels, feature) : -1;
        if (latest && target < 0) {
            log.info("No consumption of feature {} to revert for user {}", feature, contract.getUserId());
            return copy;
        }
        for (UsageLevel level : levels.values()) {
            Iterator<ConsumptionRecord> it = level.getConsumptions().iterator();
            while (it.hasNext()) {
                ConsumptionRecord record = it.next();
                if (!feature.equals(record.getFeature()) || (latest && record.getSequence() != target)) {
                    continue;
                }
                level.setConsumed(Math.max(0, level.getConsumed() - record.getAmount()));
                it.remove();
            }
        }
        return copy;
    }

    private static long latestSequence(Map<String, UsageLevel> levels, String feature) {
        long latest = -1;
        for (UsageLevel level : levels.values()) {
            for (ConsumptionRecord record : level.getConsumptions()) {
                if (feature.equals(record.getFeature())) {
                    latest = Math.max(latest, record.getSequence());
                }
            }
        }
        return latest;
    }

    private static long lastSequence(Contract contract) {
        long last = 0;
        for (Map<String, UsageLevel> levels : contract.getUsageLevels().values()) {
            for (UsageLevel level : levels.values()) {
                for (ConsumptionRecord record : level.getConsumptions()) {
                    last = Math.max(last, record.getSequence());
                }
            }
        }
        return last;
    }
}
