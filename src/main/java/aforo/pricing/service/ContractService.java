package aforo.pricing.service;

import aforo.pricing.cache.CacheEffect;
import aforo.pricing.cache.CacheEffectApplier;
import aforo.pricing.cache.CacheKeys;
import aforo.pricing.cache.CacheStore;
import aforo.pricing.dto.NewSubscription;
import aforo.pricing.entity.Contract;
import aforo.pricing.entity.Pricing;
import aforo.pricing.entity.UsageLevel;
import aforo.pricing.exception.InvalidSubscriptionException;
import aforo.pricing.exception.NotFoundException;
import aforo.pricing.exception.SubscriptionExpiredException;
import aforo.pricing.exception.ValidationException;
import aforo.pricing.model.UsageLevelKey;
import aforo.pricing.repository.ContractRepository;
import aforo.pricing.util.ContractNovation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Creates and novates contracts and keeps them consistent before evaluation: billing renewal,
 * expiry and usage-level resets. Every write invalidates the user's cached contract and evaluations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractService {

    private final ContractRepository contractRepository;
    private final CacheStore cacheStore;
    private final CacheEffectApplier cacheEffectApplier;
    private final UsageLevelService usageLevelService;
    private final PricingResolver pricingResolver;
    private final Clock clock;

    /**
     * @throws NotFoundException when the user has no contract in the organization
     */
    public Contract findByUserId(String userId, Long organizationId) {
        String key = CacheKeys.contract(userId);
        Optional<Contract> cached = readCachedContract(key);
        if (cached.isPresent() && organizationId.equals(cached.get().getOrganizationId())) {
            return cached.get();
        }
        Contract contract = contractRepository.findByUserIdAndOrganizationId(userId, organizationId)
                .orElseThrow(() -> new NotFoundException("Contract of user " + userId + " not found"));
        cacheEffectApplier.apply(CacheEffect.set(key, contract, CacheKeys.CONTRACT_TTL_SECONDS));
        return contract;
    }

    /**
     * Creates the contract of a user with fresh usage levels for every contracted service.
     *
     * @throws ValidationException when the user already has a contract in the organization
     * @throws InvalidSubscriptionException when a pricing does not offer the requested plan or add-ons
     */
    @Transactional
    public Contract create(String userId, Long organizationId, NewSubscription subscription) {
        if (contractRepository.findByUserIdAndOrganizationId(userId, organizationId).isPresent()) {
            throw new ValidationException("Contract of user " + userId + " already exists");
        }
        validateBillingPeriod(subscription);
        Instant now = clock.instant();
        Contract contract = ContractNovation.newContract(userId, organizationId, subscription, now);
        resolveSubscription(contract).forEach((service, pricing) -> {
            Map<String, UsageLevel> levels = usageLevelService.generateUsageLevels(pricing, now);
            if (!levels.isEmpty()) {
                contract.getUsageLevels().put(service, levels);
            }
        });

        Contract saved = save(contract);
        log.info("📝 Created contract of user {} for services {}", userId, saved.getContractedServices().keySet());
        return saved;
    }

    /**
     * Replaces the user's subscription. The previous one goes to the history, a new billing
     * period starts and usage levels are regenerated for services whose version changed.
     *
     * @throws NotFoundException when the user has no contract in the organization
     * @throws InvalidSubscriptionException when a pricing does not offer the requested plan or add-ons
     */
    @Transactional
    public Contract novate(String userId, Long organizationId, NewSubscription subscription) {
        validateBillingPeriod(subscription);
        Contract contract = findByUserId(userId, organizationId);
        Instant now = clock.instant();
        Contract novated = ContractNovation.performNovation(contract, subscription, now);
        resolveSubscription(novated).forEach((service, pricing) -> {
            String previousVersion = contract.getContractedServices() != null
                    ? contract.getContractedServices().get(service) : null;
            if (novated.getContractedServices().get(service).equals(previousVersion)
                    && novated.getUsageLevels().containsKey(service)) {
                return;
            }
            Map<String, UsageLevel> levels = usageLevelService.generateUsageLevels(pricing, now);
            if (levels.isEmpty()) {
                novated.getUsageLevels().remove(service);
            } else {
                novated.getUsageLevels().put(service, levels);
            }
        });
        novated.setDisabled(false);

        Contract saved = save(novated);
        log.info("🔀 Novated contract of user {} to services {}", userId, saved.getContractedServices());
        return saved;
    }

    /**
     * Changes renewal settings and starts a new billing period now. The subscription is kept.
     *
     * @param autoRenew null keeps the current setting
     * @param renewalDays null keeps the current length
     */
    @Transactional
    public Contract novateBillingPeriod(String userId, Long organizationId, Boolean autoRenew, Integer renewalDays) {
        Contract contract = findByUserId(userId, organizationId);
        NewSubscription subscription = ContractNovation.subscriptionOf(contract);
        subscription.setAutoRenew(autoRenew);
        subscription.setRenewalDays(renewalDays);
        validateBillingPeriod(subscription);

        Contract saved = save(ContractNovation.performNovation(contract, subscription, clock.instant()));
        log.info("Billing period of user {} now ends at {} (auto-renew: {})", userId,
                saved.getBillingPeriod().getEndDate(), saved.getBillingPeriod().isAutoRenew());
        return saved;
    }

    /**
     * Loads the contract and brings it up to date: renews an expired auto-renewing period and
     * resets usage levels whose period elapsed.
     *
     * @throws SubscriptionExpiredException when the period ended and the contract does not renew
     */
    @Transactional
    public Contract loadForEvaluation(String userId, Long organizationId) {
        Contract contract = findByUserId(userId, organizationId);
        Instant now = clock.instant();
        contract = ensureBillingPeriod(contract, now);
        return resetExpiredUsageLevels(contract, now);
    }

    Contract ensureBillingPeriod(Contract contract, Instant now) {
        if (contract.getBillingPeriod() == null || !contract.getBillingPeriod().hasEndedAt(now)) {
            return contract;
        }
        if (!contract.getBillingPeriod().isAutoRenew()) {
            log.info("Subscription of user {} expired at {}", contract.getUserId(), contract.getBillingPeriod().getEndDate());
            throw new SubscriptionExpiredException(contract.getUserId(), contract.getBillingPeriod().getEndDate());
        }
        log.info("🔄 Renewing contract of user {} (period ended at {})",
                contract.getUserId(), contract.getBillingPeriod().getEndDate());
        return save(ContractNovation.renew(contract, now));
    }

    Contract resetExpiredUsageLevels(Contract contract, Instant now) {
        List<UsageLevelKey> expired = usageLevelService.findExpiredUsageLevels(contract, now);
        if (expired.isEmpty()) {
            return contract;
        }
        log.info("Resetting usage levels {} of user {}", expired, contract.getUserId());
        invalidate(contract.getUserId());
        return save(usageLevelService.resetUsageLevels(contract, expired, now));
    }

    /**
     * Administrative reset of every usage level, or of the levels of one usage limit.
     */
    @Transactional
    public Contract resetUsageLevels(String userId, Long organizationId, String usageLimit) {
        Contract contract = findByUserId(userId, organizationId);
        List<UsageLevelKey> keys = usageLevelService.findUsageLevels(contract, usageLimit);
        if (usageLimit != null && keys.isEmpty()) {
            throw new NotFoundException("Usage limit " + usageLimit + " not tracked in contract of user " + userId);
        }
        return save(usageLevelService.resetUsageLevels(contract, keys, clock.instant()));
    }

    @Transactional
    public Contract recordConsumption(Contract contract, String service, String feature, Map<String, Double> increments) {
        return save(usageLevelService.recordConsumption(contract, service, feature, increments, clock.instant()));
    }

    @Transactional
    public Contract revertConsumption(Contract contract, String service, String feature, boolean latest) {
        return save(usageLevelService.revertConsumption(contract, service, feature, latest));
    }

    public Contract save(Contract contract) {
        Contract saved = contractRepository.save(contract);
        invalidate(saved.getUserId());
        return saved;
    }

    /**
     * Drops the cached contract and every cached evaluation of the user.
     */
    public void invalidate(String userId) {
        cacheEffectApplier.apply(List.of(
                CacheEffect.delete(CacheKeys.contract(userId)),
                CacheEffect.delete(CacheKeys.allFeatureEvaluations(userId))));
    }

    private Map<String, Pricing> resolveSubscription(Contract contract) {
        Map<String, String> services = contract.getContractedServices();
        if (services.isEmpty()) {
            throw new InvalidSubscriptionException("A contract needs at least one contracted service");
        }
        Set<String> subscribed = new LinkedHashSet<>(contract.getSubscriptionPlans().keySet());
        subscribed.addAll(contract.getSubscriptionAddOns().keySet());
        for (String service : subscribed) {
            if (!services.containsKey(service)) {
                throw new InvalidSubscriptionException("Service " + service + " has a plan or add-ons but is not contracted");
            }
        }

        Map<String, Pricing> pricings = pricingResolver.resolveAll(services, contract.getOrganizationId());
        pricings.forEach((service, pricing) -> NovationService.validateSubscription(pricing,
                contract.getSubscriptionPlans().get(service), contract.getSubscriptionAddOns().get(service)));
        return pricings;
    }

    private static void validateBillingPeriod(NewSubscription subscription) {
        if (subscription.getRenewalDays() != null && subscription.getRenewalDays() < 1) {
            throw new ValidationException("renewalDays must be positive");
        }
    }

    private Optional<Contract> readCachedContract(String key) {
        try {
            return cacheStore.get(key, Contract.class);
        } catch (RuntimeException e) {
            log.warn("⚠️ Cache read failed for key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
