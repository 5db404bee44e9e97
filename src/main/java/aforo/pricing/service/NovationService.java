package aforo.pricing.service;

import aforo.pricing.dto.FallbackSubscription;
import aforo.pricing.dto.NewSubscription;
import aforo.pricing.entity.AddOn;
import aforo.pricing.entity.BillingPeriod;
import aforo.pricing.entity.Contract;
import aforo.pricing.entity.Pricing;
import aforo.pricing.entity.UsageLevel;
import aforo.pricing.exception.InvalidSubscriptionException;
import aforo.pricing.exception.NovationException;
import aforo.pricing.repository.ContractRepository;
import aforo.pricing.util.ContractNovation;
import aforo.pricing.util.VersionCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Moves contracts off pricing versions and services that stop being offered.
 * The whole affected set is validated before anything is written, then written at once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NovationService {

    private final ContractRepository contractRepository;
    private final ContractService contractService;
    private final UsageLevelService usageLevelService;
    private final Clock clock;

    /**
     * Moves every contract on {@code serviceName}@{@code escapedVersion} to the latest pricing
     * with the fallback subscription. Usage levels of the service are regenerated.
     *
     * @return number of novated contracts
     * @throws InvalidSubscriptionException when the fallback is not offered by {@code latest}
     */
    @Transactional
    public int novateContractsToLatestVersion(Long organizationId, String serviceName, String escapedVersion,
                                              Pricing latest, FallbackSubscription fallback) {
        String service = serviceName.toLowerCase(Locale.ROOT);
        List<Contract> contracts = contractRepository.findByContractedServiceVersion(organizationId, service, escapedVersion);
        if (contracts.isEmpty()) {
            return 0;
        }
        validateSubscription(latest, fallback.getSubscriptionPlan(), fallback.getSubscriptionAddOns());

        Instant now = clock.instant();
        List<Contract> novated = new ArrayList<>();
        for (Contract contract : contracts) {
            NewSubscription subscription = ContractNovation.subscriptionOf(contract);
            subscription.getContractedServices().put(service, latest.getVersion());
            if (fallback.getSubscriptionPlan() != null) {
                subscription.getSubscriptionPlans().put(service, fallback.getSubscriptionPlan());
            } else {
                subscription.getSubscriptionPlans().remove(service);
            }
            subscription.getSubscriptionAddOns().put(service, new LinkedHashMap<>(fallback.getSubscriptionAddOns()));

            Contract updated = ContractNovation.performNovation(contract, subscription, now);
            Map<String, UsageLevel> levels = usageLevelService.generateUsageLevels(latest, now);
            if (levels.isEmpty()) {
                updated.getUsageLevels().remove(service);
            } else {
                updated.getUsageLevels().put(service, levels);
            }
            novated.add(updated);
        }

        bulkUpdate(novated);
        log.info("🔀 Novated {} contracts of service {} from version {} to {}",
                novated.size(), serviceName, VersionCodec.unescape(escapedVersion), latest.getVersion());
        return novated.size();
    }

    /**
     * Removes a service from every contract of the organization. Contracts left without any
     * service are disabled: no usage levels and a zero-length, non-renewing billing period.
     *
     * @return number of updated contracts
     */
    @Transactional
    public int removeServiceFromContracts(Long organizationId, String serviceName) {
        String service = serviceName.toLowerCase(Locale.ROOT);
        List<Contract> contracts = contractRepository.findByContractedService(organizationId, service);
        Instant now = clock.instant();

        List<Contract> updated = new ArrayList<>();
        int disabled = 0;
        for (Contract contract : contracts) {
            NewSubscription subscription = ContractNovation.subscriptionOf(contract);
            boolean changed = subscription.getContractedServices().remove(service) != null;
            changed |= subscription.getSubscriptionPlans().remove(service) != null;
            changed |= subscription.getSubscriptionAddOns().remove(service) != null;
            if (!changed) {
                continue;
            }

            Contract novated = ContractNovation.performNovation(contract, subscription, now);
            novated.getUsageLevels().remove(service);
            if (novated.getContractedServices().isEmpty()) {
                novated.setUsageLevels(new LinkedHashMap<>());
                novated.setBillingPeriod(BillingPeriod.builder()
                        .startDate(now)
                        .endDate(now)
                        .autoRenew(false)
                        .renewalDays(0)
                        .build());
                novated.setDisabled(true);
                disabled++;
            }
            updated.add(novated);
        }

        bulkUpdate(updated);
        log.info("Removed service {} from {} contracts ({} disabled)", serviceName, updated.size(), disabled);
        return updated.size();
    }

    /**
     * @throws InvalidSubscriptionException when the plan or an add-on does not exist in the
     *         pricing, or an add-on cannot be combined with the plan
     */
    public static void validateSubscription(Pricing pricing, String plan, Map<String, Integer> addOns) {
        boolean hasAddOns = addOns != null && !addOns.isEmpty();
        if (plan == null && !hasAddOns) {
            throw new InvalidSubscriptionException("A subscription needs a plan or at least one add-on");
        }
        if (plan != null && (pricing.getPlans() == null || !pricing.getPlans().containsKey(plan))) {
            throw new InvalidSubscriptionException("Plan " + plan + " does not exist in pricing "
                    + pricing.getServiceName() + " " + pricing.getVersion());
        }
        if (plan == null && pricing.getPlans() != null && !pricing.getPlans().isEmpty()) {
            throw new InvalidSubscriptionException("Pricing " + pricing.getServiceName() + " " + pricing.getVersion()
                    + " requires a plan");
        }
        if (!hasAddOns) {
            return;
        }
        addOns.forEach((name, quantity) -> {
            AddOn addOn = pricing.getAddOns() != null ? pricing.getAddOns().get(name) : null;
            if (addOn == null) {
                throw new InvalidSubscriptionException("Add-on " + name + " does not exist in pricing "
                        + pricing.getServiceName() + " " + pricing.getVersion());
            }
            if (!addOn.isAvailableFor(plan)) {
                throw new InvalidSubscriptionException("Add-on " + name + " is not available for plan " + plan);
            }
            if (quantity == null || quantity < 0) {
                throw new InvalidSubscriptionException("Quantity of add-on " + name + " must not be negative");
            }
        });
    }

    private void bulkUpdate(List<Contract> contracts) {
        if (contracts.isEmpty()) {
            return;
        }
        List<Contract> saved = contractRepository.saveAll(contracts);
        if (saved.size() != contracts.size()) {
            throw new NovationException("Failed to update contracts: " + saved.size() + " of "
                    + contracts.size() + " persisted");
        }
        saved.forEach(contract -> contractService.invalidate(contract.getUserId()));
    }
}
