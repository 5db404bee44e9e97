package aforo.pricing.service;

import aforo.pricing.cache.CacheEffect;
import aforo.pricing.cache.CacheEffectApplier;
import aforo.pricing.cache.CacheKeys;
import aforo.pricing.cache.CacheStore;
import aforo.pricing.dto.EvaluationEnvelope;
import aforo.pricing.dto.EvaluationOptions;
import aforo.pricing.dto.FeatureEvaluationOptions;
import aforo.pricing.dto.FeatureEvaluationResult;
import aforo.pricing.dto.FeatureListing;
import aforo.pricing.dto.FeatureQuery;
import aforo.pricing.entity.Contract;
import aforo.pricing.entity.FeatureDefinition;
import aforo.pricing.entity.ManagedService;
import aforo.pricing.entity.Pricing;
import aforo.pricing.entity.PricingLocator;
import aforo.pricing.entity.UsageLimitDefinition;
import aforo.pricing.exception.NotFoundException;
import aforo.pricing.exception.ValidationException;
import aforo.pricing.model.FeatureValue;
import aforo.pricing.model.ServiceConfiguration;
import aforo.pricing.repository.ManagedServiceRepository;
import aforo.pricing.service.context.ContextFlattener;
import aforo.pricing.util.JwtTokenGenerator;
import aforo.pricing.util.VersionCodec;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class FeatureEvaluationServiceImpl implements FeatureEvaluationService {

    private final ContractService contractService;
    private final PricingResolver pricingResolver;
    private final ManagedServiceRepository serviceRepository;
    private final FeatureEvaluator featureEvaluator;
    private final CacheStore cacheStore;
    private final CacheEffectApplier cacheEffectApplier;
    private final JwtTokenGenerator jwtTokenGenerator;
    private final ObjectMapper objectMapper;

    @Override
    public List<FeatureListing> listFeatures(FeatureQuery query, Long organizationId) {
        if (query.getPage() < 1 || query.getOffset() < 0 || query.getLimit() < 1) {
            throw new ValidationException("page and limit must be positive and offset must not be negative");
        }

        List<FeatureListing> listings = new ArrayList<>();
        for (ManagedService service : serviceRepository.findByOrganizationIdAndDisabledFalseOrderByNameAsc(organizationId)) {
            for (Pricing pricing : pricingResolver.resolveLocators(service, locatorsToShow(service, query.getShow()))) {
                for (FeatureDefinition feature : pricing.getFeatures().values()) {
                    listings.add(FeatureListing.builder()
                            .info(feature)
                            .serviceName(service.getName())
                            .pricingVersion(VersionCodec.unescape(pricing.getVersion()))
                            .build());
                }
            }
        }

        Comparator<FeatureListing> comparator = Comparator.comparing(
                sortKey(query.getSort()), String.CASE_INSENSITIVE_ORDER);
        if (query.isDescending()) {
            comparator = comparator.reversed();
        }

        long start = query.getOffset() == 0 ? (query.getPage() - 1L) * query.getLimit() : query.getOffset();
        return listings.stream()
                .filter(l -> containsIgnoreCase(l.getInfo().getName(), query.getFeatureName()))
                .filter(l -> containsIgnoreCase(l.getServiceName(), query.getServiceName()))
                .filter(l -> containsIgnoreCase(l.getPricingVersion(), query.getPricingVersion()))
                .sorted(comparator)
                .skip(start)
                .limit(query.getLimit())
                .collect(Collectors.toList());
    }

    @Override
    public EvaluationEnvelope evaluateAll(String userId, Long organizationId, EvaluationOptions options) {
        EvaluationContexts contexts = retrieveContexts(userId, organizationId, options.isServer());
        EvaluationOutcome outcome = featureEvaluator.evaluateAll(userId, contexts, options.isDetails());
        cacheEffectApplier.apply(outcome.cacheEffects());

        log.debug("Evaluated {} features for user {}", outcome.report().getFeatures().size(), userId);
        EvaluationEnvelope.EvaluationEnvelopeBuilder envelope = EvaluationEnvelope.builder().result(outcome.report());
        if (options.isReturnContexts()) {
            envelope.pricingContext(contexts.pricingContext())
                    .subscriptionContext(contexts.subscriptionContext());
        }
        return envelope.build();
    }

    @Override
    public FeatureEvaluationResult evaluateOne(String userId,
                                               String featureId,
                                               Map<String, Double> expectedConsumption,
                                               Long organizationId,
                                               FeatureEvaluationOptions options) {
        Map<String, Double> expected = expectedConsumption != null ? expectedConsumption : Map.of();
        String requestedKey = CacheKeys.featureEvaluation(userId, featureId);

        if (!options.isRevert() && expected.isEmpty() && !options.isDetails()) {
            Optional<FeatureEvaluationResult> cached = readCached(requestedKey, FeatureEvaluationResult.class);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        cacheEffectApplier.apply(List.of(CacheEffect.delete(CacheKeys.pricingToken(userId))));

        EvaluationContexts contexts = retrieveContexts(userId, organizationId, options.isServer());
        FeatureRef resolved = resolveFeature(contexts, featureId);
        String service = resolved.service();
        String feature = resolved.feature();

        if (options.isRevert()) {
            contractService.revertConsumption(contexts.contract(), service, feature, options.isLatest());
            log.info("↩️ Reverted {} consumption of {} for user {}", options.isLatest() ? "latest" : "all", featureId, userId);
            return FeatureEvaluationResult.builder().eval(true).build();
        }

        Map<String, Double> increments = resolveConsumption(contexts.pricings().get(service), service, expected);
        FeatureDecision decision = featureEvaluator.evaluateFeature(
                userId, contexts, service, feature, increments, options.isDetails());

        if (!decision.consumption().isEmpty()) {
            contractService.recordConsumption(contexts.contract(), service, feature, decision.consumption());
        }

        List<CacheEffect> effects = new ArrayList<>(decision.cacheEffects());
        if (!effects.isEmpty() && !requestedKey.equals(CacheKeys.featureEvaluation(userId, ContextFlattener.featureId(service, feature)))) {
            effects.add(CacheEffect.set(requestedKey, decision.result(), CacheKeys.EVALUATION_TTL_SECONDS));
        }
        cacheEffectApplier.apply(effects);

        if (decision.result().isLimitReached()) {
            log.info("⛔ Limit reached for feature {} of user {} (used {} of {})",
                    featureId, userId, decision.result().getUsed(), decision.result().getLimit());
        }
        return decision.result();
    }

    @Override
    public String generatePricingToken(String userId, Long organizationId, boolean server) {
        String key = CacheKeys.pricingToken(userId);
        Optional<String> cached = readCached(key, String.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        EvaluationContexts contexts = retrieveContexts(userId, organizationId, server);
        EvaluationOutcome outcome = featureEvaluator.evaluateAll(userId, contexts, true);
        cacheEffectApplier.apply(outcome.cacheEffects());

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("features", toClaim(outcome.report().getFeatures()));
        claims.put("pricingContext", toClaim(contexts.pricingContext()));
        claims.put("subscriptionContext", toClaim(contexts.subscriptionContext()));
        String token = jwtTokenGenerator.generatePricingToken(userId, organizationId, claims,
                CacheKeys.PRICING_TOKEN_TTL_SECONDS);

        cacheEffectApplier.apply(List.of(CacheEffect.set(key, token, CacheKeys.PRICING_TOKEN_TTL_SECONDS)));
        log.info("🔑 Issued pricing token for user {} ({} features)", userId, outcome.report().getFeatures().size());
        return token;
    }

    @Override
    public EvaluationContexts retrieveContexts(String userId, Long organizationId, boolean server) {
        Contract contract = contractService.loadForEvaluation(userId, organizationId);

        Map<String, FeatureValue> subscriptionContext =
                ContextFlattener.flattenUsageLevelsIntoSubscriptionContext(contract.getUsageLevels());

        Map<String, Pricing> pricings = pricingResolver.resolveAll(contract.getContractedServices(), organizationId);

        Map<String, ServiceConfiguration> configurations =
                ContextFlattener.mapSubscriptionsToConfigurationsByService(contract, pricings);
        Map<String, FeatureValue> pricingContext = ContextFlattener.flattenConfigurationsIntoPricingContext(configurations);

        Map<String, String> evaluationContext = ContextFlattener.flattenFeatureEvaluationsIntoEvaluationContext(
                ContextFlattener.getFeatureEvaluationExpressionsByService(pricings, server));

        return new EvaluationContexts(contract, pricings, subscriptionContext, pricingContext, evaluationContext);
    }

    private record FeatureRef(String service, String feature) {
    }

    private static FeatureRef resolveFeature(EvaluationContexts contexts, String featureId) {
        int separator = featureId.indexOf('-');
        while (separator > 0) {
            String service = featureId.substring(0, separator).toLowerCase(Locale.ROOT);
            String feature = featureId.substring(separator + 1);
            Pricing pricing = contexts.pricings().get(service);
            if (pricing != null && pricing.getFeatures().containsKey(feature)) {
                return new FeatureRef(service, feature);
            }
            separator = featureId.indexOf('-', separator + 1);
        }

        List<String> services = contexts.pricings().entrySet().stream()
                .filter(e -> e.getValue().getFeatures().containsKey(featureId))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        if (services.isEmpty()) {
            throw new NotFoundException("Feature " + featureId + " not found in the contracted services");
        }
        if (services.size() > 1) {
            throw new ValidationException("Feature " + featureId + " exists in services " + services
                    + ", use <service>-<feature> to pick one");
        }
        return new FeatureRef(services.get(0), featureId);
    }

    /**
     * Maps consumption keys ({@code limit} or {@code service-limit}) to tracked usage limits
     * of the feature's service.
     */
    private static Map<String, Double> resolveConsumption(Pricing pricing, String service, Map<String, Double> expected) {
        Map<String, Double> increments = new LinkedHashMap<>();
        expected.forEach((key, amount) -> {
            if (amount == null || amount < 0) {
                throw new ValidationException("Expected consumption of " + key + " must be a positive number");
            }
            if (amount == 0) {
                return;
            }
            String limit = key.toLowerCase(Locale.ROOT).startsWith(service + "-") ? key.substring(service.length() + 1) : key;
            UsageLimitDefinition definition = pricing.getUsageLimits() != null ? pricing.getUsageLimits().get(limit) : null;
            if (definition == null || !definition.isTracked()) {
                throw new ValidationException("Usage limit " + key + " is not tracked by service " + service);
            }
            increments.merge(limit, amount, Double::sum);
        });
        return increments;
    }

    private static Map<String, PricingLocator> locatorsToShow(ManagedService service, FeatureQuery.Show show) {
        Map<String, PricingLocator> locators = new LinkedHashMap<>();
        if (show != FeatureQuery.Show.ARCHIVED && service.getActivePricings() != null) {
            locators.putAll(service.getActivePricings());
        }
        if (show != FeatureQuery.Show.ACTIVE && service.getArchivedPricings() != null) {
            locators.putAll(service.getArchivedPricings());
        }
        return locators;
    }

    private static Function<FeatureListing, String> sortKey(FeatureQuery.SortField sort) {
        if (sort == FeatureQuery.SortField.FEATURE_NAME) {
            return l -> l.getInfo().getName();
        }
        return FeatureListing::getServiceName;
    }

    private static boolean containsIgnoreCase(String value, String filter) {
        if (filter == null || filter.isBlank()) {
            return true;
        }
        return value != null && value.toLowerCase(Locale.ROOT).contains(filter.toLowerCase(Locale.ROOT));
    }

    // JWT claims must be plain JSON maps, lists and scalars.
    private Map<String, Object> toClaim(Object value) {
        return objectMapper.convertValue(value, new TypeReference<Map<String, Object>>() {
        });
    }

    private <T> Optional<T> readCached(String key, Class<T> type) {
        try {
            return cacheStore.get(key, type);
        } catch (RuntimeException e) {
            log.warn("⚠️ Cache read failed for key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
