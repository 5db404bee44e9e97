package aforo.pricing.service;

import aforo.pricing.cache.CacheKeys;
import aforo.pricing.cache.CacheStore;
import aforo.pricing.client.RemotePricingClient;
import aforo.pricing.entity.ManagedService;
import aforo.pricing.entity.Pricing;
import aforo.pricing.entity.PricingLocator;
import aforo.pricing.exception.NotFoundException;
import aforo.pricing.repository.ManagedServiceRepository;
import aforo.pricing.repository.PricingRepository;
import aforo.pricing.util.VersionCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Resolves (service, version) pairs to full pricings. Lookups go cache first, then the
 * pricing table or the remote URL; results are written back to the cache best-effort.
 */
@Service
@Slf4j
public class PricingResolver {

    private final ManagedServiceRepository serviceRepository;
    private final PricingRepository pricingRepository;
    private final CacheStore cacheStore;
    private final RemotePricingClient remotePricingClient;
    private final PricingDocumentParser documentParser;
    private final int concurrency;

    public PricingResolver(ManagedServiceRepository serviceRepository,
                           PricingRepository pricingRepository,
                           CacheStore cacheStore,
                           RemotePricingClient remotePricingClient,
                           PricingDocumentParser documentParser,
                           @Value("${aforo.pricing.resolution.concurrency:8}") int concurrency) {
        this.serviceRepository = serviceRepository;
        this.pricingRepository = pricingRepository;
        this.cacheStore = cacheStore;
        this.remotePricingClient = remotePricingClient;
        this.documentParser = documentParser;
        this.concurrency = concurrency;
    }

    /**
     * Enabled service by case-insensitive name.
     *
     * @throws NotFoundException when the organization has no such enabled service
     */
    public ManagedService findService(String serviceName, Long organizationId) {
        String key = CacheKeys.service(organizationId, serviceName);
        Optional<ManagedService> cached = cacheGet(key, ManagedService.class);
        if (cached.isPresent()) {
            return cached.get();
        }
        ManagedService service = serviceRepository.findByName(organizationId, serviceName, false)
                .orElseThrow(() -> new NotFoundException("Service " + serviceName + " not found"));
        cacheSet(key, service, CacheKeys.SERVICE_TTL_SECONDS);
        return service;
    }

    public Pricing resolvePricing(String serviceName, String version, Long organizationId) {
        return resolvePricingAsync(serviceName, version, organizationId).block();
    }

    /**
     * Looks the version up among active then archived pricings of the service.
     */
    public Mono<Pricing> resolvePricingAsync(String serviceName, String version, Long organizationId) {
        return Mono.fromCallable(() -> locate(serviceName, version, organizationId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(locator -> resolveLocator(serviceName, version, locator, organizationId));
    }

    /**
     * Resolves every contracted service in parallel (bounded window). Any failure fails the
     * whole call. The result keeps the order of {@code contractedServices}.
     */
    public Map<String, Pricing> resolveAll(Map<String, String> contractedServices, Long organizationId) {
        if (contractedServices.isEmpty()) {
            return new LinkedHashMap<>();
        }
        Map<String, Pricing> resolved = Flux.fromIterable(contractedServices.entrySet())
                .flatMap(entry -> resolvePricingAsync(entry.getKey(), entry.getValue(), organizationId)
                        .map(pricing -> Tuples.of(entry.getKey(), pricing)), concurrency)
                .collectMap(Tuple2::getT1, Tuple2::getT2)
                .block();

        Map<String, Pricing> ordered = new LinkedHashMap<>();
        for (String service : contractedServices.keySet()) {
            ordered.put(service, resolved.get(service));
        }
        return ordered;
    }

    /**
     * Pricings behind the given locators of one service. Stored pricings are loaded by id with
     * a single query; remote ones are fetched in parallel.
     */
    public List<Pricing> resolveLocators(ManagedService service, Map<String, PricingLocator> locators) {
        List<String> storedIds = new ArrayList<>();
        List<Map.Entry<String, PricingLocator>> remote = new ArrayList<>();
        for (Map.Entry<String, PricingLocator> entry : locators.entrySet()) {
            PricingLocator locator = entry.getValue();
            if (locator == null || locator.isEmpty()) {
                log.warn("Pricing {} of service {} has neither id nor url, skipping", entry.getKey(), service.getName());
            } else if (locator.isRemote()) {
                remote.add(entry);
            } else {
                storedIds.add(locator.getId());
            }
        }

        List<Pricing> pricings = new ArrayList<>();
        if (!storedIds.isEmpty()) {
            pricings.addAll(pricingRepository.findAllById(storedIds));
        }
        if (!remote.isEmpty()) {
            List<Pricing> fetched = Flux.fromIterable(remote)
                    .flatMap(entry -> resolveLocator(service.getName(), VersionCodec.unescape(entry.getKey()),
                            entry.getValue(), service.getOrganizationId()), concurrency)
                    .collectList()
                    .block();
            if (fetched != null) {
                pricings.addAll(fetched);
            }
        }
        return pricings;
    }

    private PricingLocator locate(String serviceName, String version, Long organizationId) {
        ManagedService service = findService(serviceName, organizationId);
        String escaped = VersionCodec.escape(version);
        PricingLocator locator = service.getActivePricings().get(escaped);
        if (locator == null && service.getArchivedPricings() != null) {
            locator = service.getArchivedPricings().get(escaped);
        }
        if (locator == null) {
            throw new NotFoundException("Pricing version " + VersionCodec.unescape(version)
                    + " not found for service " + serviceName);
        }
        if (locator.isEmpty()) {
            throw new NotFoundException("Pricing version " + VersionCodec.unescape(version) + " of service "
                    + serviceName + " has neither id nor url");
        }
        return locator;
    }

    private Mono<Pricing> resolveLocator(String serviceName, String version, PricingLocator locator, Long organizationId) {
        if (locator.getId() != null) {
            return Mono.fromCallable(() -> loadStored(serviceName, version, locator.getId()))
                    .subscribeOn(Schedulers.boundedElastic());
        }
        return fetchRemote(locator.getUrl(), organizationId);
    }

    private Pricing loadStored(String serviceName, String version, String pricingId) {
        String key = CacheKeys.pricingById(pricingId);
        return cacheGet(key, Pricing.class).orElseGet(() -> {
            Pricing pricing = pricingRepository.findById(pricingId)
                    .orElseThrow(() -> new NotFoundException("Pricing " + VersionCodec.unescape(version)
                            + " of service " + serviceName + " not found"));
            cacheSet(key, pricing, CacheKeys.PRICING_TTL_SECONDS);
            return pricing;
        });
    }

    /**
     * Cached or freshly fetched and validated pricing hosted at {@code url}.
     */
    public Mono<Pricing> fetchRemote(String url, Long organizationId) {
        String key = CacheKeys.pricingByUrl(url);
        return Mono.fromCallable(() -> cacheGet(key, Pricing.class))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(cached -> cached.map(Mono::just).orElseGet(() -> remotePricingClient
                        .fetchPricingYaml(url, organizationId)
                        .map(yaml -> documentParser.parse(yaml, organizationId))
                        .doOnNext(pricing -> cacheSet(key, pricing, CacheKeys.PRICING_TTL_SECONDS))));
    }

    private <T> Optional<T> cacheGet(String key, Class<T> type) {
        return bestEffort(() -> cacheStore.get(key, type), "read", key).orElse(Optional.empty());
    }

    private void cacheSet(String key, Object value, long ttlSeconds) {
        bestEffort(() -> {
            cacheStore.set(key, value, ttlSeconds, true);
            return Boolean.TRUE;
        }, "write", key);
    }

    private <T> Optional<T> bestEffort(Supplier<T> action, String operation, String key) {
        try {
            return Optional.ofNullable(action.get());
        } catch (RuntimeException e) {
            log.warn("⚠️ Cache {} failed for key {}: {}", operation, key, e.getMessage());
            return Optional.empty();
        }
    }
}
