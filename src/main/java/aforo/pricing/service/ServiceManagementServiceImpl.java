package aforo.pricing.service;

import aforo.pricing.cache.CacheEffect;
import aforo.pricing.cache.CacheEffectApplier;
import aforo.pricing.cache.CacheKeys;
import aforo.pricing.dto.FallbackSubscription;
import aforo.pricing.dto.PricingAvailability;
import aforo.pricing.entity.ManagedService;
import aforo.pricing.entity.Pricing;
import aforo.pricing.entity.PricingLocator;
import aforo.pricing.event.PricingEventPublisher;
import aforo.pricing.event.PricingLifecycleEvent;
import aforo.pricing.exception.NotFoundException;
import aforo.pricing.exception.RemoteFetchException;
import aforo.pricing.exception.ValidationException;
import aforo.pricing.repository.ManagedServiceRepository;
import aforo.pricing.repository.PricingRepository;
import aforo.pricing.util.VersionCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class ServiceManagementServiceImpl implements ServiceManagementService {

    private final ManagedServiceRepository serviceRepository;
    private final PricingRepository pricingRepository;
    private final PricingResolver pricingResolver;
    private final PricingDocumentParser documentParser;
    private final NovationService novationService;
    private final PricingEventPublisher eventPublisher;
    private final CacheEffectApplier cacheEffectApplier;
    private final Clock clock;

    @Override
    @Transactional
    public ManagedService createService(String pricingYaml, Long organizationId) {
        return register(null, documentParser.parse(pricingYaml, organizationId), this::store, organizationId);
    }

    @Override
    @Transactional
    public ManagedService createServiceFromUrl(String url, Long organizationId) {
        return register(null, fetch(url, organizationId), pricing -> remoteLocator(url), organizationId);
    }

    @Override
    @Transactional
    public ManagedService addPricing(String serviceName, String pricingYaml, Long organizationId) {
        return register(serviceName, documentParser.parse(pricingYaml, organizationId), this::store, organizationId);
    }

    @Override
    @Transactional
    public ManagedService addPricingFromUrl(String serviceName, String url, Long organizationId) {
        return register(serviceName, fetch(url, organizationId), pricing -> remoteLocator(url), organizationId);
    }

    @Override
    public List<Pricing> indexPricings(String serviceName, PricingAvailability availability, Long organizationId) {
        ManagedService service = pricingResolver.findService(serviceName, organizationId);
        Map<String, PricingLocator> locators = new LinkedHashMap<>();
        if (availability != PricingAvailability.ARCHIVED) {
            locators.putAll(service.getActivePricings());
        }
        if (availability != PricingAvailability.ACTIVE && service.getArchivedPricings() != null) {
            locators.putAll(service.getArchivedPricings());
        }
        return pricingResolver.resolveLocators(service, locators);
    }

    @Override
    public Pricing showPricing(String serviceName, String pricingVersion, Long organizationId) {
        return pricingResolver.resolvePricing(serviceName, pricingVersion, organizationId);
    }

    @Override
    @Transactional
    public ManagedService updatePricingAvailability(String serviceName,
                                                    String pricingVersion,
                                                    PricingAvailability availability,
                                                    FallbackSubscription fallback,
                                                    Long organizationId) {
        ManagedService service = loadEnabled(serviceName, organizationId);
        String escaped = VersionCodec.escape(pricingVersion);

        if ((availability == PricingAvailability.ACTIVE && service.getActivePricings().containsKey(escaped))
                || (availability == PricingAvailability.ARCHIVED && service.getArchivedPricings().containsKey(escaped))) {
            return service;
        }

        PricingLocator locator = Optional.ofNullable(service.getActivePricings().get(escaped))
                .orElse(service.getArchivedPricings().get(escaped));
        if (locator == null) {
            throw new NotFoundException("Pricing version " + pricingVersion + " not found for service " + serviceName);
        }

        PricingLifecycleEvent.Type event;
        if (availability == PricingAvailability.ACTIVE) {
            service.getArchivedPricings().remove(escaped);
            service.getActivePricings().put(escaped, locator);
            event = PricingLifecycleEvent.Type.PRICING_ACTIVATED;
        } else {
            if (service.getActivePricings().size() == 1) {
                throw new ValidationException("You cannot archive the last active pricing of service " + serviceName);
            }
            if (fallback == null || fallback.isEmpty()) {
                throw new ValidationException("Archiving pricing version " + pricingVersion + " of service "
                        + serviceName + " requires a fallback subscription to move its contracts to");
            }
            Map<String, PricingLocator> remaining = new LinkedHashMap<>(service.getActivePricings());
            remaining.remove(escaped);
            Pricing latest = latestPricing(service, remaining);

            novationService.novateContractsToLatestVersion(organizationId, service.getName(), escaped, latest, fallback);

            service.getActivePricings().remove(escaped);
            service.getArchivedPricings().put(escaped, locator);
            event = PricingLifecycleEvent.Type.PRICING_ARCHIVED;
        }

        ManagedService saved = serviceRepository.save(service);
        log.info("✅ Pricing {} of service {} is now {}", pricingVersion, saved.getName(), availability);
        eventPublisher.publish(event, organizationId, saved.getName(), VersionCodec.unescape(escaped));
        invalidate(organizationId, saved.getName());
        return saved;
    }

    @Override
    @Transactional
    public ManagedService disable(String serviceName, Long organizationId) {
        ManagedService service = loadEnabled(serviceName, organizationId);

        novationService.removeServiceFromContracts(organizationId, service.getName());

        LinkedHashMap<String, PricingLocator> archived = new LinkedHashMap<>(service.getArchivedPricings());
        long millis = clock.millis();
        service.getActivePricings().forEach((key, locator) ->
                archived.put(archived.containsKey(key) ? renamed(key, millis) : key, locator));
        service.setActivePricings(new LinkedHashMap<>());
        service.setArchivedPricings(archived);
        service.setDisabled(true);

        ManagedService saved = serviceRepository.save(service);
        log.info("🚫 Service {} disabled", saved.getName());
        eventPublisher.publish(PricingLifecycleEvent.Type.SERVICE_DISABLED, organizationId, saved.getName(), null);
        invalidate(organizationId, saved.getName());
        return saved;
    }

    @Override
    @Transactional
    public ManagedService destroyPricing(String serviceName, String pricingVersion, Long organizationId) {
        ManagedService service = loadEnabled(serviceName, organizationId);
        String escaped = VersionCodec.escape(pricingVersion);

        if (service.getActivePricings().containsKey(escaped)) {
            throw new ValidationException("Pricing version " + pricingVersion + " of service " + serviceName
                    + " is active, archive it before deleting it");
        }
        PricingLocator locator = service.getArchivedPricings().remove(escaped);
        if (locator == null) {
            throw new NotFoundException("No archived pricing version " + pricingVersion + " for service " + serviceName);
        }

        List<CacheEffect> effects = new ArrayList<>();
        if (locator.getId() != null) {
            pricingRepository.deleteById(locator.getId());
            effects.add(CacheEffect.delete(CacheKeys.pricingById(locator.getId())));
        }
        if (locator.getUrl() != null) {
            effects.add(CacheEffect.delete(CacheKeys.pricingByUrl(locator.getUrl())));
        }

        ManagedService saved = serviceRepository.save(service);
        log.info("🗑️ Pricing {} of service {} deleted", pricingVersion, saved.getName());
        effects.add(CacheEffect.delete(CacheKeys.service(organizationId, saved.getName())));
        cacheEffectApplier.apply(effects);
        return saved;
    }

    /**
     * Adds {@code pricing} to {@code serviceName}, or to a new service named after the pricing
     * when {@code serviceName} is null. A disabled service is re-enabled with the new pricing as
     * its only active one; its previous pricings are archived.
     */
    private ManagedService register(String serviceName, Pricing pricing,
                                    Function<Pricing, PricingLocator> store, Long organizationId) {
        String escaped = VersionCodec.escape(pricing.getVersion());
        long millis = clock.millis();
        ManagedService service;

        if (serviceName == null) {
            if (serviceRepository.findByName(organizationId, pricing.getServiceName(), false).isPresent()) {
                throw new ValidationException("Service " + pricing.getServiceName() + " already exists");
            }
            Optional<ManagedService> disabled = serviceRepository.findByName(organizationId, pricing.getServiceName(), true);
            PricingLocator locator = store.apply(pricing);
            if (disabled.isPresent()) {
                service = reEnable(disabled.get(), escaped, locator, millis);
            } else {
                LinkedHashMap<String, PricingLocator> active = new LinkedHashMap<>();
                active.put(escaped, locator);
                service = ManagedService.builder()
                        .organizationId(organizationId)
                        .name(pricing.getServiceName())
                        .activePricings(active)
                        .build();
            }
        } else {
            if (!pricing.getServiceName().equalsIgnoreCase(serviceName)) {
                throw new ValidationException("The pricing belongs to service " + pricing.getServiceName()
                        + ", not to " + serviceName);
            }
            service = serviceRepository.findByName(organizationId, serviceName, false)
                    .or(() -> serviceRepository.findByName(organizationId, serviceName, true))
                    .orElseThrow(() -> new NotFoundException("Service " + serviceName + " not found"));
            if (service.getActivePricings().containsKey(escaped)) {
                throw new ValidationException("Pricing version " + pricing.getVersion()
                        + " already exists for service " + serviceName);
            }
            PricingLocator locator = store.apply(pricing);
            if (service.isDisabled()) {
                service = reEnable(service, escaped, locator, millis);
            } else {
                PricingLocator previous = service.getArchivedPricings().remove(escaped);
                if (previous != null) {
                    service.getArchivedPricings().put(renamed(escaped, millis), previous);
                }
                service.getActivePricings().put(escaped, locator);
            }
        }

        ManagedService saved = serviceRepository.save(service);
        log.info("✅ Pricing {} added to service {}", pricing.getVersion(), saved.getName());
        eventPublisher.publish(PricingLifecycleEvent.Type.PRICING_CREATED, organizationId, saved.getName(), pricing.getVersion());
        invalidate(organizationId, saved.getName());
        return saved;
    }

    private static ManagedService reEnable(ManagedService service, String escaped, PricingLocator locator, long millis) {
        LinkedHashMap<String, PricingLocator> archived = new LinkedHashMap<>(service.getArchivedPricings());
        PricingLocator collision = archived.remove(escaped);
        if (collision != null) {
            archived.put(renamed(escaped, millis), collision);
        }
        service.getActivePricings().forEach((key, previous) ->
                archived.put(key.equals(escaped) || archived.containsKey(key) ? renamed(key, millis) : key, previous));

        LinkedHashMap<String, PricingLocator> active = new LinkedHashMap<>();
        active.put(escaped, locator);
        service.setActivePricings(active);
        service.setArchivedPricings(archived);
        service.setDisabled(false);
        log.info("Re-enabling service {} with pricing {}", service.getName(), VersionCodec.unescape(escaped));
        return service;
    }

    /**
     * Most recently created pricing among the given locators.
     */
    private Pricing latestPricing(ManagedService service, Map<String, PricingLocator> locators) {
        return pricingResolver.resolveLocators(service, locators).stream()
                .max(Comparator.comparing(Pricing::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                .orElseThrow(() -> new NotFoundException("No active pricing found for service " + service.getName()));
    }

    private ManagedService loadEnabled(String serviceName, Long organizationId) {
        return serviceRepository.findByName(organizationId, serviceName, false)
                .orElseThrow(() -> new NotFoundException("Service " + serviceName + " not found"));
    }

    private PricingLocator store(Pricing pricing) {
        Pricing saved = pricingRepository.save(pricing);
        return PricingLocator.builder().id(saved.getId()).build();
    }

    private Pricing fetch(String url, Long organizationId) {
        Pricing pricing = pricingResolver.fetchRemote(url, organizationId).block();
        if (pricing == null) {
            throw new RemoteFetchException(url, "no pricing returned");
        }
        return pricing;
    }

    private static PricingLocator remoteLocator(String url) {
        return PricingLocator.builder().url(url).build();
    }

    private static String renamed(String key, long millis) {
        return key + "_" + millis;
    }

    /**
     * Pricing changes alter every evaluation of the organization's users.
     */
    private void invalidate(Long organizationId, String serviceName) {
        cacheEffectApplier.apply(List.of(
                CacheEffect.delete(CacheKeys.service(organizationId, serviceName)),
                CacheEffect.delete(CacheKeys.allFeatures())));
    }
}
