package aforo.pricing.service;

import aforo.pricing.PricingFixtures;
import aforo.pricing.cache.CacheEffectApplier;
import aforo.pricing.cache.CacheKeys;
import aforo.pricing.cache.InMemoryCacheStore;
import aforo.pricing.dto.FallbackSubscription;
import aforo.pricing.dto.PricingAvailability;
import aforo.pricing.entity.ManagedService;
import aforo.pricing.entity.Pricing;
import aforo.pricing.entity.PricingLocator;
import aforo.pricing.event.PricingEventPublisher;
import aforo.pricing.event.PricingLifecycleEvent;
import aforo.pricing.exception.NotFoundException;
import aforo.pricing.exception.ValidationException;
import aforo.pricing.repository.ManagedServiceRepository;
import aforo.pricing.repository.PricingRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static aforo.pricing.PricingFixtures.NOW;
import static aforo.pricing.PricingFixtures.ORG;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ServiceManagementServiceImplTest {

    private static final String URL = "https://pricings.example.com/zoom-3.yml";
    private static final long MILLIS = NOW.toEpochMilli();

    private ManagedServiceRepository serviceRepository;
    private PricingRepository pricingRepository;
    private PricingResolver pricingResolver;
    private NovationService novationService;
    private PricingEventPublisher eventPublisher;
    private InMemoryCacheStore cacheStore;
    private ServiceManagementServiceImpl service;

    @BeforeEach
    void setUp() {
        serviceRepository = mock(ManagedServiceRepository.class);
        when(serviceRepository.save(any(ManagedService.class))).thenAnswer(invocation -> invocation.getArgument(0));
        pricingRepository = mock(PricingRepository.class);
        when(pricingRepository.save(any(Pricing.class))).thenAnswer(invocation -> {
            Pricing pricing = invocation.getArgument(0);
            pricing.setId("stored-" + pricing.getVersion());
            return pricing;
        });
        pricingResolver = mock(PricingResolver.class);
        novationService = mock(NovationService.class);
        eventPublisher = mock(PricingEventPublisher.class);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        cacheStore = new InMemoryCacheStore(new ObjectMapper().findAndRegisterModules(), clock);

        service = new ServiceManagementServiceImpl(serviceRepository, pricingRepository, pricingResolver,
                new PricingDocumentParser(Validation.buildDefaultValidatorFactory().getValidator()),
                novationService, eventPublisher, new CacheEffectApplier(cacheStore), clock);
    }

    @Test
    void shouldCreateServiceFromDocument() throws IOException {
        cacheStore.set(CacheKeys.service(ORG, "Zoom"), "stale", 60, true);
        cacheStore.set(CacheKeys.featureEvaluation(PricingFixtures.USER, "zoom-meetings"), "stale", 60, true);

        ManagedService created = service.createService(fixture("zoom.yml"), ORG);

        assertEquals("Zoom", created.getName());
        assertEquals(ORG, created.getOrganizationId());
        assertFalse(created.isDisabled());
        assertEquals(PricingLocator.builder().id("stored-2.0").build(), created.getActivePricings().get("2_0"));
        assertTrue(created.getArchivedPricings().isEmpty());
        verify(eventPublisher).publish(PricingLifecycleEvent.Type.PRICING_CREATED, ORG, "Zoom", "2.0");
        assertTrue(cacheStore.match("*").isEmpty());
    }

    @Test
    void shouldRejectDuplicateService() {
        when(serviceRepository.findByName(ORG, "Zoom", false)).thenReturn(Optional.of(zoomService()));

        assertThrows(ValidationException.class, () -> service.createService(fixture("zoom.yml"), ORG));
        verify(pricingRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void shouldReEnableDisabledServiceWithNewPricing() throws IOException {
        ManagedService disabled = ManagedService.builder()
                .organizationId(ORG)
                .name("Zoom")
                .disabled(true)
                .archivedPricings(locators("1_0", "zoom-1.0", "2_0", "zoom-2.0"))
                .build();
        when(serviceRepository.findByName(ORG, "Zoom", true)).thenReturn(Optional.of(disabled));

        ManagedService enabled = service.createService(fixture("zoom.yml"), ORG);

        assertFalse(enabled.isDisabled());
        assertEquals(List.of("2_0"), List.copyOf(enabled.getActivePricings().keySet()));
        assertEquals("stored-2.0", enabled.getActivePricings().get("2_0").getId());
        assertEquals("zoom-2.0", enabled.getArchivedPricings().get("2_0_" + MILLIS).getId());
        assertEquals("zoom-1.0", enabled.getArchivedPricings().get("1_0").getId());
    }

    @Test
    void shouldAddPricingAndRenameArchivedVersionWithSameKey() throws IOException {
        ManagedService zoom = zoomService();
        zoom.getArchivedPricings().put("2_0", PricingLocator.builder().id("zoom-2.0-old").build());
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoom));

        ManagedService updated = service.addPricing("zoom", fixture("zoom.yml"), ORG);

        assertEquals(List.of("1_0", "2_0"), List.copyOf(updated.getActivePricings().keySet()));
        assertFalse(updated.getArchivedPricings().containsKey("2_0"));
        assertEquals("zoom-2.0-old", updated.getArchivedPricings().get("2_0_" + MILLIS).getId());
        verify(eventPublisher).publish(PricingLifecycleEvent.Type.PRICING_CREATED, ORG, "Zoom", "2.0");
    }

    @Test
    void shouldRejectPricingOfAnotherService() {
        assertThrows(ValidationException.class, () -> service.addPricing("teams", fixture("zoom.yml"), ORG));
        verifyNoInteractions(serviceRepository);
    }

    @Test
    void shouldRejectVersionThatIsAlreadyActive() {
        ManagedService zoom = zoomService();
        zoom.getActivePricings().put("2_0", PricingLocator.builder().id("zoom-2.0").build());
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoom));

        assertThrows(ValidationException.class, () -> service.addPricing("zoom", fixture("zoom.yml"), ORG));
        verify(pricingRepository, never()).save(any());
    }

    @Test
    void shouldFailToAddPricingToUnknownService() {
        assertThrows(NotFoundException.class, () -> service.addPricing("Zoom", fixture("zoom.yml"), ORG));
    }

    @Test
    void shouldAddRemotePricingByUrl() {
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoomService()));
        when(pricingResolver.fetchRemote(URL, ORG)).thenReturn(Mono.just(PricingFixtures.zoom("3.0")));

        ManagedService updated = service.addPricingFromUrl("zoom", URL, ORG);

        assertEquals(PricingLocator.builder().url(URL).build(), updated.getActivePricings().get("3_0"));
        verify(pricingRepository, never()).save(any());
    }

    @Test
    void shouldArchivePricingAfterMovingItsContracts() {
        ManagedService zoom = zoomService();
        zoom.getActivePricings().put("2_0", PricingLocator.builder().id("zoom-2.0").build());
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoom));
        Pricing latest = PricingFixtures.zoom("2.0");
        when(pricingResolver.resolveLocators(any(ManagedService.class), anyMap())).thenReturn(List.of(latest));
        FallbackSubscription fallback = FallbackSubscription.builder().subscriptionPlan("BASIC").build();

        ManagedService updated = service.updatePricingAvailability("zoom", "1.0", PricingAvailability.ARCHIVED,
                fallback, ORG);

        verify(novationService).novateContractsToLatestVersion(ORG, "Zoom", "1_0", latest, fallback);
        assertEquals(List.of("2_0"), List.copyOf(updated.getActivePricings().keySet()));
        assertEquals("zoom-1.0", updated.getArchivedPricings().get("1_0").getId());
        verify(eventPublisher).publish(PricingLifecycleEvent.Type.PRICING_ARCHIVED, ORG, "Zoom", "1.0");
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldNovateToMostRecentRemainingPricing() {
        ManagedService zoom = zoomService();
        zoom.getActivePricings().put("2_0", PricingLocator.builder().id("zoom-2.0").build());
        zoom.getActivePricings().put("3_0", PricingLocator.builder().id("zoom-3.0").build());
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoom));
        Pricing older = PricingFixtures.zoom("2.0");
        Pricing newer = PricingFixtures.zoom("3.0");
        newer.setCreatedAt(NOW);
        when(pricingResolver.resolveLocators(any(ManagedService.class), anyMap())).thenReturn(List.of(newer, older));
        FallbackSubscription fallback = FallbackSubscription.builder().subscriptionPlan("PRO").build();

        service.updatePricingAvailability("zoom", "1.0", PricingAvailability.ARCHIVED, fallback, ORG);

        ArgumentCaptor<Map<String, PricingLocator>> remaining = ArgumentCaptor.forClass(Map.class);
        verify(pricingResolver).resolveLocators(any(ManagedService.class), remaining.capture());
        assertEquals(List.of("2_0", "3_0"), List.copyOf(remaining.getValue().keySet()));
        verify(novationService).novateContractsToLatestVersion(ORG, "Zoom", "1_0", newer, fallback);
    }

    @Test
    void shouldRefuseToArchiveLastActivePricing() {
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoomService()));

        assertThrows(ValidationException.class, () -> service.updatePricingAvailability("zoom", "1.0",
                PricingAvailability.ARCHIVED, FallbackSubscription.builder().subscriptionPlan("BASIC").build(), ORG));
        verifyNoInteractions(novationService);
        verify(serviceRepository, never()).save(any());
    }

    @Test
    void shouldRequireFallbackToArchive() {
        ManagedService zoom = zoomService();
        zoom.getActivePricings().put("2_0", PricingLocator.builder().id("zoom-2.0").build());
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoom));

        assertThrows(ValidationException.class, () -> service.updatePricingAvailability("zoom", "1.0",
                PricingAvailability.ARCHIVED, null, ORG));
        assertThrows(ValidationException.class, () -> service.updatePricingAvailability("zoom", "1.0",
                PricingAvailability.ARCHIVED, new FallbackSubscription(), ORG));
        verifyNoInteractions(novationService);
    }

    @Test
    void shouldReactivateArchivedPricing() {
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoomService()));

        ManagedService updated = service.updatePricingAvailability("zoom", "0.9", PricingAvailability.ACTIVE, null, ORG);

        assertEquals(List.of("1_0", "0_9"), List.copyOf(updated.getActivePricings().keySet()));
        assertTrue(updated.getArchivedPricings().isEmpty());
        verify(eventPublisher).publish(PricingLifecycleEvent.Type.PRICING_ACTIVATED, ORG, "Zoom", "0.9");
    }

    @Test
    void shouldLeaveServiceUntouchedWhenAlreadyInRequestedState() {
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoomService()));

        service.updatePricingAvailability("zoom", "1.0", PricingAvailability.ACTIVE, null, ORG);

        verify(serviceRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void shouldFailToChangeUnknownVersion() {
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoomService()));

        assertThrows(NotFoundException.class, () -> service.updatePricingAvailability("zoom", "5.0",
                PricingAvailability.ACTIVE, null, ORG));
    }

    @Test
    void shouldDisableServiceAndArchiveItsPricings() {
        ManagedService zoom = zoomService();
        zoom.getActivePricings().put("0_9", PricingLocator.builder().id("zoom-0.9-new").build());
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoom));

        ManagedService disabled = service.disable("zoom", ORG);

        verify(novationService).removeServiceFromContracts(ORG, "Zoom");
        assertTrue(disabled.isDisabled());
        assertTrue(disabled.getActivePricings().isEmpty());
        assertEquals("zoom-0.9", disabled.getArchivedPricings().get("0_9").getId());
        assertEquals("zoom-0.9-new", disabled.getArchivedPricings().get("0_9_" + MILLIS).getId());
        assertEquals("zoom-1.0", disabled.getArchivedPricings().get("1_0").getId());
        verify(eventPublisher).publish(PricingLifecycleEvent.Type.SERVICE_DISABLED, ORG, "Zoom", null);
    }

    @Test
    void shouldDestroyArchivedStoredPricing() {
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoomService()));
        cacheStore.set(CacheKeys.pricingById("zoom-0.9"), "cached", 60, true);

        ManagedService updated = service.destroyPricing("zoom", "0.9", ORG);

        assertFalse(updated.getArchivedPricings().containsKey("0_9"));
        verify(pricingRepository).deleteById("zoom-0.9");
        assertFalse(cacheStore.get(CacheKeys.pricingById("zoom-0.9"), String.class).isPresent());
    }

    @Test
    void shouldDestroyArchivedRemotePricing() {
        ManagedService zoom = zoomService();
        zoom.getArchivedPricings().put("0_8", PricingLocator.builder().url(URL).build());
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoom));
        cacheStore.set(CacheKeys.pricingByUrl(URL), "cached", 60, true);

        service.destroyPricing("zoom", "0.8", ORG);

        verify(pricingRepository, never()).deleteById(any());
        assertFalse(cacheStore.get(CacheKeys.pricingByUrl(URL), String.class).isPresent());
    }

    @Test
    void shouldRefuseToDestroyActiveOrUnknownPricing() {
        when(serviceRepository.findByName(ORG, "zoom", false)).thenReturn(Optional.of(zoomService()));

        assertThrows(ValidationException.class, () -> service.destroyPricing("zoom", "1.0", ORG));
        assertThrows(NotFoundException.class, () -> service.destroyPricing("zoom", "4.0", ORG));
        verify(pricingRepository, never()).deleteById(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldIndexPricingsByAvailability() {
        ManagedService zoom = zoomService();
        when(pricingResolver.findService("zoom", ORG)).thenReturn(zoom);
        when(pricingResolver.resolveLocators(eq(zoom), anyMap())).thenReturn(List.of(PricingFixtures.zoom("0.9")));

        List<Pricing> archived = service.indexPricings("zoom", PricingAvailability.ARCHIVED, ORG);
        service.indexPricings("zoom", null, ORG);

        assertEquals("0.9", archived.get(0).getVersion());
        ArgumentCaptor<Map<String, PricingLocator>> locators = ArgumentCaptor.forClass(Map.class);
        verify(pricingResolver, times(2)).resolveLocators(eq(zoom), locators.capture());
        assertEquals(List.of("0_9"), List.copyOf(locators.getAllValues().get(0).keySet()));
        assertEquals(List.of("1_0", "0_9"), List.copyOf(locators.getAllValues().get(1).keySet()));
    }

    @Test
    void shouldShowPricingThroughResolver() {
        Pricing pricing = PricingFixtures.zoom("1.0");
        when(pricingResolver.resolvePricing("zoom", "1.0", ORG)).thenReturn(pricing);

        assertSame(pricing, service.showPricing("zoom", "1.0", ORG));
    }

    private static ManagedService zoomService() {
        return ManagedService.builder()
                .id(3L)
                .organizationId(ORG)
                .name("Zoom")
                .activePricings(locators("1_0", "zoom-1.0"))
                .archivedPricings(locators("0_9", "zoom-0.9"))
                .build();
    }

    private static LinkedHashMap<String, PricingLocator> locators(String... versionsAndIds) {
        LinkedHashMap<String, PricingLocator> locators = new LinkedHashMap<>();
        for (int i = 0; i < versionsAndIds.length; i += 2) {
            locators.put(versionsAndIds[i], PricingLocator.builder().id(versionsAndIds[i + 1]).build());
        }
        return locators;
    }

    private String fixture(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/pricings/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
