package aforo.pricing.service;

import aforo.pricing.dto.FallbackSubscription;
import aforo.pricing.dto.PricingAvailability;
import aforo.pricing.entity.ManagedService;
import aforo.pricing.entity.Pricing;

import java.util.List;

/**
 * Services of an organization and the lifecycle of their pricing versions.
 */
public interface ServiceManagementService {

    /**
     * Creates a service from an uploaded pricing document, or re-enables a disabled service of
     * the same name. The pricing is stored.
     */
    ManagedService createService(String pricingYaml, Long organizationId);

    /**
     * Same as {@link #createService} for a pricing hosted at {@code url}; only the URL is stored.
     */
    ManagedService createServiceFromUrl(String url, Long organizationId);

    /**
     * Adds a new active pricing version to an existing service.
     *
     * @throws aforo.pricing.exception.ValidationException when the document names another
     *         service or the version is already active
     */
    ManagedService addPricing(String serviceName, String pricingYaml, Long organizationId);

    ManagedService addPricingFromUrl(String serviceName, String url, Long organizationId);

    /**
     * Pricings of a service with the given availability, or all of them when {@code availability} is null.
     */
    List<Pricing> indexPricings(String serviceName, PricingAvailability availability, Long organizationId);

    Pricing showPricing(String serviceName, String pricingVersion, Long organizationId);

    /**
     * Activates or archives a pricing version. Archiving moves every contract on that version
     * to the latest remaining active pricing with {@code fallback} as its subscription.
     *
     * @throws aforo.pricing.exception.ValidationException when archiving the last active version
     *         or without a fallback subscription
     * @throws aforo.pricing.exception.InvalidSubscriptionException when the fallback is not
     *         offered by the latest active pricing
     */
    ManagedService updatePricingAvailability(String serviceName,
                                             String pricingVersion,
                                             PricingAvailability availability,
                                             FallbackSubscription fallback,
                                             Long organizationId);

    /**
     * Removes the service from every contract and disables it. Its active pricings are archived.
     */
    ManagedService disable(String serviceName, Long organizationId);

    /**
     * Deletes an archived pricing version. Active versions must be archived first.
     */
    ManagedService destroyPricing(String serviceName, String pricingVersion, Long organizationId);
}
