package aforo.pricing.dto;

/**
 * Whether a pricing version is offered to new contracts.
 */
public enum PricingAvailability {
    ACTIVE,
    ARCHIVED
}
