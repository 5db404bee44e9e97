package aforo.pricing.model;

/**
 * Identifies one usage level of a contract.
 */
public record UsageLevelKey(String service, String usageLimit) {

    @Override
    public String toString() {
        return service + "-" + usageLimit;
    }
}
