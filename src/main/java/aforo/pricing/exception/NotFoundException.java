package aforo.pricing.exception;

/**
 * A contract, service, pricing version or pricing document does not exist.
 */
public class NotFoundException extends PricingEngineException {

    public NotFoundException(String message) {
        super(message);
    }
}
