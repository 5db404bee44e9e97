package aforo.pricing.exception;

/**
 * A bulk contract update did not persist every affected contract.
 */
public class NovationException extends PricingEngineException {

    public NovationException(String message) {
        super(message);
    }
}
