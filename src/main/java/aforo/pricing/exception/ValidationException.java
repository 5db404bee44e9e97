package aforo.pricing.exception;

/**
 * Input or document rejected before any state was changed.
 */
public class ValidationException extends PricingEngineException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
