package aforo.pricing.exception;

/**
 * Root of the errors raised by the evaluation engine.
 */
public abstract class PricingEngineException extends RuntimeException {

    protected PricingEngineException(String message) {
        super(message);
    }

    protected PricingEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
