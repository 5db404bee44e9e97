package aforo.pricing.exception;

/**
 * A subscription (plan + add-ons) that the target pricing does not offer.
 */
public class InvalidSubscriptionException extends ValidationException {

    public InvalidSubscriptionException(String message) {
        super(message);
    }
}
