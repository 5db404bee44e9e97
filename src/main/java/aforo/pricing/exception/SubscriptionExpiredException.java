package aforo.pricing.exception;

import java.time.Instant;

/**
 * The contract's billing period has ended and it does not renew automatically.
 */
public class SubscriptionExpiredException extends PricingEngineException {

    private final String userId;
    private final Instant endDate;

    public SubscriptionExpiredException(String userId, Instant endDate) {
        super("Subscription of user " + userId + " expired at " + endDate + ". Please renew it to keep using the service");
        this.userId = userId;
        this.endDate = endDate;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getEndDate() {
        return endDate;
    }
}
