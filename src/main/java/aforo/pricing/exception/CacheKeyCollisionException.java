package aforo.pricing.exception;

public class CacheKeyCollisionException extends PricingEngineException {

    public CacheKeyCollisionException(String key) {
        super("Value already exists in cache for key '" + key + "', please use a different key.");
    }
}
