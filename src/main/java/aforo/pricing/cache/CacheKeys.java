package aforo.pricing.cache;

/**
 * Key layout of the cache.
 */
public final class CacheKeys {

    public static final long PRICING_TTL_SECONDS = 3600;
    public static final long EVALUATION_TTL_SECONDS = 3600;
    public static final long CONTRACT_TTL_SECONDS = 3600;
    public static final long SERVICE_TTL_SECONDS = 3600;
    public static final long PRICING_TOKEN_TTL_SECONDS = 3600;

    private CacheKeys() {
    }

    public static String service(Long organizationId, String serviceName) {
        return "service." + organizationId + "." + serviceName;
    }

    public static String pricingById(String pricingId) {
        return "pricing.id." + pricingId;
    }

    public static String pricingByUrl(String url) {
        return "pricing.url." + url;
    }

    public static String contract(String userId) {
        return "contracts." + userId;
    }

    public static String featureEvaluations(String userId) {
        return "features." + userId + ".eval";
    }

    public static String featureEvaluation(String userId, String featureId) {
        return "features." + userId + ".eval." + featureId;
    }

    /** Signed evaluation snapshot of a user. Covered by {@link #allFeatureEvaluations(String)}. */
    public static String pricingToken(String userId) {
        return "features." + userId + ".pricingToken";
    }

    /** Every cached evaluation of a user. */
    public static String allFeatureEvaluations(String userId) {
        return "features." + userId + ".*";
    }

    /** Every cached evaluation of every user. */
    public static String allFeatures() {
        return "features.*";
    }
}
