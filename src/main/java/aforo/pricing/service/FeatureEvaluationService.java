package aforo.pricing.service;

import aforo.pricing.dto.EvaluationEnvelope;
import aforo.pricing.dto.EvaluationOptions;
import aforo.pricing.dto.FeatureEvaluationOptions;
import aforo.pricing.dto.FeatureEvaluationResult;
import aforo.pricing.dto.FeatureListing;
import aforo.pricing.dto.FeatureQuery;

import java.util.List;
import java.util.Map;

/**
 * Feature catalog and per-user feature evaluation.
 */
public interface FeatureEvaluationService {

    /**
     * Features of every enabled service of the organization, filtered, sorted and paged.
     *
     * @param query filters and paging; page numbering starts at 1, a non-zero offset wins over the page
     * @param organizationId organization whose services are listed
     * @return one entry per (service, pricing version, feature)
     */
    List<FeatureListing> listFeatures(FeatureQuery query, Long organizationId);

    /**
     * Evaluates every feature of the user's contracted services. Does not consume anything.
     *
     * @param userId user holding the contract
     * @param organizationId organization of the contract
     * @param options detail level, expression variant and whether to return the contexts
     * @return the result, with the pricing and subscription contexts when requested
     */
    EvaluationEnvelope evaluateAll(String userId, Long organizationId, EvaluationOptions options);

    /**
     * Evaluates one feature and, when {@code expectedConsumption} is given and allowed,
     * records it against the feature's usage limits. With {@code options.revert} the feature's
     * consumption is reverted instead and a positive result returned.
     *
     * @param featureId {@code <service>-<feature>} or a feature name unique among the contracted services
     * @param expectedConsumption usage limit → increment; may be empty
     */
    FeatureEvaluationResult evaluateOne(String userId,
                                        String featureId,
                                        Map<String, Double> expectedConsumption,
                                        Long organizationId,
                                        FeatureEvaluationOptions options);

    /**
     * Evaluates every feature with details and signs the result together with the pricing and
     * subscription contexts. The token is cached until the next single-feature evaluation or
     * contract change of the user.
     *
     * @return compact JWT with claims {@code features}, {@code pricingContext} and {@code subscriptionContext}
     */
    String generatePricingToken(String userId, Long organizationId, boolean server);

    /**
     * Builds the contexts of a user after renewing and resetting the contract as needed.
     */
    EvaluationContexts retrieveContexts(String userId, Long organizationId, boolean server);
}
