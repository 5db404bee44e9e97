package aforo.pricing.dto;

import aforo.pricing.model.FeatureValue;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Result of a full evaluation, optionally with the contexts it was computed from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvaluationEnvelope {

    private Map<String, FeatureValue> pricingContext;
    private Map<String, FeatureValue> subscriptionContext;
    private FeatureEvaluationReport result;
}
