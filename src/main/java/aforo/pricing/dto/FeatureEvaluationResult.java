package aforo.pricing.dto;

import aforo.pricing.model.FeatureValue;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outcome of evaluating one feature for one user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeatureEvaluationResult {

    private boolean eval;

    /** Current consumption of the feature's usage limit, when it has one. */
    private Double used;

    /** Value of the feature's usage limit, when it has one. */
    private Double limit;

    /** Set when the requested consumption would exceed the limit; nothing was consumed. */
    private boolean limitReached;

    private Error error;

    /** Only filled in detailed mode. */
    private Trace trace;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Error {
        private String code;
        private String message;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Trace {
        private String expression;
        private FeatureValue value;
        private Map<String, FeatureValue> variables;
    }
}
