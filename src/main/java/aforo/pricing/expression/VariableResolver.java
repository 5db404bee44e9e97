package aforo.pricing.expression;

import aforo.pricing.model.FeatureValue;

import java.util.Map;

/**
 * Supplies values for the identifiers of an expression.
 */
@FunctionalInterface
public interface VariableResolver {

    /**
     * @return the value bound to {@code name}, or null when the name is unknown
     */
    FeatureValue resolve(String name);

    static VariableResolver of(Map<String, FeatureValue> variables) {
        return variables::get;
    }
}
