package aforo.pricing.expression;

import aforo.pricing.exception.ExpressionException;
import aforo.pricing.model.FeatureValue;
import org.springframework.expression.TypedValue;

import java.util.Set;

/**
 * Root object of one evaluation. Reads a dotted name segment by segment: names the
 * expression uses in full resolve to values, shorter prefixes to a {@link VariablePath}.
 */
final class VariableScope {

    private final String source;
    private final VariableResolver resolver;
    private final Set<String> variables;

    VariableScope(String source, VariableResolver resolver, Set<String> variables) {
        this.source = source;
        this.resolver = resolver;
        this.variables = variables;
    }

    TypedValue lookup(String name) {
        if (!variables.contains(name)) {
            return new TypedValue(new VariablePath(this, name));
        }
        FeatureValue value = resolver.resolve(name);
        if (value == null) {
            throw new ExpressionException(source, "Undefined variable " + name);
        }
        return new TypedValue(unwrap(value));
    }

    // Numbers are handed to SpEL as doubles so that division is never integral.
    private static Object unwrap(FeatureValue value) {
        return switch (value.getType()) {
            case BOOLEAN -> value.asBoolean();
            case NUMERIC -> value.asNumber();
            case TEXT -> value.asText();
        };
    }
}
