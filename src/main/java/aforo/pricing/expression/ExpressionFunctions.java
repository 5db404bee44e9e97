package aforo.pricing.expression;

import org.springframework.core.convert.TypeDescriptor;
import org.springframework.expression.AccessException;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.MethodExecutor;
import org.springframework.expression.MethodResolver;
import org.springframework.expression.TypedValue;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * The numeric functions callable from an expression: variadic {@code min}/{@code max}
 * and unary {@code abs}/{@code floor}/{@code ceil}/{@code round}.
 */
final class ExpressionFunctions implements MethodResolver {

    static final ExpressionFunctions INSTANCE = new ExpressionFunctions();

    private static final Set<String> VARIADIC = Set.of("min", "max");
    private static final Set<String> UNARY = Set.of("abs", "floor", "ceil", "round");

    private ExpressionFunctions() {
    }

    static boolean supports(String name, int arguments) {
        if (VARIADIC.contains(name)) {
            return arguments > 0;
        }
        return UNARY.contains(name) && arguments == 1;
    }

    @Override
    public MethodExecutor resolve(EvaluationContext context, Object target, String name,
                                  List<TypeDescriptor> argumentTypes) {
        if (!(target instanceof VariableScope) || !supports(name, argumentTypes.size())) {
            return null;
        }
        return (evaluationContext, receiver, arguments) -> new TypedValue(apply(name, numbers(name, arguments)));
    }

    private static double[] numbers(String name, Object[] arguments) throws AccessException {
        double[] values = new double[arguments.length];
        for (int i = 0; i < arguments.length; i++) {
            if (!(arguments[i] instanceof Number number)) {
                throw new AccessException(name + "() expects numbers but got " + arguments[i]);
            }
            values[i] = number.doubleValue();
        }
        return values;
    }

    private static double apply(String name, double[] values) {
        return switch (name) {
            case "min" -> Arrays.stream(values).min().orElseThrow();
            case "max" -> Arrays.stream(values).max().orElseThrow();
            case "abs" -> Math.abs(values[0]);
            case "floor" -> Math.floor(values[0]);
            case "ceil" -> Math.ceil(values[0]);
            case "round" -> Math.round(values[0]);
            default -> throw new IllegalArgumentException("Unknown function " + name);
        };
    }
}
