package aforo.pricing.expression;

import aforo.pricing.exception.ExpressionException;
import aforo.pricing.model.FeatureValue;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.spel.SpelNode;
import org.springframework.expression.spel.ast.CompoundExpression;
import org.springframework.expression.spel.ast.Indexer;
import org.springframework.expression.spel.ast.MethodReference;
import org.springframework.expression.spel.ast.PropertyOrFieldReference;
import org.springframework.expression.spel.ast.StringLiteral;
import org.springframework.expression.spel.standard.SpelExpression;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * An immutable, thread-safe parsed expression. One instance is shared by every evaluation
 * of the same expression text.
 */
public final class CompiledExpression {

    private static final TruthinessTypeConverter TYPE_CONVERTER = new TruthinessTypeConverter();

    private final String source;
    private final SpelExpression expression;
    private final Set<String> variables;

    CompiledExpression(String source, SpelExpression expression) {
        this.source = source;
        this.expression = expression;
        Set<String> names = new HashSet<>();
        inspect(expression.getAST(), names);
        this.variables = Collections.unmodifiableSet(names);
    }

    /**
     * @throws ExpressionException on unknown variables, type errors or division by zero
     */
    public FeatureValue evaluate(VariableResolver resolver) {
        VariableScope scope = new VariableScope(source, resolver, variables);
        EvaluationContext context = SimpleEvaluationContext.forPropertyAccessors(VariableAccessor.INSTANCE)
                .withMethodResolvers(ExpressionFunctions.INSTANCE)
                .withTypeConverter(TYPE_CONVERTER)
                .withRootObject(scope)
                .build();
        Object result;
        try {
            result = expression.getValue(context);
        } catch (EvaluationException | ArithmeticException e) {
            throw translate(e);
        }
        return toFeatureValue(result);
    }

    public String source() {
        return source;
    }

    /** Full dotted names read by the expression, e.g. {@code features.Max seats}. */
    Set<String> variables() {
        return variables;
    }

    private ExpressionException translate(RuntimeException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ExpressionException expressionError) {
                return expressionError;
            }
            if (cause instanceof ArithmeticException) {
                return new ExpressionException(source, "Division by zero", e);
            }
        }
        String message = e instanceof EvaluationException evaluationError
                ? evaluationError.getSimpleMessage()
                : e.getMessage();
        return new ExpressionException(source, message, e);
    }

    private FeatureValue toFeatureValue(Object result) {
        if (result instanceof VariablePath path) {
            throw new ExpressionException(source, "Undefined variable " + path.name());
        }
        if (result instanceof Number number && !Double.isFinite(number.doubleValue())) {
            throw new ExpressionException(source, "Division by zero");
        }
        if (result instanceof Boolean || result instanceof Number || result instanceof String) {
            return FeatureValue.fromRaw(result);
        }
        throw new ExpressionException(source, "Unsupported result "
                + (result == null ? "null" : result.getClass().getSimpleName()));
    }

    private void inspect(SpelNode node, Set<String> names) {
        if (node instanceof PropertyOrFieldReference reference) {
            names.add(reference.getName());
            return;
        }
        if (node instanceof MethodReference function) {
            if (!ExpressionFunctions.supports(function.getName(), function.getChildCount())) {
                throw new ExpressionException(source, "Unknown function " + function.getName()
                        + " with " + function.getChildCount() + " argument(s)");
            }
        }
        if (node instanceof CompoundExpression) {
            String path = dottedName(node);
            if (path != null) {
                names.add(path);
                return;
            }
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            inspect(node.getChild(i), names);
        }
    }

    private static String dottedName(SpelNode compound) {
        StringBuilder path = new StringBuilder();
        for (int i = 0; i < compound.getChildCount(); i++) {
            String segment = segment(compound.getChild(i));
            if (segment == null) {
                return null;
            }
            if (i > 0) {
                path.append('.');
            }
            path.append(segment);
        }
        return path.toString();
    }

    private static String segment(SpelNode node) {
        if (node instanceof PropertyOrFieldReference reference) {
            return reference.getName();
        }
        if (node instanceof Indexer && node.getChildCount() == 1
                && node.getChild(0) instanceof StringLiteral literal) {
            return String.valueOf(literal.getLiteralValue().getValue());
        }
        return null;
    }
}
