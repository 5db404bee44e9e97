package aforo.pricing.expression;

import aforo.pricing.exception.ExpressionException;
import aforo.pricing.model.FeatureValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.stereotype.Component;
import org.springframework.util.ConcurrentLruCache;

import java.util.Map;

/**
 * Evaluates feature expressions against a flat variable map using SpEL.
 *
 * Supported syntax: number, quoted text and boolean literals; dotted identifiers
 * ({@code features.maxSeats}, {@code usage['api calls']}); {@code ! -} prefixes;
 * {@code * / % + -}; comparisons; {@code == !=}; short-circuit {@code && ||};
 * {@code cond ? a : b}; and the functions {@code min max abs floor ceil round}.
 *
 * Evaluation runs in a read-only context with no bean, type or constructor access.
 * Parsed expressions are memoised by their text in a bounded LRU cache.
 */
@Slf4j
@Component
public class ExpressionEvaluator {

    static final int DEFAULT_CACHE_SIZE = 1024;

    private final SpelExpressionParser parser = new SpelExpressionParser();
    private final ConcurrentLruCache<String, CompiledExpression> compiled;

    public ExpressionEvaluator() {
        this(DEFAULT_CACHE_SIZE);
    }

    ExpressionEvaluator(int cacheSize) {
        this.compiled = new ConcurrentLruCache<>(cacheSize, this::parse);
    }

    /**
     * @throws ExpressionException if the text is empty, does not parse or calls an unknown function
     */
    public CompiledExpression compile(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionException(String.valueOf(expression), "Empty expression");
        }
        return compiled.get(expression);
    }

    public FeatureValue evaluate(String expression, Map<String, FeatureValue> context) {
        return evaluate(expression, VariableResolver.of(context));
    }

    public FeatureValue evaluate(String expression, VariableResolver variables) {
        return compile(expression).evaluate(variables);
    }

    int cachedExpressions() {
        return compiled.size();
    }

    private CompiledExpression parse(String expression) {
        try {
            return new CompiledExpression(expression, parser.parseRaw(expression));
        } catch (ParseException e) {
            log.debug("⚠️ Unparseable expression '{}': {}", expression, e.getSimpleMessage());
            throw new ExpressionException(expression, e.getSimpleMessage(), e);
        }
    }
}
