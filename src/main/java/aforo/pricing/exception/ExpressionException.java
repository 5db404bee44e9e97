package aforo.pricing.exception;

/**
 * Malformed expression or reference to an unknown variable. Indicates broken pricing data.
 */
public class ExpressionException extends PricingEngineException {

    private final String expression;

    public ExpressionException(String expression, String message) {
        super(message + " in expression: " + expression);
        this.expression = expression;
    }

    public ExpressionException(String expression, String message, Throwable cause) {
        super(message + " in expression: " + expression, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
