package aforo.pricing.expression;

/**
 * A dotted prefix such as {@code features} in {@code features.maxSeats}.
 */
record VariablePath(VariableScope scope, String name) {

    VariablePath child(String segment) {
        return new VariablePath(scope, name + "." + segment);
    }
}
