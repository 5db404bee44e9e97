package aforo.pricing.expression;

import org.springframework.expression.AccessException;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.PropertyAccessor;
import org.springframework.expression.TypedValue;

/**
 * Read-only property access over the flat variable map. Serves both
 * {@code features.maxSeats} and {@code features['Max seats']}.
 */
final class VariableAccessor implements PropertyAccessor {

    static final VariableAccessor INSTANCE = new VariableAccessor();

    private VariableAccessor() {
    }

    @Override
    public Class<?>[] getSpecificTargetClasses() {
        return new Class<?>[] {VariableScope.class, VariablePath.class};
    }

    @Override
    public boolean canRead(EvaluationContext context, Object target, String name) {
        return target instanceof VariableScope || target instanceof VariablePath;
    }

    @Override
    public TypedValue read(EvaluationContext context, Object target, String name) throws AccessException {
        if (target instanceof VariableScope scope) {
            return scope.lookup(name);
        }
        if (target instanceof VariablePath path) {
            return path.scope().lookup(path.child(name).name());
        }
        throw new AccessException("Cannot read '" + name + "'");
    }

    @Override
    public boolean canWrite(EvaluationContext context, Object target, String name) {
        return false;
    }

    @Override
    public void write(EvaluationContext context, Object target, String name, Object newValue) throws AccessException {
        throw new AccessException("Expression variables are read-only: " + name);
    }
}
