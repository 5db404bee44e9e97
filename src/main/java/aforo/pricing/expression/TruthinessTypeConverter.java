package aforo.pricing.expression;

import aforo.pricing.model.FeatureValue;
import org.springframework.core.convert.TypeDescriptor;
import org.springframework.expression.TypeConverter;
import org.springframework.expression.spel.support.StandardTypeConverter;

/**
 * Lets {@code && || ! ?:} accept numbers and text (non-zero and non-empty are true) and
 * prints integral numbers without a fraction when concatenated with text.
 */
final class TruthinessTypeConverter implements TypeConverter {

    private final StandardTypeConverter delegate = new StandardTypeConverter();

    @Override
    public boolean canConvert(TypeDescriptor sourceType, TypeDescriptor targetType) {
        return isBoolean(targetType) || isText(targetType) || delegate.canConvert(sourceType, targetType);
    }

    @Override
    public Object convertValue(Object value, TypeDescriptor sourceType, TypeDescriptor targetType) {
        if (isBoolean(targetType) && (value == null || scalar(value))) {
            return value != null && FeatureValue.fromRaw(value).isTruthy();
        }
        if (isText(targetType) && value != null && scalar(value)) {
            return FeatureValue.fromRaw(value).toString();
        }
        return delegate.convertValue(value, sourceType, targetType);
    }

    private static boolean scalar(Object value) {
        return value instanceof Boolean || value instanceof Number || value instanceof String;
    }

    private static boolean isBoolean(TypeDescriptor type) {
        return type.getType() == Boolean.class || type.getType() == boolean.class;
    }

    private static boolean isText(TypeDescriptor type) {
        return type.getType() == String.class;
    }
}
