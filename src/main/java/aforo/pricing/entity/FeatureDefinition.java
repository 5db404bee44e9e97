package aforo.pricing.entity;

import aforo.pricing.model.FeatureValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A feature of a pricing's catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureDefinition {

    private String name;
    private String description;
    private FeatureValue.Type valueType;
    private FeatureValue defaultValue;

    /** Client-side evaluation expression. */
    private String expression;

    /** Server-side variant, used instead of {@link #expression} when present and requested. */
    private String serverExpression;

    private String type;  // DOMAIN, INTEGRATION, PAYMENT, ...
}
