package aforo.pricing.entity;

import aforo.pricing.model.FeatureValue;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A usage limit of a pricing's catalog. Numeric, trackable limits get a usage level per
 * contract; the linked features are the ones whose evaluation consumes it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageLimitDefinition {

    private String name;
    private String description;
    private FeatureValue.Type valueType;
    private FeatureValue defaultValue;

    @Builder.Default
    private List<String> linkedFeatures = new ArrayList<>();

    private boolean trackable;

    /** Null when the level never resets on its own. */
    private RenewalPeriod period;

    @JsonIgnore
    public boolean isTracked() {
        return trackable && valueType == FeatureValue.Type.NUMERIC;
    }
}
