package aforo.pricing.entity;

import aforo.pricing.model.FeatureValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Purchasable extension of a plan. Numeric values are per-unit increments
 * (multiplied by the subscribed quantity); boolean and text values replace the plan's.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddOn {

    private String name;
    private String description;
    private BigDecimal price;

    /** Plans this add-on can be bought with; empty means every plan. */
    @Builder.Default
    private List<String> availableFor = new ArrayList<>();

    @Builder.Default
    private Map<String, FeatureValue> features = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, FeatureValue> usageLimits = new LinkedHashMap<>();

    public boolean isAvailableFor(String plan) {
        return availableFor == null || availableFor.isEmpty() || (plan != null && availableFor.contains(plan));
    }
}
