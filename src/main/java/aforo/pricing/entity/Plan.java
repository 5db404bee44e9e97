package aforo.pricing.entity;

import aforo.pricing.model.FeatureValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Plan {

    private String name;
    private String description;
    private BigDecimal price;

    /** Overrides of catalog defaults; missing entries keep the default. */
    @Builder.Default
    private Map<String, FeatureValue> features = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, FeatureValue> usageLimits = new LinkedHashMap<>();
}
