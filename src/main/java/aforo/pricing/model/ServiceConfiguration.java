package aforo.pricing.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effective feature and usage-limit values of one contracted service, after applying the
 * subscribed plan and add-ons on top of the catalog defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceConfiguration {

    @Builder.Default
    private Map<String, FeatureValue> features = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, FeatureValue> usageLimits = new LinkedHashMap<>();
}
