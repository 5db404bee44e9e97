package aforo.pricing.dto;

import aforo.pricing.entity.FeatureDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureListing {

    private FeatureDefinition info;
    private String serviceName;
    private String pricingVersion;
}
