package aforo.pricing.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plan and add-ons that contracts are moved to when their pricing version is archived.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FallbackSubscription {

    private String subscriptionPlan;

    @Builder.Default
    private Map<String, Integer> subscriptionAddOns = new LinkedHashMap<>();

    @JsonIgnore
    public boolean isEmpty() {
        return subscriptionPlan == null && (subscriptionAddOns == null || subscriptionAddOns.isEmpty());
    }
}
