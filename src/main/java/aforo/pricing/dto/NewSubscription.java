package aforo.pricing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full replacement subscription applied by a novation. Versions are given unescaped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewSubscription {

    @Builder.Default
    private Map<String, String> contractedServices = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> subscriptionPlans = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Map<String, Integer>> subscriptionAddOns = new LinkedHashMap<>();

    /** Null keeps the contract's current setting. */
    private Boolean autoRenew;

    /** Null keeps the contract's current renewal days. */
    private Integer renewalDays;
}
