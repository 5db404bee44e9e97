package aforo.pricing.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of a contract's subscription before it was renewed or novated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractHistoryEntry {

    private Instant startDate;
    private Instant endDate;
    private Map<String, String> contractedServices;
    private Map<String, String> subscriptionPlans;
    private Map<String, Map<String, Integer>> subscriptionAddOns;
}
