package aforo.pricing.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One accepted consumption of a usage level, kept so it can be reverted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsumptionRecord {

    /** Increases with every consumption of the contract; records of one call share it. */
    private long sequence;

    private String feature;
    private double amount;
    private Instant timestamp;
}
