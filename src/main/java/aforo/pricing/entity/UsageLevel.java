package aforo.pricing.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracked consumption of one usage limit by one user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageLevel {

    private double consumed;

    /** Null for levels that never reset. */
    private Instant resetTimeStamp;

    /** Copied from the usage limit when the level is created; drives the next reset. */
    private RenewalPeriod period;

    @Builder.Default
    private List<ConsumptionRecord> consumptions = new ArrayList<>();

    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        return resetTimeStamp != null && now.isAfter(resetTimeStamp);
    }
}
