package aforo.pricing.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Embeddable
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BillingPeriod {

    public static final int DEFAULT_RENEWAL_DAYS = 30;

    @Column(name = "billing_start_date")
    private Instant startDate;

    @Column(name = "billing_end_date")
    private Instant endDate;

    @Column(name = "auto_renew")
    private boolean autoRenew;

    @Column(name = "renewal_days")
    private Integer renewalDays;

    public boolean hasEndedAt(Instant now) {
        return endDate != null && now.isAfter(endDate);
    }
}
