package aforo.pricing.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * How often a usage level is reset, e.g. every 1 MONTH.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenewalPeriod {

    private int value;
    private Unit unit;

    public enum Unit {
        SEC(ChronoUnit.SECONDS),
        MIN(ChronoUnit.MINUTES),
        HOUR(ChronoUnit.HOURS),
        DAY(ChronoUnit.DAYS),
        MONTH(ChronoUnit.MONTHS),
        YEAR(ChronoUnit.YEARS);

        private final ChronoUnit chronoUnit;

        Unit(ChronoUnit chronoUnit) {
            this.chronoUnit = chronoUnit;
        }
    }

    /**
     * Next reset instant counted from {@code from}. Months and years are calendar based (UTC).
     */
    public Instant nextResetFrom(Instant from) {
        return from.atZone(ZoneOffset.UTC).plus(value, unit.chronoUnit).toInstant();
    }
}
