package aforo.pricing.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Published whenever a pricing is created, activated or archived, or a service is disabled.
 * Consumers are notified asynchronously; publishing never fails the operation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingLifecycleEvent {

    public enum Type {
        PRICING_CREATED("pricingCreated"),
        PRICING_ACTIVATED("pricingActivated"),
        PRICING_ARCHIVED("pricingArchived"),
        SERVICE_DISABLED("serviceDisabled");

        private final String code;

        Type(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    private Type type;

    private Long organizationId;

    private String serviceName;

    /**
     * Unescaped pricing version; null for service-level events.
     */
    private String pricingVersion;

    private Instant occurredAt;
}
