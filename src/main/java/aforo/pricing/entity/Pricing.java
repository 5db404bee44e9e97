package aforo.pricing.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A published pricing version of a service. Immutable once stored; a new version is
 * published instead of editing this one. The same version may be stored twice when it is
 * re-published after archival; services tell them apart by locator id.
 */
@Entity
@Table(name = "pricing",
       indexes = {
           @Index(name = "idx_pricing_org_id", columnList = "organization_id"),
           @Index(name = "idx_pricing_service_version", columnList = "service_name, version")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pricing {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "service_name", nullable = false, length = 200)
    private String serviceName;

    @Column(name = "version", nullable = false, length = 100)
    private String version;

    @Column(name = "currency", length = 10)
    private String currency;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "features", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, FeatureDefinition> features = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "usage_limits", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, UsageLimitDefinition> usageLimits = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "plans", columnDefinition = "jsonb")
    private Map<String, Plan> plans;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "add_ons", columnDefinition = "jsonb")
    private Map<String, AddOn> addOns;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
