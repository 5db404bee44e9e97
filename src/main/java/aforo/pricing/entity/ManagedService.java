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

/**
 * A SaaS service of an organization and the index of its pricing versions.
 * Version keys are stored escaped (see {@link aforo.pricing.util.VersionCodec}); a key
 * is either active or archived, never both.
 */
@Entity
@Table(name = "managed_service",
       indexes = {
           @Index(name = "idx_managed_service_org_id", columnList = "organization_id"),
           @Index(name = "idx_managed_service_name", columnList = "name")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManagedService {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "disabled", nullable = false)
    private boolean disabled;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "active_pricings", columnDefinition = "jsonb")
    @Builder.Default
    private LinkedHashMap<String, PricingLocator> activePricings = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "archived_pricings", columnDefinition = "jsonb")
    @Builder.Default
    private LinkedHashMap<String, PricingLocator> archivedPricings = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
