package aforo.pricing.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Subscription of one user to specific pricing versions, with the user's usage levels.
 * Service keys are lower-case and versions escaped.
 */
@Entity
@Table(name = "contract",
       uniqueConstraints = @UniqueConstraint(name = "uk_contract_user", columnNames = {"organization_id", "user_id"}),
       indexes = {
           @Index(name = "idx_contract_org_id", columnList = "organization_id"),
           @Index(name = "idx_contract_user_id", columnList = "user_id")
       })
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Contract {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 200)
    private String userId;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    /** service → escaped version */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "contracted_services", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, String> contractedServices = new LinkedHashMap<>();

    /** service → plan name */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "subscription_plans", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, String> subscriptionPlans = new LinkedHashMap<>();

    /** service → (add-on → quantity) */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "subscription_add_ons", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Map<String, Integer>> subscriptionAddOns = new LinkedHashMap<>();

    /** service → (usage limit → level) */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "usage_levels", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Map<String, UsageLevel>> usageLevels = new LinkedHashMap<>();

    @Embedded
    private BillingPeriod billingPeriod;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "history", columnDefinition = "jsonb")
    @Builder.Default
    private List<ContractHistoryEntry> history = new ArrayList<>();

    @Column(name = "disabled", nullable = false)
    private boolean disabled;

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
