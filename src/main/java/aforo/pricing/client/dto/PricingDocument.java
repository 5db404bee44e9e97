package aforo.pricing.client.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Pricing document as published in YAML, either uploaded or hosted at a remote URL.
 * Plan and add-on values may be written as a scalar or as {@code {value: x}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingDocument {

    @NotBlank
    @JsonAlias({"serviceName", "saas"})
    private String saasName;

    @NotBlank
    private String version;

    private String currency;

    private String createdAt;

    @NotEmpty
    private Map<String, @Valid @NotNull FeatureDoc> features;

    private Map<String, @Valid @NotNull UsageLimitDoc> usageLimits;

    private Map<String, @Valid @NotNull PlanDoc> plans;

    private Map<String, @Valid @NotNull AddOnDoc> addOns;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FeatureDoc {
        private String description;

        @NotBlank
        private String valueType;

        private Object defaultValue;

        private String expression;

        private String serverExpression;

        private String type;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UsageLimitDoc {
        private String description;

        @NotBlank
        private String valueType;

        private Object defaultValue;

        private List<String> linkedFeatures;

        private Boolean trackable;

        @Valid
        private PeriodDoc period;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PeriodDoc {
        private int value;

        @NotBlank
        private String unit;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlanDoc {
        private String description;
        private Object price;
        private Map<String, Object> features;
        private Map<String, Object> usageLimits;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AddOnDoc {
        private String description;
        private Object price;
        private List<String> availableFor;
        private Map<String, Object> features;
        private Map<String, Object> usageLimits;
        private Map<String, Object> usageLimitsExtensions;
    }
}
