package aforo.pricing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filters and paging for the feature catalog listing. Name filters are case-insensitive
 * substring matches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureQuery {

    public enum SortField {
        FEATURE_NAME,
        SERVICE_NAME
    }

    public enum Show {
        ACTIVE,
        ARCHIVED,
        ALL
    }

    private String featureName;
    private String serviceName;
    private String pricingVersion;

    @Builder.Default
    private int page = 1;

    @Builder.Default
    private int offset = 0;

    @Builder.Default
    private int limit = 20;

    @Builder.Default
    private SortField sort = SortField.SERVICE_NAME;

    @Builder.Default
    private boolean descending = false;

    @Builder.Default
    private Show show = Show.ACTIVE;
}
