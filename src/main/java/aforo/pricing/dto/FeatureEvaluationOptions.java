package aforo.pricing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureEvaluationOptions {

    /** Undo consumption of the feature instead of evaluating it. */
    private boolean revert;

    /** With {@link #revert}: undo only the latest consumption (true) or all of it (false). */
    @Builder.Default
    private boolean latest = true;

    private boolean server;

    private boolean details;
}
