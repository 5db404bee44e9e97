package aforo.pricing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluation of every feature of every contracted service, keyed by {@code <service>-<feature>}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureEvaluationReport {

    @Builder.Default
    private Map<String, FeatureEvaluationResult> features = new LinkedHashMap<>();
}
