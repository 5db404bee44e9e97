package aforo.pricing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationOptions {

    /** Include the expression trace of every feature. */
    private boolean details;

    /** Prefer server-side expressions. */
    private boolean server;

    /** Return the pricing and subscription contexts along with the result. */
    private boolean returnContexts;
}
