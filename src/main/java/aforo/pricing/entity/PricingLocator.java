package aforo.pricing.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where a pricing version lives: a stored pricing id or a remote YAML URL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PricingLocator {

    private String id;
    private String url;

    @JsonIgnore
    public boolean isRemote() {
        return id == null && url != null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return id == null && url == null;
    }
}
