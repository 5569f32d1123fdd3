package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inclusive price range; either bound may be absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BudgetRange {
    @JsonProperty("min")
    private Long min;

    @JsonProperty("max")
    private Long max;

    private BudgetRange() {}

    public BudgetRange(Long min, Long max) {
        this.min = min;
        this.max = max;
    }

    public Long getMin() { return min; }

    public Long getMax() { return max; }

    @JsonIgnore
    public boolean isStated() { return min != null || max != null; }
}
