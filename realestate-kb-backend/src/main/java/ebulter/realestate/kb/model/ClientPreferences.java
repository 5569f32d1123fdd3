package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a client is looking for. Every part is optional; only stated parts take part in matching.
 * Weighting hints are multipliers keyed by "price", "bedrooms", "area" and "type".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientPreferences {
    @JsonProperty("budget_range")
    private BudgetRange budgetRange;

    @JsonProperty("min_bedrooms")
    private Integer minBedrooms;

    @JsonProperty("desired_areas")
    private List<String> desiredAreas;

    private List<String> propertyTypes;

    @JsonProperty("weights")
    private Map<String, Double> weights;

    private ClientPreferences() {}

    public ClientPreferences(BudgetRange budgetRange, Integer minBedrooms, List<String> desiredAreas,
                             List<String> propertyTypes) {
        this(budgetRange, minBedrooms, desiredAreas, propertyTypes, null);
    }

    public ClientPreferences(BudgetRange budgetRange, Integer minBedrooms, List<String> desiredAreas,
                             List<String> propertyTypes, Map<String, Double> weights) {
        this.budgetRange = budgetRange;
        this.minBedrooms = minBedrooms;
        this.desiredAreas = desiredAreas == null ? null : new ArrayList<>(desiredAreas);
        this.propertyTypes = propertyTypes == null ? null : new ArrayList<>(propertyTypes);
        this.weights = weights == null ? null : new LinkedHashMap<>(weights);
    }

    public static ClientPreferences none() {
        return new ClientPreferences(null, null, null, null);
    }

    public BudgetRange getBudgetRange() { return budgetRange; }

    public Integer getMinBedrooms() { return minBedrooms; }

    public List<String> getDesiredAreas() {
        return desiredAreas == null ? List.of() : Collections.unmodifiableList(desiredAreas);
    }

    public List<String> getPropertyTypes() {
        return propertyTypes == null ? List.of() : Collections.unmodifiableList(propertyTypes);
    }

    @JsonProperty("property_types")
    private void setPropertyTypes(List<String> types) {
        if (types != null) {
            types.forEach(this::setPropertyType);
        }
    }

    // single-type form, merged with property_types when both are present
    @JsonProperty("property_type")
    private void setPropertyType(String type) {
        if (type == null || type.isBlank()) {
            return;
        }
        if (propertyTypes == null) {
            propertyTypes = new ArrayList<>();
        }
        propertyTypes.add(type);
    }

    public Map<String, Double> getWeights() {
        return weights == null ? Map.of() : Collections.unmodifiableMap(weights);
    }
}
