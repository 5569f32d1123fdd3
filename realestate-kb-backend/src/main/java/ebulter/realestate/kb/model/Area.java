package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A neighbourhood. Its name is the key other records refer to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Area implements KnowledgeRecord {
    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("demographics")
    private Map<String, Object> demographics;

    @JsonProperty("walkability_score")
    private Integer walkabilityScore;

    @JsonProperty("school_rating")
    private Double schoolRating;

    @JsonProperty("median_home_price")
    private Long medianHomePrice;

    @JsonProperty("amenity_ids")
    private List<String> amenityIds;

    private Area() {}

    public Area(String name, String description, List<String> amenityIds) {
        this.name = name;
        this.description = description;
        this.amenityIds = amenityIds == null ? null : new ArrayList<>(amenityIds);
    }

    public Area(String name, String description, Map<String, Object> demographics, Integer walkabilityScore,
                Double schoolRating, List<String> amenityIds) {
        this(name, description, amenityIds);
        this.demographics = demographics == null ? null : new LinkedHashMap<>(demographics);
        this.walkabilityScore = walkabilityScore;
        this.schoolRating = schoolRating;
    }

    @Override
    @JsonIgnore
    public String getId() { return name; }

    public String getName() { return name; }

    public String getDescription() { return description; }

    public Map<String, Object> getDemographics() {
        return demographics == null ? Map.of() : Collections.unmodifiableMap(demographics);
    }

    public Integer getWalkabilityScore() { return walkabilityScore; }

    public Double getSchoolRating() { return schoolRating; }

    public Long getMedianHomePrice() { return medianHomePrice; }

    public List<String> getAmenityIds() {
        return amenityIds == null ? List.of() : Collections.unmodifiableList(amenityIds);
    }

    @Override
    public List<String> validate() {
        return name == null || name.isBlank() ? List.of("missing name") : List.of();
    }
}
