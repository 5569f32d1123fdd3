package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Amenity implements KnowledgeRecord {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("category")
    private AmenityCategory category;

    @JsonProperty("area")
    private String area;

    @JsonProperty("rating")
    private Double rating;

    @JsonProperty("description")
    private String description;

    private Amenity() {}

    public Amenity(String id, String name, AmenityCategory category, String area) {
        this.id = id;
        this.name = name;
        this.category = category;
        this.area = area;
    }

    @Override
    public String getId() { return id; }

    public String getName() { return name; }

    public AmenityCategory getCategory() { return category == null ? AmenityCategory.OTHER : category; }

    public String getArea() { return area; }

    public Double getRating() { return rating; }

    public String getDescription() { return description; }

    @Override
    public List<String> validate() {
        return id == null || id.isBlank() ? List.of("missing id") : List.of();
    }
}
