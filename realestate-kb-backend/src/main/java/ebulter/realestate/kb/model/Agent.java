package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An agent profile. The portfolio lists every listing the agent owns or has owned,
 * including ones no longer present in the listing collection.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Agent implements KnowledgeRecord {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("email")
    private String email;

    @JsonProperty("phone")
    private String phone;

    @JsonProperty("specializations")
    private List<String> specializations;

    @JsonProperty("expertise_areas")
    private List<String> expertiseAreas;

    @JsonProperty("bio")
    private String bio;

    @JsonProperty("listing_ids")
    private List<String> listingIds;

    @JsonProperty("client_testimonials")
    private List<Testimonial> testimonials;

    private Agent() {}

    public Agent(String id, String name, List<String> specializations, List<String> listingIds) {
        this.id = id;
        this.name = name;
        this.specializations = specializations == null ? null : new ArrayList<>(specializations);
        this.listingIds = listingIds == null ? null : new ArrayList<>(listingIds);
    }

    public Agent(String id, String name, List<String> specializations, List<String> listingIds,
                 List<Testimonial> testimonials) {
        this(id, name, specializations, listingIds);
        this.testimonials = testimonials == null ? null : new ArrayList<>(testimonials);
    }

    @Override
    public String getId() { return id; }

    public String getName() { return name == null ? "" : name; }

    public String getEmail() { return email; }

    public String getPhone() { return phone; }

    public List<String> getSpecializations() { return unmodifiable(specializations); }

    public List<String> getExpertiseAreas() { return unmodifiable(expertiseAreas); }

    public String getBio() { return bio == null ? "" : bio; }

    public List<String> getListingIds() { return unmodifiable(listingIds); }

    public List<Testimonial> getTestimonials() { return unmodifiable(testimonials); }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (id == null || id.isBlank()) {
            problems.add("missing id");
        }
        if (name == null || name.isBlank()) {
            problems.add("missing name");
        }
        return problems;
    }

    private static <T> List<T> unmodifiable(List<T> list) {
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }
}
