package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A property listing as stored in properties/active_listings.json
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Listing implements KnowledgeRecord {
    @JsonProperty("id")
    private String id;

    @JsonProperty("address")
    private String address;

    @JsonProperty("area")
    private String area;

    @JsonProperty("price")
    private Long price;

    @JsonProperty("bedrooms")
    private int bedrooms;

    @JsonProperty("bathrooms")
    private double bathrooms;

    @JsonProperty("square_feet")
    private int squareFeet;

    @JsonProperty("property_type")
    private String propertyType;

    @JsonProperty("style")
    private String style;

    @JsonProperty("status")
    private ListingStatus status;

    @JsonProperty("agent_id")
    private String agentId;

    @JsonProperty("description")
    private String description;

    @JsonProperty("features")
    private List<String> features;

    @JsonProperty("year_built")
    private Integer yearBuilt;

    @JsonProperty("listing_date")
    private LocalDate listingDate;

    private Listing() {}

    public Listing(String id, String address, String area, long price, int bedrooms, double bathrooms,
                   int squareFeet, String propertyType, ListingStatus status, String agentId,
                   String description, List<String> features) {
        this.id = id;
        this.address = address;
        this.area = area;
        this.price = price;
        this.bedrooms = bedrooms;
        this.bathrooms = bathrooms;
        this.squareFeet = squareFeet;
        this.propertyType = propertyType;
        this.status = status;
        this.agentId = agentId;
        this.description = description;
        this.features = features == null ? null : new ArrayList<>(features);
    }

    @Override
    public String getId() { return id; }

    public String getAddress() { return address == null ? "" : address; }

    public String getArea() { return area; }

    public long getPrice() { return price == null ? 0L : price; }

    public int getBedrooms() { return bedrooms; }

    public double getBathrooms() { return bathrooms; }

    /** Zero when the listing does not state its size */
    public int getSquareFeet() { return squareFeet; }

    public String getPropertyType() { return propertyType; }

    public String getStyle() { return style; }

    public ListingStatus getStatus() { return status == null ? ListingStatus.ACTIVE : status; }

    @JsonIgnore
    public boolean isActive() { return getStatus() == ListingStatus.ACTIVE; }

    public String getAgentId() { return agentId; }

    public String getDescription() { return description == null ? "" : description; }

    public List<String> getFeatures() {
        return features == null ? List.of() : Collections.unmodifiableList(features);
    }

    public Integer getYearBuilt() { return yearBuilt; }

    public LocalDate getListingDate() { return listingDate; }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (id == null || id.isBlank()) {
            problems.add("missing id");
        }
        if (price == null) {
            problems.add("missing price");
        } else if (price < 0) {
            problems.add("negative price " + price);
        }
        if (area == null || area.isBlank()) {
            problems.add("missing area");
        }
        if (bedrooms < 0 || bathrooms < 0 || squareFeet < 0) {
            problems.add("negative room count or size");
        }
        return problems;
    }

    @Override
    public String toString() {
        return "Listing{id=" + id + ", area=" + area + ", price=" + price + ", status=" + getStatus() + "}";
    }
}
