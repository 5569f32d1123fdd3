package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Testimonial {
    @JsonProperty("client_name")
    private String clientName;

    @JsonProperty("rating")
    private double rating;

    @JsonProperty("comment")
    private String comment;

    private Testimonial() {}

    public Testimonial(String clientName, double rating, String comment) {
        this.clientName = clientName;
        this.rating = rating;
        this.comment = comment;
    }

    public String getClientName() { return clientName; }

    public double getRating() { return rating; }

    public String getComment() { return comment; }
}
