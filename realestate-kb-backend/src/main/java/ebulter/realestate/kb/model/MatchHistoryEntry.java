package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

@JsonIgnoreProperties(ignoreUnknown = true)
public class MatchHistoryEntry {
    @JsonProperty("listing_id")
    private String listingId;

    @JsonProperty("feedback")
    private String feedback;

    @JsonProperty("date")
    private LocalDate date;

    private MatchHistoryEntry() {}

    public MatchHistoryEntry(String listingId, String feedback, LocalDate date) {
        this.listingId = listingId;
        this.feedback = feedback;
        this.date = date;
    }

    public String getListingId() { return listingId; }

    public String getFeedback() { return feedback; }

    public LocalDate getDate() { return date; }
}
