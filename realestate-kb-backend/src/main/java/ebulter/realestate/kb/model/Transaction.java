package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A closed sale or lease. The area is optional; when absent the listing's area is used.
 * Sale documents may spell the price and date as sale_price and sale_date.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Transaction implements KnowledgeRecord {
    @JsonProperty("id")
    private String id;

    @JsonProperty("listing_id")
    private String listingId;

    @JsonProperty("agent_id")
    private String agentId;

    @JsonProperty("area")
    private String area;

    @JsonProperty("closing_price")
    @JsonAlias("sale_price")
    private Long closingPrice;

    @JsonProperty("closing_date")
    @JsonAlias("sale_date")
    private LocalDate closingDate;

    @JsonProperty("type")
    private TransactionType type;

    @JsonProperty("days_on_market")
    private Integer daysOnMarket;

    @JsonProperty("price_per_sqft")
    private Double pricePerSqft;

    private Transaction() {}

    public Transaction(String id, String listingId, String agentId, String area, long closingPrice,
                       LocalDate closingDate, TransactionType type, Integer daysOnMarket, Double pricePerSqft) {
        this.id = id;
        this.listingId = listingId;
        this.agentId = agentId;
        this.area = area;
        this.closingPrice = closingPrice;
        this.closingDate = closingDate;
        this.type = type;
        this.daysOnMarket = daysOnMarket;
        this.pricePerSqft = pricePerSqft;
    }

    @Override
    public String getId() { return id; }

    public String getListingId() { return listingId; }

    public String getAgentId() { return agentId; }

    public String getArea() { return area; }

    public long getClosingPrice() { return closingPrice == null ? 0L : closingPrice; }

    public LocalDate getClosingDate() { return closingDate; }

    public TransactionType getType() { return type == null ? TransactionType.SALE : type; }

    public Integer getDaysOnMarket() { return daysOnMarket; }

    public Double getPricePerSqft() { return pricePerSqft; }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (id == null || id.isBlank()) {
            problems.add("missing id");
        }
        if (closingPrice == null) {
            problems.add("missing closing price");
        } else if (closingPrice < 0) {
            problems.add("negative closing price " + closingPrice);
        }
        return problems;
    }
}
