package ebulter.realestate.kb.model;

import java.util.List;

/**
 * A listing together with everything it is cross-referenced to.
 * Agent and area are null when the listing's references do not resolve.
 */
public class ListingInsights {
    private final Listing listing;
    private final Agent agent;
    private final Area area;
    private final AreaMarketSummary areaSummary;
    private final List<Transaction> comparableSales;
    private final List<Amenity> amenities;

    public ListingInsights(Listing listing, Agent agent, Area area, AreaMarketSummary areaSummary,
                           List<Transaction> comparableSales, List<Amenity> amenities) {
        this.listing = listing;
        this.agent = agent;
        this.area = area;
        this.areaSummary = areaSummary;
        this.comparableSales = List.copyOf(comparableSales);
        this.amenities = List.copyOf(amenities);
    }

    public Listing getListing() { return listing; }

    public Agent getAgent() { return agent; }

    public Area getArea() { return area; }

    public AreaMarketSummary getAreaSummary() { return areaSummary; }

    public List<Transaction> getComparableSales() { return comparableSales; }

    public List<Amenity> getAmenities() { return amenities; }
}
