package ebulter.realestate.kb.model;

import java.util.List;

public class AreaReport {
    private final Area area;
    private final AreaMarketSummary summary;
    private final List<Listing> listings;
    private final List<Transaction> recentSales;
    private final List<Amenity> amenities;
    private final MarketTrends trends;

    public AreaReport(Area area, AreaMarketSummary summary, List<Listing> listings, List<Transaction> recentSales,
                      List<Amenity> amenities, MarketTrends trends) {
        this.area = area;
        this.summary = summary;
        this.listings = List.copyOf(listings);
        this.recentSales = List.copyOf(recentSales);
        this.amenities = List.copyOf(amenities);
        this.trends = trends;
    }

    public Area getArea() { return area; }

    public AreaMarketSummary getSummary() { return summary; }

    public List<Listing> getListings() { return listings; }

    public List<Transaction> getRecentSales() { return recentSales; }

    public List<Amenity> getAmenities() { return amenities; }

    public MarketTrends getTrends() { return trends; }
}
