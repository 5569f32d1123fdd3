package ebulter.realestate.kb.model;

/**
 * Market figures for one area, computed over its active listings.
 * Price fields are null when the area has no active listing.
 */
public class AreaMarketSummary {
    private final String areaName;
    private final int activeListingCount;
    private final int totalListingCount;
    private final Double averagePrice;
    private final Long minPrice;
    private final Long maxPrice;
    private final Double pricePerSquareFoot;
    private final int amenityCount;

    public AreaMarketSummary(String areaName, int activeListingCount, int totalListingCount, Double averagePrice,
                             Long minPrice, Long maxPrice, Double pricePerSquareFoot, int amenityCount) {
        this.areaName = areaName;
        this.activeListingCount = activeListingCount;
        this.totalListingCount = totalListingCount;
        this.averagePrice = averagePrice;
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
        this.pricePerSquareFoot = pricePerSquareFoot;
        this.amenityCount = amenityCount;
    }

    public String getAreaName() { return areaName; }

    public int getActiveListingCount() { return activeListingCount; }

    public int getTotalListingCount() { return totalListingCount; }

    public Double getAveragePrice() { return averagePrice; }

    public Long getMinPrice() { return minPrice; }

    public Long getMaxPrice() { return maxPrice; }

    public Double getPricePerSquareFoot() { return pricePerSquareFoot; }

    public int getAmenityCount() { return amenityCount; }
}
