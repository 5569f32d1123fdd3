package ebulter.realestate.kb.model;

/**
 * Price spread of the active listings. Percentiles use the nearest-rank method.
 */
public class PriceDistribution {
    private final int count;
    private final Long minPrice;
    private final Long maxPrice;
    private final Double meanPrice;
    private final Long medianPrice;
    private final Long percentile25;
    private final Long percentile75;

    public PriceDistribution(int count, Long minPrice, Long maxPrice, Double meanPrice, Long medianPrice,
                             Long percentile25, Long percentile75) {
        this.count = count;
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
        this.meanPrice = meanPrice;
        this.medianPrice = medianPrice;
        this.percentile25 = percentile25;
        this.percentile75 = percentile75;
    }

    public static PriceDistribution empty() {
        return new PriceDistribution(0, null, null, null, null, null, null);
    }

    public int getCount() { return count; }

    public Long getMinPrice() { return minPrice; }

    public Long getMaxPrice() { return maxPrice; }

    public Double getMeanPrice() { return meanPrice; }

    public Long getMedianPrice() { return medianPrice; }

    public Long getPercentile25() { return percentile25; }

    public Long getPercentile75() { return percentile75; }
}
