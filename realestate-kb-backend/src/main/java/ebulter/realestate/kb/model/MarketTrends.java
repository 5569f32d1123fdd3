package ebulter.realestate.kb.model;

public class MarketTrends {
    public static final String ALL_AREAS = "All Areas";

    private final String area;
    private final int totalSales;
    private final Double averageSalePrice;
    private final Double averageDaysOnMarket;
    private final Double averagePricePerSqft;

    public MarketTrends(String area, int totalSales, Double averageSalePrice, Double averageDaysOnMarket,
                        Double averagePricePerSqft) {
        this.area = area;
        this.totalSales = totalSales;
        this.averageSalePrice = averageSalePrice;
        this.averageDaysOnMarket = averageDaysOnMarket;
        this.averagePricePerSqft = averagePricePerSqft;
    }

    public String getArea() { return area; }

    public int getTotalSales() { return totalSales; }

    public Double getAverageSalePrice() { return averageSalePrice; }

    public Double getAverageDaysOnMarket() { return averageDaysOnMarket; }

    public Double getAveragePricePerSqft() { return averagePricePerSqft; }
}
