package ebulter.realestate.kb.model;

import java.util.List;

public class AgentPerformance {
    private final String agentId;
    private final String name;
    private final int closedTransactionCount;
    private final long totalClosingVolume;
    private final Double averageClosingPrice;
    private final Double averageDaysOnMarket;
    private final int activePortfolioSize;
    private final int totalPortfolioSize;
    private final Double averageClientRating;
    private final List<String> specializations;

    public AgentPerformance(String agentId, String name, int closedTransactionCount, long totalClosingVolume,
                            Double averageClosingPrice, Double averageDaysOnMarket, int activePortfolioSize,
                            int totalPortfolioSize, Double averageClientRating, List<String> specializations) {
        this.agentId = agentId;
        this.name = name;
        this.closedTransactionCount = closedTransactionCount;
        this.totalClosingVolume = totalClosingVolume;
        this.averageClosingPrice = averageClosingPrice;
        this.averageDaysOnMarket = averageDaysOnMarket;
        this.activePortfolioSize = activePortfolioSize;
        this.totalPortfolioSize = totalPortfolioSize;
        this.averageClientRating = averageClientRating;
        this.specializations = List.copyOf(specializations);
    }

    public String getAgentId() { return agentId; }

    public String getName() { return name; }

    public int getClosedTransactionCount() { return closedTransactionCount; }

    public long getTotalClosingVolume() { return totalClosingVolume; }

    public Double getAverageClosingPrice() { return averageClosingPrice; }

    public Double getAverageDaysOnMarket() { return averageDaysOnMarket; }

    public int getActivePortfolioSize() { return activePortfolioSize; }

    public int getTotalPortfolioSize() { return totalPortfolioSize; }

    public Double getAverageClientRating() { return averageClientRating; }

    public List<String> getSpecializations() { return specializations; }
}
