package ebulter.realestate.kb.service;

import ebulter.realestate.kb.exception.NotFoundException;
import ebulter.realestate.kb.model.AgentPerformance;
import ebulter.realestate.kb.model.AreaMarketSummary;
import ebulter.realestate.kb.model.MarketTrends;
import ebulter.realestate.kb.model.PriceDistribution;
import ebulter.realestate.kb.model.Snapshot;
import ebulter.realestate.kb.util.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AggregationServiceTest {

    private AggregationService aggregationService;
    private Snapshot snapshot;

    @BeforeEach
    void setUp() {
        aggregationService = new AggregationService();
        snapshot = TestRecords.fixtureLoader().load(1);
    }

    @Nested
    class AreaStats {

        @Test
        public void testSummarizesActiveListingsOfArea() {
            // Act
            AreaMarketSummary summary = aggregationService.areaStats(snapshot, "woodcrest");

            // Assert
            assertEquals("Woodcrest", summary.getAreaName());
            assertEquals(1, summary.getActiveListingCount());
            assertEquals(2, summary.getTotalListingCount());
            assertEquals(450000.0, summary.getAveragePrice());
            assertEquals(Long.valueOf(450000), summary.getMinPrice());
            assertEquals(Long.valueOf(450000), summary.getMaxPrice());
            assertEquals(250.0, summary.getPricePerSquareFoot(), 1e-9);
            assertEquals(2, summary.getAmenityCount());
        }

        @Test
        public void testAreaWithoutActiveListingsHasNoPrices() {
            // Arrange
            Snapshot quiet = Snapshot.builder().generation(1)
                    .areas(snapshot.getAreas())
                    .build();

            // Act
            AreaMarketSummary summary = aggregationService.areaStats(quiet, "Maple Heights");

            // Assert
            assertEquals(0, summary.getActiveListingCount());
            assertNull(summary.getAveragePrice());
            assertNull(summary.getMinPrice());
            assertNull(summary.getPricePerSquareFoot());
        }

        @Test
        public void testUnknownAreaIsNotFound() {
            assertThrows(NotFoundException.class, () -> aggregationService.areaStats(snapshot, "Atlantis"));
        }
    }

    @Nested
    class AgentStats {

        @Test
        public void testAgentWithTransactionsAndTestimonials() {
            // Act
            AgentPerformance performance = aggregationService.agentStats(snapshot, "A001");

            // Assert
            assertEquals("Sarah Johnson", performance.getName());
            assertEquals(2, performance.getClosedTransactionCount());
            assertEquals(483000, performance.getTotalClosingVolume());
            assertEquals(241500.0, performance.getAverageClosingPrice());
            assertEquals(20.0, performance.getAverageDaysOnMarket());
            assertEquals(1, performance.getActivePortfolioSize());
            assertEquals(2, performance.getTotalPortfolioSize());
            assertEquals(4.5, performance.getAverageClientRating());
            assertEquals(List.of("first-time buyers", "single family"), performance.getSpecializations());
        }

        @Test
        public void testAgentWithoutTestimonialsHasNoRating() {
            AgentPerformance performance = aggregationService.agentStats(snapshot, "A002");

            assertNull(performance.getAverageClientRating());
            assertEquals(2, performance.getActivePortfolioSize());
            assertEquals(1, performance.getClosedTransactionCount());
        }

        @Test
        public void testUnknownAgentIsNotFound() {
            assertThrows(NotFoundException.class, () -> aggregationService.agentStats(snapshot, "A404"));
        }
    }

    @Nested
    class Distribution {

        @Test
        public void testNearestRankPercentilesOverActiveListings() {
            // Act
            PriceDistribution distribution = aggregationService.priceDistribution(snapshot);

            // Assert
            assertEquals(3, distribution.getCount());
            assertEquals(Long.valueOf(380000), distribution.getMinPrice());
            assertEquals(Long.valueOf(900000), distribution.getMaxPrice());
            assertEquals(576666.67, distribution.getMeanPrice(), 0.01);
            assertEquals(Long.valueOf(450000), distribution.getMedianPrice());
            assertEquals(Long.valueOf(380000), distribution.getPercentile25());
            assertEquals(Long.valueOf(900000), distribution.getPercentile75());
        }

        @Test
        public void testEmptySnapshotGivesEmptyDistribution() {
            PriceDistribution distribution = aggregationService.priceDistribution(Snapshot.empty());

            assertEquals(0, distribution.getCount());
            assertNull(distribution.getMedianPrice());
        }
    }

    @Nested
    class Trends {

        @Test
        public void testAllAreasCountsSalesOnly() {
            // Act
            MarketTrends trends = aggregationService.marketTrends(snapshot, null);

            // Assert
            assertEquals(MarketTrends.ALL_AREAS, trends.getArea());
            assertEquals(2, trends.getTotalSales());
            assertEquals(510000.0, trends.getAverageSalePrice());
            assertEquals(25.0, trends.getAverageDaysOnMarket());
            assertEquals(720.0, trends.getAveragePricePerSqft());
        }

        @Test
        public void testSingleArea() {
            MarketTrends trends = aggregationService.marketTrends(snapshot, "Woodcrest");

            assertEquals("Woodcrest", trends.getArea());
            assertEquals(1, trends.getTotalSales());
            assertEquals(480000.0, trends.getAverageSalePrice());
            assertNull(trends.getAveragePricePerSqft());
        }

        @Test
        public void testUnknownAreaIsNotFound() {
            assertThrows(NotFoundException.class, () -> aggregationService.marketTrends(snapshot, "Atlantis"));
        }
    }

    @Test
    public void testCompareAreasSkipsUnknownAndKeepsOrder() {
        // Act
        List<AreaMarketSummary> summaries = aggregationService.compareAreas(snapshot,
                List.of("Downtown Riverside", "Atlantis", "Woodcrest"));

        // Assert
        assertEquals(List.of("Downtown Riverside", "Woodcrest"),
                summaries.stream().map(AreaMarketSummary::getAreaName).collect(Collectors.toList()));
        assertEquals(750.0, summaries.get(0).getPricePerSquareFoot(), 1e-9);
    }
}
