package ebulter.realestate.kb.service;

import ebulter.realestate.kb.exception.NotFoundException;
import ebulter.realestate.kb.model.Agent;
import ebulter.realestate.kb.model.AgentPerformance;
import ebulter.realestate.kb.model.Area;
import ebulter.realestate.kb.model.AreaMarketSummary;
import ebulter.realestate.kb.model.CrossReferenceIndex;
import ebulter.realestate.kb.model.EntityType;
import ebulter.realestate.kb.model.Listing;
import ebulter.realestate.kb.model.MarketTrends;
import ebulter.realestate.kb.model.PriceDistribution;
import ebulter.realestate.kb.model.Snapshot;
import ebulter.realestate.kb.model.Testimonial;
import ebulter.realestate.kb.model.Transaction;
import ebulter.realestate.kb.model.TransactionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.LongSummaryStatistics;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Read-only statistics over one snapshot. Every method is a pure function of its arguments.
 */
public class AggregationService {
    private static final Logger logger = LoggerFactory.getLogger(AggregationService.class);

    public AreaMarketSummary areaStats(Snapshot snapshot, String areaName) {
        Area area = requireArea(snapshot, areaName);
        return summarize(snapshot, area);
    }

    public AgentPerformance agentStats(Snapshot snapshot, String agentId) {
        Agent agent = snapshot.findAgent(agentId)
                .orElseThrow(() -> new NotFoundException(EntityType.AGENT, agentId));
        CrossReferenceIndex index = snapshot.getIndex();

        List<Listing> portfolio = snapshot.listings(index.listingsForAgent(agent.getId()));
        int activePortfolio = (int) portfolio.stream().filter(Listing::isActive).count();

        List<Transaction> transactions = snapshot.transactions(index.transactionsForAgent(agent.getId()));
        LongSummaryStatistics closing = transactions.stream()
                .mapToLong(Transaction::getClosingPrice)
                .summaryStatistics();
        Double averageDaysOnMarket = boxed(transactions.stream()
                .filter(t -> t.getDaysOnMarket() != null)
                .mapToInt(Transaction::getDaysOnMarket)
                .average());
        Double averageRating = boxed(agent.getTestimonials().stream()
                .mapToDouble(Testimonial::getRating)
                .average());

        return new AgentPerformance(agent.getId(), agent.getName(), transactions.size(), closing.getSum(),
                closing.getCount() == 0 ? null : closing.getAverage(), averageDaysOnMarket,
                activePortfolio, portfolio.size(), averageRating, agent.getSpecializations());
    }

    /**
     * Price distribution of the active listings; percentiles use the nearest-rank method
     */
    public PriceDistribution priceDistribution(Snapshot snapshot) {
        long[] prices = snapshot.getListings().stream()
                .filter(Listing::isActive)
                .mapToLong(Listing::getPrice)
                .sorted()
                .toArray();
        if (prices.length == 0) {
            return PriceDistribution.empty();
        }
        double mean = 0;
        for (long price : prices) {
            mean += price;
        }
        mean /= prices.length;
        return new PriceDistribution(prices.length, prices[0], prices[prices.length - 1], mean,
                nearestRank(prices, 50), nearestRank(prices, 25), nearestRank(prices, 75));
    }

    /**
     * Sale statistics for one area, or for every area when {@code areaName} is null or blank.
     * Leases are not counted as sales.
     */
    public MarketTrends marketTrends(Snapshot snapshot, String areaName) {
        List<Transaction> transactions;
        String label;
        if (areaName == null || areaName.isBlank()) {
            transactions = snapshot.getTransactions();
            label = MarketTrends.ALL_AREAS;
        } else {
            Area area = requireArea(snapshot, areaName);
            transactions = snapshot.transactions(snapshot.getIndex().transactionsForArea(area.getName()));
            label = area.getName();
        }

        List<Transaction> sales = transactions.stream()
                .filter(t -> t.getType() == TransactionType.SALE)
                .collect(Collectors.toList());
        Double averagePrice = boxed(sales.stream().mapToLong(Transaction::getClosingPrice).average());
        Double averageDays = boxed(sales.stream()
                .filter(t -> t.getDaysOnMarket() != null)
                .mapToInt(Transaction::getDaysOnMarket)
                .average());
        List<Double> pricesPerSqft = new ArrayList<>();
        for (Transaction sale : sales) {
            pricePerSqft(snapshot, sale).ifPresent(pricesPerSqft::add);
        }
        Double averagePerSqft = boxed(pricesPerSqft.stream().mapToDouble(Double::doubleValue).average());

        return new MarketTrends(label, sales.size(), averagePrice, averageDays, averagePerSqft);
    }

    /**
     * Summaries for the named areas in the order given; unknown names are skipped
     */
    public List<AreaMarketSummary> compareAreas(Snapshot snapshot, Collection<String> areaNames) {
        List<AreaMarketSummary> summaries = new ArrayList<>();
        for (String name : areaNames) {
            Optional<Area> area = snapshot.findArea(name);
            if (area.isPresent()) {
                summaries.add(summarize(snapshot, area.get()));
            } else {
                logger.debug("Skipping unknown area {} in comparison", name);
            }
        }
        return summaries;
    }

    AreaMarketSummary summarize(Snapshot snapshot, Area area) {
        CrossReferenceIndex index = snapshot.getIndex();
        List<Listing> listings = snapshot.listings(index.listingsForArea(area.getName()));
        List<Listing> active = listings.stream().filter(Listing::isActive).collect(Collectors.toList());

        LongSummaryStatistics prices = active.stream().mapToLong(Listing::getPrice).summaryStatistics();
        long pricedSquareFeet = 0;
        long pricedTotal = 0;
        for (Listing listing : active) {
            if (listing.getSquareFeet() > 0) {
                pricedSquareFeet += listing.getSquareFeet();
                pricedTotal += listing.getPrice();
            }
        }
        boolean any = prices.getCount() > 0;
        return new AreaMarketSummary(area.getName(), active.size(), listings.size(),
                any ? prices.getAverage() : null,
                any ? prices.getMin() : null,
                any ? prices.getMax() : null,
                pricedSquareFeet > 0 ? (double) pricedTotal / pricedSquareFeet : null,
                index.amenitiesForArea(area.getName()).size());
    }

    private static Area requireArea(Snapshot snapshot, String areaName) {
        return snapshot.findArea(areaName)
                .orElseThrow(() -> new NotFoundException(EntityType.AREA, areaName));
    }

    // Recorded price per square foot, else derived from the listing's size
    private static Optional<Double> pricePerSqft(Snapshot snapshot, Transaction sale) {
        if (sale.getPricePerSqft() != null) {
            return Optional.of(sale.getPricePerSqft());
        }
        return snapshot.findListing(sale.getListingId())
                .filter(listing -> listing.getSquareFeet() > 0)
                .map(listing -> (double) sale.getClosingPrice() / listing.getSquareFeet());
    }

    private static long nearestRank(long[] sorted, int percentile) {
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
        return sorted[Math.max(rank, 1) - 1];
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
