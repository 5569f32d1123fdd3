package ebulter.realestate.kb.service;

import ebulter.realestate.kb.exception.NotFoundException;
import ebulter.realestate.kb.model.BudgetRange;
import ebulter.realestate.kb.model.Client;
import ebulter.realestate.kb.model.ClientPreferences;
import ebulter.realestate.kb.model.EntityType;
import ebulter.realestate.kb.model.Listing;
import ebulter.realestate.kb.model.ListingMatch;
import ebulter.realestate.kb.model.ScoreBreakdown;
import ebulter.realestate.kb.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ranks active listings against a client's stated preferences.
 * <p>
 * Four components are scored in [0, 1]: price fit, bedroom fit, area match and type match.
 * A component the client did not state is left out entirely, so the score is the weighted
 * mean of the stated components scaled to 0-100.
 */
public class MatchingService {
    private static final Logger logger = LoggerFactory.getLogger(MatchingService.class);

    public static final double PRICE_WEIGHT = 40.0;
    public static final double BEDROOM_WEIGHT = 20.0;
    public static final double AREA_WEIGHT = 25.0;
    public static final double TYPE_WEIGHT = 15.0;

    /** Credit lost per percent the price lies outside the budget */
    public static final double PRICE_DECAY_PER_PERCENT = 0.02;

    public static final String PRICE_HINT = "price";
    public static final String BEDROOMS_HINT = "bedrooms";
    public static final String AREA_HINT = "area";
    public static final String TYPE_HINT = "type";

    /**
     * Ranked matches for a client, truncated to {@code limit} when it is positive
     * @throws NotFoundException if the client is not in the snapshot
     */
    public List<ListingMatch> match(Snapshot snapshot, String clientId, int limit) {
        Client client = snapshot.findClient(clientId)
                .orElseThrow(() -> new NotFoundException(EntityType.CLIENT, clientId));
        Set<String> priorMatches = new HashSet<>(snapshot.getIndex().priorMatchesForClient(client.getId()));
        List<ListingMatch> ranking = rank(snapshot.getListings(), client.getPreferences(), priorMatches);

        logger.debug("Client {} matched {} listings", clientId, ranking.size());
        if (limit > 0 && ranking.size() > limit) {
            return List.copyOf(ranking.subList(0, limit));
        }
        return ranking;
    }

    /**
     * Score every active listing of the pool and keep the ones scoring above zero,
     * best first, ties in pool order
     */
    public List<ListingMatch> rank(List<Listing> pool, ClientPreferences preferences, Set<String> priorMatches) {
        List<ListingMatch> matches = new ArrayList<>();
        for (Listing listing : pool) {
            if (!listing.isActive()) {
                continue;
            }
            ListingMatch match = score(listing, preferences, priorMatches.contains(listing.getId()));
            if (match.getScore() > 0) {
                matches.add(match);
            }
        }
        matches.sort(Comparator.comparingDouble(ListingMatch::getScore).reversed());
        return List.copyOf(matches);
    }

    public ListingMatch score(Listing listing, ClientPreferences preferences, boolean previouslyMatched) {
        ScoreBreakdown breakdown = new ScoreBreakdown(
                priceFit(listing.getPrice(), preferences.getBudgetRange()),
                bedroomFit(listing.getBedrooms(), preferences.getMinBedrooms()),
                membership(listing.getArea(), preferences.getDesiredAreas()),
                membership(listing.getPropertyType(), preferences.getPropertyTypes()));

        Double[] components = {breakdown.getPriceFit(), breakdown.getBedroomFit(),
                breakdown.getAreaMatch(), breakdown.getTypeMatch()};
        double[] weights = effectiveWeights(components, preferences.getWeights());

        double weighted = 0;
        double totalWeight = 0;
        for (int i = 0; i < components.length; i++) {
            if (components[i] != null) {
                weighted += weights[i] * components[i];
                totalWeight += weights[i];
            }
        }
        double score = totalWeight == 0 ? 0 : round2(100.0 * weighted / totalWeight);
        return new ListingMatch(listing, score, breakdown, previouslyMatched);
    }

    static Double priceFit(long price, BudgetRange budget) {
        if (budget == null || !budget.isStated()) {
            return null;
        }
        Long min = budget.getMin();
        Long max = budget.getMax();
        double distance;
        if (min != null && price < min) {
            distance = (min - price) / (double) Math.max(min, 1L);
        } else if (max != null && price > max) {
            distance = (price - max) / (double) Math.max(max, 1L);
        } else {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - distance * 100.0 * PRICE_DECAY_PER_PERCENT);
    }

    static Double bedroomFit(int bedrooms, Integer minBedrooms) {
        if (minBedrooms == null) {
            return null;
        }
        if (minBedrooms <= 0 || bedrooms >= minBedrooms) {
            return 1.0;
        }
        return Math.max(0, bedrooms) / (double) minBedrooms;
    }

    static Double membership(String value, Collection<String> desired) {
        if (desired.isEmpty()) {
            return null;
        }
        if (value == null) {
            return 0.0;
        }
        Set<String> normalized = desired.stream()
                .filter(Objects::nonNull)
                .map(d -> d.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        return normalized.contains(value.trim().toLowerCase(Locale.ROOT)) ? 1.0 : 0.0;
    }

    // Hints scale the base weights; if every stated weight ends up zero the base weights apply
    static double[] effectiveWeights(Double[] components, Map<String, Double> hints) {
        double[] base = {PRICE_WEIGHT, BEDROOM_WEIGHT, AREA_WEIGHT, TYPE_WEIGHT};
        String[] keys = {PRICE_HINT, BEDROOMS_HINT, AREA_HINT, TYPE_HINT};
        if (hints.isEmpty()) {
            return base;
        }
        double[] scaled = new double[base.length];
        double statedTotal = 0;
        for (int i = 0; i < base.length; i++) {
            Double hint = hints.get(keys[i]);
            double factor = hint == null || hint.isNaN() || hint.isInfinite() ? 1.0 : Math.max(0.0, hint);
            scaled[i] = base[i] * factor;
            if (components[i] != null) {
                statedTotal += scaled[i];
            }
        }
        return statedTotal > 0 ? scaled : base;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
