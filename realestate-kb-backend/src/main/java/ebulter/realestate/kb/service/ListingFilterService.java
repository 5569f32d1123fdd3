package ebulter.realestate.kb.service;

import ebulter.realestate.kb.exception.InvalidCriteriaException;
import ebulter.realestate.kb.model.Agent;
import ebulter.realestate.kb.model.Listing;
import ebulter.realestate.kb.model.ListingCriteria;
import ebulter.realestate.kb.model.ListingPage;
import ebulter.realestate.kb.model.ListingSort;
import ebulter.realestate.kb.model.ListingStatus;
import ebulter.realestate.kb.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Filters listings of one snapshot by {@link ListingCriteria}.
 * Each supplied criterion becomes its own predicate; a listing has to pass all of them.
 */
public class ListingFilterService {
    private static final Logger logger = LoggerFactory.getLogger(ListingFilterService.class);

    /**
     * Listings matching every supplied criterion, in insertion order unless a price sort is requested
     * @throws InvalidCriteriaException for reversed or negative bounds
     */
    public List<Listing> filter(Snapshot snapshot, ListingCriteria criteria) {
        validate(criteria);
        Predicate<Listing> predicate = predicateFor(criteria);

        List<Listing> matches = snapshot.getListings().stream()
                .filter(predicate)
                .collect(Collectors.toCollection(ArrayList::new));
        Comparator<Listing> comparator = comparatorFor(criteria.getSort());
        if (comparator != null) {
            // List.sort is stable, equal prices keep insertion order
            matches.sort(comparator);
        }

        logger.debug("Filter {} matched {} of {} listings", criteria, matches.size(), snapshot.getListings().size());
        return Collections.unmodifiableList(matches);
    }

    /**
     * One 1-based page of the filter result
     */
    public ListingPage filterPage(Snapshot snapshot, ListingCriteria criteria, int page, int pageSize) {
        if (page < 1) {
            throw new InvalidCriteriaException("page", "page must be at least 1, got " + page);
        }
        if (pageSize < 1) {
            throw new InvalidCriteriaException("pageSize", "pageSize must be at least 1, got " + pageSize);
        }
        List<Listing> matches = filter(snapshot, criteria);

        int totalCount = matches.size();
        int totalPages = (int) Math.ceil((double) totalCount / pageSize);
        long startIndex = (long) (page - 1) * pageSize;
        List<Listing> pageListings = startIndex >= totalCount
                ? List.of()
                : matches.subList((int) startIndex, (int) Math.min(startIndex + pageSize, totalCount));

        return new ListingPage(pageListings, totalCount, page, pageSize, totalPages);
    }

    public List<Listing> search(Snapshot snapshot, String text) {
        return filter(snapshot, ListingCriteria.builder().text(text).build());
    }

    /**
     * Agents whose name, specializations, expertise areas or bio contain the text. A blank text returns all agents.
     */
    public List<Agent> searchAgents(Snapshot snapshot, String text) {
        if (text == null || text.isBlank()) {
            return snapshot.getAgents();
        }
        String needle = normalize(text);
        return snapshot.getAgents().stream()
                .filter(agent -> contains(agent.getName(), needle)
                        || anyContains(agent.getSpecializations(), needle)
                        || anyContains(agent.getExpertiseAreas(), needle)
                        || contains(agent.getBio(), needle))
                .collect(Collectors.toUnmodifiableList());
    }

    void validate(ListingCriteria criteria) {
        checkRange("price", criteria.getMinPrice(), criteria.getMaxPrice());
        checkRange("bedrooms", criteria.getMinBedrooms(), criteria.getMaxBedrooms());
        checkRange("bathrooms", criteria.getMinBathrooms(), criteria.getMaxBathrooms());
        checkRange("squareFeet", criteria.getMinSquareFeet(), criteria.getMaxSquareFeet());
    }

    private static <T extends Number & Comparable<T>> void checkRange(String field, T min, T max) {
        if ((min != null && min.doubleValue() < 0) || (max != null && max.doubleValue() < 0)) {
            throw new InvalidCriteriaException(field,
                    field + " bounds must not be negative (min=" + min + ", max=" + max + ")", min, max);
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new InvalidCriteriaException(field,
                    field + " minimum " + min + " is greater than maximum " + max, min, max);
        }
    }

    private static Predicate<Listing> predicateFor(ListingCriteria criteria) {
        List<Predicate<Listing>> predicates = new ArrayList<>();

        Long minPrice = criteria.getMinPrice();
        Long maxPrice = criteria.getMaxPrice();
        if (minPrice != null) predicates.add(l -> l.getPrice() >= minPrice);
        if (maxPrice != null) predicates.add(l -> l.getPrice() <= maxPrice);

        Integer minBedrooms = criteria.getMinBedrooms();
        Integer maxBedrooms = criteria.getMaxBedrooms();
        if (minBedrooms != null) predicates.add(l -> l.getBedrooms() >= minBedrooms);
        if (maxBedrooms != null) predicates.add(l -> l.getBedrooms() <= maxBedrooms);

        Double minBathrooms = criteria.getMinBathrooms();
        Double maxBathrooms = criteria.getMaxBathrooms();
        if (minBathrooms != null) predicates.add(l -> l.getBathrooms() >= minBathrooms);
        if (maxBathrooms != null) predicates.add(l -> l.getBathrooms() <= maxBathrooms);

        Integer minSquareFeet = criteria.getMinSquareFeet();
        Integer maxSquareFeet = criteria.getMaxSquareFeet();
        if (minSquareFeet != null) predicates.add(l -> l.getSquareFeet() >= minSquareFeet);
        if (maxSquareFeet != null) predicates.add(l -> l.getSquareFeet() <= maxSquareFeet);

        if (!criteria.getPropertyTypes().isEmpty()) {
            Set<String> types = normalizeAll(criteria.getPropertyTypes());
            predicates.add(l -> l.getPropertyType() != null && types.contains(normalize(l.getPropertyType())));
        }

        if (!criteria.getStatuses().isEmpty()) {
            Set<ListingStatus> statuses = criteria.getStatuses();
            predicates.add(l -> statuses.contains(l.getStatus()));
        }

        if (!criteria.getAreas().isEmpty()) {
            Set<String> areas = normalizeAll(criteria.getAreas());
            predicates.add(l -> l.getArea() != null && areas.contains(normalize(l.getArea())));
        }

        for (String feature : criteria.getFeatures()) {
            String tag = normalize(feature);
            predicates.add(l -> anyContains(l.getFeatures(), tag));
        }

        String text = criteria.getText();
        if (text != null && !text.isBlank()) {
            String needle = normalize(text);
            predicates.add(l -> contains(l.getAddress(), needle)
                    || contains(l.getDescription(), needle)
                    || anyContains(l.getFeatures(), needle));
        }

        return predicates.stream().reduce(l -> true, Predicate::and);
    }

    private static Comparator<Listing> comparatorFor(ListingSort sort) {
        return switch (sort) {
            case PRICE_ASC -> Comparator.comparingLong(Listing::getPrice);
            case PRICE_DESC -> Comparator.comparingLong(Listing::getPrice).reversed();
            case INSERTION -> null;
        };
    }

    private static boolean anyContains(Collection<String> values, String needle) {
        for (String value : values) {
            if (contains(value, needle)) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static Set<String> normalizeAll(Collection<String> values) {
        return values.stream().map(ListingFilterService::normalize).collect(Collectors.toSet());
    }
}
