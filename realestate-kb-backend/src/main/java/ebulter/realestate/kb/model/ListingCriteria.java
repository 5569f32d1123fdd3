package ebulter.realestate.kb.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Filter criteria for listing searches. Every field is optional; an unset field imposes no constraint.
 * Ranges are inclusive.
 */
public class ListingCriteria {
    private final Long minPrice;
    private final Long maxPrice;
    private final Integer minBedrooms;
    private final Integer maxBedrooms;
    private final Double minBathrooms;
    private final Double maxBathrooms;
    private final Integer minSquareFeet;
    private final Integer maxSquareFeet;
    private final Set<String> propertyTypes;
    private final Set<ListingStatus> statuses;
    private final Set<String> areas;
    private final List<String> features;
    private final String text;
    private final ListingSort sort;

    private ListingCriteria(Builder builder) {
        this.minPrice = builder.minPrice;
        this.maxPrice = builder.maxPrice;
        this.minBedrooms = builder.minBedrooms;
        this.maxBedrooms = builder.maxBedrooms;
        this.minBathrooms = builder.minBathrooms;
        this.maxBathrooms = builder.maxBathrooms;
        this.minSquareFeet = builder.minSquareFeet;
        this.maxSquareFeet = builder.maxSquareFeet;
        this.propertyTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.propertyTypes));
        this.statuses = builder.statuses.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.statuses));
        this.areas = Collections.unmodifiableSet(new LinkedHashSet<>(builder.areas));
        this.features = List.copyOf(builder.features);
        this.text = builder.text;
        this.sort = builder.sort == null ? ListingSort.INSERTION : builder.sort;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** No constraints at all */
    public static ListingCriteria any() {
        return builder().build();
    }

    public Long getMinPrice() { return minPrice; }

    public Long getMaxPrice() { return maxPrice; }

    public Integer getMinBedrooms() { return minBedrooms; }

    public Integer getMaxBedrooms() { return maxBedrooms; }

    public Double getMinBathrooms() { return minBathrooms; }

    public Double getMaxBathrooms() { return maxBathrooms; }

    public Integer getMinSquareFeet() { return minSquareFeet; }

    public Integer getMaxSquareFeet() { return maxSquareFeet; }

    public Set<String> getPropertyTypes() { return propertyTypes; }

    public Set<ListingStatus> getStatuses() { return statuses; }

    public Set<String> getAreas() { return areas; }

    public List<String> getFeatures() { return features; }

    public String getText() { return text; }

    public ListingSort getSort() { return sort; }

    @Override
    public String toString() {
        return "ListingCriteria{price=" + minPrice + ".." + maxPrice
                + ", bedrooms=" + minBedrooms + ".." + maxBedrooms
                + ", bathrooms=" + minBathrooms + ".." + maxBathrooms
                + ", squareFeet=" + minSquareFeet + ".." + maxSquareFeet
                + ", types=" + propertyTypes + ", statuses=" + statuses + ", areas=" + areas
                + ", features=" + features + ", text=" + text + ", sort=" + sort + "}";
    }

    public static class Builder {
        private Long minPrice;
        private Long maxPrice;
        private Integer minBedrooms;
        private Integer maxBedrooms;
        private Double minBathrooms;
        private Double maxBathrooms;
        private Integer minSquareFeet;
        private Integer maxSquareFeet;
        private final Set<String> propertyTypes = new LinkedHashSet<>();
        private final Set<ListingStatus> statuses = new LinkedHashSet<>();
        private final Set<String> areas = new LinkedHashSet<>();
        private final List<String> features = new ArrayList<>();
        private String text;
        private ListingSort sort;

        private Builder() {}

        public Builder minPrice(Long minPrice) {
            this.minPrice = minPrice;
            return this;
        }

        public Builder maxPrice(Long maxPrice) {
            this.maxPrice = maxPrice;
            return this;
        }

        public Builder minBedrooms(Integer minBedrooms) {
            this.minBedrooms = minBedrooms;
            return this;
        }

        public Builder maxBedrooms(Integer maxBedrooms) {
            this.maxBedrooms = maxBedrooms;
            return this;
        }

        public Builder minBathrooms(Double minBathrooms) {
            this.minBathrooms = minBathrooms;
            return this;
        }

        public Builder maxBathrooms(Double maxBathrooms) {
            this.maxBathrooms = maxBathrooms;
            return this;
        }

        public Builder minSquareFeet(Integer minSquareFeet) {
            this.minSquareFeet = minSquareFeet;
            return this;
        }

        public Builder maxSquareFeet(Integer maxSquareFeet) {
            this.maxSquareFeet = maxSquareFeet;
            return this;
        }

        public Builder propertyTypes(Collection<String> propertyTypes) {
            addAll(this.propertyTypes, propertyTypes);
            return this;
        }

        public Builder propertyType(String propertyType) {
            return propertyType == null ? this : propertyTypes(List.of(propertyType));
        }

        public Builder statuses(Collection<ListingStatus> statuses) {
            if (statuses != null) {
                this.statuses.addAll(statuses);
            }
            return this;
        }

        public Builder status(ListingStatus status) {
            return status == null ? this : statuses(List.of(status));
        }

        public Builder areas(Collection<String> areas) {
            addAll(this.areas, areas);
            return this;
        }

        public Builder area(String area) {
            return area == null ? this : areas(List.of(area));
        }

        public Builder features(Collection<String> features) {
            if (features != null) {
                features.stream().filter(f -> f != null && !f.isBlank()).forEach(this.features::add);
            }
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder sort(ListingSort sort) {
            this.sort = sort;
            return this;
        }

        public ListingCriteria build() {
            return new ListingCriteria(this);
        }

        private static void addAll(Set<String> target, Collection<String> values) {
            if (values != null) {
                values.stream().filter(v -> v != null && !v.isBlank()).forEach(target::add);
            }
        }
    }
}
