package ebulter.realestate.kb.model;

import java.util.Locale;

public enum ListingSort {
    INSERTION,
    PRICE_ASC,
    PRICE_DESC;

    /**
     * Parse "price"/"asc"/"desc" style caller input; null or blank keeps insertion order
     */
    public static ListingSort fromValue(String sortBy, String sortOrder) {
        if (sortBy == null || sortBy.isBlank()) {
            return INSERTION;
        }
        if (!"price".equals(sortBy.trim().toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Unsupported sort key: " + sortBy);
        }
        return "desc".equalsIgnoreCase(sortOrder) ? PRICE_DESC : PRICE_ASC;
    }
}
