package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Amenity categories; anything unrecognised is {@link #OTHER} rather than a malformed record
 */
public enum AmenityCategory {
    SCHOOL,
    PARK,
    SHOPPING,
    HEALTHCARE,
    OTHER;

    @JsonCreator
    public static AmenityCategory fromValue(String value) {
        if (value == null) {
            return OTHER;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "school", "schools" -> SCHOOL;
            case "park", "parks", "recreation" -> PARK;
            case "shopping", "shop", "retail" -> SHOPPING;
            case "healthcare", "hospital", "clinic" -> HEALTHCARE;
            default -> OTHER;
        };
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
