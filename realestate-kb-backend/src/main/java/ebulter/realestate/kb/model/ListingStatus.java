package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ListingStatus {
    ACTIVE,
    PENDING,
    SOLD;

    @JsonCreator
    public static ListingStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ACTIVE;
        }
        return ListingStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
