package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ClientRole {
    BUYER,
    SELLER,
    INVESTOR;

    @JsonCreator
    public static ClientRole fromValue(String value) {
        if (value == null || value.isBlank()) {
            return BUYER;
        }
        return ClientRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
