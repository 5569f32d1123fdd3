package ebulter.realestate.kb.util;

import java.time.Instant;

/**
 * Time provider interface for testability
 * Allows controlling load timestamps and durations in unit tests
 */
public interface TimeProvider {
    /**
     * Returns the current time in milliseconds
     */
    long currentTimeMillis();

    /**
     * Returns the current time as an instant, used to stamp snapshots
     */
    default Instant now() {
        return Instant.ofEpochMilli(currentTimeMillis());
    }
}
