package guraa.wiringdoc.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * How the interleaver treats tracks of unequal length.
 */
public enum TrackLengthPolicy {
    /** Exhausted tracks drop out and the remaining tracks keep interleaving. */
    SHRINK,
    /** Tracks of unequal length are a configuration error. */
    STRICT;

    @JsonCreator
    public static TrackLengthPolicy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SHRINK;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
