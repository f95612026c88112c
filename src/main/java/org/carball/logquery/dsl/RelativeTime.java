package org.carball.logquery.dsl;

import org.carball.logquery.error.SemanticException;

import java.time.Duration;
import java.util.Map;

/**
 * A "now minus N units" literal such as {@code -15m} or {@code -7d}. Only a single
 * magnitude/unit pair is supported.
 */
public record RelativeTime(long magnitude, String unit, String literal) {

    private static final Map<String, Duration> UNITS = Map.of(
            "s", Duration.ofSeconds(1),
            "m", Duration.ofMinutes(1),
            "h", Duration.ofHours(1),
            "d", Duration.ofDays(1));

    public static RelativeTime parse(String literal) throws SemanticException {
        if (literal == null || !literal.startsWith("-")) {
            throw new SemanticException("Invalid time interval: " + literal + ", must start with -");
        }

        int pos = 1;
        while (pos < literal.length() && Character.isDigit(literal.charAt(pos))) {
            pos++;
        }
        if (pos == 1) {
            throw new SemanticException("Invalid time interval format: " + literal);
        }

        long magnitude;
        try {
            magnitude = Long.parseLong(literal.substring(1, pos));
        } catch (NumberFormatException e) {
            throw new SemanticException("Time interval value out of range: " + literal);
        }
        if (magnitude == 0) {
            throw new SemanticException("Time interval value cannot be zero: " + literal);
        }

        String unit = literal.substring(pos);
        if (!UNITS.containsKey(unit)) {
            throw new SemanticException("Invalid time unit '" + unit + "' in " + literal + ", must be s, m, h, or d");
        }
        return new RelativeTime(magnitude, unit, literal);
    }

    public Duration toDuration() {
        return UNITS.get(unit).multipliedBy(magnitude);
    }
}
