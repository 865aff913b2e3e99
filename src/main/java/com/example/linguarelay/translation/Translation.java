package com.example.linguarelay.translation;

/**
 * Result of a gateway call. A degraded result carries the placeholder text and is relayed like any other.
 */
public record Translation(String text, boolean degraded, int attempts) {

    static final String UNAVAILABLE_PREFIX = "[Translation unavailable: ";

    public static Translation ok(String text, int attempts) {
        return new Translation(text, false, attempts);
    }

    public static Translation unavailable(String reason, int attempts) {
        return new Translation(UNAVAILABLE_PREFIX + reason + "]", true, attempts);
    }
}
