package com.spantagger.domain.tagging.model;

/**
 * Single-letter prefix of a tag. Which markers are legal, and what role each plays,
 * depends on the {@link EncodingScheme}.
 */
public enum Marker {
    OUTSIDE('O'),
    BEGIN('B'),
    INSIDE('I'),
    MIDDLE('M'),
    END('E'),
    LAST('L'),
    SINGLE('S'),
    UNIT('U'),
    WHOLE('W');

    private final char symbol;

    Marker(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * @return the marker written as {@code symbol}, or null if no marker uses it
     */
    public static Marker ofSymbol(char symbol) {
        for (Marker marker : values()) {
            if (marker.symbol == symbol) {
                return marker;
            }
        }
        return null;
    }
}
