package com.spantagger.domain.tagging.model;

/**
 * Decoded tag.
 *
 * @param marker the prefix marker
 * @param type   entity type, null for the outside marker
 */
public record Tag(Marker marker, String type) {

    public static final Tag OUTSIDE = new Tag(Marker.OUTSIDE, null);

    public static final char SEPARATOR = '-';

    public boolean isOutside() {
        return marker == Marker.OUTSIDE;
    }

    public boolean hasType(String other) {
        return type != null && type.equals(other);
    }

    /**
     * Raw form, e.g. {@code "B-PER"} or {@code "O"}.
     */
    public String value() {
        return isOutside() ? String.valueOf(marker.symbol()) : marker.symbol() + String.valueOf(SEPARATOR) + type;
    }

    @Override
    public String toString() {
        return value();
    }
}
