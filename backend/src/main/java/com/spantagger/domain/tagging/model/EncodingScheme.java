package com.spantagger.domain.tagging.model;

import com.spantagger.domain.tagging.exception.MalformedTagException;
import com.spantagger.domain.tagging.exception.UnknownSchemeException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The five supported span-encoding conventions.
 *
 * Each constant is a small data table: which marker renders each {@link TokenRole},
 * and whether spans are closed explicitly (IOBES, BILOU, BMEWO) or only inferred from
 * the next tag (IOB, BIO). Parser, encoder and transition table read these tables
 * and contain no per-scheme branches of their own.
 *
 * IOB (a.k.a. IOB1) shares BIO's alphabet but writes {@code B} only on the first token of
 * a span that directly follows another span of the same type; every other token is {@code I}.
 */
public enum EncodingScheme {
    IOB(Marker.BEGIN, Marker.INSIDE, Marker.INSIDE, Marker.BEGIN, false, true, "iob", "iob1"),
    BIO(Marker.BEGIN, Marker.INSIDE, Marker.INSIDE, Marker.BEGIN, false, false, "bio", "iob2"),
    IOBES(Marker.BEGIN, Marker.INSIDE, Marker.END, Marker.SINGLE, true, false, "iobes"),
    BILOU(Marker.BEGIN, Marker.INSIDE, Marker.LAST, Marker.UNIT, true, false, "bilou"),
    BMEWO(Marker.BEGIN, Marker.MIDDLE, Marker.END, Marker.WHOLE, true, false, "bmewo", "bmeow");

    private final Marker beginMarker;
    private final Marker insideMarker;
    private final Marker endMarker;
    private final Marker singleMarker;
    private final boolean explicitBoundary;
    private final boolean beginOnlyAtBoundary;
    private final List<String> names;
    private final Set<Marker> alphabet;

    EncodingScheme(Marker beginMarker,
                   Marker insideMarker,
                   Marker endMarker,
                   Marker singleMarker,
                   boolean explicitBoundary,
                   boolean beginOnlyAtBoundary,
                   String... names) {
        this.beginMarker = beginMarker;
        this.insideMarker = insideMarker;
        this.endMarker = endMarker;
        this.singleMarker = singleMarker;
        this.explicitBoundary = explicitBoundary;
        this.beginOnlyAtBoundary = beginOnlyAtBoundary;
        this.names = List.of(names);
        this.alphabet = Collections.unmodifiableSet(
                EnumSet.of(Marker.OUTSIDE, beginMarker, insideMarker, endMarker, singleMarker));
    }

    /**
     * Resolve a scheme by name, case-insensitively. Accepts the aliases IOB1 and IOB2.
     *
     * @throws UnknownSchemeException if no scheme answers to {@code name}
     */
    public static EncodingScheme fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (EncodingScheme scheme : values()) {
                if (scheme.names.contains(key)) {
                    return scheme;
                }
            }
        }
        throw new UnknownSchemeException(name);
    }

    /**
     * True when every span carries its own end (or singleton) marker.
     */
    public boolean explicitBoundary() {
        return explicitBoundary;
    }

    /**
     * True when the begin marker is reserved for a span directly following a span of the same type.
     */
    public boolean beginOnlyAtBoundary() {
        return beginOnlyAtBoundary;
    }

    public Set<Marker> alphabet() {
        return alphabet;
    }

    /**
     * Role of {@code marker} in this scheme, or null if the marker is not in the alphabet.
     * In the lookahead family a span's end is never written, so only OUTSIDE, BEGIN and INSIDE occur.
     */
    public TokenRole roleOf(Marker marker) {
        if (marker == Marker.OUTSIDE) {
            return TokenRole.OUTSIDE;
        }
        if (explicitBoundary) {
            if (marker == singleMarker) return TokenRole.SINGLE;
            if (marker == endMarker) return TokenRole.END;
        }
        if (marker == beginMarker) return TokenRole.BEGIN;
        if (marker == insideMarker) return TokenRole.INSIDE;
        return null;
    }

    public TokenRole roleOf(Tag tag) {
        return roleOf(tag.marker());
    }

    /**
     * Marker for a token at {@code position} in its span.
     *
     * @param position        BEGIN, INSIDE, END for first, middle and last token; SINGLE for a one-token span
     * @param followsSameType whether the span starts right after a span of the same type
     */
    public Marker markerFor(TokenRole position, boolean followsSameType) {
        if (beginOnlyAtBoundary) {
            boolean first = position == TokenRole.BEGIN || position == TokenRole.SINGLE;
            return first && followsSameType ? beginMarker : insideMarker;
        }
        return switch (position) {
            case OUTSIDE -> Marker.OUTSIDE;
            case BEGIN -> beginMarker;
            case INSIDE -> insideMarker;
            case END -> endMarker;
            case SINGLE -> singleMarker;
        };
    }

    /**
     * Decode one raw tag: either {@code "O"} or {@code "<marker>-<type>"}, split on the first separator.
     *
     * @throws MalformedTagException if the marker is not in this scheme or the type is missing
     */
    public Tag decode(String raw) {
        if (raw == null) {
            throw new MalformedTagException(null, this);
        }
        if (raw.length() == 1 && raw.charAt(0) == Marker.OUTSIDE.symbol()) {
            return Tag.OUTSIDE;
        }
        // exactly one marker character, then the separator, then a non-empty type
        if (raw.length() < 3 || raw.charAt(1) != Tag.SEPARATOR) {
            throw new MalformedTagException(raw, this);
        }
        Marker marker = Marker.ofSymbol(raw.charAt(0));
        if (marker == null || marker == Marker.OUTSIDE || !alphabet.contains(marker)) {
            throw new MalformedTagException(raw, this);
        }
        return new Tag(marker, raw.substring(2));
    }

    public List<Tag> decodeAll(List<String> raw) {
        List<Tag> tags = new ArrayList<>(raw.size());
        for (String value : raw) {
            tags.add(decode(value));
        }
        return tags;
    }

    /**
     * Every raw tag this scheme can produce for the given entity types: {@code "O"} first,
     * then each typed marker in alphabet order, type by type. Repeated types are listed once.
     */
    public List<String> tagsFor(Collection<String> types) {
        List<String> tags = new ArrayList<>();
        tags.add(Tag.OUTSIDE.value());
        for (String type : new LinkedHashSet<>(types)) {
            for (Marker marker : alphabet) {
                if (marker != Marker.OUTSIDE) {
                    tags.add(new Tag(marker, type).value());
                }
            }
        }
        return tags;
    }
}
