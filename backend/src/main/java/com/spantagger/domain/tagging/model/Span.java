package com.spantagger.domain.tagging.model;

import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Value object for one labeled span of tokens.
 * Spans are always contiguous: {@code tokens} is exactly {@code [start, end)}.
 *
 * @param type   entity type, never blank
 * @param start  index of the first token
 * @param end    index one past the last token
 * @param tokens token indices covered, ascending
 */
public record Span(
        String type,
        int start,
        int end,
        List<Integer> tokens
) {

    public static final Comparator<Span> BY_START = Comparator
            .comparingInt(Span::start)
            .thenComparingInt(Span::end);

    public Span {
        if (type == null || type.isEmpty()) {
            throw new IllegalArgumentException("Span type must not be empty");
        }
        if (start > end) {
            throw new IllegalArgumentException("Span start " + start + " is after end " + end);
        }
        tokens = List.copyOf(tokens);
        if (!tokens.equals(range(start, end))) {
            throw new IllegalArgumentException(
                    "Span tokens " + tokens + " do not match [" + start + ", " + end + ")");
        }
    }

    public static Span of(String type, int start, int end) {
        return new Span(type, start, end, range(start, end));
    }

    public int length() {
        return end - start;
    }

    private static List<Integer> range(int start, int end) {
        return IntStream.range(start, end).boxed().toList();
    }
}
