package com.spantagger.interfaces.api.dto;

import com.spantagger.domain.tagging.model.Span;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * @param length token count; omitted means the sequence ends at the furthest span
 */
public record EncodeRequest(
        @NotNull(message = "Spans are required")
        @Size(max = 10000, message = "At most 10000 spans per request")
        List<@NotNull(message = "Span entries must not be null") @Valid SpanEntry> spans,

        @Min(value = 0, message = "Length must not be negative")
        @Max(value = 10000, message = "At most 10000 tokens per request")
        Integer length,

        String scheme
) {
    /**
     * Span as sent over the wire; the token list is implied by start and end.
     */
    public record SpanEntry(
            @NotBlank(message = "Span type is required")
            String type,

            @Min(value = 0, message = "Span start must not be negative")
            @Max(value = 10000, message = "Span start must be at most 10000")
            int start,

            @Min(value = 0, message = "Span end must not be negative")
            @Max(value = 10000, message = "Span end must be at most 10000")
            int end
    ) {}

    /**
     * @throws IllegalArgumentException if an entry has its start after its end
     */
    public List<Span> toSpans() {
        return spans.stream()
                .map(s -> Span.of(s.type(), s.start(), s.end()))
                .toList();
    }
}
