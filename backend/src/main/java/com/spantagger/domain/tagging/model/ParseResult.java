package com.spantagger.domain.tagging.model;

import java.util.List;

/**
 * Spans decoded from a tag sequence plus the repairs needed to get them.
 * {@code repairs} is empty unless the policy was {@link ErrorPolicy#KEEP_GOING}.
 */
public record ParseResult(
        List<Span> spans,
        List<Repair> repairs
) {
    public ParseResult {
        spans = List.copyOf(spans);
        repairs = List.copyOf(repairs);
    }

    public boolean repaired() {
        return !repairs.isEmpty();
    }
}
