package com.spantagger.infrastructure.tagging;

import com.spantagger.domain.tagging.exception.OutOfRangeException;
import com.spantagger.domain.tagging.exception.OverlapException;
import com.spantagger.domain.tagging.model.EncodingScheme;
import com.spantagger.domain.tagging.model.Marker;
import com.spantagger.domain.tagging.model.Span;
import com.spantagger.domain.tagging.model.Tag;
import com.spantagger.domain.tagging.model.TokenRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders spans back into one raw tag per token. Inverse of {@link TagParser}.
 */
@Slf4j
@Component
public class TagEncoder {

    /**
     * Encode with the sequence length taken from the furthest span end.
     */
    public List<String> encode(List<Span> spans, EncodingScheme scheme) {
        int length = spans.stream().mapToInt(Span::end).max().orElse(0);
        return encode(spans, length, scheme);
    }

    /**
     * Spans may come in any order; tokens no span covers are {@code O}.
     * Empty spans cover no token and leave no trace in the output.
     *
     * @throws OutOfRangeException if a span starts before 0 or ends after {@code length}
     * @throws OverlapException    if two spans share a token
     */
    public List<String> encode(List<Span> spans, int length, EncodingScheme scheme) {
        List<Span> sorted = new ArrayList<>(spans);
        sorted.sort(Span.BY_START);

        List<String> tags = new ArrayList<>(Collections.nCopies(length, Tag.OUTSIDE.value()));
        Span previous = null;
        for (Span span : sorted) {
            if (span.start() < 0 || span.end() > length) {
                throw new OutOfRangeException(span, length);
            }
            if (span.length() == 0) {
                continue;
            }
            if (previous != null && span.start() < previous.end()) {
                throw new OverlapException(previous, span);
            }

            boolean followsSameType = previous != null
                    && previous.end() == span.start()
                    && previous.type().equals(span.type());
            for (int token = span.start(); token < span.end(); token++) {
                Marker marker = scheme.markerFor(position(span, token), followsSameType);
                tags.set(token, new Tag(marker, span.type()).value());
            }
            previous = span;
        }

        log.debug("[TagEncoder] Encoded {} spans into {} {} tags", sorted.size(), length, scheme);
        return tags;
    }

    private TokenRole position(Span span, int token) {
        if (span.length() == 1) return TokenRole.SINGLE;
        if (token == span.start()) return TokenRole.BEGIN;
        if (token == span.end() - 1) return TokenRole.END;
        return TokenRole.INSIDE;
    }
}
