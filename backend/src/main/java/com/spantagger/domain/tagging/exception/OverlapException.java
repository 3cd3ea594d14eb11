package com.spantagger.domain.tagging.exception;

import com.spantagger.domain.tagging.model.Span;
import lombok.Getter;

@Getter
public class OverlapException extends TaggingException {

    private final Span first;
    private final Span second;

    public OverlapException(Span first, Span second) {
        super(String.format("Spans overlap: %s [%d, %d) and %s [%d, %d)",
                first.type(), first.start(), first.end(),
                second.type(), second.start(), second.end()));
        this.first = first;
        this.second = second;
    }
}
