package com.spantagger.domain.tagging.exception;

import com.spantagger.domain.tagging.model.Span;
import lombok.Getter;

@Getter
public class OutOfRangeException extends TaggingException {

    private final Span span;
    private final int length;

    public OutOfRangeException(Span span, int length) {
        super(String.format("Span %s [%d, %d) is outside a sequence of %d tokens",
                span.type(), span.start(), span.end(), length));
        this.span = span;
        this.length = length;
    }
}
