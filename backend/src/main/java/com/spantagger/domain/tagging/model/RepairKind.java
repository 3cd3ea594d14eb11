package com.spantagger.domain.tagging.model;

public enum RepairKind {
    /** Continuation marker with no open span of its type; a new span was opened. */
    CONTINUATION_AS_BEGIN,
    /** End marker with no open span of its type; emitted as a one-token span. */
    END_AS_SINGLE,
    /** Open span cut off before its end marker; closed at the last token it covered. */
    UNTERMINATED_SPAN,
    /** IOB begin marker not preceded by a span of the same type; treated as an ordinary begin. */
    UNEXPECTED_BEGIN
}
