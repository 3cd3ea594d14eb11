package com.spantagger.domain.tagging.exception;

import com.spantagger.domain.tagging.model.EncodingScheme;
import lombok.Getter;

/**
 * A well-formed tag sequence breaks the scheme's begin/inside/end grammar.
 * {@code previous} is null at the start of the sequence and {@code current} is null
 * when the sequence ends inside an unterminated span (then {@code index} equals its length).
 */
@Getter
public class InvalidTransitionException extends TaggingException {

    private final int index;
    private final String previous;
    private final String current;
    private final EncodingScheme scheme;

    public InvalidTransitionException(int index, String previous, String current, EncodingScheme scheme) {
        super(String.format("Invalid %s transition at token %d: %s -> %s",
                scheme, index,
                previous == null ? "<start>" : previous,
                current == null ? "<end>" : current));
        this.index = index;
        this.previous = previous;
        this.current = current;
        this.scheme = scheme;
    }
}
