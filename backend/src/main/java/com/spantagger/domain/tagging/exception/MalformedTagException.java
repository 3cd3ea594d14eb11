package com.spantagger.domain.tagging.exception;

import com.spantagger.domain.tagging.model.EncodingScheme;
import lombok.Getter;

/**
 * A raw tag string does not decode to a marker of the scheme plus a non-empty type.
 * Never repaired by any error policy.
 */
@Getter
public class MalformedTagException extends TaggingException {

    private final String rawTag;
    private final EncodingScheme scheme;

    public MalformedTagException(String rawTag, EncodingScheme scheme) {
        super(String.format("Malformed %s tag: `%s`", scheme, rawTag));
        this.rawTag = rawTag;
        this.scheme = scheme;
    }
}
