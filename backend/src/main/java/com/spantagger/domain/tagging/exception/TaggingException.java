package com.spantagger.domain.tagging.exception;

/**
 * Base type for every error raised while decoding, encoding or converting tags.
 */
public class TaggingException extends RuntimeException {

    public TaggingException(String message) {
        super(message);
    }
}
