package com.spantagger.domain.tagging.exception;

public class UnknownSchemeException extends TaggingException {

    public UnknownSchemeException(String name) {
        super(String.format("Unknown encoding scheme: `%s`", name));
    }
}
