package com.spantagger.domain.tagging.exception;

public class UnknownPolicyException extends TaggingException {

    public UnknownPolicyException(String name) {
        super(String.format("Unknown error policy: `%s` (expected strict, coerce or keep-going)", name));
    }
}
