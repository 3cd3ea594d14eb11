package com.spantagger.domain.tagging.model;

/**
 * Structural role a token plays relative to the span it belongs to.
 */
public enum TokenRole {
    OUTSIDE,
    BEGIN,
    INSIDE,
    END,
    SINGLE
}
