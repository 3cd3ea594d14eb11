package com.spantagger.domain.tagging.model;

/**
 * One cell of a transition matrix over raw tags, including the synthetic start and end labels.
 */
public record Transition(String source, String target, boolean allowed) {}
