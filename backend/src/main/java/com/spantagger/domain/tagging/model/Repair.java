package com.spantagger.domain.tagging.model;

/**
 * One repair applied while parsing under a repairing {@link ErrorPolicy}.
 *
 * @param index    token index of the invalid transition (the sequence length for an unterminated final span)
 * @param kind     what was repaired
 * @param previous raw tag before the transition, null at the start of the sequence
 * @param current  raw tag after the transition, null at the end of the sequence
 */
public record Repair(
        int index,
        RepairKind kind,
        String previous,
        String current
) {}
