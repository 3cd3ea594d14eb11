package com.spantagger.domain.tagging.model;

import java.util.List;

/**
 * Result of checking a tag sequence against its scheme's grammar.
 *
 * @param valid   true if the sequence parsed without a single repair
 * @param repairs every repair a lenient parse had to apply
 */
public record ValidationResult(
        boolean valid,
        List<Repair> repairs
) {
    public static ValidationResult of(ParseResult result) {
        return new ValidationResult(!result.repaired(), result.repairs());
    }
}
