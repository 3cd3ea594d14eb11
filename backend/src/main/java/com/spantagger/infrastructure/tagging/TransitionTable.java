package com.spantagger.infrastructure.tagging;

import com.spantagger.domain.tagging.model.EncodingScheme;
import com.spantagger.domain.tagging.model.Tag;
import com.spantagger.domain.tagging.model.TokenRole;
import com.spantagger.domain.tagging.model.Transition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Legal (previous tag, next tag) pairs per scheme.
 *
 * Rules are stored per pair of {@link TokenRole}s and built once from the scheme descriptors.
 * Entity types only matter for {@link Constraint#SAME_TYPE} cells, so one table serves any
 * type vocabulary. The start of a sequence behaves like a preceding {@code O}, the end like
 * a following {@code O}.
 *
 * Used by {@link TagParser} to detect invalid input, and by callers who want to mask
 * a model's output space during constrained decoding.
 */
@Component
public class TransitionTable {

    public static final String DEFAULT_START_LABEL = "<START>";
    public static final String DEFAULT_END_LABEL = "<END>";

    private enum Constraint { ALLOWED, SAME_TYPE, FORBIDDEN }

    private static final Map<EncodingScheme, Constraint[][]> RULES = new EnumMap<>(EncodingScheme.class);

    static {
        for (EncodingScheme scheme : EncodingScheme.values()) {
            int size = TokenRole.values().length;
            Constraint[][] cells = new Constraint[size][size];
            for (TokenRole previous : TokenRole.values()) {
                for (TokenRole next : TokenRole.values()) {
                    cells[previous.ordinal()][next.ordinal()] = scheme.explicitBoundary()
                            ? explicitRule(previous, next)
                            : lookaheadRule(scheme, previous, next);
                }
            }
            RULES.put(scheme, cells);
        }
    }

    private static Constraint lookaheadRule(EncodingScheme scheme, TokenRole previous, TokenRole next) {
        boolean afterSpan = previous == TokenRole.BEGIN || previous == TokenRole.INSIDE;
        return switch (next) {
            case BEGIN -> {
                if (!scheme.beginOnlyAtBoundary()) yield Constraint.ALLOWED;
                // IOB: B only separates two adjacent spans of the same type
                yield afterSpan ? Constraint.SAME_TYPE : Constraint.FORBIDDEN;
            }
            case INSIDE -> {
                if (scheme.beginOnlyAtBoundary()) yield Constraint.ALLOWED;
                yield afterSpan ? Constraint.SAME_TYPE : Constraint.FORBIDDEN;
            }
            default -> Constraint.ALLOWED;
        };
    }

    private static Constraint explicitRule(TokenRole previous, TokenRole next) {
        boolean open = previous == TokenRole.BEGIN || previous == TokenRole.INSIDE;
        boolean continues = next == TokenRole.INSIDE || next == TokenRole.END;
        if (open) {
            return continues ? Constraint.SAME_TYPE : Constraint.FORBIDDEN;
        }
        return continues ? Constraint.FORBIDDEN : Constraint.ALLOWED;
    }

    /**
     * @param previous the preceding tag, or null at the start of the sequence
     * @param next     the following tag, or null at the end of the sequence
     */
    public boolean isAllowed(EncodingScheme scheme, Tag previous, Tag next) {
        TokenRole from = previous == null ? TokenRole.OUTSIDE : scheme.roleOf(previous);
        TokenRole to = next == null ? TokenRole.OUTSIDE : scheme.roleOf(next);
        if (from == null || to == null) {
            return false;
        }
        return switch (RULES.get(scheme)[from.ordinal()][to.ordinal()]) {
            case ALLOWED -> true;
            case FORBIDDEN -> false;
            case SAME_TYPE -> previous.type().equals(next.type());
        };
    }

    /**
     * Raw-string variant; null stands for the start or end of the sequence.
     */
    public boolean isAllowed(EncodingScheme scheme, String previous, String next) {
        return isAllowed(scheme,
                previous == null ? null : scheme.decode(previous),
                next == null ? null : scheme.decode(next));
    }

    public boolean canStart(EncodingScheme scheme, Tag first) {
        return isAllowed(scheme, null, first);
    }

    public boolean canEnd(EncodingScheme scheme, Tag last) {
        return isAllowed(scheme, last, null);
    }

    /**
     * Tags over {@code types} that may legally follow {@code previous} (null for the start of a sequence).
     */
    public Set<Tag> successors(EncodingScheme scheme, Tag previous, Collection<String> types) {
        Set<Tag> successors = new LinkedHashSet<>();
        for (String raw : scheme.tagsFor(types)) {
            Tag next = scheme.decode(raw);
            if (isAllowed(scheme, previous, next)) {
                successors.add(next);
            }
        }
        return successors;
    }

    public List<Transition> transitions(EncodingScheme scheme, Collection<String> types) {
        return transitions(scheme, types, DEFAULT_START_LABEL, DEFAULT_END_LABEL);
    }

    /**
     * Full transition matrix over the scheme's tags for {@code types}, plus the start and end labels.
     * Nothing transitions into the start label and nothing leaves the end label.
     */
    public List<Transition> transitions(EncodingScheme scheme,
                                        Collection<String> types,
                                        String startLabel,
                                        String endLabel) {
        List<String> labels = new ArrayList<>(scheme.tagsFor(types));
        labels.add(startLabel);
        labels.add(endLabel);

        List<Transition> transitions = new ArrayList<>(labels.size() * labels.size());
        for (String source : labels) {
            for (String target : labels) {
                boolean allowed;
                if (target.equals(startLabel) || source.equals(endLabel)) {
                    allowed = false;
                } else {
                    Tag from = source.equals(startLabel) ? null : scheme.decode(source);
                    Tag to = target.equals(endLabel) ? null : scheme.decode(target);
                    allowed = isAllowed(scheme, from, to);
                }
                transitions.add(new Transition(source, target, allowed));
            }
        }
        return transitions;
    }
}
