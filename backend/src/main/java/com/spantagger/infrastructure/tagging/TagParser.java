package com.spantagger.infrastructure.tagging;

import com.spantagger.domain.tagging.exception.InvalidTransitionException;
import com.spantagger.domain.tagging.model.EncodingScheme;
import com.spantagger.domain.tagging.model.ErrorPolicy;
import com.spantagger.domain.tagging.model.ParseResult;
import com.spantagger.domain.tagging.model.Repair;
import com.spantagger.domain.tagging.model.RepairKind;
import com.spantagger.domain.tagging.model.Span;
import com.spantagger.domain.tagging.model.Tag;
import com.spantagger.domain.tagging.model.TokenRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes a token-aligned tag sequence into spans.
 *
 * Every tag is decoded first, so a malformed tag fails the call under any policy.
 * Each adjacent pair is then checked against the {@link TransitionTable}; an illegal pair
 * either fails the parse ({@link ErrorPolicy#STRICT}) or is repaired:
 * <ul>
 *   <li>continuation without an open span of its type opens a new span</li>
 *   <li>end marker without an open span of its type becomes a one-token span</li>
 *   <li>a span cut off before its end marker is closed at the last token it covered</li>
 *   <li>an IOB begin marker with no same-type predecessor is read as an ordinary begin</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TagParser {

    private final TransitionTable transitionTable;

    /**
     * Strict parse.
     *
     * @throws InvalidTransitionException on the first grammar violation
     */
    public List<Span> parse(List<String> tags, EncodingScheme scheme) {
        return parse(tags, scheme, ErrorPolicy.STRICT).spans();
    }

    public ParseResult parse(List<String> tags, EncodingScheme scheme, ErrorPolicy policy) {
        List<Tag> decoded = scheme.decodeAll(tags);
        SpanCursor cursor = new SpanCursor();
        List<Repair> repairs = new ArrayList<>();

        Tag previous = null;
        for (int i = 0; i < decoded.size(); i++) {
            Tag current = decoded.get(i);
            if (!transitionTable.isAllowed(scheme, previous, current)) {
                repairs.add(reject(tags, i, repairKind(scheme, current), scheme, policy));
            }

            String type = current.type();
            switch (scheme.roleOf(current)) {
                case OUTSIDE -> cursor.close(i);
                case BEGIN -> {
                    cursor.close(i);
                    cursor.open(type, i);
                }
                case INSIDE -> {
                    if (!cursor.isOpen(type)) {
                        cursor.close(i);
                        cursor.open(type, i);
                    }
                }
                case END -> {
                    if (cursor.isOpen(type)) {
                        cursor.close(i + 1);
                    } else {
                        cursor.close(i);
                        cursor.single(type, i);
                    }
                }
                case SINGLE -> {
                    cursor.close(i);
                    cursor.single(type, i);
                }
            }
            previous = current;
        }

        int length = decoded.size();
        if (!transitionTable.canEnd(scheme, previous)) {
            repairs.add(reject(tags, length, RepairKind.UNTERMINATED_SPAN, scheme, policy));
        }
        cursor.close(length);

        if (!repairs.isEmpty()) {
            log.debug("[TagParser] {} repairs while parsing {} {} tags", repairs.size(), length, scheme);
        }
        return new ParseResult(cursor.spans, policy.reportsRepairs() ? repairs : List.of());
    }

    private Repair reject(List<String> tags, int index, RepairKind kind, EncodingScheme scheme, ErrorPolicy policy) {
        String previous = index > 0 ? tags.get(index - 1) : null;
        String current = index < tags.size() ? tags.get(index) : null;
        if (!policy.repairs()) {
            throw new InvalidTransitionException(index, previous, current, scheme);
        }
        return new Repair(index, kind, previous, current);
    }

    private RepairKind repairKind(EncodingScheme scheme, Tag current) {
        TokenRole role = scheme.roleOf(current);
        if (role == TokenRole.INSIDE) return RepairKind.CONTINUATION_AS_BEGIN;
        if (role == TokenRole.END) return RepairKind.END_AS_SINGLE;
        if (role == TokenRole.BEGIN && scheme.beginOnlyAtBoundary()) return RepairKind.UNEXPECTED_BEGIN;
        // O, begin or singleton arriving while an explicit-boundary span is still open
        return RepairKind.UNTERMINATED_SPAN;
    }

    /**
     * The span currently being read, plus everything already closed.
     */
    private static final class SpanCursor {
        private final List<Span> spans = new ArrayList<>();
        private String openType;
        private int openStart = -1;

        boolean isOpen(String type) {
            return openType != null && openType.equals(type);
        }

        void open(String type, int start) {
            openType = type;
            openStart = start;
        }

        void close(int end) {
            if (openType != null) {
                spans.add(Span.of(openType, openStart, end));
                openType = null;
                openStart = -1;
            }
        }

        void single(String type, int index) {
            spans.add(Span.of(type, index, index + 1));
        }
    }
}
