package com.spantagger.application.tagging;

import com.spantagger.domain.tagging.model.EncodingScheme;
import com.spantagger.domain.tagging.model.ErrorPolicy;
import com.spantagger.domain.tagging.model.ParseResult;
import com.spantagger.domain.tagging.model.Span;
import com.spantagger.domain.tagging.model.Transition;
import com.spantagger.domain.tagging.model.ValidationResult;
import com.spantagger.infrastructure.tagging.TagConverter;
import com.spantagger.infrastructure.tagging.TagEncoder;
import com.spantagger.infrastructure.tagging.TagParser;
import com.spantagger.infrastructure.tagging.TransitionTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point for callers that select schemes and policies by name.
 * Blank names fall back to the configured defaults.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaggingAppService {

    static final int MAX_TRANSITION_TYPES = 100;

    private final TagParser tagParser;
    private final TagEncoder tagEncoder;
    private final TagConverter tagConverter;
    private final TransitionTable transitionTable;

    @Value("${tagging.default-scheme:bio}")
    private String defaultScheme;

    @Value("${tagging.default-policy:strict}")
    private String defaultPolicy;

    @Value("${tagging.transitions.start-label:" + TransitionTable.DEFAULT_START_LABEL + "}")
    private String startLabel;

    @Value("${tagging.transitions.end-label:" + TransitionTable.DEFAULT_END_LABEL + "}")
    private String endLabel;

    public ParseResult parse(List<String> tags, String schemeName, String policyName) {
        EncodingScheme scheme = resolveScheme(schemeName);
        ParseResult result = tagParser.parse(tags, scheme, resolvePolicy(policyName));
        logRepairs("parse", scheme, tags.size(), result);
        return result;
    }

    /**
     * @param length token count, or null to end the sequence at the furthest span
     */
    public List<String> encode(List<Span> spans, Integer length, String schemeName) {
        EncodingScheme scheme = resolveScheme(schemeName);
        return length == null
                ? tagEncoder.encode(spans, scheme)
                : tagEncoder.encode(spans, length, scheme);
    }

    public List<String> convert(List<String> tags, String sourceName, String targetName, String policyName) {
        return tagConverter.convert(tags,
                resolveScheme(sourceName),
                resolveScheme(targetName),
                resolvePolicy(policyName));
    }

    /**
     * Grammar check: the sequence is valid when a lenient parse needs no repair.
     */
    public ValidationResult validate(List<String> tags, String schemeName) {
        EncodingScheme scheme = resolveScheme(schemeName);
        ParseResult result = tagParser.parse(tags, scheme, ErrorPolicy.KEEP_GOING);
        logRepairs("validate", scheme, tags.size(), result);
        return ValidationResult.of(result);
    }

    /**
     * @throws IllegalArgumentException if more than {@link #MAX_TRANSITION_TYPES} distinct types are given
     */
    public List<Transition> transitions(String schemeName, List<String> types) {
        EncodingScheme scheme = resolveScheme(schemeName);
        Set<String> distinct = new LinkedHashSet<>(types);
        if (distinct.size() > MAX_TRANSITION_TYPES) {
            throw new IllegalArgumentException(String.format(
                    "At most %d entity types per transition matrix, got %d", MAX_TRANSITION_TYPES, distinct.size()));
        }
        return transitionTable.transitions(scheme, distinct, startLabel, endLabel);
    }

    EncodingScheme resolveScheme(String name) {
        return EncodingScheme.fromName(name == null || name.isBlank() ? defaultScheme : name);
    }

    ErrorPolicy resolvePolicy(String name) {
        return ErrorPolicy.fromName(name == null || name.isBlank() ? defaultPolicy : name);
    }

    private void logRepairs(String operation, EncodingScheme scheme, int length, ParseResult result) {
        if (result.repaired()) {
            log.info("[TaggingAppService] {}: {} repairs in {} {} tags (first at token {})",
                    operation, result.repairs().size(), length, scheme, result.repairs().get(0).index());
        }
    }
}
