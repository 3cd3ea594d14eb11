package com.spantagger.infrastructure.tagging;

import com.spantagger.domain.tagging.model.EncodingScheme;
import com.spantagger.domain.tagging.model.ErrorPolicy;
import com.spantagger.domain.tagging.model.ParseResult;
import com.spantagger.domain.tagging.model.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scheme-to-scheme conversion: parse with the source scheme, encode with the target.
 *
 * A per-tag lookup cannot do this in general. IOB output depends on the neighbouring span's
 * type, and the explicit-boundary schemes need to know whether the next token continues the span.
 */
@Component
@RequiredArgsConstructor
public class TagConverter {

    private final TagParser tagParser;
    private final TagEncoder tagEncoder;

    public List<String> convert(List<String> tags, EncodingScheme source, EncodingScheme target) {
        return convert(tags, source, target, ErrorPolicy.STRICT);
    }

    /**
     * @param policy how invalid transitions in {@code tags} are handled during the parse step
     */
    public List<String> convert(List<String> tags, EncodingScheme source, EncodingScheme target, ErrorPolicy policy) {
        ParseResult parsed = tagParser.parse(tags, source, policy);
        return tagEncoder.encode(parsed.spans(), tags.size(), target);
    }

    /**
     * Rewrite a single tag between two explicit-boundary schemes (IOBES, BILOU, BMEWO),
     * whose markers correspond one to one.
     *
     * @throws IllegalArgumentException if either scheme infers span ends from context
     */
    public String convertTag(String tag, EncodingScheme source, EncodingScheme target) {
        if (!source.explicitBoundary() || !target.explicitBoundary()) {
            throw new IllegalArgumentException(String.format(
                    "Tag-by-tag conversion from %s to %s needs context; convert the whole sequence", source, target));
        }
        Tag decoded = source.decode(tag);
        if (decoded.isOutside()) {
            return decoded.value();
        }
        return new Tag(target.markerFor(source.roleOf(decoded), false), decoded.type()).value();
    }
}
