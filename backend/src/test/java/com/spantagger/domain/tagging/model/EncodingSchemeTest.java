package com.spantagger.domain.tagging.model;

import com.spantagger.domain.tagging.exception.MalformedTagException;
import com.spantagger.domain.tagging.exception.UnknownPolicyException;
import com.spantagger.domain.tagging.exception.UnknownSchemeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncodingSchemeTest {

    @Nested
    @DisplayName("Scheme name resolution")
    class FromName {

        @Test
        void canonical_names() {
            assertThat(EncodingScheme.fromName("iob")).isEqualTo(EncodingScheme.IOB);
            assertThat(EncodingScheme.fromName("bio")).isEqualTo(EncodingScheme.BIO);
            assertThat(EncodingScheme.fromName("iobes")).isEqualTo(EncodingScheme.IOBES);
            assertThat(EncodingScheme.fromName("bilou")).isEqualTo(EncodingScheme.BILOU);
            assertThat(EncodingScheme.fromName("bmewo")).isEqualTo(EncodingScheme.BMEWO);
        }

        @Test
        void aliases_case_and_whitespace() {
            assertThat(EncodingScheme.fromName("IOB1")).isEqualTo(EncodingScheme.IOB);
            assertThat(EncodingScheme.fromName(" IOB2 ")).isEqualTo(EncodingScheme.BIO);
            assertThat(EncodingScheme.fromName("BMEOW")).isEqualTo(EncodingScheme.BMEWO);
        }

        @ParameterizedTest
        @ValueSource(strings = {"token", "bioes2", "", "io"})
        void unknown_names_rejected(String name) {
            assertThatThrownBy(() -> EncodingScheme.fromName(name))
                    .isInstanceOf(UnknownSchemeException.class)
                    .hasMessageContaining(name);
        }

        @Test
        void null_name_rejected() {
            assertThatThrownBy(() -> EncodingScheme.fromName(null))
                    .isInstanceOf(UnknownSchemeException.class);
        }

        @Test
        void policy_names() {
            assertThat(ErrorPolicy.fromName("strict")).isEqualTo(ErrorPolicy.STRICT);
            assertThat(ErrorPolicy.fromName("Coerce")).isEqualTo(ErrorPolicy.COERCE);
            assertThat(ErrorPolicy.fromName("keep-going")).isEqualTo(ErrorPolicy.KEEP_GOING);
            assertThat(ErrorPolicy.fromName("KEEP_GOING")).isEqualTo(ErrorPolicy.KEEP_GOING);
            assertThatThrownBy(() -> ErrorPolicy.fromName("lenient"))
                    .isInstanceOf(UnknownPolicyException.class);
        }
    }

    @Nested
    @DisplayName("Decoding a single tag")
    class Decode {

        @Test
        void outside() {
            assertThat(EncodingScheme.BIO.decode("O")).isEqualTo(Tag.OUTSIDE);
            assertThat(EncodingScheme.BIO.decode("O").isOutside()).isTrue();
        }

        @Test
        void marker_and_type() {
            Tag tag = EncodingScheme.IOBES.decode("S-PER");
            assertThat(tag.marker()).isEqualTo(Marker.SINGLE);
            assertThat(tag.type()).isEqualTo("PER");
            assertThat(tag.value()).isEqualTo("S-PER");
        }

        @Test
        void splits_on_first_separator_only() {
            Tag tag = EncodingScheme.BIO.decode("B-I-PER");
            assertThat(tag.marker()).isEqualTo(Marker.BEGIN);
            assertThat(tag.type()).isEqualTo("I-PER");
        }

        @ParameterizedTest
        @EnumSource(EncodingScheme.class)
        void unknown_marker_is_malformed_in_every_scheme(EncodingScheme scheme) {
            assertThatThrownBy(() -> scheme.decode("X-PER"))
                    .isInstanceOf(MalformedTagException.class)
                    .hasMessageContaining("X-PER");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "B", "B-", "BPER", "BB-PER", "O-PER", "-PER", "o"})
        void syntactically_broken_tags(String raw) {
            assertThatThrownBy(() -> EncodingScheme.BIO.decode(raw))
                    .isInstanceOf(MalformedTagException.class);
        }

        @Test
        void marker_outside_the_scheme_alphabet() {
            assertThatThrownBy(() -> EncodingScheme.BIO.decode("E-PER"))
                    .isInstanceOf(MalformedTagException.class);
            assertThatThrownBy(() -> EncodingScheme.IOBES.decode("L-PER"))
                    .isInstanceOf(MalformedTagException.class);
            assertThatThrownBy(() -> EncodingScheme.BMEWO.decode("I-PER"))
                    .isInstanceOf(MalformedTagException.class);
            assertThat(EncodingScheme.BMEWO.decode("M-PER").marker()).isEqualTo(Marker.MIDDLE);
        }

        @Test
        void null_tag() {
            assertThatThrownBy(() -> EncodingScheme.IOB.decode(null))
                    .isInstanceOf(MalformedTagException.class);
        }
    }

    @Nested
    @DisplayName("Marker roles and rendering")
    class Roles {

        @Test
        void explicit_schemes_map_all_five_roles() {
            assertThat(EncodingScheme.BILOU.roleOf(Marker.LAST)).isEqualTo(TokenRole.END);
            assertThat(EncodingScheme.BILOU.roleOf(Marker.UNIT)).isEqualTo(TokenRole.SINGLE);
            assertThat(EncodingScheme.BMEWO.roleOf(Marker.MIDDLE)).isEqualTo(TokenRole.INSIDE);
            assertThat(EncodingScheme.BMEWO.roleOf(Marker.WHOLE)).isEqualTo(TokenRole.SINGLE);
            assertThat(EncodingScheme.IOBES.roleOf(Marker.END)).isEqualTo(TokenRole.END);
        }

        @Test
        void lookahead_schemes_have_no_end_role() {
            assertThat(EncodingScheme.BIO.roleOf(Marker.INSIDE)).isEqualTo(TokenRole.INSIDE);
            assertThat(EncodingScheme.BIO.roleOf(Marker.BEGIN)).isEqualTo(TokenRole.BEGIN);
            assertThat(EncodingScheme.IOB.roleOf(Marker.END)).isNull();
        }

        @Test
        void bio_renders_singletons_with_begin() {
            assertThat(EncodingScheme.BIO.markerFor(TokenRole.SINGLE, false)).isEqualTo(Marker.BEGIN);
            assertThat(EncodingScheme.BIO.markerFor(TokenRole.END, false)).isEqualTo(Marker.INSIDE);
        }

        @Test
        void iob_writes_begin_only_after_same_type() {
            assertThat(EncodingScheme.IOB.markerFor(TokenRole.BEGIN, false)).isEqualTo(Marker.INSIDE);
            assertThat(EncodingScheme.IOB.markerFor(TokenRole.SINGLE, true)).isEqualTo(Marker.BEGIN);
            assertThat(EncodingScheme.IOB.markerFor(TokenRole.INSIDE, true)).isEqualTo(Marker.INSIDE);
        }

        @Test
        void tag_vocabulary() {
            assertThat(EncodingScheme.BIO.tagsFor(List.of("PER", "LOC")))
                    .containsExactly("O", "B-PER", "I-PER", "B-LOC", "I-LOC");
            assertThat(EncodingScheme.BMEWO.tagsFor(List.of("X")))
                    .containsExactly("O", "B-X", "M-X", "E-X", "W-X");
        }

        @Test
        void repeated_types_appear_once_in_vocabulary() {
            assertThat(EncodingScheme.IOBES.tagsFor(List.of("PER", "LOC", "PER")))
                    .containsExactly("O", "B-PER", "I-PER", "E-PER", "S-PER", "B-LOC", "I-LOC", "E-LOC", "S-LOC");
        }
    }

    @Nested
    @DisplayName("Span value object")
    class SpanInvariants {

        @Test
        void tokens_cover_start_to_end() {
            Span span = Span.of("PER", 2, 5);
            assertThat(span.tokens()).containsExactly(2, 3, 4);
            assertThat(span.length()).isEqualTo(3);
        }

        @Test
        void rejects_inconsistent_tokens() {
            assertThatThrownBy(() -> new Span("PER", 0, 2, List.of(0, 2)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void rejects_empty_type_and_reversed_bounds() {
            assertThatThrownBy(() -> Span.of("", 0, 1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Span.of("PER", 3, 1)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
