package com.spantagger.infrastructure.tagging;

import com.spantagger.domain.tagging.model.EncodingScheme;
import com.spantagger.domain.tagging.model.Marker;
import com.spantagger.domain.tagging.model.Tag;
import com.spantagger.domain.tagging.model.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class TransitionTableTest {

    private static final List<String> TYPES = List.of("PER", "LOC");

    private TransitionTable table;

    @BeforeEach
    void setUp() {
        table = new TransitionTable();
    }

    private static Tag tag(Marker marker, String type) {
        return new Tag(marker, type);
    }

    @Nested
    @DisplayName("BIO")
    class Bio {

        @Test
        void outside_is_followed_by_outside_or_begin() {
            assertThat(table.successors(EncodingScheme.BIO, Tag.OUTSIDE, TYPES))
                    .containsExactly(Tag.OUTSIDE, tag(Marker.BEGIN, "PER"), tag(Marker.BEGIN, "LOC"));
        }

        @Test
        void span_continues_only_with_its_own_type() {
            assertThat(table.successors(EncodingScheme.BIO, tag(Marker.BEGIN, "PER"), TYPES))
                    .containsExactly(Tag.OUTSIDE, tag(Marker.BEGIN, "PER"), tag(Marker.INSIDE, "PER"),
                            tag(Marker.BEGIN, "LOC"));
            assertThat(table.isAllowed(EncodingScheme.BIO, "I-PER", "I-LOC")).isFalse();
            assertThat(table.isAllowed(EncodingScheme.BIO, "I-PER", "I-PER")).isTrue();
        }

        @Test
        void sequence_cannot_open_with_inside() {
            assertThat(table.canStart(EncodingScheme.BIO, tag(Marker.INSIDE, "PER"))).isFalse();
            assertThat(table.canStart(EncodingScheme.BIO, tag(Marker.BEGIN, "PER"))).isTrue();
            assertThat(table.canEnd(EncodingScheme.BIO, tag(Marker.INSIDE, "PER"))).isTrue();
        }
    }

    @Nested
    @DisplayName("IOB")
    class Iob {

        @Test
        void begin_only_between_spans_of_the_same_type() {
            assertThat(table.canStart(EncodingScheme.IOB, tag(Marker.BEGIN, "PER"))).isFalse();
            assertThat(table.isAllowed(EncodingScheme.IOB, "O", "B-PER")).isFalse();
            assertThat(table.isAllowed(EncodingScheme.IOB, "I-LOC", "B-PER")).isFalse();
            assertThat(table.isAllowed(EncodingScheme.IOB, "I-PER", "B-PER")).isTrue();
            assertThat(table.isAllowed(EncodingScheme.IOB, "B-PER", "B-PER")).isTrue();
        }

        @Test
        void inside_may_follow_anything() {
            assertThat(table.canStart(EncodingScheme.IOB, tag(Marker.INSIDE, "PER"))).isTrue();
            assertThat(table.successors(EncodingScheme.IOB, tag(Marker.INSIDE, "PER"), TYPES))
                    .containsExactly(Tag.OUTSIDE, tag(Marker.BEGIN, "PER"), tag(Marker.INSIDE, "PER"),
                            tag(Marker.INSIDE, "LOC"));
        }
    }

    @Nested
    @DisplayName("Explicit-boundary schemes")
    class Explicit {

        @Test
        void iobes_open_span_must_continue_or_end() {
            assertThat(table.successors(EncodingScheme.IOBES, tag(Marker.BEGIN, "PER"), TYPES))
                    .containsExactly(tag(Marker.INSIDE, "PER"), tag(Marker.END, "PER"));
            assertThat(table.canEnd(EncodingScheme.IOBES, tag(Marker.BEGIN, "PER"))).isFalse();
            assertThat(table.canEnd(EncodingScheme.IOBES, tag(Marker.END, "PER"))).isTrue();
        }

        @Test
        void iobes_start_successors() {
            assertThat(table.successors(EncodingScheme.IOBES, null, TYPES))
                    .containsExactly(Tag.OUTSIDE,
                            tag(Marker.BEGIN, "PER"), tag(Marker.SINGLE, "PER"),
                            tag(Marker.BEGIN, "LOC"), tag(Marker.SINGLE, "LOC"));
        }

        @Test
        void bilou_and_bmewo_use_their_own_markers() {
            assertThat(table.isAllowed(EncodingScheme.BILOU, "B-PER", "L-PER")).isTrue();
            assertThat(table.isAllowed(EncodingScheme.BILOU, "U-PER", "L-PER")).isFalse();
            assertThat(table.isAllowed(EncodingScheme.BMEWO, "M-PER", "E-PER")).isTrue();
            assertThat(table.isAllowed(EncodingScheme.BMEWO, "E-PER", "M-PER")).isFalse();
            assertThat(table.isAllowed(EncodingScheme.BMEWO, "B-PER", "W-LOC")).isFalse();
        }
    }

    @Nested
    @DisplayName("Transition matrix")
    class Matrix {

        @Test
        void covers_every_pair_including_boundaries() {
            List<Transition> transitions = table.transitions(EncodingScheme.BIO, TYPES);
            assertThat(transitions).hasSize(7 * 7);
        }

        @Test
        void nothing_enters_start_or_leaves_end() {
            List<Transition> transitions = table.transitions(EncodingScheme.IOBES, TYPES, "<s>", "</s>");
            assertThat(transitions)
                    .filteredOn(t -> t.target().equals("<s>") || t.source().equals("</s>"))
                    .isNotEmpty()
                    .noneMatch(Transition::allowed);
        }

        @Test
        void boundary_cells_follow_the_scheme() {
            List<Transition> transitions = table.transitions(EncodingScheme.BIO, TYPES);
            assertThat(transitions).contains(
                    new Transition("<START>", "I-PER", false),
                    new Transition("<START>", "B-PER", true),
                    new Transition("I-LOC", "<END>", true),
                    new Transition("B-PER", "I-LOC", false));
        }
    }

    @ParameterizedTest
    @EnumSource(EncodingScheme.class)
    @DisplayName("Every tag the encoder writes is a legal successor of the one before")
    void encoder_output_is_closed_under_the_table(EncodingScheme scheme) {
        TagEncoder encoder = new TagEncoder();
        Random random = new Random(7L + scheme.ordinal());
        for (int trial = 0; trial < 200; trial++) {
            SpanFixtures.Layout layout = SpanFixtures.randomLayout(random);
            List<String> tags = encoder.encode(layout.spans(), layout.length(), scheme);

            String previous = null;
            for (String current : tags) {
                assertThat(table.isAllowed(scheme, previous, current))
                        .as("%s -> %s in %s", previous, current, tags)
                        .isTrue();
                previous = current;
            }
            assertThat(table.isAllowed(scheme, previous, null)).as("end of %s", tags).isTrue();
        }
    }
}
