package com.libragraph.atomizer.formats.pipeline;

import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.ContentHash;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class AtomGraphTest {

    private final ContentHash root = ContentHash.ofUtf8("root");

    @Test
    void shouldKeepFirstAtomPerHashAndCountEmissions() {
        AtomGraph.Builder graph = AtomGraph.builder();
        graph.addChild(root, Position.offset(0), Modality.TEXT, Subtypes.SENTENCE, bytes("Hi. "), "Hi.", null);
        graph.addChild(root, Position.offset(4), Modality.TEXT, Subtypes.SENTENCE, bytes("Hi. "), "Hi.", null);

        AtomGraph built = graph.build();

        assertThat(built.atoms()).hasSize(1);
        assertThat(built.emissions()).isEqualTo(2);
        assertThat(built.compositions()).extracting(AtomComposition::sequenceIndex).containsExactly(0, 1);
    }

    @Test
    void shouldChunkRepeatedCarrierOnlyOnce() {
        byte[] payload = "abcdefgh".repeat(10).getBytes(StandardCharsets.UTF_8);
        AtomGraph.Builder graph = AtomGraph.builder();
        ContentHash first = graph.addChild(root, Position.offset(0), Modality.TEXT, Subtypes.SENTENCE, payload, null, null);
        ContentHash second = graph.addChild(root, Position.offset(80), Modality.TEXT, Subtypes.SENTENCE, payload, null, null);

        AtomGraph built = graph.build();

        assertThat(first).isEqualTo(second);
        assertThat(built.compositions()).filteredOn(c -> c.parentAtomHash().equals(first)).hasSize(2);
        assertThat(built.compositions()).filteredOn(c -> c.parentAtomHash().equals(root)).hasSize(2);
    }

    @Test
    void shouldSkipEdgesOfAlreadyExpandedParentOnMerge() {
        AtomGraph.Builder inner = AtomGraph.builder();
        ContentHash frame = ContentHash.ofUtf8("frame");
        inner.link(frame, ContentHash.ofUtf8("block"), Position.pixel(0, 0, 0, 0));
        AtomGraph fragment = inner.build();

        AtomGraph.Builder outer = AtomGraph.builder();
        outer.merge(fragment);
        outer.merge(fragment);

        assertThat(outer.build().compositions()).hasSize(1);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
