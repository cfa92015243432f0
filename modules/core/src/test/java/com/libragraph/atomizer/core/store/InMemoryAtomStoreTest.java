package com.libragraph.atomizer.core.store;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.ContentHash;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryAtomStoreTest {

    private final InMemoryAtomStore store = new InMemoryAtomStore();

    private static Atom text(String value) {
        return Atom.leaf(value.getBytes(StandardCharsets.UTF_8), Modality.TEXT, Subtypes.SENTENCE, value, null);
    }

    private static Atom parent(String label) {
        byte[] bytes = label.getBytes(StandardCharsets.UTF_8);
        return new Atom(bytes, ContentHash.ofUtf8("parent:" + label), Modality.TEXT, Subtypes.PARAGRAPH,
                null, label, null);
    }

    private static AtomComposition edge(Atom parent, Atom child, int index) {
        return new AtomComposition(parent.contentHash(), child.contentHash(), index, Position.offset(index));
    }

    @Test
    void shouldCountReferencesPerHash() {
        Atom hello = text("Hello. ");
        Atom world = text("World.");

        store.upsertAtoms(List.of(hello, world));
        store.upsertAtoms(List.of(hello));

        assertThat(store.atomCount()).isEqualTo(2);
        assertThat(store.referenceCount(hello.contentHash())).isEqualTo(2);
        assertThat(store.referenceCount(world.contentHash())).isEqualTo(1);
        assertThat(store.referenceCount(ContentHash.ofUtf8("absent"))).isZero();
        assertThat(store.find(world.contentHash())).contains(world);
    }

    @Test
    void shouldKeepFirstEdgePerSequenceIndex() {
        Atom root = parent("root");
        Atom a = text("a");
        Atom b = text("b");
        store.upsertAtoms(List.of(root, a, b));

        store.storeCompositions(List.of(edge(root, b, 1), edge(root, a, 0)));
        store.storeCompositions(List.of(edge(root, b, 0)));

        assertThat(store.componentsOf(root.contentHash()))
                .extracting(AtomComposition::componentAtomHash)
                .containsExactly(a.contentHash(), b.contentHash());
        assertThat(store.compositionCount()).isEqualTo(2);
        assertThat(store.componentsOf(a.contentHash())).isEmpty();
    }

    @Test
    void shouldReconstructLeavesInOrder() {
        Atom root = parent("root");
        Atom paragraph = parent("paragraph");
        Atom first = text("One. ");
        Atom second = text("Two. ");
        Atom third = text("Three.");
        store.upsertAtoms(List.of(root, paragraph, first, second, third));
        store.storeCompositions(List.of(
                edge(root, paragraph, 0), edge(root, third, 1),
                edge(paragraph, first, 0), edge(paragraph, second, 1)));

        assertThat(new String(store.reconstruct(root.contentHash()), StandardCharsets.UTF_8))
                .isEqualTo("One. Two. Three.");
    }

    @Test
    void shouldRejectMissingAtomsAndCycles() {
        Atom root = parent("root");
        Atom loop = parent("loop");
        store.upsertAtoms(List.of(root, loop));
        store.storeCompositions(List.of(edge(root, loop, 0), edge(loop, root, 0)));

        assertThatThrownBy(() -> store.reconstruct(root.contentHash()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cycle");
        assertThatThrownBy(() -> store.reconstruct(ContentHash.ofUtf8("nowhere")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Missing atom");
    }
}
