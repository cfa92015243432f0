package com.libragraph.atomizer.formats.atomizers.text;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import org.junit.jupiter.api.Test;

import static com.libragraph.atomizer.formats.AtomizerFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class MarkdownAtomizerTest {

    private static final String DOC = """
            # Guide

            Read the [docs](https://example.com/docs) first.

            ## Setup

            - install
            - configure

            ```java
            int x = 1;
            ```

            | name | value |
            |------|-------|
            | a    | 1     |
            """;

    private final MarkdownAtomizer atomizer = new MarkdownAtomizer();

    @Test
    void shouldOutrankPlainText() {
        assertThat(atomizer.canHandle("text/markdown", "md")).isTrue();
        assertThat(atomizer.priority()).isGreaterThan(new TextAtomizer().priority());
    }

    @Test
    void shouldEmitStructuralAtoms() {
        AtomizationResult result = atomize(atomizer, "guide.md", "text/markdown", DOC);

        assertWellFormed(result);
        assertThat(result.atomsOfSubtype(Subtypes.HEADING))
                .extracting(Atom::canonicalText)
                .containsExactly("H1: Guide", "H2: Setup");
        assertThat(result.atomsOfSubtype(Subtypes.PARAGRAPH))
                .extracting(Atom::canonicalText)
                .containsExactly("Read the docs first.");
        assertThat(result.atomsOfSubtype(Subtypes.LIST_ITEM))
                .extracting(Atom::canonicalText)
                .containsExactly("install", "configure");
        assertThat(result.atomsOfSubtype(Subtypes.LINK)).singleElement()
                .satisfies(link -> assertThat(link.metadata()).contains("https://example.com/docs"));
        assertThat(result.atomsOfSubtype(Subtypes.TABLE_ROW)).hasSize(2);
    }

    @Test
    void shouldTagCodeBlockWithLanguage() {
        AtomizationResult result = atomize(atomizer, "guide.md", "text/markdown", DOC);

        assertThat(result.atomsOfSubtype(Subtypes.CODE_BLOCK)).singleElement()
                .satisfies(block -> {
                    assertThat(block.modality()).isEqualTo(Modality.CODE);
                    assertThat(block.canonicalText()).isEqualTo("int x = 1;\n");
                    assertThat(block.metadata()).contains("\"language\":\"java\"");
                });
    }

    @Test
    void shouldPositionBlocksByLineAndHeadingDepth() {
        AtomizationResult result = atomize(atomizer, "guide.md", "text/markdown", DOC);

        var edges = childrenOf(result, result.rootHash());
        AtomComposition firstHeading = edges.get(0);
        AtomComposition firstItem = edges.stream()
                .filter(e -> atom(result, e.componentAtomHash()).subtype().equals(Subtypes.LIST_ITEM))
                .findFirst().orElseThrow();

        assertThat(firstHeading.position().y()).isEqualTo(1);
        assertThat(firstItem.position().y()).isEqualTo(7);
        assertThat(firstItem.position().z()).isEqualTo(2);
    }
}
