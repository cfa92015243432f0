package com.libragraph.atomizer.formats.atomizers.structured;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.types.Subtypes;
import org.junit.jupiter.api.Test;

import static com.libragraph.atomizer.formats.AtomizerFixtures.*;
import static org.assertj.core.api.Assertions.*;

class XmlAndYamlAtomizerTest {

    @Test
    void shouldAtomizeXmlElements() {
        AtomizationResult result = atomize(new XmlAtomizer(), "pom.xml", "application/xml",
                "<project><name>atomizer</name><version>1.0</version></project>");

        assertWellFormed(result);
        assertThat(result.processingInfo().detectedFormat()).isEqualTo("application/xml");
        assertThat(result.atomsOfSubtype(Subtypes.FIELD))
                .extracting(Atom::canonicalText)
                .containsExactly("atomizer", "1.0");
        assertThat(result.compositions()).extracting(c -> c.position().path()).contains("/name", "/version");
    }

    @Test
    void shouldRejectUnclosedXml() {
        assertThatThrownBy(() -> atomize(new XmlAtomizer(), "bad.xml", "application/xml", "<a><b></a>"))
                .isInstanceOf(StructuralParseException.class);
    }

    @Test
    void shouldAtomizeYamlMappingsAndSequences() {
        String yaml = """
                service:
                  name: atomizer
                  ports:
                    - 8080
                    - 8443
                """;

        AtomizationResult result = atomize(new YamlAtomizer(), "app.yaml", "application/yaml", yaml);

        assertWellFormed(result);
        assertThat(result.atomsOfSubtype(Subtypes.ARRAY)).hasSize(1);
        assertThat(result.compositions()).extracting(c -> c.position().path())
                .contains("/service/name", "/service/ports/0", "/service/ports/1");
    }

    @Test
    void shouldRejectInvalidYaml() {
        assertThatThrownBy(() -> atomize(new YamlAtomizer(), "bad.yml", "application/yaml", "a: [1, 2"))
                .isInstanceOf(StructuralParseException.class);
    }
}
