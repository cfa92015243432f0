package com.libragraph.atomizer.formats.atomizers.code;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.types.Subtypes;
import org.junit.jupiter.api.Test;

import static com.libragraph.atomizer.formats.AtomizerFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class CodeAtomizerTest {

    private final CodeAtomizer atomizer = new CodeAtomizer();

    @Test
    void shouldExtractJavaElements() {
        String source = """
                package demo;

                import java.util.List;

                // Greets people.
                public class Greeter {
                    public String greet(String name) {
                        return "Hello " + name;
                    }
                }
                """;

        AtomizationResult result = atomize(atomizer, "Greeter.java", "text/x-java-source", source);

        assertWellFormed(result);
        assertThat(result.processingInfo().detectedFormat()).isEqualTo("text/x-java");
        assertThat(result.atomsOfSubtype(Subtypes.IMPORT)).extracting(Atom::canonicalText)
                .containsExactly("package demo;", "import java.util.List;");
        assertThat(result.atomsOfSubtype(Subtypes.CLASS)).singleElement()
                .satisfies(a -> assertThat(a.metadata()).contains("\"name\":\"Greeter\""));
        assertThat(result.atomsOfSubtype(Subtypes.FUNCTION)).singleElement()
                .satisfies(a -> assertThat(a.metadata()).contains("\"name\":\"greet\""));
        assertThat(result.atomsOfSubtype(Subtypes.COMMENT)).extracting(Atom::canonicalText)
                .containsExactly("// Greets people.");
    }

    @Test
    void shouldPositionByLineAndColumn() {
        String source = "import os\n\n  def run():\n    pass\n";

        AtomizationResult result = atomize(atomizer, "tool.py", null, source);

        AtomComposition def = childrenOf(result, result.rootHash()).get(1);
        assertThat(def.position().y()).isEqualTo(3);
        assertThat(def.position().x()).isEqualTo(3);
    }

    @Test
    void shouldDegradeToLinesWhenNothingIsRecognised() {
        String source = "x = 1\ny = 2\n";

        AtomizationResult result = atomize(atomizer, "calc.py", null, source);

        assertThat(result.atomsOfSubtype(Subtypes.CODE_LINE)).hasSize(2);
        assertThat(result.rootAtom().metadata()).contains("\"structural\":false");
    }
}
