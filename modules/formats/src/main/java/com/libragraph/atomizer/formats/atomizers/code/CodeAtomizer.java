package com.libragraph.atomizer.formats.atomizers.code;

import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.DetectionCriteria;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.pipeline.AtomGraph;
import com.libragraph.atomizer.formats.pipeline.AtomizationContext;
import com.libragraph.atomizer.formats.pipeline.AtomizerPipeline;
import com.libragraph.atomizer.formats.pipeline.DecodedText;
import com.libragraph.atomizer.formats.pipeline.FormatOutcome;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Source code: imports, type declarations, functions and comments, positioned by line and column.
 * When the language is unknown or nothing is recognised, every non-blank line becomes a
 * {@code code-line} atom instead.
 */
@ApplicationScoped
public class CodeAtomizer implements Atomizer {

    private static final DetectionCriteria CRITERIA = DetectionCriteria.of(20,
            Set.of("text/x-java-source", "text/x-java", "text/x-kotlin", "text/x-scala", "text/x-csharp",
                    "text/x-python", "application/x-python", "text/javascript", "application/javascript",
                    "application/typescript", "text/x-go", "text/x-rust", "text/x-c", "text/x-c++src",
                    "text/x-ruby", "application/x-php", "application/sql", "text/x-sql", "application/x-sh",
                    "text/x-shellscript", "text/x-powershell", "text/x-swift"),
            Arrays.stream(CodeLanguage.values())
                    .flatMap(l -> l.extensions().stream())
                    .collect(Collectors.toUnmodifiableSet()));

    private static final Set<String> KEYWORDS = Set.of(
            "if", "else", "for", "foreach", "while", "switch", "return", "catch", "sizeof", "new", "delete", "do");

    private final AtomizerPipeline pipeline = new AtomizerPipeline(CodeAtomizer.class.getSimpleName(), Modality.CODE);

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, this::atomizeCode);
    }

    /**
     * A recognised source element; {@code line} and {@code column} are 1-based.
     */
    record Element(String subtype, int line, int column, String text, String name) {
    }

    private FormatOutcome atomizeCode(AtomizationContext ctx) {
        AtomGraph.Builder graph = AtomGraph.builder();
        DecodedText decoded = DecodedText.decode(ctx.content().toByteArray());
        if (decoded.fallback()) {
            graph.warn(decoded.fallbackWarning(ctx.source().fileName()));
        }

        Optional<CodeLanguage> language = CodeLanguage.forExtension(ctx.source().fileExtension())
                .or(() -> CodeLanguage.forContentType(ctx.source().contentType()));
        String[] lines = decoded.text().split("\r?\n", -1);

        List<Element> elements = language.map(l -> extract(l, lines)).orElse(List.of());
        boolean degraded = elements.isEmpty();
        if (degraded) {
            elements = lineElements(lines);
        }

        String languageId = language.map(CodeLanguage::id).orElse("unknown");
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int i = 0; i < elements.size(); i++) {
            if (i % 256 == 0) {
                ctx.checkCancelled();
            }
            Element e = elements.get(i);
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("language", languageId);
            if (e.name() != null) {
                meta.put("name", e.name());
            }
            graph.addChild(ctx.rootHash(), Position.lineColumn(e.line(), e.column()), Modality.CODE, e.subtype(),
                    e.text().getBytes(StandardCharsets.UTF_8), e.text(), meta);
            counts.merge(e.subtype(), 1, Integer::sum);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("language", languageId);
        summary.put("lines", lines.length);
        summary.put("structural", !degraded);
        summary.put("elements", counts);
        return new FormatOutcome("text/x-" + languageId, summary, graph.build());
    }

    static List<Element> extract(CodeLanguage language, String[] lines) {
        List<Element> elements = new ArrayList<>();
        StringBuilder block = null;
        int blockLine = 0;
        int blockColumn = 0;
        Element pendingLineComment = null;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String trimmed = line.strip();
            int column = line.indexOf(trimmed) + 1;

            if (block != null) {
                block.append('\n').append(line);
                if (line.contains(language.blockEnd())) {
                    elements.add(new Element(Subtypes.COMMENT, blockLine, blockColumn, block.toString().strip(), null));
                    block = null;
                }
                continue;
            }

            boolean isLineComment = language.lineComment() != null && trimmed.startsWith(language.lineComment())
                    && (language.blockStart() == null || !trimmed.startsWith(language.blockStart()));
            if (isLineComment) {
                if (pendingLineComment != null && pendingLineComment.line() + countLines(pendingLineComment.text()) == i + 1) {
                    pendingLineComment = new Element(Subtypes.COMMENT, pendingLineComment.line(),
                            pendingLineComment.column(), pendingLineComment.text() + "\n" + trimmed, null);
                } else {
                    flush(elements, pendingLineComment);
                    pendingLineComment = new Element(Subtypes.COMMENT, i + 1, column, trimmed, null);
                }
                continue;
            }
            flush(elements, pendingLineComment);
            pendingLineComment = null;

            if (language.blockStart() != null && trimmed.startsWith(language.blockStart())) {
                if (trimmed.indexOf(language.blockEnd(), language.blockStart().length()) >= 0) {
                    elements.add(new Element(Subtypes.COMMENT, i + 1, column, trimmed, null));
                } else {
                    block = new StringBuilder(line);
                    blockLine = i + 1;
                    blockColumn = column;
                }
                continue;
            }
            if (trimmed.isEmpty()) {
                continue;
            }

            Element element = match(language.imports(), Subtypes.IMPORT, line, trimmed, i + 1, column);
            if (element == null) element = match(language.types(), Subtypes.CLASS, line, trimmed, i + 1, column);
            if (element == null) element = match(language.functions(), Subtypes.FUNCTION, line, trimmed, i + 1, column);
            if (element != null) {
                elements.add(element);
            }
        }
        flush(elements, pendingLineComment);
        if (block != null) {
            elements.add(new Element(Subtypes.COMMENT, blockLine, blockColumn, block.toString().strip(), null));
        }
        return elements;
    }

    private static Element match(Pattern pattern, String subtype, String line, String trimmed, int lineNo, int column) {
        if (pattern == null) {
            return null;
        }
        Matcher m = pattern.matcher(line);
        if (!m.find()) {
            return null;
        }
        String name = null;
        for (int g = m.groupCount(); g >= 1; g--) {
            if (m.group(g) != null) {
                name = m.group(g);
                break;
            }
        }
        if (name != null && KEYWORDS.contains(name)) {
            return null;
        }
        return new Element(subtype, lineNo, column, trimmed, name);
    }

    private static List<Element> lineElements(String[] lines) {
        List<Element> elements = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].strip();
            if (!trimmed.isEmpty()) {
                elements.add(new Element(Subtypes.CODE_LINE, i + 1, lines[i].indexOf(trimmed) + 1, trimmed, null));
            }
        }
        return elements;
    }

    private static void flush(List<Element> elements, Element pending) {
        if (pending != null) {
            elements.add(pending);
        }
    }

    private static int countLines(String text) {
        return (int) text.chars().filter(c -> c == '\n').count() + 1;
    }
}
