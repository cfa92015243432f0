package com.libragraph.atomizer.formats.atomizers.text;

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
import com.libragraph.atomizer.util.ContentHash;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Code;
import org.commonmark.node.CustomBlock;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.ListBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.Text;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Markdown: headings, paragraphs, code blocks, list items, links and table rows, in document order
 * under the root. Each atom holds the element's Markdown rendering; positions carry the source
 * line (y) and the depth of the enclosing heading (z). Round trip is structural, not byte-exact.
 */
@ApplicationScoped
public class MarkdownAtomizer implements Atomizer {

    private static final DetectionCriteria CRITERIA = DetectionCriteria.of(25,
            Set.of("text/markdown", "text/x-markdown"),
            Set.of("md", "markdown", "mdown", "mkd"));

    private static final Parser PARSER = Parser.builder()
            .extensions(List.of(TablesExtension.create()))
            .includeSourceSpans(IncludeSourceSpans.BLOCKS)
            .build();

    private final AtomizerPipeline pipeline = new AtomizerPipeline(MarkdownAtomizer.class.getSimpleName(), Modality.TEXT);

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, this::atomizeMarkdown);
    }

    private FormatOutcome atomizeMarkdown(AtomizationContext ctx) {
        AtomGraph.Builder graph = AtomGraph.builder();
        DecodedText decoded = DecodedText.decode(ctx.content().toByteArray());
        if (decoded.fallback()) {
            graph.warn(decoded.fallbackWarning(ctx.source().fileName()));
        }

        Node document = PARSER.parse(decoded.text());
        StructureVisitor visitor = new StructureVisitor(ctx, graph);
        document.accept(visitor);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("headings", visitor.counts.getOrDefault(Subtypes.HEADING, 0));
        summary.put("codeBlocks", visitor.counts.getOrDefault(Subtypes.CODE_BLOCK, 0));
        summary.put("links", visitor.counts.getOrDefault(Subtypes.LINK, 0));
        summary.put("tableRows", visitor.counts.getOrDefault(Subtypes.TABLE_ROW, 0));
        return new FormatOutcome("text/markdown", summary, graph.build());
    }

    private static final class StructureVisitor extends AbstractVisitor {

        private final AtomizationContext ctx;
        private final AtomGraph.Builder graph;
        private final Map<String, Integer> counts = new LinkedHashMap<>();
        private int headingDepth;
        private int listDepth;

        StructureVisitor(AtomizationContext ctx, AtomGraph.Builder graph) {
            this.ctx = ctx;
            this.graph = graph;
        }

        @Override
        public void visit(Heading heading) {
            headingDepth = heading.getLevel();
            String text = textOf(heading);
            Map<String, Object> meta = Map.of("level", heading.getLevel());
            emit(heading, Modality.TEXT, Subtypes.HEADING, "#".repeat(heading.getLevel()) + " " + text,
                    "H" + heading.getLevel() + ": " + text, meta);
            emitLinks(heading);
        }

        @Override
        public void visit(Paragraph paragraph) {
            String text = textOf(paragraph);
            if (!text.isBlank()) {
                emit(paragraph, Modality.TEXT, Subtypes.PARAGRAPH, text, text, null);
            }
            emitLinks(paragraph);
        }

        @Override
        public void visit(FencedCodeBlock block) {
            String info = block.getInfo() == null ? "" : block.getInfo().trim();
            String language = info.isEmpty() ? null : info.split("\\s+")[0];
            codeBlock(block, block.getLiteral(), language);
        }

        @Override
        public void visit(IndentedCodeBlock block) {
            codeBlock(block, block.getLiteral(), null);
        }

        @Override
        public void visit(ListItem item) {
            ListBlock list = (ListBlock) item.getParent();
            StringBuilder sb = new StringBuilder();
            List<Node> nested = new ArrayList<>();
            for (Node child = item.getFirstChild(); child != null; child = child.getNext()) {
                if (child instanceof ListBlock) {
                    nested.add(child);
                } else {
                    if (sb.length() > 0) sb.append(' ');
                    collectText(child, sb);
                }
            }
            String text = sb.toString().trim();
            boolean ordered = list instanceof OrderedList;
            if (!text.isEmpty()) {
                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put("ordered", ordered);
                meta.put("depth", listDepth);
                emit(item, Modality.TEXT, Subtypes.LIST_ITEM, "  ".repeat(listDepth) + (ordered ? "1. " : "- ") + text,
                        text, meta);
                emitLinks(item);
            }
            listDepth++;
            nested.forEach(n -> n.accept(this));
            listDepth--;
        }

        @Override
        public void visit(CustomBlock block) {
            if (block instanceof TableBlock) {
                collectRows(block);
            } else {
                visitChildren(block);
            }
        }

        private void collectRows(Node node) {
            for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
                if (child instanceof TableRow row) {
                    List<String> cells = new ArrayList<>();
                    for (Node cell = row.getFirstChild(); cell != null; cell = cell.getNext()) {
                        cells.add(textOf(cell));
                    }
                    String rendered = "| " + String.join(" | ", cells) + " |";
                    emit(row, Modality.TEXT, Subtypes.TABLE_ROW, rendered, String.join(" | ", cells),
                            Map.of("cells", cells.size()));
                    emitLinks(row);
                } else {
                    collectRows(child);
                }
            }
        }

        private void codeBlock(Node block, String literal, String language) {
            Map<String, Object> meta = new LinkedHashMap<>();
            if (language != null) meta.put("language", language);
            meta.put("lines", literal.isEmpty() ? 0 : literal.split("\n", -1).length - 1);
            String fence = "```" + (language == null ? "" : language);
            emit(block, Modality.CODE, Subtypes.CODE_BLOCK, fence + "\n" + literal + "```",
                    literal, meta);
        }

        private void emitLinks(Node block) {
            for (Link link : linksIn(block)) {
                String text = textOf(link);
                String rendered = "[" + text + "](" + link.getDestination() + ")";
                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put("url", link.getDestination());
                if (link.getTitle() != null) meta.put("title", link.getTitle());
                emit(block, Modality.TEXT, Subtypes.LINK, rendered, text.isEmpty() ? link.getDestination() : text, meta);
            }
        }

        private void emit(Node node, Modality modality, String subtype, String rendered,
                          String canonical, Map<String, Object> meta) {
            ctx.checkCancelled();
            ContentHash hash = graph.addPayload(modality, subtype, rendered.getBytes(StandardCharsets.UTF_8),
                    canonical, meta);
            graph.link(ctx.rootHash(), hash, new Position(0, lineOf(node), headingDepth, 0, null));
            counts.merge(subtype, 1, Integer::sum);
        }

        private static int lineOf(Node node) {
            for (Node n = node; n != null; n = n.getParent()) {
                List<SourceSpan> spans = n.getSourceSpans();
                if (spans != null && !spans.isEmpty()) {
                    return spans.get(0).getLineIndex() + 1;
                }
            }
            return 0;
        }

        private static List<Link> linksIn(Node node) {
            List<Link> links = new ArrayList<>();
            node.accept(new AbstractVisitor() {
                @Override
                public void visit(Link link) {
                    links.add(link);
                }

                @Override
                public void visit(ListItem item) {
                    if (item == node) visitChildren(item);
                }
            });
            return links;
        }

        private static String textOf(Node node) {
            StringBuilder sb = new StringBuilder();
            collectText(node, sb);
            return sb.toString().trim();
        }

        private static void collectText(Node node, StringBuilder sb) {
            if (node instanceof Text text) {
                sb.append(text.getLiteral());
            } else if (node instanceof Code code) {
                sb.append(code.getLiteral());
            } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
                sb.append(' ');
            } else {
                for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
                    collectText(child, sb);
                }
            }
        }
    }
}
