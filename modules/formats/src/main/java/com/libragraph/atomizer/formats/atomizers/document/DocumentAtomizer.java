package com.libragraph.atomizer.formats.atomizers.document;

import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.DetectionCriteria;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.atomizers.text.SentenceSegmenter;
import com.libragraph.atomizer.formats.pipeline.AtomGraph;
import com.libragraph.atomizer.formats.pipeline.AtomizationContext;
import com.libragraph.atomizer.formats.pipeline.AtomizerPipeline;
import com.libragraph.atomizer.formats.pipeline.FormatOutcome;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.ContentHash;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.tika.exception.TikaException;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.Office;
import org.apache.tika.metadata.PagedText;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.jboss.logging.Logger;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Office and publishing documents through Apache Tika. Extracted text is split into
 * {@code paragraph} carriers whose children are {@code sentence} atoms. A document Tika cannot
 * parse keeps its metadata atom and gets a warning.
 */
@ApplicationScoped
public class DocumentAtomizer implements Atomizer {

    private static final Logger log = Logger.getLogger(DocumentAtomizer.class);

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n|\\r\\n\\s*\\r\\n");

    private static final DetectionCriteria CRITERIA = DetectionCriteria.of(40,
            Set.of("application/pdf",
                    "application/msword",
                    "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
                    "application/vnd.ms-excel",
                    "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
                    "application/vnd.ms-powerpoint",
                    "application/vnd.openxmlformats-officedocument.presentationml.presentation",
                    "application/vnd.oasis.opendocument.text",
                    "application/vnd.oasis.opendocument.spreadsheet",
                    "application/vnd.oasis.opendocument.presentation",
                    "application/rtf",
                    "text/rtf",
                    "application/epub+zip"),
            Set.of("pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "odt", "ods", "odp", "rtf", "epub"));

    private final AtomizerPipeline pipeline = new AtomizerPipeline(DocumentAtomizer.class.getSimpleName(), Modality.DOCUMENT);
    private final Parser parser = new AutoDetectParser();

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, this::atomizeDocument);
    }

    private FormatOutcome atomizeDocument(AtomizationContext ctx) throws IOException {
        AtomGraph.Builder graph = AtomGraph.builder();
        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, ctx.source().fileName());
        metadata.set(Metadata.CONTENT_TYPE, ctx.source().contentType());
        BodyContentHandler handler = new BodyContentHandler(-1);

        String text;
        try (InputStream stream = TikaInputStream.get(ctx.content().inputStream(0))) {
            parser.parse(stream, handler, metadata, new ParseContext());
            text = handler.toString();
        } catch (TikaException | SAXException e) {
            log.warnf("Tika could not parse %s: %s", ctx.source().fileName(), e.getMessage());
            graph.warn("Document " + ctx.source().fileName() + " could not be parsed: " + e.getMessage());
            text = "";
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        putIfPresent(summary, "title", metadata.get(TikaCoreProperties.TITLE));
        putIfPresent(summary, "author", metadata.get(TikaCoreProperties.CREATOR));
        String pages = metadata.get(PagedText.N_PAGES);
        if (pages == null) {
            pages = metadata.get(Office.PAGE_COUNT);
        }
        putIfPresent(summary, "pageCount", pages);

        int paragraphs = 0;
        int offset = 0;
        for (String paragraph : paragraphs(text)) {
            ctx.checkCancelled();
            addParagraph(ctx, graph, paragraph, offset);
            offset += paragraph.length();
            paragraphs++;
        }
        summary.put("characters", text.length());
        summary.put("paragraphs", paragraphs);

        String detected = metadata.get(Metadata.CONTENT_TYPE);
        return new FormatOutcome(detected == null ? ctx.source().contentType() : detected, summary, graph.build());
    }

    static List<String> paragraphs(String text) {
        List<String> result = new ArrayList<>();
        for (String part : PARAGRAPH_BREAK.split(text)) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    private static void addParagraph(AtomizationContext ctx, AtomGraph.Builder graph, String paragraph, int offset) {
        byte[] bytes = paragraph.getBytes(StandardCharsets.UTF_8);
        ContentHash hash = ContentHash.ofUtf8(Subtypes.PARAGRAPH + ":" + paragraph);
        graph.addNode(hash, Modality.DOCUMENT, Subtypes.PARAGRAPH, bytes, paragraph, null);
        graph.link(ctx.rootHash(), hash, Position.offset(offset));
        if (!graph.markExpanded(hash)) {
            return;
        }
        for (SentenceSegmenter.Segment segment : SentenceSegmenter.segment(paragraph)) {
            String sentence = segment.of(paragraph);
            graph.addChild(hash, Position.offset(segment.start()), Modality.TEXT, Subtypes.SENTENCE,
                    sentence.getBytes(StandardCharsets.UTF_8), sentence.strip(), null);
        }
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value);
        }
    }
}
