package com.libragraph.atomizer.formats.atomizers.structured;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.DetectionCriteria;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.pipeline.AtomizerPipeline;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Set;

/**
 * XML documents, read into a tree where elements become objects, repeated elements arrays,
 * and attributes and text scalar fields. Malformed XML is a structural failure.
 */
@ApplicationScoped
public class XmlAtomizer implements Atomizer {

    private static final DetectionCriteria CRITERIA = DetectionCriteria.of(25,
            Set.of("application/xml", "text/xml"),
            Set.of("xml", "xsd", "xsl", "xslt", "pom", "svgz"));

    private final AtomizerPipeline pipeline = new AtomizerPipeline(XmlAtomizer.class.getSimpleName(), Modality.STRUCTURED);
    private final TreeAtomization tree = new TreeAtomization(new XmlMapper(), "application/xml");

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, tree::atomize);
    }
}
