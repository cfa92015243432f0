package com.libragraph.atomizer.formats.tika;

import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.util.buffer.BinaryData;
import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.detect.Detector;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;

/**
 * Detects the MIME type of nested content from its bytes and entry name. Used for archive entries,
 * whose declared type is unknown.
 */
public final class ContentTypeDetector {

    private static final Logger log = Logger.getLogger(ContentTypeDetector.class);

    private static final Detector DETECTOR = new DefaultDetector();

    private ContentTypeDetector() {
    }

    /**
     * @param name entry or file name, may be null
     * @return detected MIME type without parameters; {@code application/octet-stream} when unknown
     */
    public static String detect(BinaryData content, String name) {
        Metadata metadata = new Metadata();
        if (name != null) {
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, name);
        }
        try (InputStream stream = TikaInputStream.get(content.inputStream(0))) {
            MediaType type = DETECTOR.detect(stream, metadata);
            return type.getBaseType().toString();
        } catch (IOException e) {
            log.debugf("Content type detection failed for %s: %s", name, e.getMessage());
            return SourceMetadata.DEFAULT_CONTENT_TYPE;
        }
    }
}
