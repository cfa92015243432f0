package com.libragraph.atomizer.types;

/**
 * Atom subtype labels shared between atomizers and consumers of their output.
 */
public final class Subtypes {

    private Subtypes() {
    }

    public static final String FILE_METADATA = "file-metadata";
    public static final String CHUNK = "chunk";

    // text and documents
    public static final String SENTENCE = "sentence";
    public static final String PARAGRAPH = "paragraph";
    public static final String HEADING = "heading";
    public static final String CODE_BLOCK = "code-block";
    public static final String LIST_ITEM = "list-item";
    public static final String LINK = "link";
    public static final String TABLE_ROW = "table-row";

    // structured data
    public static final String OBJECT = "object";
    public static final String ARRAY = "array";
    public static final String FIELD = "field";

    // source code
    public static final String IMPORT = "import";
    public static final String CLASS = "class";
    public static final String FUNCTION = "function";
    public static final String COMMENT = "comment";
    public static final String CODE_LINE = "code-line";

    // media
    public static final String PIXEL_BLOCK = "pixel-block";
    public static final String OCR_TEXT = "ocr-text";
    public static final String DETECTED_OBJECT = "detected-object";
    public static final String SCENE_ANALYSIS = "scene-analysis";
    public static final String AUDIO_BUFFER = "audio-buffer";
    public static final String PCM_CHUNK = "pcm-chunk";
    public static final String ENCODED_CHUNK = "encoded-chunk";
    public static final String VIDEO_BOX = "video-box";

    // model weights
    public static final String MODEL_METADATA = "model-metadata";
    public static final String MODEL_HEADER = "model-header";
    public static final String TENSOR = "tensor";
    public static final String WEIGHT_CHUNK = "weight-chunk";
    public static final String ONNX_NODE = "onnx-node";

    // binary fallback
    public static final String BYTE_CHUNK = "byte-chunk";
}
