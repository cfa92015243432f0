package com.libragraph.atomizer.formats.pipeline;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Text decoded for atomization. Strict UTF-8 first; bytes that are not valid UTF-8 are read as
 * ISO-8859-1, which maps every byte to one char. Either way {@link #encode} of any substring
 * gives back the original bytes of that span.
 *
 * @param fallback true when the UTF-8 decode failed
 */
public record DecodedText(String text, Charset charset, boolean fallback) {

    public static DecodedText decode(byte[] bytes) {
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return new DecodedText(text, StandardCharsets.UTF_8, false);
        } catch (CharacterCodingException e) {
            return new DecodedText(new String(bytes, StandardCharsets.ISO_8859_1), StandardCharsets.ISO_8859_1, true);
        }
    }

    public byte[] encode(int start, int end) {
        return text.substring(start, end).getBytes(charset);
    }

    public String fallbackWarning(String fileName) {
        return fileName + " is not valid UTF-8; decoded as ISO-8859-1";
    }
}
