package com.libragraph.atomizer.formats.codecs;

import com.libragraph.atomizer.formats.api.ResourceLimitExceededException;
import com.libragraph.atomizer.util.buffer.Buffer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Copies a decompressing stream into a fresh {@link Buffer}, stopping at a size ceiling.
 */
public final class BoundedCopy {

    private static final int CHUNK = 64 * 1024;

    private BoundedCopy() {
    }

    /**
     * @param expectedSize size hint for buffer allocation, or -1 when unknown
     * @param limitName    reported in the exception when {@code maxBytes} is exceeded
     * @throws ResourceLimitExceededException once more than {@code maxBytes} bytes are produced
     */
    public static Buffer copy(InputStream in, long expectedSize, long maxBytes, String limitName) throws IOException {
        Buffer output = Buffer.allocate(expectedSize >= 0 ? Math.min(expectedSize, maxBytes) : 64 * 1024);
        boolean done = false;
        try (OutputStream out = output.outputStream(0)) {
            byte[] chunk = new byte[CHUNK];
            long total = 0;
            int n;
            while ((n = in.read(chunk)) != -1) {
                total += n;
                if (total > maxBytes) {
                    throw new ResourceLimitExceededException(limitName, maxBytes, total);
                }
                out.write(chunk, 0, n);
            }
            done = true;
        } finally {
            if (!done) {
                output.close();
            }
        }
        return output;
    }
}
