package com.libragraph.atomizer.util.buffer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Spill buffer for decompressed entries too large for the heap. The backing file lives only as
 * long as the buffer: it is opened with {@code DELETE_ON_CLOSE} and removed by {@link #close()}.
 */
public final class FileBuffer extends Buffer {

    static final String PREFIX = "atomizer-spill-";

    private final Path file;
    private final FileChannel channel;

    private FileBuffer(Path file) throws IOException {
        this.file = file;
        this.channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE,
                StandardOpenOption.DELETE_ON_CLOSE);
    }

    public static FileBuffer createTemp() throws IOException {
        return new FileBuffer(Files.createTempFile(PREFIX, ".bin"));
    }

    public static FileBuffer createIn(Path directory) throws IOException {
        return new FileBuffer(Files.createTempFile(directory, PREFIX, ".bin"));
    }

    public Path file() {
        return file;
    }

    @Override
    public long size() {
        try {
            return channel.size();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to size spill file " + file, e);
        }
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        return channel.read(dst);
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        return channel.write(src);
    }

    // FileChannel.truncate already clamps the position
    @Override
    public SeekableByteChannel truncate(long newSize) throws IOException {
        channel.truncate(newSize);
        return this;
    }

    @Override
    public long position() throws IOException {
        return channel.position();
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        checkPosition(newPosition);
        channel.position(newPosition);
        return this;
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        if (channel.isOpen()) {
            channel.close();
            Files.deleteIfExists(file);
        }
    }
}
