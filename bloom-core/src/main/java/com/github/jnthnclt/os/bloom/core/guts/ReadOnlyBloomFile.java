package com.github.jnthnclt.os.bloom.core.guts;

import com.github.jnthnclt.os.bloom.core.api.BloomBlockReader;
import com.github.jnthnclt.os.bloom.io.IPointerReadable;
import com.github.jnthnclt.os.bloom.io.PointerReadableByteBufferFile;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

/**
 * Maps a block file on first use and shares the mapping with every caller.
 *
 * @author jonathan.colt
 */
public class ReadOnlyBloomFile implements BloomBlockReader {

    public static final long BUFFER_SEGMENT_SIZE = 1024L * 1024 * 1024;

    private final File file;
    private final long bufferSegmentSize;
    private volatile PointerReadableByteBufferFile pointerReadable;

    public ReadOnlyBloomFile(File file) {
        this(file, BUFFER_SEGMENT_SIZE);
    }

    public ReadOnlyBloomFile(File file, long bufferSegmentSize) {
        this.file = file;
        this.bufferSegmentSize = bufferSegmentSize;
    }

    public String getFileName() {
        return file.toString();
    }

    @Override
    public IPointerReadable blooms() throws IOException {
        PointerReadableByteBufferFile got = pointerReadable;
        if (got == null) {
            synchronized (this) {
                got = pointerReadable;
                if (got == null) {
                    if (!file.exists()) {
                        throw new FileNotFoundException("Missing bloom block " + file);
                    }
                    got = new PointerReadableByteBufferFile(bufferSegmentSize, file);
                    pointerReadable = got;
                }
            }
        }
        return got;
    }

    @Override
    public String toString() {
        return "ReadOnlyBloomFile{" + "file=" + file + ", mapped=" + (pointerReadable != null) + '}';
    }
}
