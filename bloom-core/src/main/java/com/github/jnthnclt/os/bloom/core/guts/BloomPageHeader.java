package com.github.jnthnclt.os.bloom.core.guts;

import com.github.jnthnclt.os.bloom.io.IAppendOnly;
import com.github.jnthnclt.os.bloom.io.IPointerReadable;
import java.io.IOException;

/**
 *
 * @author jonathan.colt
 */
public class BloomPageHeader {

    public static final int SIZE_IN_BYTES = 8 + 4 + 4;

    /** absolute position of the page's first record */
    public final long offset;
    /** record bytes, excludes the trailing checksum */
    public final int length;
    public final int bloomCount;

    public BloomPageHeader(long offset, int length, int bloomCount) {
        this.offset = offset;
        this.length = length;
        this.bloomCount = bloomCount;
    }

    public void write(IAppendOnly writeable) throws IOException {
        writeable.appendLong(offset);
        writeable.appendInt(length);
        writeable.appendInt(bloomCount);
    }

    static BloomPageHeader read(IPointerReadable readable, long fp) throws IOException {
        long offset = readable.readLong(fp);
        int length = readable.readInt(fp + 8);
        int bloomCount = readable.readInt(fp + 8 + 4);
        return new BloomPageHeader(offset, length, bloomCount);
    }

    @Override
    public String toString() {
        return "BloomPageHeader{"
            + "offset=" + offset
            + ", length=" + length
            + ", bloomCount=" + bloomCount
            + '}';
    }
}
