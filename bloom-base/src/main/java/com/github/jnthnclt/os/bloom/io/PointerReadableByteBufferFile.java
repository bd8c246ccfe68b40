package com.github.jnthnclt.os.bloom.io;

import com.github.jnthnclt.os.bloom.base.UIO;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * Memory maps a read only file in power of two segments.
 */
public class PointerReadableByteBufferFile implements IPointerReadable {

    public static final long MAX_BUFFER_SEGMENT_SIZE = UIO.chunkLength(30);

    private final long maxBufferSegmentSize;
    private final File file;
    private final long length;
    private final ByteBuffer[] bbs;
    private final int fShift;
    private final long fseekMask;

    public PointerReadableByteBufferFile(long maxBufferSegmentSize, File file) throws IOException {
        this.maxBufferSegmentSize = Math.min(UIO.chunkLength(UIO.chunkPower(maxBufferSegmentSize, 0)), MAX_BUFFER_SEGMENT_SIZE);
        this.file = file;
        this.fShift = Long.numberOfTrailingZeros(this.maxBufferSegmentSize);
        this.fseekMask = this.maxBufferSegmentSize - 1;

        try (RandomAccessFile raf = new RandomAccessFile(file, "r"); FileChannel channel = raf.getChannel()) {
            this.length = channel.size();
            int segments = (int) (length >> fShift) + 1;
            this.bbs = new ByteBuffer[segments];
            for (int n = 0; n < segments; n++) {
                long segmentOffset = this.maxBufferSegmentSize * n;
                long segmentLength = Math.min(this.maxBufferSegmentSize, length - segmentOffset);
                bbs[n] = channel.map(FileChannel.MapMode.READ_ONLY, segmentOffset, segmentLength);
            }
        }
    }

    public File getFile() {
        return file;
    }

    @Override
    public long length() {
        return length;
    }

    @Override
    public int read(long position) throws IOException {
        if (position < 0 || position >= length) {
            return -1;
        }
        return bbs[(int) (position >> fShift)].get((int) (position & fseekMask)) & 0xFF;
    }

    @Override
    public int readInt(long position) throws IOException {
        return UIO.bytesInt(readAtMost(position, 4));
    }

    @Override
    public long readLong(long position) throws IOException {
        return UIO.bytesLong(readAtMost(position, 8));
    }

    private byte[] readAtMost(long position, int count) throws IOException {
        byte[] bytes = new byte[count];
        read(position, bytes, 0, count);
        return bytes;
    }

    @Override
    public int read(long position, byte[] b, int offset, int len) throws IOException {
        if (position < 0 || position + len > length) {
            throw new EOFException("Cannot read " + len + " bytes at " + position + " of " + length + " in " + file);
        }
        int remaining = len;
        while (remaining > 0) {
            ByteBuffer bb = bbs[(int) (position >> fShift)];
            int segmentPosition = (int) (position & fseekMask);
            int chunk = Math.min(remaining, bb.limit() - segmentPosition);
            for (int i = 0; i < chunk; i++) {
                b[offset + i] = bb.get(segmentPosition + i);
            }
            position += chunk;
            offset += chunk;
            remaining -= chunk;
        }
        return len;
    }

    @Override
    public String toString() {
        return "PointerReadableByteBufferFile{"
            + "file=" + file
            + ", length=" + length
            + ", segments=" + bbs.length
            + '}';
    }
}
