package com.github.jnthnclt.os.bloom.base;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * A read only window onto a byte array. The window cannot be moved, the array underneath is shared.
 */
public class BolBuffer {

    public final byte[] bytes;
    public final int offset;
    public final int length;

    public BolBuffer(byte[] bytes, int offset, int length) {
        Preconditions.checkPositionIndexes(offset, offset + length, bytes.length);
        this.bytes = bytes;
        this.offset = offset;
        this.length = length;
    }

    public byte get(int index) {
        Preconditions.checkElementIndex(index, length);
        return bytes[offset + index];
    }

    public byte[] copy() {
        return Arrays.copyOfRange(bytes, offset, offset + length);
    }

    @Override
    public String toString() {
        return "BolBuffer{"
            + "bytes=" + bytes.length
            + ", offset=" + offset
            + ", length=" + length
            + '}';
    }
}
