package com.github.jnthnclt.os.bloom.io;

import com.github.jnthnclt.os.bloom.base.UIO;
import java.io.EOFException;
import java.io.IOException;

public class PointerReadableBytes implements IPointerReadable {

    private final byte[] bytes;

    public PointerReadableBytes(byte[] bytes) {
        this.bytes = bytes;
    }

    @Override
    public long length() {
        return bytes.length;
    }

    @Override
    public int read(long readPointer) throws IOException {
        if (readPointer < 0 || readPointer >= bytes.length) {
            return -1;
        }
        return bytes[(int) readPointer] & 0xFF;
    }

    @Override
    public int readInt(long readPointer) throws IOException {
        checkBounds(readPointer, 4);
        return UIO.bytesInt(bytes, (int) readPointer);
    }

    @Override
    public long readLong(long readPointer) throws IOException {
        checkBounds(readPointer, 8);
        return UIO.bytesLong(bytes, (int) readPointer);
    }

    @Override
    public int read(long readPointer, byte[] b, int _offset, int _len) throws IOException {
        checkBounds(readPointer, _len);
        System.arraycopy(bytes, (int) readPointer, b, _offset, _len);
        return _len;
    }

    private void checkBounds(long readPointer, int length) throws EOFException {
        if (readPointer < 0 || readPointer + length > bytes.length) {
            throw new EOFException("Cannot read " + length + " bytes at " + readPointer + " of " + bytes.length);
        }
    }
}
