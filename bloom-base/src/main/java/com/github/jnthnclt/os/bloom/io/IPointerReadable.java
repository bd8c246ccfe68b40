package com.github.jnthnclt.os.bloom.io;

import java.io.IOException;

/**
 * Random access, read only view of a block's bytes.
 *
 * @author jonathan.colt
 */
public interface IPointerReadable {

    long length();

    int read(long readPointer) throws IOException;

    int readInt(long readPointer) throws IOException;

    long readLong(long readPointer) throws IOException;

    int read(long readPointer, byte b[], int _offset, int _len) throws IOException;

}
