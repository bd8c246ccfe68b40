package com.github.jnthnclt.os.bloom.base;

/**
 * Source of page decode buffers. A pool must outlive every reader that draws from it.
 */
public interface PageBufferPool {

    /**
     * @return a buffer of at least size bytes, contents undefined
     */
    byte[] acquire(int size);

    void recycle(byte[] bytes);
}
