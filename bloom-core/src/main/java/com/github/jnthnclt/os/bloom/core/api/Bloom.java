package com.github.jnthnclt.os.bloom.core.api;

import com.github.jnthnclt.os.bloom.base.BolBuffer;

/**
 * A decoded bloom. The bytes are a view onto the page buffer that produced them; when that buffer is pooled
 * they are only valid until the reader moves off the page. Call {@link #copy()} to keep them longer.
 */
public class Bloom {

    private final BolBuffer filter;

    public Bloom(BolBuffer filter) {
        this.filter = filter;
    }

    /**
     * The fixed window onto the page buffer. It cannot be re-pointed.
     */
    public BolBuffer filter() {
        return filter;
    }

    public byte get(int index) {
        return filter.get(index);
    }

    public int sizeInBytes() {
        return filter.length;
    }

    public byte[] copy() {
        return filter.copy();
    }

    @Override
    public String toString() {
        return "Bloom{" + "filter=" + filter + '}';
    }
}
