package com.github.jnthnclt.os.bloom.core.api;

import com.google.common.base.Preconditions;

/**
 * Locates a bloom inside a block, the page it lives on and its byte offset within that page.
 */
public class BloomOffset implements Comparable<BloomOffset> {

    public final int page;
    public final int byteOffset;

    public BloomOffset(int page, int byteOffset) {
        Preconditions.checkArgument(page >= 0, "page must be non-negative, was %s", page);
        Preconditions.checkArgument(byteOffset >= 0, "byteOffset must be non-negative, was %s", byteOffset);
        this.page = page;
        this.byteOffset = byteOffset;
    }

    @Override
    public int compareTo(BloomOffset o) {
        int c = Integer.compare(page, o.page);
        if (c != 0) {
            return c;
        }
        return Integer.compare(byteOffset, o.byteOffset);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        BloomOffset other = (BloomOffset) obj;
        return page == other.page && byteOffset == other.byteOffset;
    }

    @Override
    public int hashCode() {
        return 31 * page + byteOffset;
    }

    @Override
    public String toString() {
        return "BloomOffset{" + "page=" + page + ", byteOffset=" + byteOffset + '}';
    }
}
