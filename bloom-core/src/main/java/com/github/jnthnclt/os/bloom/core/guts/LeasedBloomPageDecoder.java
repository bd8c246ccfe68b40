package com.github.jnthnclt.os.bloom.core.guts;

import com.github.jnthnclt.os.bloom.base.BolBuffer;
import com.github.jnthnclt.os.bloom.base.PageLease;
import com.github.jnthnclt.os.bloom.base.UIO;
import com.github.jnthnclt.os.bloom.core.BloomStats;
import com.github.jnthnclt.os.bloom.core.api.Bloom;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomPageDecodeException;
import com.github.jnthnclt.os.bloom.core.guts.api.BloomPageDecoder;

/**
 * Decodes length prefixed blooms straight out of a leased page buffer.
 */
class LeasedBloomPageDecoder implements BloomPageDecoder {

    private final int pageIndex;
    private final int bloomCount;
    private final PageLease lease;
    private final BloomStats stats;

    private int position;
    private Bloom cur;
    private BloomPageDecodeException err;

    LeasedBloomPageDecoder(int pageIndex, int bloomCount, PageLease lease, BloomStats stats) {
        this.pageIndex = pageIndex;
        this.bloomCount = bloomCount;
        this.lease = lease;
        this.stats = stats;
    }

    @Override
    public int pageIndex() {
        return pageIndex;
    }

    @Override
    public int bloomCount() {
        return bloomCount;
    }

    @Override
    public void seek(int byteOffset) {
        err = null;
        cur = null;
        position = byteOffset;
        decode();
    }

    @Override
    public boolean next() {
        if (err != null || position >= lease.length()) {
            return false;
        }
        return decode();
    }

    private boolean decode() {
        byte[] page = lease.bytes();
        int length = lease.length();
        if (position < 0 || position + 4L > length) {
            err = new BloomPageDecodeException("No bloom length at " + position + " in page " + pageIndex + " of " + length + " bytes.");
            return false;
        }
        int filterLength = UIO.bytesInt(page, position);
        if (filterLength < 0 || position + 4L + filterLength > length) {
            err = new BloomPageDecodeException("Bloom at " + position + " in page " + pageIndex + " claims " + filterLength + " bytes.");
            return false;
        }
        cur = new Bloom(new BolBuffer(page, position + 4, filterLength));
        position += 4 + filterLength;
        return true;
    }

    @Override
    public Bloom at() {
        return cur;
    }

    @Override
    public BloomPageDecodeException err() {
        return err;
    }

    @Override
    public void relinquish() {
        lease.release();
        stats.pagesRelinquished.increment();
    }

    @Override
    public void forfeit() {
        lease.forfeit();
        stats.pagesForfeited.increment();
    }

    @Override
    public String toString() {
        return "LeasedBloomPageDecoder{"
            + "pageIndex=" + pageIndex
            + ", position=" + position
            + ", lease=" + lease
            + ", err=" + err
            + '}';
    }
}
