package com.github.jnthnclt.os.bloom.base;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single owner handle on a pooled page buffer. The lease ends exactly once, either by {@link #release()}
 * which hands the buffer back to its pool, or by {@link #forfeit()} which lets the buffer escape with
 * whatever still references it. Touching the lease after it ended throws.
 */
public class PageLease {

    private final PageBufferPool pool;
    private final byte[] bytes;
    private final int length;
    private final AtomicBoolean ended = new AtomicBoolean(false);

    private PageLease(PageBufferPool pool, byte[] bytes, int length) {
        this.pool = pool;
        this.bytes = bytes;
        this.length = length;
    }

    public static PageLease acquire(PageBufferPool pool, int length) {
        return new PageLease(pool, pool.acquire(length), length);
    }

    public byte[] bytes() {
        if (ended.get()) {
            throw new IllegalStateException("Lease on " + length + " bytes already ended.");
        }
        return bytes;
    }

    /**
     * Number of meaningful bytes, the backing array may be larger.
     */
    public int length() {
        return length;
    }

    public boolean isEnded() {
        return ended.get();
    }

    public void release() {
        end("release");
        pool.recycle(bytes);
    }

    public void forfeit() {
        end("forfeit");
    }

    private void end(String how) {
        if (!ended.compareAndSet(false, true)) {
            throw new IllegalStateException("Cannot " + how + " a lease on " + length + " bytes that already ended.");
        }
    }

    @Override
    public String toString() {
        return "PageLease{"
            + "length=" + length
            + ", capacity=" + bytes.length
            + ", ended=" + ended.get()
            + '}';
    }
}
