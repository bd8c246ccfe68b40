package com.github.jnthnclt.os.bloom.core;

import java.util.concurrent.atomic.LongAdder;

/**
 *
 * @author jonathan.colt
 */
public class BloomStats {

    public final LongAdder headerLoads = new LongAdder();
    public final LongAdder pagesDecoded = new LongAdder();
    public final LongAdder pageBytesRead = new LongAdder();
    public final LongAdder pagesTooLarge = new LongAdder();
    public final LongAdder pageChecksumFailures = new LongAdder();
    public final LongAdder pagesRelinquished = new LongAdder();
    public final LongAdder pagesForfeited = new LongAdder();

    @Override
    public String toString() {
        return "BloomStats{"
            + "headerLoads=" + headerLoads
            + ", pagesDecoded=" + pagesDecoded
            + ", pageBytesRead=" + pageBytesRead
            + ", pagesTooLarge=" + pagesTooLarge
            + ", pageChecksumFailures=" + pageChecksumFailures
            + ", pagesRelinquished=" + pagesRelinquished
            + ", pagesForfeited=" + pagesForfeited
            + '}';
    }
}
