package com.github.jnthnclt.os.bloom.core;

import com.github.jnthnclt.os.bloom.base.BucketedPageBufferPool;
import com.github.jnthnclt.os.bloom.base.HeapPageBufferPool;
import com.github.jnthnclt.os.bloom.base.PageBufferPool;
import com.github.jnthnclt.os.bloom.core.api.BloomBlockReader;
import com.github.jnthnclt.os.bloom.core.api.BloomReaderConfig;
import com.github.jnthnclt.os.bloom.core.guts.PagedBloomBlock;
import com.github.jnthnclt.os.bloom.core.guts.ReadOnlyBloomFile;
import com.github.jnthnclt.os.bloom.core.guts.api.BloomBlock;
import com.github.jnthnclt.os.bloom.log.BloomLogger;
import com.github.jnthnclt.os.bloom.log.BloomLoggerFactory;
import java.io.File;

/**
 * Wires blocks, cursors and queriers to one pool and one set of stats. The pool lives as long as this instance,
 * so every cursor handed out must be done before it is discarded.
 *
 * @author jonathan.colt
 */
public class BloomReaders {

    private static final BloomLogger LOG = BloomLoggerFactory.getLogger();

    private final BloomReaderConfig config;
    private final PageBufferPool pool;
    private final BloomStats stats = new BloomStats();

    public BloomReaders(BloomReaderConfig config) {
        this(config, config.usePool
            ? new BucketedPageBufferPool(config.poolMinPower, config.poolMaxPower, config.poolBuffersPerBucket)
            : HeapPageBufferPool.INSTANCE);
    }

    public BloomReaders(BloomReaderConfig config, PageBufferPool pool) {
        this.config = config;
        this.pool = pool;
        LOG.info("Bloom readers configured {}", config);
    }

    public BloomBlock open(String name, BloomBlockReader reader) {
        return new PagedBloomBlock(name, reader, pool, stats);
    }

    public BloomBlock open(File file) {
        return open(file.getName(), new ReadOnlyBloomFile(file));
    }

    public LazyBloomCursor cursor(BloomBlock block) {
        return new LazyBloomCursor(block, config.usePool, config.maxPageSize, stats);
    }

    public LazyBloomQuerier querier(BloomBlock block) {
        return new LazyBloomQuerier(cursor(block));
    }

    public BloomReaderConfig config() {
        return config;
    }

    public PageBufferPool pool() {
        return pool;
    }

    public BloomStats stats() {
        return stats;
    }
}
