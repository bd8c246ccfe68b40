package com.github.jnthnclt.os.bloom.core;

import com.github.jnthnclt.os.bloom.core.api.Bloom;
import com.github.jnthnclt.os.bloom.core.api.BloomOffset;
import com.github.jnthnclt.os.bloom.core.api.CursorError;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomBlockException;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomPageDecodeException;
import com.github.jnthnclt.os.bloom.core.guts.CursorState;
import com.github.jnthnclt.os.bloom.core.guts.api.BloomBlock;
import com.github.jnthnclt.os.bloom.core.guts.api.BloomPageDecoder;
import com.github.jnthnclt.os.bloom.io.IPointerReadable;
import com.github.jnthnclt.os.bloom.log.BloomLogger;
import com.github.jnthnclt.os.bloom.log.BloomLoggerFactory;

/**
 * Reads one block's blooms a page at a time, either by jumping to a known {@link BloomOffset} or by walking every
 * bloom in order. Headers are loaded on first use and at most one page is held at a time.
 * <p>
 * When pooling is on a page's buffer goes back to the pool the moment the cursor moves off that page, so a
 * {@link Bloom} must be consumed (or copied) before the next page transition.
 * <p>
 * Failures are recorded rather than thrown, check {@link #err()}. Only a page too large error is ever cleared, and
 * only by {@link #seek(BloomOffset)}. Not thread safe; use one cursor per query.
 *
 * @author jonathan.colt
 */
public class LazyBloomCursor implements AutoCloseable {

    private static final BloomLogger LOG = BloomLoggerFactory.getLogger();

    private final BloomBlock block;
    private final boolean usePool;
    private final int maxPageSize;
    private final BloomStats stats;

    private boolean initialized;
    private boolean closed;
    private CursorState state = CursorState.READY;
    private int curPageIndex;
    private BloomPageDecoder curPage;

    public LazyBloomCursor(BloomBlock block, boolean usePool, int maxPageSize, BloomStats stats) {
        this.block = block;
        this.usePool = usePool;
        this.maxPageSize = maxPageSize;
        this.stats = stats;
    }

    private void ensureInit() {
        if (!initialized) {
            initialized = true;
            try {
                block.loadHeaders();
            } catch (BloomBlockException x) {
                record(CursorError.Source.CURSOR, x);
            }
        }
    }

    public void seek(BloomOffset offset) {
        if (closed) {
            return;
        }
        ensureInit();

        state = state.onSeek();
        if (!state.isReady()) {
            return;
        }

        if (curPage == null || curPageIndex != offset.page) {
            dropPage();
            BloomPageDecoder decoder = acquire(offset.page);
            if (decoder == null) {
                return;
            }
            curPageIndex = offset.page;
            curPage = decoder;
        }

        curPage.seek(offset.byteOffset);
    }

    public boolean next() {
        if (closed) {
            return false;
        }
        ensureInit();
        if (!state.isReady()) {
            return false;
        }

        while (curPageIndex < block.pageCount()) {
            if (curPage == null) {
                curPage = acquire(curPageIndex);
                if (curPage == null) {
                    return false;
                }
            }

            if (curPage.next()) {
                return true;
            }

            BloomPageDecodeException pageErr = curPage.err();
            if (pageErr != null) {
                record(CursorError.Source.PAGE, pageErr);
                return false;
            }

            dropPage();
            curPageIndex++;
        }

        // finished last page
        return false;
    }

    /**
     * The bloom at the current position. Only defined after a successful seek or a next that returned true.
     */
    public Bloom at() {
        return curPage.at();
    }

    public CursorError err() {
        if (state.error != null) {
            return state.error;
        }
        if (curPage != null) {
            BloomPageDecodeException pageErr = curPage.err();
            if (pageErr != null) {
                return new CursorError(CursorError.Source.PAGE, pageErr);
            }
        }
        return null;
    }

    CursorState state() {
        return state;
    }

    int pageIndex() {
        return curPageIndex;
    }

    /**
     * Gives back the held page. Afterwards seek does nothing and next returns false.
     */
    @Override
    public void close() {
        closed = true;
        dropPage();
    }

    private BloomPageDecoder acquire(int pageIndex) {
        try {
            IPointerReadable readable = block.blooms();
            return block.pageDecoder(readable, pageIndex, maxPageSize, stats);
        } catch (BloomBlockException x) {
            record(CursorError.Source.CURSOR, x);
            return null;
        }
    }

    private void dropPage() {
        if (curPage != null) {
            if (usePool) {
                curPage.relinquish();
            } else {
                curPage.forfeit();
            }
            curPage = null;
        }
    }

    private void record(CursorError.Source source, BloomBlockException x) {
        state = state.fail(source, x);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Cursor over {} is now {}", block, state);
        }
    }
}
